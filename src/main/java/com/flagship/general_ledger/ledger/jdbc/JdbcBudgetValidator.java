package com.flagship.general_ledger.ledger.jdbc;

import com.flagship.general_ledger.ledger.Amounts;
import com.flagship.general_ledger.ledger.GlBatch;
import com.flagship.general_ledger.ledger.GlEntry;
import com.flagship.general_ledger.ledger.port.BudgetValidator;
import com.flagship.general_ledger.ledger.port.BudgetViolation;
import com.flagship.general_ledger.ledger.port.FiscalYear;
import com.flagship.general_ledger.ledger.port.FiscalYearLookup;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.sql.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Budget check against the budgets table.
 *
 * Actual spend for an account / cost center pair is the net (debit minus credit)
 * of active GL entries inside the fiscal year plus the net of the batch.
 * Pairs without a budget row are not limited.
 */
@Repository
@Slf4j
@ConditionalOnProperty(name = "ledger.budget.enabled", havingValue = "true", matchIfMissing = true)
public class JdbcBudgetValidator implements BudgetValidator {

    private final JdbcTemplate jdbcTemplate;
    private final FiscalYearLookup fiscalYearLookup;

    public JdbcBudgetValidator(JdbcTemplate jdbcTemplate, FiscalYearLookup fiscalYearLookup) {
        this.jdbcTemplate = jdbcTemplate;
        this.fiscalYearLookup = fiscalYearLookup;
    }

    @Override
    public Optional<BudgetViolation> validate(GlBatch batch) {
        if (batch.isEmpty()) {
            return Optional.empty();
        }
        String company = batch.company();
        Optional<FiscalYear> fiscalYear = fiscalYearLookup.findFiscalYear(batch.postingDate(), company);
        if (fiscalYear.isEmpty()) {
            log.debug("No fiscal year for {} on {}, skipping budget check", company, batch.postingDate());
            return Optional.empty();
        }

        for (Map.Entry<BudgetKey, BigDecimal> net : netByAccountAndCostCenter(batch).entrySet()) {
            BudgetKey key = net.getKey();
            Optional<BigDecimal> budget = findBudget(company, fiscalYear.get().getName(), key);
            if (budget.isEmpty()) {
                continue;
            }
            BigDecimal actual = postedNet(company, fiscalYear.get(), key).add(net.getValue());
            if (actual.compareTo(budget.get()) > 0) {
                return Optional.of(new BudgetViolation(key.account, key.costCenter, budget.get(), actual));
            }
        }
        return Optional.empty();
    }

    private Map<BudgetKey, BigDecimal> netByAccountAndCostCenter(GlBatch batch) {
        Map<BudgetKey, BigDecimal> net = new LinkedHashMap<>();
        for (GlEntry entry : batch.entries()) {
            if (!GlEntry.isPresent(entry.getCostCenter())) {
                continue;
            }
            BigDecimal amount = Amounts.orZero(entry.getDebit()).subtract(Amounts.orZero(entry.getCredit()));
            net.merge(new BudgetKey(entry.getAccount(), entry.getCostCenter()), amount, BigDecimal::add);
        }
        return net;
    }

    private Optional<BigDecimal> findBudget(String company, String fiscalYear, BudgetKey key) {
        List<BigDecimal> budgets = jdbcTemplate.queryForList(
            "SELECT budget_amount FROM budgets " +
            "WHERE company = ? AND fiscal_year = ? AND account = ? AND cost_center = ?",
            BigDecimal.class,
            company,
            fiscalYear,
            key.account,
            key.costCenter
        );
        return budgets.stream().findFirst();
    }

    private BigDecimal postedNet(String company, FiscalYear fiscalYear, BudgetKey key) {
        BigDecimal net = jdbcTemplate.queryForObject(
            "SELECT COALESCE(SUM(debit) - SUM(credit), 0) FROM gl_entries " +
            "WHERE company = ? AND account = ? AND cost_center = ? AND is_cancelled = FALSE " +
            "AND posting_date BETWEEN ? AND ?",
            BigDecimal.class,
            company,
            key.account,
            key.costCenter,
            Date.valueOf(fiscalYear.getStartDate()),
            Date.valueOf(fiscalYear.getEndDate())
        );
        return Amounts.orZero(net);
    }

    @Value
    private static class BudgetKey {
        String account;
        String costCenter;
    }
}
