package com.flagship.general_ledger.ledger.jdbc;

import com.flagship.general_ledger.ledger.GlBatch;
import com.flagship.general_ledger.ledger.GlEntry;
import com.flagship.general_ledger.ledger.port.AccountingDimension;
import com.flagship.general_ledger.ledger.port.AccountingDimensionProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.function.Function;

/**
 * Accounting dimensions configured to post balancing entries automatically.
 *
 * A dimension needs offsetting only when the batch spans more than one of its values.
 */
@Repository
@ConditionalOnProperty(name = "ledger.dimensions.enabled", havingValue = "true", matchIfMissing = true)
public class JdbcAccountingDimensionProvider implements AccountingDimensionProvider {

    private final JdbcTemplate jdbcTemplate;

    public JdbcAccountingDimensionProvider(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<AccountingDimension> getDimensionsForOffsetting(GlBatch batch, String company) {
        List<AccountingDimension> configured = jdbcTemplate.query(
            "SELECT fieldname, name, offsetting_account, account_currency FROM accounting_dimensions " +
            "WHERE company = ? AND automatically_post_balancing_entry = TRUE AND disabled = FALSE " +
            "AND offsetting_account IS NOT NULL ORDER BY name",
            (rs, rowNum) -> new AccountingDimension(
                rs.getString("fieldname"),
                rs.getString("name"),
                rs.getString("offsetting_account"),
                rs.getString("account_currency")
            ),
            company
        );
        return configured.stream()
            .filter(dimension -> distinctValues(batch, dimension.getFieldname()) > 1)
            .toList();
    }

    private static long distinctValues(GlBatch batch, String fieldname) {
        Function<GlEntry, String> field = dimensionField(fieldname);
        if (field == null) {
            return 0;
        }
        return batch.stream()
            .map(field)
            .filter(GlEntry::isPresent)
            .distinct()
            .count();
    }

    private static Function<GlEntry, String> dimensionField(String fieldname) {
        switch (fieldname) {
            case "cost_center":
                return GlEntry::getCostCenter;
            case "project":
                return GlEntry::getProject;
            case "finance_book":
                return GlEntry::getFinanceBook;
            default:
                return null;
        }
    }
}
