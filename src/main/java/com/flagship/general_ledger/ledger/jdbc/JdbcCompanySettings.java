package com.flagship.general_ledger.ledger.jdbc;

import com.flagship.general_ledger.ledger.port.CompanySettings;
import lombok.Value;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Company accounting settings over the companies table.
 */
@Repository
public class JdbcCompanySettings implements CompanySettings {

    private final JdbcTemplate jdbcTemplate;

    public JdbcCompanySettings(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public String getDefaultCurrency(String company) {
        return findCompany(company).defaultCurrency;
    }

    @Override
    public Optional<String> getRoundOffAccount(String company) {
        return Optional.ofNullable(findCompany(company).roundOffAccount);
    }

    @Override
    public Optional<String> getRoundOffCostCenter(String company) {
        return Optional.ofNullable(findCompany(company).roundOffCostCenter);
    }

    @Override
    public Optional<LocalDate> getAccountsFrozenTillDate(String company) {
        return Optional.ofNullable(findCompany(company).accountsFrozenTillDate);
    }

    @Override
    public Optional<LocalDate> getBooksClosedTillDate(String company) {
        return Optional.ofNullable(findCompany(company).booksClosedTillDate);
    }

    @Override
    public Optional<String> getExchangeGainLossAccount(String company) {
        return Optional.ofNullable(findCompany(company).exchangeGainLossAccount);
    }

    private CompanyRecord findCompany(String company) {
        return jdbcTemplate.query(
            "SELECT default_currency, round_off_account, round_off_cost_center, exchange_gain_loss_account, " +
            "accounts_frozen_till_date, books_closed_till_date FROM companies WHERE name = ?",
            companyRowMapper(),
            company
        ).stream()
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Company not found: " + company));
    }

    private RowMapper<CompanyRecord> companyRowMapper() {
        return (rs, rowNum) -> new CompanyRecord(
            rs.getString("default_currency"),
            rs.getString("round_off_account"),
            rs.getString("round_off_cost_center"),
            rs.getString("exchange_gain_loss_account"),
            toLocalDate(rs.getDate("accounts_frozen_till_date")),
            toLocalDate(rs.getDate("books_closed_till_date"))
        );
    }

    private static LocalDate toLocalDate(Date date) {
        return date != null ? date.toLocalDate() : null;
    }

    @Value
    private static class CompanyRecord {
        String defaultCurrency;
        String roundOffAccount;
        String roundOffCostCenter;
        String exchangeGainLossAccount;
        LocalDate accountsFrozenTillDate;
        LocalDate booksClosedTillDate;
    }
}
