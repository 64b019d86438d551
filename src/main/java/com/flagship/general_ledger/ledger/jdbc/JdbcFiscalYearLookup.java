package com.flagship.general_ledger.ledger.jdbc;

import com.flagship.general_ledger.ledger.port.FiscalYear;
import com.flagship.general_ledger.ledger.port.FiscalYearLookup;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Fiscal year resolution over the fiscal_years table. Disabled years are ignored.
 */
@Repository
public class JdbcFiscalYearLookup implements FiscalYearLookup {

    private final JdbcTemplate jdbcTemplate;

    public JdbcFiscalYearLookup(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<FiscalYear> findFiscalYear(LocalDate date, String company) {
        return jdbcTemplate.query(
            "SELECT name, year_start_date, year_end_date FROM fiscal_years " +
            "WHERE company = ? AND disabled = FALSE AND ? BETWEEN year_start_date AND year_end_date " +
            "ORDER BY year_start_date DESC",
            fiscalYearRowMapper(),
            company,
            Date.valueOf(date)
        ).stream().findFirst();
    }

    @Override
    public Optional<FiscalYear> getFiscalYear(String name, String company) {
        return jdbcTemplate.query(
            "SELECT name, year_start_date, year_end_date FROM fiscal_years WHERE name = ? AND company = ?",
            fiscalYearRowMapper(),
            name,
            company
        ).stream().findFirst();
    }

    private RowMapper<FiscalYear> fiscalYearRowMapper() {
        return (rs, rowNum) -> new FiscalYear(
            rs.getString("name"),
            rs.getDate("year_start_date").toLocalDate(),
            rs.getDate("year_end_date").toLocalDate()
        );
    }
}
