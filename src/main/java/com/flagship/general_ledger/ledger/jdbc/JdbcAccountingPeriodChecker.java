package com.flagship.general_ledger.ledger.jdbc;

import com.flagship.general_ledger.ledger.port.AccountingPeriodChecker;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.time.LocalDate;
import java.util.Optional;

/**
 * Checks accounting periods that close specific document types.
 */
@Repository
@ConditionalOnProperty(name = "ledger.periods.enabled", havingValue = "true", matchIfMissing = true)
public class JdbcAccountingPeriodChecker implements AccountingPeriodChecker {

    private static final String CLOSED_PERIOD_SQL =
        "SELECT ap.name FROM accounting_periods ap " +
        "JOIN accounting_period_closed_documents cd ON cd.period_name = ap.name " +
        "WHERE ap.company = ? AND cd.document_type = ? AND cd.closed = TRUE " +
        "AND ? BETWEEN ap.start_date AND ap.end_date " +
        "ORDER BY ap.start_date";

    private final JdbcTemplate jdbcTemplate;

    public JdbcAccountingPeriodChecker(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean isDocumentTypeClosed(String company, String documentType, LocalDate postingDate) {
        return getClosedPeriodName(company, documentType, postingDate).isPresent();
    }

    @Override
    public Optional<String> getClosedPeriodName(String company, String documentType, LocalDate postingDate) {
        return jdbcTemplate.queryForList(
            CLOSED_PERIOD_SQL,
            String.class,
            company,
            documentType,
            Date.valueOf(postingDate)
        ).stream().findFirst();
    }
}
