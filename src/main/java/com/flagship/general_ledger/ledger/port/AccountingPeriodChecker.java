package com.flagship.general_ledger.ledger.port;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Accounting periods may close individual document types for a date range.
 */
public interface AccountingPeriodChecker {

    boolean isDocumentTypeClosed(String company, String documentType, LocalDate postingDate);

    /** Human-readable name of the closed period covering the date, if any. */
    Optional<String> getClosedPeriodName(String company, String documentType, LocalDate postingDate);
}
