package com.flagship.general_ledger.ledger.port;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Resolves fiscal years for a company.
 */
public interface FiscalYearLookup {

    Optional<FiscalYear> findFiscalYear(LocalDate date, String company);

    Optional<FiscalYear> getFiscalYear(String name, String company);
}
