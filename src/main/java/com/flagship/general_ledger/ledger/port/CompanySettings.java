package com.flagship.general_ledger.ledger.port;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Company-level accounting configuration.
 */
public interface CompanySettings {

    String getDefaultCurrency(String company);

    Optional<String> getRoundOffAccount(String company);

    Optional<String> getRoundOffCostCenter(String company);

    /** Posting before this date requires the advance-adjustment flag. */
    Optional<LocalDate> getAccountsFrozenTillDate(String company);

    /** No posting is allowed on or before this date. */
    Optional<LocalDate> getBooksClosedTillDate(String company);

    /** Account whose zero-balance merged entries are kept. */
    Optional<String> getExchangeGainLossAccount(String company);
}
