package com.flagship.general_ledger.ledger.port;

import lombok.Value;

/**
 * A bookkeeping dimension that must balance independently, with the account
 * used for its balancing (offsetting) entries.
 */
@Value
public class AccountingDimension {
    String fieldname;
    String name;
    String offsettingAccount;
    String accountCurrency;
}
