package com.flagship.general_ledger.ledger.port;

import lombok.Builder;
import lombok.Value;

/**
 * Account from the chart of accounts, as seen by the posting engine.
 */
@Value
@Builder
public class Account {
    String name;
    String accountName;
    String company;
    String accountCurrency;
    RootType rootType;
    boolean group;
    boolean disabled;
    boolean frozen;
    /** Required balance sign, or null when unconstrained. */
    BalanceMustBe balanceMustBe;

    public enum RootType {
        ASSET,
        LIABILITY,
        EQUITY,
        INCOME,
        EXPENSE
    }

    public enum BalanceMustBe {
        DEBIT,
        CREDIT
    }
}
