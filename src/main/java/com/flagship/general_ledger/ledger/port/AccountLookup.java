package com.flagship.general_ledger.ledger.port;

import java.util.Optional;

/**
 * Read access to account master data.
 *
 * The flag queries default to {@link #getAccount(String)}; implementations
 * backed by a cache or a narrower query may override them.
 */
public interface AccountLookup {

    Optional<Account> getAccount(String name);

    default Optional<String> getAccountCurrency(String name) {
        return getAccount(name).map(Account::getAccountCurrency);
    }

    default boolean isGroup(String name) {
        return getAccount(name).map(Account::isGroup).orElse(false);
    }

    default boolean isFrozen(String name) {
        return getAccount(name).map(Account::isFrozen).orElse(false);
    }

    default boolean isDisabled(String name) {
        return getAccount(name).map(Account::isDisabled).orElse(false);
    }

    /**
     * Required balance sign of the account. Exposed for callers that check
     * running balances; posting itself does not enforce it.
     */
    default Optional<Account.BalanceMustBe> getBalanceMustBe(String name) {
        return getAccount(name).map(Account::getBalanceMustBe);
    }
}
