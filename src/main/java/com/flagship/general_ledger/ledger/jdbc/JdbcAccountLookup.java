package com.flagship.general_ledger.ledger.jdbc;

import com.flagship.general_ledger.ledger.port.Account;
import com.flagship.general_ledger.ledger.port.AccountLookup;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Chart of accounts lookup over the accounts table.
 */
@Repository
public class JdbcAccountLookup implements AccountLookup {

    private final JdbcTemplate jdbcTemplate;

    public JdbcAccountLookup(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Account> getAccount(String name) {
        return jdbcTemplate.query(
            "SELECT name, account_name, company, account_currency, root_type, is_group, disabled, " +
            "freeze_account, balance_must_be FROM accounts WHERE name = ?",
            accountRowMapper(),
            name
        ).stream().findFirst();
    }

    /**
     * Creates an account. Used for setup and tests.
     */
    public void createAccount(Account account) {
        jdbcTemplate.update(
            "INSERT INTO accounts (name, account_name, company, account_currency, root_type, is_group, " +
            "disabled, freeze_account, balance_must_be) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
            account.getName(),
            account.getAccountName() != null ? account.getAccountName() : account.getName(),
            account.getCompany(),
            account.getAccountCurrency(),
            account.getRootType().name(),
            account.isGroup(),
            account.isDisabled(),
            account.isFrozen(),
            account.getBalanceMustBe() != null ? account.getBalanceMustBe().name() : null
        );
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> {
            String balanceMustBe = rs.getString("balance_must_be");
            return Account.builder()
                .name(rs.getString("name"))
                .accountName(rs.getString("account_name"))
                .company(rs.getString("company"))
                .accountCurrency(rs.getString("account_currency"))
                .rootType(Account.RootType.valueOf(rs.getString("root_type")))
                .group(rs.getBoolean("is_group"))
                .disabled(rs.getBoolean("disabled"))
                .frozen(rs.getBoolean("freeze_account"))
                .balanceMustBe(balanceMustBe != null ? Account.BalanceMustBe.valueOf(balanceMustBe) : null)
                .build();
        };
    }
}
