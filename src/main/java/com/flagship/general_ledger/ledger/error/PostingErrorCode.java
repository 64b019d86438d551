package com.flagship.general_ledger.ledger.error;

/**
 * Stable classification of posting failures, for programmatic handling.
 */
public enum PostingErrorCode {
    ACCOUNT_NOT_FOUND,
    ACCOUNT_DISABLED,
    ACCOUNT_FROZEN,
    ACCOUNT_IS_GROUP,
    DEBIT_CREDIT_MISMATCH,
    INSUFFICIENT_ENTRY_COUNT,
    PERIOD_CLOSED,
    FISCAL_YEAR_NOT_FOUND,
    ACCOUNTS_FROZEN_TILL_DATE,
    BOOKS_CLOSED,
    BUDGET_EXCEEDED,
    INVALID_ACCOUNT_CURRENCY,
    CURRENCY_MISMATCH,
    VOUCHER_NOT_FOUND,
    VOUCHER_ALREADY_POSTED,
    /** Malformed input: empty batch, mixed vouchers, missing account. */
    INVALID_BATCH,
    /** A collaborator (store, lookup, validator) threw or timed out. */
    COLLABORATOR_FAILURE
}
