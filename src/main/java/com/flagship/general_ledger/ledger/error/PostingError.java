package com.flagship.general_ledger.ledger.error;

import com.flagship.general_ledger.ledger.VoucherRef;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * A posting failure: stable code, human-readable message, and the values
 * behind it (account names, dates, computed differences) as ordered details.
 *
 * Multi-item failures (disabled accounts) list every offending item.
 */
@Value
@Builder
public class PostingError {

    PostingErrorCode code;
    String message;
    @Singular
    Map<String, String> details;
    Throwable cause;

    public String detail(String key) {
        return details.get(key);
    }

    public PostingException toException() {
        return new PostingException(this);
    }

    @Override
    public String toString() {
        return code + ": " + message;
    }

    // ==================== Account Errors ====================

    public static PostingError disabledAccounts(List<String> accounts) {
        return PostingError.builder()
            .code(PostingErrorCode.ACCOUNT_DISABLED)
            .message("Cannot create accounting entries against disabled accounts: "
                + String.join(", ", accounts))
            .detail("accounts", String.join(",", accounts))
            .build();
    }

    public static PostingError accountNotFound(String account) {
        return PostingError.builder()
            .code(PostingErrorCode.ACCOUNT_NOT_FOUND)
            .message("Account " + account + " does not exist")
            .detail("account", account)
            .build();
    }

    public static PostingError accountFrozen(String account) {
        return PostingError.builder()
            .code(PostingErrorCode.ACCOUNT_FROZEN)
            .message("Account " + account + " is frozen")
            .detail("account", account)
            .build();
    }

    public static PostingError accountIsGroup(String account) {
        return PostingError.builder()
            .code(PostingErrorCode.ACCOUNT_IS_GROUP)
            .message("Account " + account + " is a group account and cannot be used in transactions")
            .detail("account", account)
            .build();
    }

    public static PostingError invalidAccountCurrency(String account, String declared, String expected) {
        return PostingError.builder()
            .code(PostingErrorCode.INVALID_ACCOUNT_CURRENCY)
            .message(String.format("Account %s has currency %s but the entry declares %s",
                account, expected, declared))
            .detail("account", account)
            .detail("declaredCurrency", declared)
            .detail("accountCurrency", expected)
            .build();
    }

    public static PostingError currencyMismatch(String account, String currency,
                                                BigDecimal companyAmount, BigDecimal accountAmount) {
        return PostingError.builder()
            .code(PostingErrorCode.CURRENCY_MISMATCH)
            .message(String.format(
                "Account %s is in company currency %s but amounts differ: company %s, account %s",
                account, currency, companyAmount.toPlainString(), accountAmount.toPlainString()))
            .detail("account", account)
            .detail("currency", currency)
            .detail("companyAmount", companyAmount.toPlainString())
            .detail("accountAmount", accountAmount.toPlainString())
            .build();
    }

    // ==================== Balance Errors ====================

    public static PostingError debitCreditMismatch(String voucherType, String voucherNo, BigDecimal difference) {
        return PostingError.builder()
            .code(PostingErrorCode.DEBIT_CREDIT_MISMATCH)
            .message(String.format("Debit and Credit not equal for %s #%s. Difference is %s.",
                voucherType, voucherNo, difference.toPlainString()))
            .detail("voucherType", voucherType)
            .detail("voucherNo", voucherNo)
            .detail("difference", difference.toPlainString())
            .build();
    }

    public static PostingError insufficientEntries(int expected, int actual) {
        return PostingError.builder()
            .code(PostingErrorCode.INSUFFICIENT_ENTRY_COUNT)
            .message("Incorrect number of General Ledger Entries found. "
                + "You might have selected a wrong Account in the transaction.")
            .detail("expected", String.valueOf(expected))
            .detail("actual", String.valueOf(actual))
            .build();
    }

    // ==================== Period Errors ====================

    public static PostingError periodClosed(String company, String documentType,
                                            LocalDate postingDate, String periodName) {
        return PostingError.builder()
            .code(PostingErrorCode.PERIOD_CLOSED)
            .message(String.format("Accounting period is closed for %s in %s on %s (Period: %s)",
                documentType, company, postingDate, periodName))
            .detail("company", company)
            .detail("documentType", documentType)
            .detail("postingDate", String.valueOf(postingDate))
            .detail("period", periodName != null ? periodName : "")
            .build();
    }

    public static PostingError fiscalYearNotFound(LocalDate date, String company) {
        return PostingError.builder()
            .code(PostingErrorCode.FISCAL_YEAR_NOT_FOUND)
            .message(String.format("Date %s is not in any active Fiscal Year for %s", date, company))
            .detail("date", String.valueOf(date))
            .detail("company", company)
            .build();
    }

    public static PostingError accountsFrozenTill(LocalDate frozenTill, LocalDate postingDate) {
        return PostingError.builder()
            .code(PostingErrorCode.ACCOUNTS_FROZEN_TILL_DATE)
            .message("Accounts are frozen till " + frozenTill)
            .detail("frozenTill", frozenTill.toString())
            .detail("postingDate", String.valueOf(postingDate))
            .build();
    }

    public static PostingError booksClosed(LocalDate closedTill, LocalDate postingDate) {
        return PostingError.builder()
            .code(PostingErrorCode.BOOKS_CLOSED)
            .message("Books have been closed till " + closedTill)
            .detail("closedTill", closedTill.toString())
            .detail("postingDate", String.valueOf(postingDate))
            .build();
    }

    // ==================== Budget Errors ====================

    public static PostingError budgetExceeded(String account, String costCenter,
                                              BigDecimal budget, BigDecimal actual, BigDecimal variance) {
        return PostingError.builder()
            .code(PostingErrorCode.BUDGET_EXCEEDED)
            .message(String.format("Budget exceeded for %s in %s: budget %s, actual %s, over by %s",
                account, costCenter, budget.toPlainString(), actual.toPlainString(), variance.toPlainString()))
            .detail("account", account)
            .detail("costCenter", costCenter)
            .detail("budget", budget.toPlainString())
            .detail("actual", actual.toPlainString())
            .detail("variance", variance.toPlainString())
            .build();
    }

    // ==================== Voucher Errors ====================

    public static PostingError voucherNotFound(VoucherRef voucher) {
        return PostingError.builder()
            .code(PostingErrorCode.VOUCHER_NOT_FOUND)
            .message("No GL entries found for " + voucher)
            .detail("voucherType", voucher.getVoucherType())
            .detail("voucherNo", voucher.getVoucherNo())
            .build();
    }

    public static PostingError voucherAlreadyPosted(VoucherRef voucher) {
        return PostingError.builder()
            .code(PostingErrorCode.VOUCHER_ALREADY_POSTED)
            .message(voucher + " already has GL entries")
            .detail("voucherType", voucher.getVoucherType())
            .detail("voucherNo", voucher.getVoucherNo())
            .build();
    }

    public static PostingError invalidBatch(String reason) {
        return PostingError.builder()
            .code(PostingErrorCode.INVALID_BATCH)
            .message(reason)
            .build();
    }

    public static PostingError collaboratorFailure(String operation, RuntimeException cause) {
        return PostingError.builder()
            .code(PostingErrorCode.COLLABORATOR_FAILURE)
            .message(String.format("%s failed: %s", operation, cause.getMessage()))
            .detail("operation", operation)
            .cause(cause)
            .build();
    }
}
