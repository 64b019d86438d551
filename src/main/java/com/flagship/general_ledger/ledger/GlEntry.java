package com.flagship.general_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Domain model for a General Ledger entry.
 * One debit/credit line of a ledger transaction.
 *
 * Amounts are carried in three parallel views:
 * - company currency (debit / credit)
 * - account currency (debitInAccountCurrency / creditInAccountCurrency)
 * - transaction currency (debitInTransactionCurrency / creditInTransactionCurrency)
 *
 * Entries are immutable. Pipeline stages produce modified copies via toBuilder().
 *
 * Key invariant (after processing): debit >= 0 and credit >= 0 in every view.
 */
@Value
@Builder(toBuilder = true)
public class GlEntry {

    String name;

    LocalDate postingDate;
    LocalDate dueDate;
    String company;
    String fiscalYear;

    // Source document
    String voucherType;
    String voucherNo;
    String voucherSubtype;
    String voucherDetailNo;

    String account;
    String accountCurrency;

    // Receivable / payable tracking
    String partyType;
    String party;

    // AR/AP matching
    String againstVoucherType;
    String againstVoucher;

    @Builder.Default
    BigDecimal debit = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal credit = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal debitInAccountCurrency = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal creditInAccountCurrency = BigDecimal.ZERO;

    String transactionCurrency;
    @Builder.Default
    BigDecimal transactionExchangeRate = BigDecimal.ONE;
    @Builder.Default
    BigDecimal debitInTransactionCurrency = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal creditInTransactionCurrency = BigDecimal.ZERO;

    // Dimensions
    String costCenter;
    String project;
    String financeBook;

    boolean opening;
    boolean advance;
    boolean cancelled;

    String remarks;

    /**
     * True if this entry is posted against a party (customer, supplier, ...).
     */
    public boolean hasParty() {
        return isPresent(partyType) && isPresent(party);
    }

    /**
     * Returns a copy with debit and credit swapped in every currency view.
     */
    public GlEntry swapDebitCredit() {
        return toBuilder()
            .debit(credit)
            .credit(debit)
            .debitInAccountCurrency(creditInAccountCurrency)
            .creditInAccountCurrency(debitInAccountCurrency)
            .debitInTransactionCurrency(creditInTransactionCurrency)
            .creditInTransactionCurrency(debitInTransactionCurrency)
            .build();
    }

    /**
     * Returns a copy with party and against-voucher references removed.
     * Synthesized entries (offsetting, round-off) never carry a party.
     */
    public GlEntry withoutPartyReferences() {
        return toBuilder()
            .partyType(null)
            .party(null)
            .againstVoucherType(null)
            .againstVoucher(null)
            .build();
    }

    public VoucherRef voucherRef() {
        return new VoucherRef(voucherType, voucherNo, company);
    }

    public static boolean isPresent(String value) {
        return value != null && !value.isEmpty();
    }
}
