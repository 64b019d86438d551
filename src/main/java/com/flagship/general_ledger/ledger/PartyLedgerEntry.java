package com.flagship.general_ledger.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Receivable / payable projection of a GL entry that carries a party.
 * Tracked separately from the GL for payment allocation and reconciliation.
 *
 * Never created standalone: see {@link #fromGlEntry(GlEntry)}.
 */
@Value
@Builder(toBuilder = true)
public class PartyLedgerEntry {

    LocalDate postingDate;
    String company;
    String account;

    String partyType;
    String party;

    String voucherType;
    String voucherNo;
    String voucherDetailNo;

    String againstVoucherType;
    String againstVoucherNo;

    String accountCurrency;
    /** Signed debit minus credit, company currency. */
    BigDecimal amount;
    /** Signed debit minus credit, account currency. */
    BigDecimal amountInAccountCurrency;
    LocalDate dueDate;

    String financeBook;
    boolean delinked;

    public static PartyLedgerEntry fromGlEntry(GlEntry entry) {
        if (!entry.hasParty()) {
            throw new IllegalArgumentException(
                "Party ledger entries require a party: account " + entry.getAccount());
        }
        return PartyLedgerEntry.builder()
            .postingDate(entry.getPostingDate())
            .company(entry.getCompany())
            .account(entry.getAccount())
            .partyType(entry.getPartyType())
            .party(entry.getParty())
            .voucherType(entry.getVoucherType())
            .voucherNo(entry.getVoucherNo())
            .voucherDetailNo(entry.getVoucherDetailNo())
            .againstVoucherType(entry.getAgainstVoucherType())
            .againstVoucherNo(entry.getAgainstVoucher())
            .accountCurrency(entry.getAccountCurrency())
            .amount(Amounts.orZero(entry.getDebit()).subtract(Amounts.orZero(entry.getCredit())))
            .amountInAccountCurrency(Amounts.orZero(entry.getDebitInAccountCurrency())
                .subtract(Amounts.orZero(entry.getCreditInAccountCurrency())))
            .dueDate(entry.getDueDate())
            .financeBook(entry.getFinanceBook())
            .delinked(false)
            .build();
    }
}
