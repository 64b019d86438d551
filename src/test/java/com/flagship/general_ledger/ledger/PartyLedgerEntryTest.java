package com.flagship.general_ledger.ledger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class PartyLedgerEntryTest {

    @Test
    @DisplayName("Amount is signed debit minus credit")
    void signedAmount() {
        GlEntry entry = GlEntry.builder()
            .postingDate(LocalDate.of(2024, 4, 1))
            .dueDate(LocalDate.of(2024, 5, 1))
            .company("Acme Ltd")
            .voucherType("Purchase Invoice")
            .voucherNo("PINV-9")
            .account("Creditors")
            .accountCurrency("EUR")
            .partyType("Supplier")
            .party("S-1")
            .againstVoucherType("Purchase Order")
            .againstVoucher("PO-3")
            .credit(new BigDecimal("250"))
            .creditInAccountCurrency(new BigDecimal("230"))
            .build();

        PartyLedgerEntry ple = PartyLedgerEntry.fromGlEntry(entry);

        assertEquals(0, new BigDecimal("-250").compareTo(ple.getAmount()));
        assertEquals(0, new BigDecimal("-230").compareTo(ple.getAmountInAccountCurrency()));
        assertEquals("Supplier", ple.getPartyType());
        assertEquals("S-1", ple.getParty());
        assertEquals("PO-3", ple.getAgainstVoucherNo());
        assertEquals(LocalDate.of(2024, 5, 1), ple.getDueDate());
        assertFalse(ple.isDelinked());
    }

    @Test
    @DisplayName("Entries without a party are rejected")
    void requiresParty() {
        GlEntry entry = GlEntry.builder().account("Cash").partyType("Customer").build();

        assertThrows(IllegalArgumentException.class, () -> PartyLedgerEntry.fromGlEntry(entry));
    }
}
