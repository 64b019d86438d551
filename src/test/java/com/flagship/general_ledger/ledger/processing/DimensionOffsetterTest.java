package com.flagship.general_ledger.ledger.processing;

import com.flagship.general_ledger.ledger.GlBatch;
import com.flagship.general_ledger.ledger.GlEntry;
import com.flagship.general_ledger.ledger.port.AccountingDimension;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DimensionOffsetterTest {

    private final DimensionOffsetter offsetter = new DimensionOffsetter(2);

    private static GlEntry entry(String account, String costCenter, String debit, String credit) {
        return GlEntry.builder()
            .postingDate(LocalDate.of(2024, 2, 1))
            .company("Acme Ltd")
            .voucherType("Journal Entry")
            .voucherNo("JV-7")
            .account(account)
            .costCenter(costCenter)
            .partyType("Supplier")
            .party("S-1")
            .debit(new BigDecimal(debit))
            .credit(new BigDecimal(credit))
            .debitInAccountCurrency(new BigDecimal(debit))
            .creditInAccountCurrency(new BigDecimal(credit))
            .build();
    }

    @Test
    @DisplayName("No dimensions means no offsetting entries")
    void noDimensions() {
        GlBatch batch = GlBatch.of(entry("Expenses", "East", "100", "0"));

        assertSame(batch, offsetter.offset(batch, List.of()));
    }

    @Test
    @DisplayName("One dimension produces a swapped entry per line on its offsetting account")
    void singleDimension() {
        GlBatch batch = GlBatch.of(
            entry("Expenses", "East", "100", "0"),
            entry("Creditors", "West", "0", "100")
        );
        AccountingDimension segment = new AccountingDimension("cost_center", "Segment", "Inter Segment", "USD");

        GlBatch offset = offsetter.offset(batch, List.of(segment));

        assertEquals(4, offset.size());
        GlEntry first = offset.entries().get(2);
        assertEquals("Inter Segment", first.getAccount());
        assertEquals("USD", first.getAccountCurrency());
        assertEquals("East", first.getCostCenter());
        assertEquals(0, new BigDecimal("100").compareTo(first.getCredit()));
        assertEquals(0, first.getDebit().signum());
        assertEquals("Offsetting for Accounting Dimension - Segment", first.getRemarks());
        assertFalse(first.hasParty());
        assertTrue(offset.isBalanced());
    }

    @Test
    @DisplayName("Amounts are split evenly across dimensions")
    void splitAcrossDimensions() {
        GlBatch batch = GlBatch.of(entry("Expenses", "East", "100", "0"));
        List<AccountingDimension> dimensions = List.of(
            new AccountingDimension("cost_center", "Segment", "Inter Segment", null),
            new AccountingDimension("project", "Project", "Inter Project", null),
            new AccountingDimension("finance_book", "Book", "Inter Book", null)
        );

        List<GlEntry> offsetting = offsetter.offsettingEntries(batch, dimensions);

        assertEquals(3, offsetting.size());
        for (GlEntry e : offsetting) {
            assertEquals(new BigDecimal("33.33"), e.getCredit());
            assertEquals(new BigDecimal("33.33"), e.getCreditInAccountCurrency());
        }
        assertEquals(List.of("Inter Segment", "Inter Project", "Inter Book"),
            offsetting.stream().map(GlEntry::getAccount).toList());
    }
}
