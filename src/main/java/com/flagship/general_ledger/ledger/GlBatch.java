package com.flagship.general_ledger.ledger;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * Ordered, immutable collection of GL entries belonging to one transaction.
 *
 * Invariant (after the posting pipeline): total debit equals total credit
 * within the voucher's allowance at the configured precision.
 *
 * Every transform returns a new batch; entries handed in by a caller are
 * never modified.
 */
@EqualsAndHashCode
@ToString
public final class GlBatch {

    private static final int BALANCE_PRECISION = 2;

    private final List<GlEntry> entries;

    private GlBatch(List<GlEntry> entries) {
        this.entries = List.copyOf(entries);
    }

    public static GlBatch of(Collection<GlEntry> entries) {
        return new GlBatch(new ArrayList<>(entries));
    }

    public static GlBatch of(GlEntry... entries) {
        return new GlBatch(Arrays.asList(entries));
    }

    public static GlBatch empty() {
        return new GlBatch(List.of());
    }

    public List<GlEntry> entries() {
        return entries;
    }

    public Stream<GlEntry> stream() {
        return entries.stream();
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public GlEntry first() {
        if (entries.isEmpty()) {
            throw new IllegalStateException("Batch has no entries");
        }
        return entries.get(0);
    }

    public String voucherType() {
        return first().getVoucherType();
    }

    public String voucherNo() {
        return first().getVoucherNo();
    }

    public String company() {
        return first().getCompany();
    }

    public LocalDate postingDate() {
        return first().getPostingDate();
    }

    public VoucherRef voucherRef() {
        return first().voucherRef();
    }

    public BigDecimal totalDebit() {
        return entries.stream()
            .map(GlEntry::getDebit)
            .map(Amounts::orZero)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal totalCredit() {
        return entries.stream()
            .map(GlEntry::getCredit)
            .map(Amounts::orZero)
            .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /**
     * Total debit minus total credit, each line rounded to the precision first.
     */
    public BigDecimal difference(int precision) {
        BigDecimal diff = entries.stream()
            .map(e -> Amounts.round(e.getDebit(), precision).subtract(Amounts.round(e.getCredit(), precision)))
            .reduce(BigDecimal.ZERO, BigDecimal::add);
        return Amounts.round(diff, precision);
    }

    /**
     * True if total debit equals total credit at two decimal places.
     */
    public boolean isBalanced() {
        return Amounts.isZero(totalDebit().subtract(totalCredit()), BALANCE_PRECISION);
    }

    /**
     * True if the absolute debit/credit difference is strictly below the tolerance.
     */
    public boolean isBalanced(BigDecimal tolerance) {
        return Amounts.round(totalDebit().subtract(totalCredit()), BALANCE_PRECISION).abs()
            .compareTo(tolerance) < 0;
    }

    public GlBatch append(Collection<GlEntry> additional) {
        if (additional.isEmpty()) {
            return this;
        }
        List<GlEntry> combined = new ArrayList<>(entries);
        combined.addAll(additional);
        return new GlBatch(combined);
    }

    public GlBatch append(GlEntry entry) {
        return append(List.of(entry));
    }

    public GlBatch map(Function<GlEntry, GlEntry> transform) {
        return new GlBatch(entries.stream().map(transform).toList());
    }

    /**
     * Builds the inverse batch used to cancel this one: debit and credit are
     * swapped on every currency view and remarks are prefixed.
     */
    public GlBatch reversed(String remarkPrefix) {
        return map(entry -> entry.swapDebitCredit().toBuilder()
            .remarks(remarkPrefix + (entry.getRemarks() != null ? entry.getRemarks() : ""))
            .build());
    }
}
