package com.flagship.general_ledger.ledger.port;

import com.flagship.general_ledger.ledger.GlEntry;

import java.util.List;

/**
 * Persistence contract for GL entries.
 *
 * Stored entries are append-only: corrections are made by saving a
 * reversing batch, never by updating amounts.
 */
public interface GlEntryStore {

    default void save(GlEntry entry) {
        saveBatch(List.of(entry));
    }

    /**
     * Persists all entries of one transaction. Either every entry commits or none does.
     */
    void saveBatch(List<GlEntry> entries);

    /**
     * All stored entries of the voucher, cancelled ones included, in insertion order.
     */
    List<GlEntry> getByVoucher(String voucherType, String voucherNo);

    void markCancelled(String voucherType, String voucherNo);

    /**
     * Marks the voucher's entries cancelled and saves the reversal as one atomic unit.
     * Implementations that are not called inside a surrounding transaction must override this.
     */
    default void cancel(String voucherType, String voucherNo, List<GlEntry> reversal) {
        markCancelled(voucherType, voucherNo);
        saveBatch(reversal);
    }
}
