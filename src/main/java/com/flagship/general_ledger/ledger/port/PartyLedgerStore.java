package com.flagship.general_ledger.ledger.port;

import com.flagship.general_ledger.ledger.PartyLedgerEntry;

import java.util.List;

/**
 * Persistence contract for the receivable / payable ledger.
 */
public interface PartyLedgerStore {

    void saveBatch(List<PartyLedgerEntry> entries);

    List<PartyLedgerEntry> getByVoucher(String voucherType, String voucherNo);

    /** Detaches the voucher's entries from outstanding calculations (on cancellation). */
    void delink(String voucherType, String voucherNo);
}
