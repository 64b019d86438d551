package com.flagship.general_ledger.ledger.processing;

import com.flagship.general_ledger.ledger.GlEntry;
import lombok.Value;

/**
 * Composite identity deciding which entries collapse into one during merge.
 * Null and empty values compare equal to each other but not to a populated value.
 */
@Value
public class MergeKey {
    String account;
    String costCenter;
    String party;
    String partyType;
    String voucherDetailNo;
    String againstVoucher;
    String againstVoucherType;
    String project;
    String financeBook;
    String voucherNo;

    public static MergeKey of(GlEntry entry) {
        return new MergeKey(
            normalize(entry.getAccount()),
            normalize(entry.getCostCenter()),
            normalize(entry.getParty()),
            normalize(entry.getPartyType()),
            normalize(entry.getVoucherDetailNo()),
            normalize(entry.getAgainstVoucher()),
            normalize(entry.getAgainstVoucherType()),
            normalize(entry.getProject()),
            normalize(entry.getFinanceBook()),
            normalize(entry.getVoucherNo())
        );
    }

    private static String normalize(String value) {
        return value != null ? value : "";
    }
}
