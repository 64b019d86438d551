package com.flagship.general_ledger.ledger;

import lombok.Value;

/**
 * Identifies the source document (invoice, payment, adjustment) of a batch.
 */
@Value
public class VoucherRef {
    String voucherType;
    String voucherNo;
    String company;

    @Override
    public String toString() {
        return voucherType + " #" + voucherNo;
    }
}
