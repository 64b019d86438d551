package com.flagship.general_ledger.ledger;

import lombok.Builder;
import lombok.Value;

/**
 * Controls how a batch is posted.
 */
@Value
@Builder(toBuilder = true)
public class PostingOptions {

    /** Reverse the stored entries of the voucher instead of posting the batch. */
    boolean cancel;

    /** Advance adjustment: bypasses the accounts-frozen checks. */
    boolean advanceAdjustment;

    @Builder.Default
    boolean mergeEntries = true;

    /** Re-deriving a historical batch; skips budget and duplicate-voucher checks. */
    boolean fromRepost;

    public static PostingOptions defaults() {
        return PostingOptions.builder().build();
    }

    public static PostingOptions cancellation() {
        return PostingOptions.builder().cancel(true).build();
    }
}
