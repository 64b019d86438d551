package com.flagship.general_ledger.ledger;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Set;

/**
 * Numeric and naming policy for the posting pipeline.
 * Bound from {@code ledger.posting.*} properties; see LedgerConfig.
 */
@Value
@Builder(toBuilder = true)
public class PostingPolicy {

    @Builder.Default
    int precision = 2;

    @Builder.Default
    BigDecimal defaultAllowance = new BigDecimal("0.5");

    @Builder.Default
    BigDecimal tightAllowance = new BigDecimal("0.05");

    @Singular
    Set<String> tightAllowanceVoucherTypes;

    @Builder.Default
    String periodClosingVoucherType = "Period Closing Voucher";

    @Builder.Default
    String roundOffRemark = "Round Off";

    @Builder.Default
    String reversalRemarkPrefix = "Cancelled: ";

    public static PostingPolicy defaults() {
        return PostingPolicy.builder()
            .tightAllowanceVoucherType("Journal Entry")
            .tightAllowanceVoucherType("Payment Entry")
            .build();
    }

    /**
     * Largest debit/credit difference that may be absorbed by a round-off entry.
     */
    public BigDecimal allowanceFor(String voucherType) {
        return tightAllowanceVoucherTypes.contains(voucherType) ? tightAllowance : defaultAllowance;
    }

    public BigDecimal minUnit() {
        return Amounts.minUnit(precision);
    }

    public boolean isPeriodClosingVoucher(String voucherType) {
        return periodClosingVoucherType.equals(voucherType);
    }
}
