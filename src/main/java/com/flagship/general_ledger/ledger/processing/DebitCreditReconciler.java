package com.flagship.general_ledger.ledger.processing;

import com.flagship.general_ledger.ledger.Amounts;
import com.flagship.general_ledger.ledger.GlBatch;
import com.flagship.general_ledger.ledger.GlEntry;
import com.flagship.general_ledger.ledger.PostingPolicy;
import com.flagship.general_ledger.ledger.PostingResult;
import com.flagship.general_ledger.ledger.error.PostingError;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Asserts that a batch balances and builds the round-off entry that absorbs
 * small differences.
 *
 * |difference| above the voucher type's allowance: hard failure.
 * minUnit <= |difference| <= allowance: round-off entry required.
 * |difference| below minUnit: nothing to do.
 */
@Slf4j
public class DebitCreditReconciler {

    private final PostingPolicy policy;

    public DebitCreditReconciler(PostingPolicy policy) {
        this.policy = policy;
    }

    public BigDecimal difference(GlBatch batch) {
        return batch.difference(policy.getPrecision());
    }

    /**
     * Checks the batch-wide debit/credit difference against the allowance.
     *
     * @return the difference a round-off entry has to absorb, empty if none is needed,
     *         or a DEBIT_CREDIT_MISMATCH failure
     */
    public PostingResult<Optional<BigDecimal>> check(GlBatch batch) {
        BigDecimal diff = difference(batch);
        BigDecimal allowance = policy.allowanceFor(batch.voucherType());

        if (diff.abs().compareTo(allowance) > 0) {
            return PostingResult.failure(
                PostingError.debitCreditMismatch(batch.voucherType(), batch.voucherNo(), diff));
        }
        if (diff.abs().compareTo(policy.minUnit()) >= 0) {
            return PostingResult.success(Optional.of(diff));
        }
        return PostingResult.success(Optional.empty());
    }

    /**
     * Appends an entry on the round-off account that cancels the difference:
     * credit when debits exceed credits, debit otherwise.
     */
    public GlBatch appendRoundOff(GlBatch batch, BigDecimal diff, RoundOffTarget target) {
        BigDecimal amount = Amounts.round(diff.abs(), policy.getPrecision());
        boolean creditSide = diff.signum() > 0;

        GlEntry.GlEntryBuilder builder = batch.first().withoutPartyReferences().toBuilder()
            .name(null)
            .account(target.getAccount())
            .costCenter(target.getCostCenter())
            .voucherDetailNo(null)
            .remarks(policy.getRoundOffRemark())
            .debitInTransactionCurrency(BigDecimal.ZERO)
            .creditInTransactionCurrency(BigDecimal.ZERO);
        if (target.getCurrency() != null) {
            builder.accountCurrency(target.getCurrency());
        }

        if (creditSide) {
            builder.debit(BigDecimal.ZERO).credit(amount)
                .debitInAccountCurrency(BigDecimal.ZERO).creditInAccountCurrency(amount);
        } else {
            builder.debit(amount).credit(BigDecimal.ZERO)
                .debitInAccountCurrency(amount).creditInAccountCurrency(BigDecimal.ZERO);
        }

        log.debug("Round-off entry on {}: {} {}", target.getAccount(), creditSide ? "credit" : "debit", amount);
        return batch.append(builder.build());
    }

    /**
     * Company round-off account, cost center and currency.
     */
    @Value
    public static class RoundOffTarget {
        String account;
        String costCenter;
        String currency;
    }
}
