package com.flagship.general_ledger.ledger.processing;

import com.flagship.general_ledger.ledger.Amounts;
import com.flagship.general_ledger.ledger.GlBatch;
import com.flagship.general_ledger.ledger.GlEntry;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Batch-to-batch transforms applied before a batch is reconciled and saved:
 * merging of entries with the same {@link MergeKey} and normalization of
 * negative amounts.
 *
 * Transforms never modify the input batch.
 */
@Slf4j
public class GlMapProcessor {

    private final int precision;

    public GlMapProcessor(int precision) {
        this.precision = precision;
    }

    /**
     * Runs the pipeline: merge (optional), then negative-amount normalization.
     *
     * @param batch Batch to process
     * @param mergeEntries Whether entries with the same merge key are combined
     * @param zeroBalanceAccounts Accounts whose zero-balance merged entries are kept
     * @return Processed batch
     */
    public GlBatch process(GlBatch batch, boolean mergeEntries, Set<String> zeroBalanceAccounts) {
        GlBatch result = batch;
        if (mergeEntries) {
            result = mergeSimilarEntries(result, zeroBalanceAccounts);
        }
        return toggleDebitCreditIfNegative(result);
    }

    /**
     * Combines entries sharing a merge key by summing debit and credit in all
     * three currency views. Merged entries keep the position and the non-amount
     * fields of the first entry with that key.
     *
     * Entries whose rounded debit and credit are both zero are dropped, unless
     * posted to one of the given accounts.
     */
    public GlBatch mergeSimilarEntries(GlBatch batch, Set<String> zeroBalanceAccounts) {
        Map<MergeKey, GlEntry> merged = new LinkedHashMap<>();

        for (GlEntry entry : batch.entries()) {
            merged.merge(MergeKey.of(entry), entry, GlMapProcessor::accumulate);
        }

        List<GlEntry> result = merged.values().stream()
            .filter(entry -> !isZeroBalance(entry) || zeroBalanceAccounts.contains(entry.getAccount()))
            .toList();

        log.debug("Merged {} entries into {}", batch.size(), result.size());
        return GlBatch.of(result);
    }

    /**
     * Moves negative amounts to the opposite side so that no entry leaves the
     * pipeline with a negative debit or credit in any currency view.
     */
    public GlBatch toggleDebitCreditIfNegative(GlBatch batch) {
        return batch.map(GlMapProcessor::toggle);
    }

    private boolean isZeroBalance(GlEntry entry) {
        return Amounts.isZero(entry.getDebit(), precision) && Amounts.isZero(entry.getCredit(), precision);
    }

    private static GlEntry accumulate(GlEntry target, GlEntry source) {
        return target.toBuilder()
            .debit(sum(target.getDebit(), source.getDebit()))
            .credit(sum(target.getCredit(), source.getCredit()))
            .debitInAccountCurrency(sum(target.getDebitInAccountCurrency(), source.getDebitInAccountCurrency()))
            .creditInAccountCurrency(sum(target.getCreditInAccountCurrency(), source.getCreditInAccountCurrency()))
            .debitInTransactionCurrency(
                sum(target.getDebitInTransactionCurrency(), source.getDebitInTransactionCurrency()))
            .creditInTransactionCurrency(
                sum(target.getCreditInTransactionCurrency(), source.getCreditInTransactionCurrency()))
            .build();
    }

    private static GlEntry toggle(GlEntry entry) {
        DebitCredit company = DebitCredit.normalize(entry.getDebit(), entry.getCredit());
        DebitCredit account = DebitCredit.normalize(
            entry.getDebitInAccountCurrency(), entry.getCreditInAccountCurrency());
        DebitCredit transaction = DebitCredit.normalize(
            entry.getDebitInTransactionCurrency(), entry.getCreditInTransactionCurrency());

        return entry.toBuilder()
            .debit(company.debit)
            .credit(company.credit)
            .debitInAccountCurrency(account.debit)
            .creditInAccountCurrency(account.credit)
            .debitInTransactionCurrency(transaction.debit)
            .creditInTransactionCurrency(transaction.credit)
            .build();
    }

    private static BigDecimal sum(BigDecimal a, BigDecimal b) {
        return Amounts.orZero(a).add(Amounts.orZero(b));
    }

    /**
     * One debit/credit pair.
     */
    private static final class DebitCredit {
        private final BigDecimal debit;
        private final BigDecimal credit;

        private DebitCredit(BigDecimal debit, BigDecimal credit) {
            this.debit = debit;
            this.credit = credit;
        }

        static DebitCredit normalize(BigDecimal debitValue, BigDecimal creditValue) {
            BigDecimal debit = Amounts.orZero(debitValue);
            BigDecimal credit = Amounts.orZero(creditValue);

            // Both negative and equal: flip both in place
            if (debit.signum() < 0 && credit.signum() < 0 && debit.compareTo(credit) == 0) {
                debit = debit.negate();
                credit = credit.negate();
            }

            if (debit.signum() < 0) {
                credit = credit.subtract(debit);
                debit = BigDecimal.ZERO;
            }

            if (credit.signum() < 0) {
                debit = debit.subtract(credit);
                credit = BigDecimal.ZERO;
            }

            return new DebitCredit(debit, credit);
        }
    }
}
