package com.flagship.general_ledger.ledger.processing;

import com.flagship.general_ledger.ledger.Amounts;
import com.flagship.general_ledger.ledger.GlBatch;
import com.flagship.general_ledger.ledger.GlEntry;
import com.flagship.general_ledger.ledger.port.AccountingDimension;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the balancing entries that keep independently balanced accounting
 * dimensions (e.g. business segments) neutral.
 *
 * For every entry and every dimension one entry is created on the dimension's
 * offsetting account, with debit and credit swapped and divided evenly across
 * the dimensions.
 */
public class DimensionOffsetter {

    static final String REMARK_PREFIX = "Offsetting for Accounting Dimension - ";

    private final int precision;

    public DimensionOffsetter(int precision) {
        this.precision = precision;
    }

    public GlBatch offset(GlBatch batch, List<AccountingDimension> dimensions) {
        return batch.append(offsettingEntries(batch, dimensions));
    }

    public List<GlEntry> offsettingEntries(GlBatch batch, List<AccountingDimension> dimensions) {
        if (dimensions.isEmpty()) {
            return List.of();
        }
        BigDecimal count = BigDecimal.valueOf(dimensions.size());

        List<GlEntry> offsetting = new ArrayList<>(batch.size() * dimensions.size());
        for (GlEntry entry : batch.entries()) {
            BigDecimal debit = share(entry.getCredit(), count);
            BigDecimal credit = share(entry.getDebit(), count);
            BigDecimal debitInTransactionCurrency = share(entry.getCreditInTransactionCurrency(), count);
            BigDecimal creditInTransactionCurrency = share(entry.getDebitInTransactionCurrency(), count);

            for (AccountingDimension dimension : dimensions) {
                offsetting.add(entry.withoutPartyReferences().toBuilder()
                    .name(null)
                    .account(dimension.getOffsettingAccount())
                    .accountCurrency(dimension.getAccountCurrency())
                    .debit(debit)
                    .credit(credit)
                    .debitInAccountCurrency(debit)
                    .creditInAccountCurrency(credit)
                    .debitInTransactionCurrency(debitInTransactionCurrency)
                    .creditInTransactionCurrency(creditInTransactionCurrency)
                    .remarks(REMARK_PREFIX + dimension.getName())
                    .build());
            }
        }
        return offsetting;
    }

    private BigDecimal share(BigDecimal amount, BigDecimal count) {
        return Amounts.round(amount, precision).divide(count, precision, RoundingMode.HALF_UP);
    }
}
