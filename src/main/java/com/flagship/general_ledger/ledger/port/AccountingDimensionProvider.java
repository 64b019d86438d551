package com.flagship.general_ledger.ledger.port;

import com.flagship.general_ledger.ledger.GlBatch;

import java.util.List;

public interface AccountingDimensionProvider {

    /**
     * Dimensions of the company that need offsetting entries for this batch.
     */
    List<AccountingDimension> getDimensionsForOffsetting(GlBatch batch, String company);
}
