package com.flagship.general_ledger.ledger.port;

import com.flagship.general_ledger.ledger.GlBatch;

import java.util.Optional;

public interface BudgetValidator {

    /**
     * Returns the first budget the batch would exceed, or empty if within limits.
     */
    Optional<BudgetViolation> validate(GlBatch batch);
}
