package com.flagship.general_ledger.ledger.port;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Budget limit exceeded by a batch for one account / cost center pair.
 */
@Value
public class BudgetViolation {
    String account;
    String costCenter;
    BigDecimal budget;
    BigDecimal actual;

    public BigDecimal getVariance() {
        return actual.subtract(budget);
    }
}
