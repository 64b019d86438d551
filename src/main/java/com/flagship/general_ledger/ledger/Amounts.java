package com.flagship.general_ledger.ledger;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed-precision money helpers shared by the posting pipeline.
 */
public final class Amounts {

    private Amounts() {
        // Utility class
    }

    public static BigDecimal round(BigDecimal value, int precision) {
        return orZero(value).setScale(precision, RoundingMode.HALF_UP);
    }

    /**
     * Smallest representable unit at the given precision, e.g. 0.01 for 2.
     */
    public static BigDecimal minUnit(int precision) {
        return BigDecimal.ONE.movePointLeft(precision);
    }

    public static boolean isZero(BigDecimal value, int precision) {
        return round(value, precision).signum() == 0;
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
