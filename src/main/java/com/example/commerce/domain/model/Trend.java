package com.example.commerce.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Period-over-period change in percent, rounded to one decimal place.
 * A zero or missing baseline yields 0.
 */
public final class Trend {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Trend() {
    }

    public static double percentChange(long current, long previous) {
        return percentChange(BigDecimal.valueOf(current), BigDecimal.valueOf(previous));
    }

    public static double percentChange(BigDecimal current, BigDecimal previous) {
        if (previous == null || previous.signum() <= 0) {
            return 0.0;
        }
        BigDecimal base = current != null ? current : BigDecimal.ZERO;
        return base.subtract(previous)
                .multiply(HUNDRED)
                .divide(previous, 1, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
