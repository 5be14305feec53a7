package com.skindx.domain.diagnosis.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

public final class Confidence {

    private Confidence() {
    }

    public static double clamp(double value) {
        if (Double.isNaN(value)) return 0.0;
        return Math.max(0.0, Math.min(1.0, value));
    }

    /**
     * Half-up rounding to two decimals. Weighted sums such as 0.785 may land just below
     * the midpoint in binary, so the value is first settled at ten decimals. Non-finite
     * input is clamped instead of rounded.
     */
    public static double round2(double value) {
        if (!Double.isFinite(value)) return clamp(value);
        return BigDecimal.valueOf(value)
                .setScale(10, RoundingMode.HALF_UP)
                .setScale(2, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
