package org.coregstack.coreg;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Fixed precision rounding applied to the azimuth correction terms so results match stacks
 * processed by earlier versions of the workflow.
 * <p>
 * Rounds the exact binary value of a double half-even, so {@code 2.675} (stored as 2.67499...)
 * rounds down at two decimals.
 */
public final class HistoricalRounding {

    public static final int DECIMALS = 6;

    private HistoricalRounding() {
    }

    public static double round6(double value) {
        return round(value, DECIMALS);
    }

    public static double round(double value, int decimals) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return value;
        }
        return new BigDecimal(value).setScale(decimals, RoundingMode.HALF_EVEN).doubleValue();
    }
}
