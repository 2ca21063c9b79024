package com.nosota.mescrow.mapper;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Conversion between major currency units used by the API (150.25) and minor units
 * stored by the ledger (15025).
 */
public final class MinorUnits {

    private static final int SCALE = 2;

    private MinorUnits() {
    }

    /**
     * Rounds half-up to the nearest minor unit.
     *
     * @throws ArithmeticException if the result does not fit in a long
     */
    public static long toMinor(BigDecimal amount) {
        return amount.movePointRight(SCALE).setScale(0, RoundingMode.HALF_UP).longValueExact();
    }

    public static BigDecimal toMajor(long minor) {
        return BigDecimal.valueOf(minor, SCALE);
    }
}
