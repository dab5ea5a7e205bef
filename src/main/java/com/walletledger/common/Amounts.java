package com.walletledger.common;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Rounding and comparison helpers for amounts held as doubles.
 */
public final class Amounts {

    /** Tolerance used when comparing balances across stores. */
    public static final double EPSILON = 1e-5;

    private Amounts() {
    }

    public static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public static double round2(double value) {
        return round(value, 2);
    }

    public static boolean equal(double a, double b) {
        return Math.abs(a - b) <= EPSILON;
    }

    public static boolean isZero(double value) {
        return Math.abs(value) <= EPSILON;
    }
}
