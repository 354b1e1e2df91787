package com.tournament.analytics.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Money arithmetic helpers. Amounts are kept at two decimal places, rounded half-up.
 */
public final class MoneyUtils {

    public static final int SCALE = 2;

    private MoneyUtils() {
    }

    public static BigDecimal fromCents(long cents) {
        return BigDecimal.valueOf(cents, SCALE);
    }

    public static BigDecimal scale(BigDecimal value) {
        return value == null ? null : value.setScale(SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal divide(BigDecimal dividend, BigDecimal divisor) {
        if (divisor == null || divisor.signum() == 0) {
            return BigDecimal.ZERO.setScale(SCALE);
        }
        return dividend.divide(divisor, SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal divide(BigDecimal dividend, long divisor) {
        return divide(dividend, BigDecimal.valueOf(divisor));
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    public static double toDouble(BigDecimal value) {
        return value == null ? 0.0 : value.doubleValue();
    }

    /**
     * Rounds a ratio or percentage to two decimals.
     */
    public static double round2(double value) {
        if (!Double.isFinite(value)) {
            return value;
        }
        return BigDecimal.valueOf(value).setScale(SCALE, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * {@code part / whole * 100} at two decimals, 0 when {@code whole} is 0.
     */
    public static double percentage(double part, double whole) {
        if (whole == 0) {
            return 0.0;
        }
        return round2(part / whole * 100.0);
    }
}
