package br.com.analytics.pipeline.profit_analytics_batch.support;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Single ingress point for numeric values coming out of source rows. Anything that is null,
 * non-finite or not a number becomes zero, so the formulas downstream never see a missing value.
 */
public final class SafeNumbers {

    public static final int MONEY_SCALE = 2;
    public static final int WORKING_SCALE = 10;

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private SafeNumbers() {
    }

    public static BigDecimal money(Object value) {
        if (value == null) {
            return BigDecimal.ZERO;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Double || value instanceof Float) {
            double raw = ((Number) value).doubleValue();
            return Double.isFinite(raw) ? BigDecimal.valueOf(raw) : BigDecimal.ZERO;
        }
        if (value instanceof Number number) {
            return BigDecimal.valueOf(number.longValue());
        }
        if (value instanceof CharSequence text) {
            String trimmed = text.toString().trim();
            if (trimmed.isEmpty()) {
                return BigDecimal.ZERO;
            }
            try {
                return new BigDecimal(trimmed);
            } catch (NumberFormatException e) {
                return BigDecimal.ZERO;
            }
        }
        return BigDecimal.ZERO;
    }

    public static long count(Object value) {
        return Math.max(0L, money(value).longValue());
    }

    public static BigDecimal nonNegative(BigDecimal value) {
        return value.signum() < 0 ? BigDecimal.ZERO : value;
    }

    /**
     * Division that yields zero for a zero or missing denominator.
     */
    public static BigDecimal divide(BigDecimal numerator, BigDecimal denominator) {
        if (denominator == null || denominator.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return numerator.divide(denominator, WORKING_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal divide(BigDecimal numerator, long denominator) {
        return divide(numerator, BigDecimal.valueOf(denominator));
    }

    public static BigDecimal ratioPercent(BigDecimal numerator, BigDecimal denominator) {
        return divide(numerator, denominator).multiply(HUNDRED);
    }

    public static BigDecimal percentOf(BigDecimal base, BigDecimal percent) {
        return base.multiply(percent).divide(HUNDRED, WORKING_SCALE, RoundingMode.HALF_UP);
    }

    public static BigDecimal round(BigDecimal value) {
        return value.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }
}
