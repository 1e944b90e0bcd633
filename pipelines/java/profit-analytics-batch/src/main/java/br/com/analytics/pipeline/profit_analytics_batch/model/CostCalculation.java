package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.util.Locale;

public enum CostCalculation {
    PERCENTAGE,
    FIXED,
    PER_UNIT;

    /**
     * Returns null for calculations this engine does not support (tiered, weight based, formula).
     */
    public static CostCalculation fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
