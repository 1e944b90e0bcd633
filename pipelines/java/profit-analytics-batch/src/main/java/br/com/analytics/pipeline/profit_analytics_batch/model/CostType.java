package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.util.Locale;

public enum CostType {
    PRODUCT,
    SHIPPING,
    HANDLING,
    PAYMENT,
    MARKETING,
    OPERATIONAL,
    TAX,
    OTHER;

    public static CostType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return OTHER;
        }
    }
}
