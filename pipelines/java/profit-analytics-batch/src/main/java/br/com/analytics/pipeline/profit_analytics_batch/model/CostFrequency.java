package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.util.Locale;

public enum CostFrequency {
    PER_ORDER,
    PER_ITEM,
    DAILY,
    WEEKLY,
    MONTHLY,
    QUARTERLY,
    YEARLY,
    ONE_TIME;

    public static CostFrequency fromValue(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("PER_UNIT".equals(normalized)) {
            return PER_ITEM;
        }
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    public boolean isCalendarBased() {
        return this == DAILY || this == WEEKLY || this == MONTHLY || this == QUARTERLY || this == YEARLY;
    }
}
