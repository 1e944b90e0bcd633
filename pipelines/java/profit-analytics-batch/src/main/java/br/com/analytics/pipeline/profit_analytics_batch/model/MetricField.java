package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.util.Locale;

/**
 * Additive fields of a daily or period metric. Count fields stay integral, money fields carry two decimals
 * once rounded.
 */
public enum MetricField {
    REVENUE(false),
    GROSS_SALES(false),
    DISCOUNTS(false),
    REFUNDS(false),
    TAXES_COLLECTED(false),
    ORDERS(true),
    UNITS_SOLD(true),
    CANCELLED_ORDERS(true),
    PREPAID_ORDERS(true),
    COD_ORDERS(true),
    COGS(false),
    SHIPPING_COSTS(false),
    HANDLING_FEES(false),
    TRANSACTION_FEES(false),
    MARKETING_COSTS(false),
    OPERATIONAL_COSTS(false),
    OTHER_COSTS(false),
    TAXES_PAID(false),
    AD_SPEND(false),
    PLATFORM_CONVERSION_VALUE(false),
    IMPRESSIONS(true),
    CLICKS(true),
    CONVERSIONS(true),
    REACH(true),
    VIDEO_VIEWS(true),
    VIDEO_3SEC_VIEWS(true),
    SESSIONS(true),
    VISITORS(true),
    TOTAL_CUSTOMERS(true),
    NEW_CUSTOMERS(true),
    RETURNING_CUSTOMERS(true);

    private final boolean count;

    MetricField(boolean count) {
        this.count = count;
    }

    public boolean isCount() {
        return count;
    }

    public String column() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static MetricField forCostType(CostType type) {
        return switch (type) {
            case PRODUCT -> COGS;
            case SHIPPING -> SHIPPING_COSTS;
            case HANDLING -> HANDLING_FEES;
            case PAYMENT -> TRANSACTION_FEES;
            case MARKETING -> MARKETING_COSTS;
            case OPERATIONAL -> OPERATIONAL_COSTS;
            case TAX -> TAXES_PAID;
            case OTHER -> OTHER_COSTS;
        };
    }
}
