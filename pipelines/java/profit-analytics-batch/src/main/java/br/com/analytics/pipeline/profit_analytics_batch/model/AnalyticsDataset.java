package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.util.EnumSet;
import java.util.Set;

public enum AnalyticsDataset {
    ORDERS("orders", false, false),
    ORDER_ITEMS("orderItems", false, false),
    TRANSACTIONS("transactions", false, false),
    REFUNDS("refunds", false, false),
    FULFILLMENTS("fulfillments", false, false),
    CUSTOMERS("customers", false, false),
    PRODUCTS("products", false, false),
    VARIANTS("variants", false, false),
    COST_COMPONENTS("productCostComponents", false, false),
    AD_INSIGHTS("metaInsights", true, false),
    GLOBAL_COSTS("costs", true, false),
    SESSIONS("sessions", true, false),
    SHOP_ANALYTICS("analytics", true, true);

    private final String key;
    private final boolean supplemental;
    private final boolean secondary;

    AnalyticsDataset(String key, boolean supplemental, boolean secondary) {
        this.key = key;
        this.supplemental = supplemental;
        this.secondary = secondary;
    }

    public String key() {
        return key;
    }

    public boolean isSupplemental() {
        return supplemental;
    }

    // Secondary datasets page with a smaller default size.
    public boolean isSecondary() {
        return secondary;
    }

    public static Set<AnalyticsDataset> supplementalDatasets() {
        Set<AnalyticsDataset> datasets = EnumSet.noneOf(AnalyticsDataset.class);
        for (AnalyticsDataset dataset : values()) {
            if (dataset.supplemental) {
                datasets.add(dataset);
            }
        }
        return datasets;
    }

    public static AnalyticsDataset fromKey(String key) {
        for (AnalyticsDataset dataset : values()) {
            if (dataset.key.equals(key)) {
                return dataset;
            }
        }
        throw new IllegalArgumentException("Unknown analytics dataset: " + key);
    }
}
