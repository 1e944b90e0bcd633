package br.com.analytics.pipeline.profit_analytics_batch.model;

import org.jspecify.annotations.Nullable;

/**
 * @param maxOrders       caps how many orders the loader reads, null for no cap
 * @param includeCancelled whether cancelled orders show up in the per-order breakdown
 */
public record AnalyticsFilters(
        Granularity granularity,
        @Nullable Integer maxOrders,
        boolean includeCancelled
) {

    public AnalyticsFilters {
        granularity = granularity == null ? Granularity.DAILY : granularity;
    }

    public static AnalyticsFilters defaults() {
        return new AnalyticsFilters(Granularity.DAILY, null, false);
    }
}
