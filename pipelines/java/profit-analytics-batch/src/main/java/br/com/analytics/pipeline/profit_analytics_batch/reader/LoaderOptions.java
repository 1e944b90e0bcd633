package br.com.analytics.pipeline.profit_analytics_batch.reader;

import br.com.analytics.pipeline.profit_analytics_batch.model.AnalyticsDataset;
import org.jspecify.annotations.Nullable;

import java.util.EnumSet;
import java.util.Set;

/**
 * @param datasets  allow-list of datasets to return, null for all of them
 * @param maxOrders stop the order track after this many orders, null or non-positive for no cap
 */
public record LoaderOptions(
        @Nullable Set<AnalyticsDataset> datasets,
        @Nullable Integer maxOrders
) {

    public LoaderOptions {
        datasets = datasets == null ? null : Set.copyOf(datasets);
    }

    public static LoaderOptions all() {
        return new LoaderOptions(null, null);
    }

    public static LoaderOptions withMaxOrders(@Nullable Integer maxOrders) {
        return new LoaderOptions(null, maxOrders);
    }

    public boolean shouldFetch(AnalyticsDataset dataset) {
        return datasets == null || datasets.contains(dataset);
    }

    public Set<AnalyticsDataset> requested() {
        if (datasets == null) {
            return EnumSet.allOf(AnalyticsDataset.class);
        }
        Set<AnalyticsDataset> requested = EnumSet.noneOf(AnalyticsDataset.class);
        requested.addAll(datasets);
        return requested;
    }

    Integer orderLimit() {
        return maxOrders != null && maxOrders > 0 ? maxOrders : null;
    }
}
