package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.util.Map;

/**
 * @param reducedPageSizes final page size of every dataset whose page size had to shrink during the run
 */
public record LoadMetadata(
        boolean truncatedOrders,
        int processedOrderCount,
        Map<AnalyticsDataset, Integer> reducedPageSizes
) {

    public LoadMetadata {
        reducedPageSizes = Map.copyOf(reducedPageSizes);
    }

    public static LoadMetadata empty() {
        return new LoadMetadata(false, 0, Map.of());
    }
}
