package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.util.List;

public record RangeAnalytics(
        RangeOverview overview,
        List<OrderProfitability> perOrderBreakdown,
        List<PeriodRow> periodTable,
        List<RangeCostAllocation> costAllocations,
        LoadMetadata metadata
) {
}
