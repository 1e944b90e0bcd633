package br.com.analytics.pipeline.profit_analytics_batch.model;

/**
 * @param daysWithActivity number of dates in the range that produced a daily metric
 * @param expectedDays     number of calendar dates in the range
 */
public record RangeOverview(
        MetricTotals totals,
        DerivedMetrics derived,
        int daysWithActivity,
        int expectedDays
) {
}
