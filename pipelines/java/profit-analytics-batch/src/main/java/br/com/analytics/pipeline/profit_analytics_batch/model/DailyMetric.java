package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.time.LocalDate;
import java.time.LocalDateTime;

public record DailyMetric(
        String organizationId,
        LocalDate date,
        MetricTotals totals,
        DerivedMetrics derived,
        LocalDateTime calculationDate
) {

    /**
     * Rounds the finished totals and derives every ratio from them once.
     */
    public static DailyMetric finish(String organizationId, LocalDate date, MetricTotals totals) {
        MetricTotals rounded = totals.rounded();
        return new DailyMetric(organizationId, date, rounded, DerivedMetrics.from(rounded).rounded(),
                LocalDateTime.now());
    }

    public AggregationKey key() {
        return new AggregationKey(organizationId, date);
    }
}
