package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.time.LocalDate;

public record PeriodRow(
        String periodKey,
        LocalDate periodStart,
        LocalDate periodEnd,
        MetricTotals totals,
        DerivedMetrics derived,
        int daysIncluded
) {
}
