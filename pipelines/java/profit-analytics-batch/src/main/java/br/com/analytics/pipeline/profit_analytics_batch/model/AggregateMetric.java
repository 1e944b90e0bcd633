package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.SortedSet;

public record AggregateMetric(
        String organizationId,
        String periodKey,
        PeriodType periodType,
        MetricTotals totals,
        DerivedMetrics derived,
        int daysIncluded,
        SortedSet<LocalDate> dates,
        LocalDateTime calculationDate
) {
}
