package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.time.LocalDate;

public record AggregationKey(
        String organizationId,
        LocalDate date
) {
}
