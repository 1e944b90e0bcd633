package br.com.analytics.pipeline.profit_analytics_batch.model;

import org.jspecify.annotations.Nullable;

public record Customer(
        String id,
        String organizationId,
        @Nullable Long firstOrderAt,
        long ordersCount
) implements SourceRecord {
}
