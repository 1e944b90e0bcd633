package br.com.analytics.pipeline.profit_analytics_batch.model;

public record Fulfillment(
        String id,
        String orderId,
        String status,
        long createdAt
) implements SourceRecord {
}
