package br.com.analytics.pipeline.profit_analytics_batch.model;

public record Product(
        String id,
        String title,
        String vendor
) implements SourceRecord {
}
