package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.time.LocalDate;

public record SessionMetric(
        String id,
        LocalDate date,
        long sessions,
        long visitors
) implements SourceRecord {
}
