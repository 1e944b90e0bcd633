package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.time.LocalDate;

public record ShopAnalyticsSnapshot(
        String id,
        LocalDate date,
        long sessions,
        long pageViews,
        long abandonedCarts
) implements SourceRecord {
}
