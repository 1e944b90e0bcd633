package br.com.analytics.pipeline.profit_analytics_batch.model;

import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;

public record Variant(
        String id,
        String productId,
        String sku,
        BigDecimal price
) implements SourceRecord {

    public Variant {
        price = SafeNumbers.money(price);
    }
}
