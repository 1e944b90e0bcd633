package br.com.analytics.pipeline.profit_analytics_batch.model;

import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;

public record Refund(
        String id,
        String orderId,
        BigDecimal amount,
        long processedAt
) implements SourceRecord {

    public Refund {
        amount = SafeNumbers.money(amount);
    }
}
