package br.com.analytics.pipeline.profit_analytics_batch.model;

import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

public record Transaction(
        String id,
        String orderId,
        BigDecimal amount,
        BigDecimal fee,
        String gateway,
        String kind,
        long processedAt
) implements SourceRecord {

    private static final Set<String> CASH_ON_DELIVERY_GATEWAYS = Set.of("cash_on_delivery", "cod", "manual");

    public Transaction {
        amount = SafeNumbers.money(amount);
        fee = SafeNumbers.money(fee);
    }

    public boolean isCashOnDelivery() {
        return gateway != null && CASH_ON_DELIVERY_GATEWAYS.contains(gateway.trim().toLowerCase(Locale.ROOT));
    }
}
