package br.com.analytics.pipeline.profit_analytics_batch.model;

import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;

public record OrderLineItem(
        String id,
        String orderId,
        String variantId,
        long quantity,
        BigDecimal unitPrice,
        BigDecimal lineDiscount
) implements SourceRecord {

    public OrderLineItem {
        quantity = Math.max(0L, quantity);
        unitPrice = SafeNumbers.money(unitPrice);
        lineDiscount = SafeNumbers.money(lineDiscount);
    }

    public BigDecimal grossAmount() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity));
    }

    // unitPrice x quantity - lineDiscount, floored at zero
    public BigDecimal netRevenue() {
        return SafeNumbers.nonNegative(grossAmount().subtract(lineDiscount));
    }
}
