package br.com.analytics.pipeline.profit_analytics_batch.model;

import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;

public record VariantCostComponent(
        String id,
        String variantId,
        BigDecimal cogsPerUnit,
        BigDecimal shippingPerUnit,
        BigDecimal handlingPerUnit,
        BigDecimal paymentFeePercent,
        BigDecimal paymentFixedPerItem,
        EffectiveWindow window,
        boolean active
) implements SourceRecord {

    public VariantCostComponent {
        cogsPerUnit = SafeNumbers.money(cogsPerUnit);
        shippingPerUnit = SafeNumbers.money(shippingPerUnit);
        handlingPerUnit = SafeNumbers.money(handlingPerUnit);
        paymentFeePercent = SafeNumbers.money(paymentFeePercent);
        paymentFixedPerItem = SafeNumbers.money(paymentFixedPerItem);
        window = window == null ? EffectiveWindow.open() : window;
    }

    public boolean appliesAt(long timestamp) {
        return active && window.contains(timestamp);
    }
}
