package br.com.analytics.pipeline.profit_analytics_batch.processor;

import br.com.analytics.pipeline.profit_analytics_batch.model.CostBreakdown;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostType;
import br.com.analytics.pipeline.profit_analytics_batch.model.MetricField;
import br.com.analytics.pipeline.profit_analytics_batch.model.MetricTotals;
import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;

/**
 * Unrounded running cost per {@link CostType}. Rounding happens once, when the buckets are turned into a
 * breakdown or folded into finished metric totals.
 */
public final class CostBuckets {

    private final EnumMap<CostType, BigDecimal> amounts = new EnumMap<>(CostType.class);

    public CostBuckets() {
        for (CostType type : CostType.values()) {
            amounts.put(type, BigDecimal.ZERO);
        }
    }

    public CostBuckets add(CostType type, BigDecimal amount) {
        if (amount != null && amount.signum() != 0) {
            amounts.merge(type, amount, BigDecimal::add);
        }
        return this;
    }

    public BigDecimal get(CostType type) {
        return amounts.get(type);
    }

    public BigDecimal total() {
        return amounts.values().stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public void addTo(MetricTotals totals) {
        for (Map.Entry<CostType, BigDecimal> entry : amounts.entrySet()) {
            totals.add(MetricField.forCostType(entry.getKey()), entry.getValue());
        }
    }

    public CostBreakdown toBreakdown() {
        return new CostBreakdown(
                SafeNumbers.round(get(CostType.PRODUCT)),
                SafeNumbers.round(get(CostType.SHIPPING)),
                SafeNumbers.round(get(CostType.HANDLING)),
                SafeNumbers.round(get(CostType.PAYMENT)),
                SafeNumbers.round(get(CostType.MARKETING)),
                SafeNumbers.round(get(CostType.OPERATIONAL)),
                SafeNumbers.round(get(CostType.TAX)),
                SafeNumbers.round(get(CostType.OTHER))
        );
    }
}
