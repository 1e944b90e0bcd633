package br.com.analytics.pipeline.profit_analytics_batch.model;

import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.EnumMap;
import java.util.Map;

/**
 * Additive accumulator behind daily and period metrics. Only sums live here; ratios are derived from a
 * finished accumulator by {@link DerivedMetrics#from(MetricTotals)}.
 */
public final class MetricTotals {

    private final EnumMap<MetricField, BigDecimal> values = new EnumMap<>(MetricField.class);

    public MetricTotals() {
        for (MetricField field : MetricField.values()) {
            values.put(field, BigDecimal.ZERO);
        }
    }

    public static MetricTotals empty() {
        return new MetricTotals();
    }

    public BigDecimal get(MetricField field) {
        return values.get(field);
    }

    public long getCount(MetricField field) {
        return values.get(field).longValue();
    }

    public MetricTotals add(MetricField field, BigDecimal amount) {
        if (amount != null && amount.signum() != 0) {
            values.merge(field, amount, BigDecimal::add);
        }
        return this;
    }

    public MetricTotals add(MetricField field, long amount) {
        return add(field, BigDecimal.valueOf(amount));
    }

    public MetricTotals increment(MetricField field) {
        return add(field, BigDecimal.ONE);
    }

    public void set(MetricField field, BigDecimal value) {
        values.put(field, SafeNumbers.money(value));
    }

    public MetricTotals merge(MetricTotals other) {
        for (Map.Entry<MetricField, BigDecimal> entry : other.values.entrySet()) {
            add(entry.getKey(), entry.getValue());
        }
        return this;
    }

    public boolean hasActivity() {
        return values.values().stream().anyMatch(value -> value.signum() != 0);
    }

    public MetricTotals rounded() {
        MetricTotals copy = new MetricTotals();
        for (Map.Entry<MetricField, BigDecimal> entry : values.entrySet()) {
            BigDecimal value = entry.getKey().isCount()
                    ? entry.getValue().setScale(0, RoundingMode.HALF_UP)
                    : SafeNumbers.round(entry.getValue());
            copy.values.put(entry.getKey(), value);
        }
        return copy;
    }

    public MetricTotals copy() {
        MetricTotals copy = new MetricTotals();
        copy.values.putAll(values);
        return copy;
    }

    public BigDecimal revenue() {
        return get(MetricField.REVENUE);
    }

    public long orders() {
        return getCount(MetricField.ORDERS);
    }

    @Override
    public String toString() {
        return "MetricTotals" + values;
    }
}
