package br.com.analytics.pipeline.profit_analytics_batch.model;

import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;

/**
 * Organization level cost rule. A rule with an unsupported calculation or a malformed window is kept
 * but never becomes active.
 */
public record CostRule(
        String id,
        String organizationId,
        String name,
        CostType type,
        CostCalculation calculation,
        CostFrequency frequency,
        BigDecimal value,
        CostRuleConfig config,
        EffectiveWindow window,
        boolean active
) implements SourceRecord {

    public CostRule {
        type = type == null ? CostType.OTHER : type;
        value = SafeNumbers.money(value);
        config = config == null ? CostRuleConfig.NONE : config;
        window = window == null ? EffectiveWindow.open() : window;
    }

    public boolean isWellFormed() {
        return calculation != null && window.isValid();
    }

    public boolean isActiveAt(long timestamp) {
        return active && isWellFormed() && window.contains(timestamp);
    }

    public boolean isActiveBetween(long startInclusive, long endExclusive) {
        return active && isWellFormed() && window.overlaps(startInclusive, endExclusive);
    }
}
