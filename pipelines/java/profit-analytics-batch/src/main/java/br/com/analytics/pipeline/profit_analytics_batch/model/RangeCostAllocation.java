package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.math.BigDecimal;

public record RangeCostAllocation(
        String costRuleId,
        String name,
        CostType type,
        BigDecimal amount
) {
}
