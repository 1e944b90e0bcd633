package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.math.BigDecimal;

public record CostBreakdown(
        BigDecimal cogs,
        BigDecimal shipping,
        BigDecimal handling,
        BigDecimal transactionFees,
        BigDecimal marketing,
        BigDecimal operational,
        BigDecimal tax,
        BigDecimal other
) {

    public static CostBreakdown zero() {
        return new CostBreakdown(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
                BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);
    }

    public BigDecimal totalCost() {
        return cogs.add(shipping).add(handling).add(transactionFees)
                .add(marketing).add(operational).add(tax).add(other);
    }

    public BigDecimal get(CostType type) {
        return switch (type) {
            case PRODUCT -> cogs;
            case SHIPPING -> shipping;
            case HANDLING -> handling;
            case PAYMENT -> transactionFees;
            case MARKETING -> marketing;
            case OPERATIONAL -> operational;
            case TAX -> tax;
            case OTHER -> other;
        };
    }
}
