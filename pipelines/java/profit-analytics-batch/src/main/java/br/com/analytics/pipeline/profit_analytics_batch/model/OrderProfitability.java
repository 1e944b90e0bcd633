package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.math.BigDecimal;
import java.time.LocalDate;

public record OrderProfitability(
        String orderId,
        LocalDate date,
        BigDecimal revenue,
        BigDecimal grossSales,
        long units,
        CostBreakdown costs,
        BigDecimal totalCost,
        BigDecimal profit,
        BigDecimal profitMargin,
        boolean cancelled
) {
}
