package br.com.analytics.pipeline.profit_analytics_batch.model;

import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

public record Order(
        String id,
        String organizationId,
        long createdAt,
        BigDecimal totalPrice,
        BigDecimal subtotalPrice,
        BigDecimal totalDiscounts,
        BigDecimal totalShippingPrice,
        BigDecimal totalTax,
        long totalQuantity,
        String customerId,
        String financialStatus,
        String fulfillmentStatus
) implements SourceRecord {

    private static final Set<String> CANCELLED_FINANCIAL = Set.of("voided");
    private static final Set<String> CANCELLED_FULFILLMENT = Set.of("cancelled", "canceled");

    public Order {
        totalPrice = SafeNumbers.money(totalPrice);
        subtotalPrice = SafeNumbers.money(subtotalPrice);
        totalDiscounts = SafeNumbers.money(totalDiscounts);
        totalShippingPrice = SafeNumbers.money(totalShippingPrice);
        totalTax = SafeNumbers.money(totalTax);
        totalQuantity = Math.max(0L, totalQuantity);
    }

    public boolean isCancelled() {
        return matches(financialStatus, CANCELLED_FINANCIAL) || matches(fulfillmentStatus, CANCELLED_FULFILLMENT);
    }

    public BigDecimal grossSales() {
        return subtotalPrice.add(totalDiscounts);
    }

    private static boolean matches(String status, Set<String> values) {
        return status != null && values.contains(status.trim().toLowerCase(Locale.ROOT));
    }
}
