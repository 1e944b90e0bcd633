package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.util.List;

/**
 * Everything one loader run fetched for an organization and date range. Datasets outside the requested
 * allow-list are empty lists, never null.
 */
public record AnalyticsSourceData(
        List<Order> orders,
        List<OrderLineItem> orderItems,
        List<Transaction> transactions,
        List<Refund> refunds,
        List<Fulfillment> fulfillments,
        List<Customer> customers,
        List<Product> products,
        List<Variant> variants,
        List<VariantCostComponent> costComponents,
        List<AdInsight> adInsights,
        List<CostRule> costRules,
        List<SessionMetric> sessions,
        List<ShopAnalyticsSnapshot> shopAnalytics,
        LoadMetadata metadata
) {

    public AnalyticsSourceData {
        orders = List.copyOf(orders);
        orderItems = List.copyOf(orderItems);
        transactions = List.copyOf(transactions);
        refunds = List.copyOf(refunds);
        fulfillments = List.copyOf(fulfillments);
        customers = List.copyOf(customers);
        products = List.copyOf(products);
        variants = List.copyOf(variants);
        costComponents = List.copyOf(costComponents);
        adInsights = List.copyOf(adInsights);
        costRules = List.copyOf(costRules);
        sessions = List.copyOf(sessions);
        shopAnalytics = List.copyOf(shopAnalytics);
        metadata = metadata == null ? LoadMetadata.empty() : metadata;
    }

    public static AnalyticsSourceData empty() {
        return new AnalyticsSourceData(List.of(), List.of(), List.of(), List.of(), List.of(), List.of(),
                List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), List.of(), LoadMetadata.empty());
    }
}
