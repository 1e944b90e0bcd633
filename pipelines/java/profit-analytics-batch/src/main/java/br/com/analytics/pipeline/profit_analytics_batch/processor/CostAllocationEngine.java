package br.com.analytics.pipeline.profit_analytics_batch.processor;

import br.com.analytics.pipeline.profit_analytics_batch.model.CostBreakdown;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostCalculation;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostFrequency;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostRule;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostType;
import br.com.analytics.pipeline.profit_analytics_batch.model.Order;
import br.com.analytics.pipeline.profit_analytics_batch.model.OrderLineItem;
import br.com.analytics.pipeline.profit_analytics_batch.model.OrderProfitability;
import br.com.analytics.pipeline.profit_analytics_batch.model.VariantCostComponent;
import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Two tier cost model. Variant overrides are applied to line items first and mark the revenue they charged as
 * covered; org level rules then apply, and the product and payment percentage rules only see revenue no
 * override covered.
 *
 * <p>Single-order mode checks rule activity at the order timestamp and ignores calendar based fixed costs.
 * Date mode checks activity against the whole calendar day, scopes coverage to that day and pro-rates calendar
 * based fixed costs onto it.
 */
public class CostAllocationEngine {

    private final ZoneId zone;

    public CostAllocationEngine(ZoneId zone) {
        this.zone = zone;
    }

    public CostBuckets allocateOrder(Order order, List<OrderLineItem> items, VariantCostResolver resolver,
                                     Collection<CostRule> rules) {
        CostBuckets buckets = new CostBuckets();
        RevenueCoverage coverage = new RevenueCoverage();
        applyOverrides(order.createdAt(), items, resolver, buckets, coverage);

        AllocationBase base = AllocationBase.of(order, items);
        for (CostRule rule : rules) {
            if (rule.isActiveAt(order.createdAt())) {
                applyRule(rule, base, coverage, buckets);
            }
        }
        return buckets;
    }

    /**
     * @param oneTimeChargeDates date on which each one-time rule is charged, keyed by rule id
     */
    public CostBuckets allocateDate(LocalDate date, List<Order> orders, Map<String, List<OrderLineItem>> itemsByOrder,
                                    VariantCostResolver resolver, Collection<CostRule> rules,
                                    Map<String, LocalDate> oneTimeChargeDates) {
        CostBuckets buckets = new CostBuckets();
        RevenueCoverage coverage = new RevenueCoverage();
        AllocationBase base = AllocationBase.ZERO;
        for (Order order : orders) {
            List<OrderLineItem> items = itemsByOrder.getOrDefault(order.id(), List.of());
            applyOverrides(order.createdAt(), items, resolver, buckets, coverage);
            base = base.plus(AllocationBase.of(order, items));
        }

        long dayStart = date.atStartOfDay(zone).toInstant().toEpochMilli();
        long dayEnd = date.plusDays(1).atStartOfDay(zone).toInstant().toEpochMilli();
        for (CostRule rule : rules) {
            if (!rule.isActiveBetween(dayStart, dayEnd)) {
                continue;
            }
            if (applyRule(rule, base, coverage, buckets)) {
                continue;
            }
            CostFrequency frequency = frequencyOf(rule);
            if (frequency.isCalendarBased()) {
                buckets.add(rule.type(), CalendarProRater.dailyAmount(frequency, rule.value(), date));
            } else if (frequency == CostFrequency.ONE_TIME && date.equals(oneTimeChargeDates.get(rule.id()))) {
                buckets.add(rule.type(), rule.value());
            }
        }
        return buckets;
    }

    public OrderProfitability profitability(Order order, List<OrderLineItem> items, CostBuckets buckets) {
        CostBreakdown costs = buckets.toBreakdown();
        BigDecimal revenue = SafeNumbers.round(order.totalPrice());
        BigDecimal totalCost = costs.totalCost();
        BigDecimal profit = revenue.subtract(totalCost);
        BigDecimal margin = revenue.signum() > 0
                ? SafeNumbers.round(SafeNumbers.ratioPercent(profit, revenue))
                : SafeNumbers.round(BigDecimal.ZERO);
        return new OrderProfitability(
                order.id(),
                dateOf(order),
                revenue,
                SafeNumbers.round(order.grossSales()),
                unitsOf(order, items),
                costs,
                totalCost,
                profit,
                margin,
                order.isCancelled()
        );
    }

    public LocalDate dateOf(Order order) {
        return Instant.ofEpochMilli(order.createdAt()).atZone(zone).toLocalDate();
    }

    public static long unitsOf(Order order, List<OrderLineItem> items) {
        if (items.isEmpty()) {
            return order.totalQuantity();
        }
        long units = 0;
        for (OrderLineItem item : items) {
            units += item.quantity();
        }
        return units;
    }

    static CostFrequency frequencyOf(CostRule rule) {
        return rule.frequency() == null ? CostFrequency.ONE_TIME : rule.frequency();
    }

    private static void applyOverrides(long timestamp, List<OrderLineItem> items, VariantCostResolver resolver,
                                       CostBuckets buckets, RevenueCoverage coverage) {
        for (OrderLineItem item : items) {
            Optional<VariantCostComponent> resolved = resolver.resolve(item.variantId(), timestamp);
            if (resolved.isEmpty()) {
                continue;
            }
            VariantCostComponent component = resolved.get();
            BigDecimal quantity = BigDecimal.valueOf(item.quantity());
            BigDecimal lineRevenue = item.netRevenue();

            if (component.cogsPerUnit().signum() > 0) {
                buckets.add(CostType.PRODUCT, component.cogsPerUnit().multiply(quantity));
                coverage.coverCogs(lineRevenue);
            }
            if (component.shippingPerUnit().signum() > 0) {
                buckets.add(CostType.SHIPPING, component.shippingPerUnit().multiply(quantity));
            }
            if (component.handlingPerUnit().signum() > 0) {
                buckets.add(CostType.HANDLING, component.handlingPerUnit().multiply(quantity));
            }
            if (component.paymentFeePercent().signum() > 0) {
                buckets.add(CostType.PAYMENT, SafeNumbers.percentOf(lineRevenue, component.paymentFeePercent()));
                coverage.coverPayment(lineRevenue);
            }
            if (component.paymentFixedPerItem().signum() > 0) {
                buckets.add(CostType.PAYMENT, component.paymentFixedPerItem().multiply(quantity));
            }
        }
    }

    /**
     * Applies every rule whose amount depends on orders, units or revenue.
     *
     * @return false for calendar based and one-time fixed rules, which only date mode charges
     */
    private static boolean applyRule(CostRule rule, AllocationBase base, RevenueCoverage coverage,
                                     CostBuckets buckets) {
        CostCalculation calculation = rule.calculation();
        if (calculation == CostCalculation.PERCENTAGE) {
            applyPercentage(rule, base, coverage, buckets);
            return true;
        }
        if (calculation == CostCalculation.PER_UNIT) {
            buckets.add(rule.type(), rule.value().multiply(BigDecimal.valueOf(base.units())));
            return true;
        }
        CostFrequency frequency = frequencyOf(rule);
        if (frequency == CostFrequency.PER_ORDER) {
            buckets.add(rule.type(), rule.value().multiply(BigDecimal.valueOf(base.orders())));
            return true;
        }
        if (frequency == CostFrequency.PER_ITEM) {
            buckets.add(rule.type(), rule.value().multiply(BigDecimal.valueOf(base.units())));
            return true;
        }
        return false;
    }

    private static void applyPercentage(CostRule rule, AllocationBase base, RevenueCoverage coverage,
                                        CostBuckets buckets) {
        switch (rule.type()) {
            case PRODUCT -> buckets.add(CostType.PRODUCT,
                    SafeNumbers.percentOf(coverage.uncoveredCogs(base.productRevenue()), rule.value()));
            case PAYMENT -> {
                buckets.add(CostType.PAYMENT,
                        SafeNumbers.percentOf(coverage.uncoveredPayment(base.revenue()), rule.value()));
                BigDecimal fixedFee = rule.config().fixedFee();
                if (fixedFee.signum() > 0) {
                    buckets.add(CostType.PAYMENT, fixedFee.multiply(BigDecimal.valueOf(base.orders())));
                }
            }
            default -> buckets.add(rule.type(), SafeNumbers.percentOf(base.revenue(), rule.value()));
        }
    }

    /**
     * @param productRevenue net line revenue when line items are known, else the order subtotal
     */
    private record AllocationBase(BigDecimal revenue, BigDecimal productRevenue, long units, long orders) {

        static final AllocationBase ZERO = new AllocationBase(BigDecimal.ZERO, BigDecimal.ZERO, 0, 0);

        static AllocationBase of(Order order, List<OrderLineItem> items) {
            BigDecimal productRevenue;
            if (items.isEmpty()) {
                productRevenue = order.subtotalPrice();
            } else {
                productRevenue = BigDecimal.ZERO;
                for (OrderLineItem item : items) {
                    productRevenue = productRevenue.add(item.netRevenue());
                }
            }
            return new AllocationBase(order.totalPrice(), productRevenue, unitsOf(order, items), 1);
        }

        AllocationBase plus(AllocationBase other) {
            return new AllocationBase(revenue.add(other.revenue), productRevenue.add(other.productRevenue),
                    units + other.units, orders + other.orders);
        }
    }
}
