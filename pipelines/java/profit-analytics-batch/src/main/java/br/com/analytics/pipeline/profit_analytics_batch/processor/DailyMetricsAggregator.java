package br.com.analytics.pipeline.profit_analytics_batch.processor;

import br.com.analytics.pipeline.profit_analytics_batch.model.AdInsight;
import br.com.analytics.pipeline.profit_analytics_batch.model.AnalyticsSourceData;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostCalculation;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostFrequency;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostRule;
import br.com.analytics.pipeline.profit_analytics_batch.model.Customer;
import br.com.analytics.pipeline.profit_analytics_batch.model.DailyMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.MetricField;
import br.com.analytics.pipeline.profit_analytics_batch.model.MetricTotals;
import br.com.analytics.pipeline.profit_analytics_batch.model.Order;
import br.com.analytics.pipeline.profit_analytics_batch.model.OrderLineItem;
import br.com.analytics.pipeline.profit_analytics_batch.model.OrderProfitability;
import br.com.analytics.pipeline.profit_analytics_batch.model.Refund;
import br.com.analytics.pipeline.profit_analytics_batch.model.SessionMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.ShopAnalyticsSnapshot;
import br.com.analytics.pipeline.profit_analytics_batch.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Builds one {@link DailyMetric} per organization and date out of a loaded dataset. {@link #prepare} indexes the
 * dataset once; the returned run then computes each date independently, so a failure on one date leaves the
 * others computable.
 */
public class DailyMetricsAggregator {

    private static final Logger log = LoggerFactory.getLogger(DailyMetricsAggregator.class);

    private final CostAllocationEngine engine;
    private final ZoneId zone;

    public DailyMetricsAggregator(CostAllocationEngine engine, ZoneId zone) {
        this.engine = engine;
        this.zone = zone;
    }

    /**
     * @param dates the dates this run processes; one-time costs land on the earliest of them with activity
     */
    public Run prepare(String organizationId, Collection<LocalDate> dates, AnalyticsSourceData data) {
        Run run = new Run(organizationId, data);
        run.oneTimeChargeDates.putAll(oneTimeChargeDates(run, new TreeSet<>(dates), data.costRules()));
        log.info("Prepared aggregation for organization {}: {} orders over {} dates.",
                organizationId, data.orders().size(), dates.size());
        return run;
    }

    private Map<String, LocalDate> oneTimeChargeDates(Run run, TreeSet<LocalDate> dates, List<CostRule> rules) {
        Map<String, LocalDate> chargeDates = new HashMap<>();
        for (CostRule rule : rules) {
            if (rule.calculation() != CostCalculation.FIXED
                    || CostAllocationEngine.frequencyOf(rule) != CostFrequency.ONE_TIME) {
                continue;
            }
            for (LocalDate date : dates) {
                if (run.hasActivity(date) && rule.isActiveBetween(startOf(date), startOf(date.plusDays(1)))) {
                    chargeDates.put(rule.id(), date);
                    break;
                }
            }
        }
        return chargeDates;
    }

    private long startOf(LocalDate date) {
        return date.atStartOfDay(zone).toInstant().toEpochMilli();
    }

    private LocalDate dateOf(long epochMillis) {
        return Instant.ofEpochMilli(epochMillis).atZone(zone).toLocalDate();
    }

    /**
     * Indexed view of one loaded dataset.
     */
    public final class Run {

        private final String organizationId;
        private final List<Order> orders;
        private final List<CostRule> costRules;
        private final VariantCostResolver resolver;
        private final Map<LocalDate, List<Order>> ordersByDate = new HashMap<>();
        private final Map<String, List<OrderLineItem>> itemsByOrder = new HashMap<>();
        private final Map<String, List<Transaction>> transactionsByOrder = new HashMap<>();
        private final Map<LocalDate, List<Refund>> refundsByDate = new HashMap<>();
        private final Map<LocalDate, List<AdInsight>> adInsightsByDate = new HashMap<>();
        private final Map<LocalDate, List<SessionMetric>> sessionsByDate = new HashMap<>();
        private final Map<LocalDate, List<ShopAnalyticsSnapshot>> shopAnalyticsByDate = new HashMap<>();
        private final Map<String, LocalDate> firstPurchaseByCustomer = new HashMap<>();
        private final Map<String, LocalDate> oneTimeChargeDates = new HashMap<>();

        private Run(String organizationId, AnalyticsSourceData data) {
            this.organizationId = organizationId;
            this.orders = data.orders();
            this.costRules = data.costRules();
            this.resolver = new VariantCostResolver(data.costComponents());

            for (Order order : data.orders()) {
                ordersByDate.computeIfAbsent(dateOf(order.createdAt()), date -> new ArrayList<>()).add(order);
                if (order.customerId() != null) {
                    firstPurchaseByCustomer.merge(order.customerId(), dateOf(order.createdAt()),
                            (left, right) -> left.isBefore(right) ? left : right);
                }
            }
            for (Customer customer : data.customers()) {
                if (customer.firstOrderAt() != null) {
                    firstPurchaseByCustomer.put(customer.id(), dateOf(customer.firstOrderAt()));
                }
            }
            for (OrderLineItem item : data.orderItems()) {
                itemsByOrder.computeIfAbsent(item.orderId(), id -> new ArrayList<>()).add(item);
            }
            for (Transaction transaction : data.transactions()) {
                transactionsByOrder.computeIfAbsent(transaction.orderId(), id -> new ArrayList<>()).add(transaction);
            }
            for (Refund refund : data.refunds()) {
                refundsByDate.computeIfAbsent(dateOf(refund.processedAt()), date -> new ArrayList<>()).add(refund);
            }
            for (AdInsight insight : data.adInsights()) {
                adInsightsByDate.computeIfAbsent(insight.date(), date -> new ArrayList<>()).add(insight);
            }
            for (SessionMetric session : data.sessions()) {
                sessionsByDate.computeIfAbsent(session.date(), date -> new ArrayList<>()).add(session);
            }
            for (ShopAnalyticsSnapshot snapshot : data.shopAnalytics()) {
                shopAnalyticsByDate.computeIfAbsent(snapshot.date(), date -> new ArrayList<>()).add(snapshot);
            }
        }

        boolean hasActivity(LocalDate date) {
            return ordersByDate.getOrDefault(date, List.of()).stream().anyMatch(order -> !order.isCancelled())
                    || refundsByDate.containsKey(date)
                    || adInsightsByDate.containsKey(date)
                    || sessionsByDate.containsKey(date)
                    || shopAnalyticsByDate.containsKey(date);
        }

        /**
         * Totals for one date, or empty when nothing contributed to it.
         *
         * @throws IllegalStateException when the date holds an order of another organization
         */
        public Optional<DailyMetric> computeDate(LocalDate date) {
            MetricTotals totals = new MetricTotals();
            Set<String> processedOrders = new HashSet<>();
            Set<String> customers = new HashSet<>();
            List<Order> activeOrders = new ArrayList<>();

            for (Order order : ordersByDate.getOrDefault(date, List.of())) {
                if (order.organizationId() != null && !organizationId.equals(order.organizationId())) {
                    throw new IllegalStateException("Order " + order.id() + " belongs to organization "
                            + order.organizationId() + ", not " + organizationId);
                }
                if (!processedOrders.add(order.id())) {
                    continue;
                }
                if (order.isCancelled()) {
                    totals.increment(MetricField.CANCELLED_ORDERS);
                    continue;
                }
                activeOrders.add(order);
                addOrder(totals, order);
                if (order.customerId() != null) {
                    customers.add(order.customerId());
                }
            }

            engine.allocateDate(date, activeOrders, itemsByOrder, resolver, costRules, oneTimeChargeDates)
                    .addTo(totals);

            for (Refund refund : refundsByDate.getOrDefault(date, List.of())) {
                totals.add(MetricField.REFUNDS, refund.amount());
            }
            for (AdInsight insight : adInsightsByDate.getOrDefault(date, List.of())) {
                addAdInsight(totals, insight);
            }
            addSessions(totals, date);
            addCustomers(totals, date, customers);

            if (!totals.hasActivity()) {
                return Optional.empty();
            }
            return Optional.of(DailyMetric.finish(organizationId, date, totals));
        }

        /**
         * Per order profitability in single-order mode, ordered by creation time.
         */
        public List<OrderProfitability> orderBreakdown(boolean includeCancelled) {
            List<OrderProfitability> rows = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            List<Order> sorted = new ArrayList<>(orders);
            sorted.sort((left, right) -> Long.compare(left.createdAt(), right.createdAt()));
            for (Order order : sorted) {
                if (!seen.add(order.id()) || (order.isCancelled() && !includeCancelled)) {
                    continue;
                }
                List<OrderLineItem> items = itemsByOrder.getOrDefault(order.id(), List.of());
                CostBuckets buckets = engine.allocateOrder(order, items, resolver, costRules);
                rows.add(engine.profitability(order, items, buckets));
            }
            return rows;
        }

        private void addOrder(MetricTotals totals, Order order) {
            List<OrderLineItem> items = itemsByOrder.getOrDefault(order.id(), List.of());
            totals.add(MetricField.REVENUE, order.totalPrice())
                    .add(MetricField.GROSS_SALES, order.grossSales())
                    .add(MetricField.DISCOUNTS, order.totalDiscounts())
                    .add(MetricField.TAXES_COLLECTED, order.totalTax())
                    .add(MetricField.UNITS_SOLD, CostAllocationEngine.unitsOf(order, items))
                    .increment(MetricField.ORDERS);

            boolean cashOnDelivery = transactionsByOrder.getOrDefault(order.id(), List.of()).stream()
                    .anyMatch(Transaction::isCashOnDelivery);
            totals.increment(cashOnDelivery ? MetricField.COD_ORDERS : MetricField.PREPAID_ORDERS);
        }

        private void addAdInsight(MetricTotals totals, AdInsight insight) {
            totals.add(MetricField.AD_SPEND, insight.spend())
                    .add(MetricField.PLATFORM_CONVERSION_VALUE, insight.conversionValue())
                    .add(MetricField.IMPRESSIONS, insight.impressions())
                    .add(MetricField.CLICKS, insight.clicks())
                    .add(MetricField.CONVERSIONS, insight.conversions())
                    .add(MetricField.REACH, insight.reach())
                    .add(MetricField.VIDEO_VIEWS, insight.videoViews())
                    .add(MetricField.VIDEO_3SEC_VIEWS, insight.video3SecViews());
        }

        // Shop analytics only fill in sessions for dates without session analytics.
        private void addSessions(MetricTotals totals, LocalDate date) {
            List<SessionMetric> sessions = sessionsByDate.getOrDefault(date, List.of());
            if (!sessions.isEmpty()) {
                for (SessionMetric session : sessions) {
                    totals.add(MetricField.SESSIONS, session.sessions()).add(MetricField.VISITORS, session.visitors());
                }
                return;
            }
            for (ShopAnalyticsSnapshot snapshot : shopAnalyticsByDate.getOrDefault(date, List.of())) {
                totals.add(MetricField.SESSIONS, snapshot.sessions());
            }
        }

        private void addCustomers(MetricTotals totals, LocalDate date, Set<String> customers) {
            long newCustomers = 0;
            for (String customerId : customers) {
                LocalDate firstPurchase = firstPurchaseByCustomer.get(customerId);
                if (firstPurchase == null || !firstPurchase.isBefore(date)) {
                    newCustomers++;
                }
            }
            totals.add(MetricField.TOTAL_CUSTOMERS, customers.size())
                    .add(MetricField.NEW_CUSTOMERS, newCustomers)
                    .add(MetricField.RETURNING_CUSTOMERS, customers.size() - newCustomers);
        }
    }
}
