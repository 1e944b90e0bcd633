package br.com.analytics.pipeline.profit_analytics_batch.reader;

import br.com.analytics.pipeline.profit_analytics_batch.config.AnalyticsProperties;
import br.com.analytics.pipeline.profit_analytics_batch.model.AnalyticsDataset;
import br.com.analytics.pipeline.profit_analytics_batch.model.Customer;
import br.com.analytics.pipeline.profit_analytics_batch.model.DateRange;
import br.com.analytics.pipeline.profit_analytics_batch.model.Fulfillment;
import br.com.analytics.pipeline.profit_analytics_batch.model.Order;
import br.com.analytics.pipeline.profit_analytics_batch.model.OrderLineItem;
import br.com.analytics.pipeline.profit_analytics_batch.model.Product;
import br.com.analytics.pipeline.profit_analytics_batch.model.Refund;
import br.com.analytics.pipeline.profit_analytics_batch.model.SessionMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.ShopAnalyticsSnapshot;
import br.com.analytics.pipeline.profit_analytics_batch.model.SourceRecord;
import br.com.analytics.pipeline.profit_analytics_batch.model.Transaction;
import br.com.analytics.pipeline.profit_analytics_batch.model.Variant;
import br.com.analytics.pipeline.profit_analytics_batch.model.VariantCostComponent;
import org.jspecify.annotations.Nullable;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Keyset-paginated reader over the synced source tables. Every request is charged against a read budget and
 * fails with {@link QuotaExceededException} as soon as it reads more rows than {@code max-reads-per-request}.
 */
public class JdbcPagedTableReader implements PagedTableReader {

    private static final String ORDERS_QUERY =
            "SELECT o.id AS id, o.organization_id AS organizationId, o.created_at AS createdAt, " +
            "o.total_price AS totalPrice, o.subtotal_price AS subtotalPrice, o.total_discounts AS totalDiscounts, " +
            "o.total_shipping_price AS totalShippingPrice, o.total_tax AS totalTax, " +
            "o.total_quantity AS totalQuantity, o.customer_id AS customerId, " +
            "o.financial_status AS financialStatus, o.fulfillment_status AS fulfillmentStatus " +
            "FROM orders o " +
            "WHERE o.organization_id = :organizationId " +
            "AND o.created_at >= :rangeStart AND o.created_at < :rangeEnd ";

    private static final String ORDER_ITEMS_QUERY =
            "SELECT li.id AS id, li.order_id AS orderId, li.variant_id AS variantId, li.quantity AS quantity, " +
            "li.unit_price AS unitPrice, li.line_discount AS lineDiscount " +
            "FROM order_line_items li WHERE li.order_id IN (:ids) ORDER BY li.order_id, li.id";

    private static final String TRANSACTIONS_QUERY =
            "SELECT t.id AS id, t.order_id AS orderId, t.amount AS amount, t.fee AS fee, t.gateway AS gateway, " +
            "t.kind AS kind, t.processed_at AS processedAt " +
            "FROM transactions t WHERE t.order_id IN (:ids) ORDER BY t.order_id, t.id";

    private static final String REFUNDS_QUERY =
            "SELECT r.id AS id, r.order_id AS orderId, r.amount AS amount, r.processed_at AS processedAt " +
            "FROM refunds r WHERE r.order_id IN (:ids) ORDER BY r.order_id, r.id";

    private static final String FULFILLMENTS_QUERY =
            "SELECT f.id AS id, f.order_id AS orderId, f.status AS status, f.created_at AS createdAt " +
            "FROM fulfillments f WHERE f.order_id IN (:ids) ORDER BY f.order_id, f.id";

    private static final String CUSTOMERS_QUERY =
            "SELECT c.id AS id, c.organization_id AS organizationId, c.first_order_at AS firstOrderAt, " +
            "c.orders_count AS ordersCount FROM customers c WHERE c.id IN (:ids)";

    private static final String VARIANTS_QUERY =
            "SELECT v.id AS id, v.product_id AS productId, v.sku AS sku, v.price AS price " +
            "FROM product_variants v WHERE v.id IN (:ids)";

    private static final String PRODUCTS_QUERY =
            "SELECT p.id AS id, p.title AS title, p.vendor AS vendor FROM products p WHERE p.id IN (:ids)";

    private static final String COST_COMPONENTS_QUERY =
            "SELECT c.id AS id, c.variant_id AS variantId, c.cogs_per_unit AS cogsPerUnit, " +
            "c.shipping_per_unit AS shippingPerUnit, c.handling_per_unit AS handlingPerUnit, " +
            "c.payment_fee_percent AS paymentFeePercent, c.payment_fixed_per_item AS paymentFixedPerItem, " +
            "c.effective_from AS effectiveFrom, c.effective_to AS effectiveTo, c.is_active AS isActive " +
            "FROM variant_cost_components c " +
            "WHERE c.organization_id = :organizationId AND c.variant_id IN (:ids)";

    private static final String AD_INSIGHTS_QUERY =
            "SELECT a.id AS id, a.metric_date AS metricDate, a.platform AS platform, a.spend AS spend, " +
            "a.impressions AS impressions, a.clicks AS clicks, a.conversions AS conversions, " +
            "a.conversion_value AS conversionValue, a.reach AS reach, a.video_views AS videoViews, " +
            "a.video_3sec_views AS video3SecViews " +
            "FROM ad_insights a WHERE a.organization_id = :organizationId " +
            "AND a.metric_date BETWEEN :startDate AND :endDate ";

    private static final String SESSIONS_QUERY =
            "SELECT s.id AS id, s.metric_date AS metricDate, s.sessions AS sessions, s.visitors AS visitors " +
            "FROM session_analytics s WHERE s.organization_id = :organizationId " +
            "AND s.metric_date BETWEEN :startDate AND :endDate ";

    private static final String SHOP_ANALYTICS_QUERY =
            "SELECT s.id AS id, s.metric_date AS metricDate, s.sessions AS sessions, s.page_views AS pageViews, " +
            "s.abandoned_carts AS abandonedCarts " +
            "FROM shop_analytics s WHERE s.organization_id = :organizationId " +
            "AND s.metric_date BETWEEN :startDate AND :endDate ";

    private static final String COST_RULES_QUERY =
            "SELECT c.id AS id, c.organization_id AS organizationId, c.name AS name, c.type AS type, " +
            "c.calculation AS calculation, c.frequency AS frequency, c.value AS value, c.fixed_fee AS fixedFee, " +
            "c.effective_from AS effectiveFrom, c.effective_to AS effectiveTo, c.is_active AS isActive " +
            "FROM cost_rules c WHERE c.organization_id = :organizationId " +
            "AND (c.effective_from IS NULL OR c.effective_from < :rangeEnd) " +
            "AND (c.effective_to IS NULL OR c.effective_to >= :rangeStart) ";

    private static final String DATE_KEYSET = "AND (metric_date, id) > (CAST(:afterSortKey AS DATE), :afterId) ";

    private static final RowMapper<SessionMetric> SESSION_MAPPER = (resultSet, rowNum) -> new SessionMetric(
            resultSet.getString("id"),
            resultSet.getObject("metricDate", LocalDate.class),
            ResultSets.count(resultSet, "sessions"),
            ResultSets.count(resultSet, "visitors"));

    private static final RowMapper<ShopAnalyticsSnapshot> SHOP_ANALYTICS_MAPPER =
            (resultSet, rowNum) -> new ShopAnalyticsSnapshot(
                    resultSet.getString("id"),
                    resultSet.getObject("metricDate", LocalDate.class),
                    ResultSets.count(resultSet, "sessions"),
                    ResultSets.count(resultSet, "pageViews"),
                    ResultSets.count(resultSet, "abandonedCarts"));

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ZoneId zone;
    private final int maxReadsPerRequest;

    public JdbcPagedTableReader(NamedParameterJdbcTemplate jdbcTemplate, AnalyticsProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.zone = properties.zone();
        this.maxReadsPerRequest = properties.loader().maxReadsPerRequest();
    }

    @Override
    public OrderChunk fetchOrderChunk(String organizationId, DateRange range, Set<AnalyticsDataset> datasets,
                                      @Nullable String cursor, int pageSize) {
        ReadBudget budget = new ReadBudget(AnalyticsDataset.ORDERS, pageSize + 1);
        KeysetCursor after = KeysetCursor.decode(cursor);

        MapSqlParameterSource params = rangeParams(organizationId, range)
                .addValue("limit", pageSize + 1);
        StringBuilder sql = new StringBuilder(ORDERS_QUERY);
        if (after != null) {
            sql.append("AND (o.created_at, o.id) > (:afterSortKey, :afterId) ");
            params.addValue("afterSortKey", Long.parseLong(after.sortKey())).addValue("afterId", after.id());
        }
        sql.append("ORDER BY o.created_at, o.id LIMIT :limit");

        List<Order> rows = budget.charge(jdbcTemplate.query(sql.toString(), params, new OrderRowMapper()));
        boolean done = rows.size() <= pageSize;
        List<Order> orders = done ? rows : rows.subList(0, pageSize);
        if (orders.isEmpty()) {
            return OrderChunk.ofOrders(List.of(), null, true);
        }
        Order last = orders.get(orders.size() - 1);
        String nextCursor = done ? null : new KeysetCursor(Long.toString(last.createdAt()), last.id()).encode();

        List<String> orderIds = orders.stream().map(Order::id).toList();
        boolean needsItems = datasets.contains(AnalyticsDataset.ORDER_ITEMS)
                || datasets.contains(AnalyticsDataset.VARIANTS)
                || datasets.contains(AnalyticsDataset.PRODUCTS)
                || datasets.contains(AnalyticsDataset.COST_COMPONENTS);

        List<OrderLineItem> items = needsItems
                ? budget.charge(queryByIds(ORDER_ITEMS_QUERY, orderIds, new OrderLineItemRowMapper()))
                : List.of();
        List<Transaction> transactions = datasets.contains(AnalyticsDataset.TRANSACTIONS)
                ? budget.charge(queryByIds(TRANSACTIONS_QUERY, orderIds, (rs, rowNum) -> new Transaction(
                        rs.getString("id"), rs.getString("orderId"), ResultSets.money(rs, "amount"),
                        ResultSets.money(rs, "fee"), rs.getString("gateway"), rs.getString("kind"),
                        rs.getLong("processedAt"))))
                : List.of();
        List<Refund> refunds = datasets.contains(AnalyticsDataset.REFUNDS)
                ? budget.charge(queryByIds(REFUNDS_QUERY, orderIds, (rs, rowNum) -> new Refund(
                        rs.getString("id"), rs.getString("orderId"), ResultSets.money(rs, "amount"),
                        rs.getLong("processedAt"))))
                : List.of();
        List<Fulfillment> fulfillments = datasets.contains(AnalyticsDataset.FULFILLMENTS)
                ? budget.charge(queryByIds(FULFILLMENTS_QUERY, orderIds, (rs, rowNum) -> new Fulfillment(
                        rs.getString("id"), rs.getString("orderId"), rs.getString("status"),
                        rs.getLong("createdAt"))))
                : List.of();
        List<Customer> customers = datasets.contains(AnalyticsDataset.CUSTOMERS)
                ? budget.charge(queryByIds(CUSTOMERS_QUERY, distinct(orders, Order::customerId),
                        (rs, rowNum) -> new Customer(rs.getString("id"), rs.getString("organizationId"),
                                ResultSets.nullableLong(rs, "firstOrderAt"), ResultSets.count(rs, "ordersCount"))))
                : List.of();

        Set<String> variantIds = distinct(items, OrderLineItem::variantId);
        List<Variant> variants = datasets.contains(AnalyticsDataset.VARIANTS)
                || datasets.contains(AnalyticsDataset.PRODUCTS)
                ? budget.charge(queryByIds(VARIANTS_QUERY, variantIds, (rs, rowNum) -> new Variant(
                        rs.getString("id"), rs.getString("productId"), rs.getString("sku"),
                        ResultSets.money(rs, "price"))))
                : List.of();
        List<Product> products = datasets.contains(AnalyticsDataset.PRODUCTS)
                ? budget.charge(queryByIds(PRODUCTS_QUERY, distinct(variants, Variant::productId),
                        (rs, rowNum) -> new Product(rs.getString("id"), rs.getString("title"),
                                rs.getString("vendor"))))
                : List.of();
        List<VariantCostComponent> components = List.of();
        if (datasets.contains(AnalyticsDataset.COST_COMPONENTS) && !variantIds.isEmpty()) {
            MapSqlParameterSource componentParams = new MapSqlParameterSource()
                    .addValue("organizationId", organizationId)
                    .addValue("ids", variantIds);
            components = budget.charge(jdbcTemplate.query(COST_COMPONENTS_QUERY, componentParams,
                    new VariantCostComponentRowMapper()));
        }

        return new OrderChunk(orders, items, transactions, refunds, fulfillments, customers, products, variants,
                components, nextCursor, done);
    }

    @Override
    public Page<SourceRecord> fetchPage(String organizationId, DateRange range, AnalyticsDataset dataset,
                                        @Nullable String cursor, int pageSize) {
        return switch (dataset) {
            case AD_INSIGHTS -> pageByDate(AD_INSIGHTS_QUERY, organizationId, range, dataset, cursor, pageSize,
                    new AdInsightRowMapper(), insight -> insight.date());
            case SESSIONS -> pageByDate(SESSIONS_QUERY, organizationId, range, dataset, cursor, pageSize,
                    SESSION_MAPPER, SessionMetric::date);
            case SHOP_ANALYTICS -> pageByDate(SHOP_ANALYTICS_QUERY, organizationId, range, dataset, cursor,
                    pageSize, SHOP_ANALYTICS_MAPPER, ShopAnalyticsSnapshot::date);
            case GLOBAL_COSTS -> pageCostRules(organizationId, range, cursor, pageSize);
            default -> throw new IllegalArgumentException(dataset.key() + " is read with the order track");
        };
    }

    private <T extends SourceRecord> Page<SourceRecord> pageByDate(String baseQuery, String organizationId,
                                                                   DateRange range, AnalyticsDataset dataset,
                                                                   @Nullable String cursor, int pageSize,
                                                                   RowMapper<T> rowMapper,
                                                                   Function<T, LocalDate> sortKey) {
        ReadBudget budget = new ReadBudget(dataset, pageSize + 1);
        KeysetCursor after = KeysetCursor.decode(cursor);
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("organizationId", organizationId)
                .addValue("startDate", range.startDate())
                .addValue("endDate", range.endDate())
                .addValue("limit", pageSize + 1);
        StringBuilder sql = new StringBuilder(baseQuery);
        if (after != null) {
            sql.append(DATE_KEYSET);
            params.addValue("afterSortKey", after.sortKey()).addValue("afterId", after.id());
        }
        sql.append("ORDER BY metric_date, id LIMIT :limit");

        List<T> rows = budget.charge(jdbcTemplate.query(sql.toString(), params, rowMapper));
        return toPage(rows, pageSize, last -> new KeysetCursor(sortKey.apply(last).toString(), last.id()));
    }

    private Page<SourceRecord> pageCostRules(String organizationId, DateRange range, @Nullable String cursor,
                                             int pageSize) {
        ReadBudget budget = new ReadBudget(AnalyticsDataset.GLOBAL_COSTS, pageSize + 1);
        KeysetCursor after = KeysetCursor.decode(cursor);
        MapSqlParameterSource params = rangeParams(organizationId, range).addValue("limit", pageSize + 1);
        StringBuilder sql = new StringBuilder(COST_RULES_QUERY);
        if (after != null) {
            sql.append("AND c.id > :afterId ");
            params.addValue("afterId", after.id());
        }
        sql.append("ORDER BY c.id LIMIT :limit");

        return toPage(budget.charge(jdbcTemplate.query(sql.toString(), params, new CostRuleRowMapper())), pageSize,
                last -> new KeysetCursor("", last.id()));
    }

    private static <T extends SourceRecord> Page<SourceRecord> toPage(List<T> rows, int pageSize,
                                                                      Function<T, KeysetCursor> cursorOf) {
        boolean done = rows.size() <= pageSize;
        List<T> records = done ? rows : rows.subList(0, pageSize);
        String next = done || records.isEmpty() ? null : cursorOf.apply(records.get(records.size() - 1)).encode();
        return new Page<>(new ArrayList<SourceRecord>(records), next, done);
    }

    private <T> List<T> queryByIds(String sql, Collection<String> ids, RowMapper<T> rowMapper) {
        if (ids.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query(sql, new MapSqlParameterSource("ids", ids), rowMapper);
    }

    private MapSqlParameterSource rangeParams(String organizationId, DateRange range) {
        return new MapSqlParameterSource()
                .addValue("organizationId", organizationId)
                .addValue("rangeStart", range.startMillis(zone))
                .addValue("rangeEnd", range.endMillisExclusive(zone));
    }

    private static <T> Set<String> distinct(Collection<T> rows, Function<T, String> key) {
        Set<String> values = new LinkedHashSet<>();
        for (T row : rows) {
            String value = key.apply(row);
            if (value != null) {
                values.add(value);
            }
        }
        return values;
    }

    private final class ReadBudget {

        private final AnalyticsDataset dataset;
        private long reads;

        private ReadBudget(AnalyticsDataset dataset, long plannedReads) {
            this.dataset = dataset;
            if (plannedReads > maxReadsPerRequest) {
                throw new QuotaExceededException("Too many reads: page of " + plannedReads + " rows for "
                        + dataset.key() + " exceeds the limit of " + maxReadsPerRequest);
            }
        }

        <T> List<T> charge(List<T> rows) {
            reads += Objects.requireNonNull(rows).size();
            if (reads > maxReadsPerRequest) {
                throw new QuotaExceededException("Too many reads: " + reads + " rows read for " + dataset.key()
                        + " exceeds the limit of " + maxReadsPerRequest);
            }
            return rows;
        }
    }
}
