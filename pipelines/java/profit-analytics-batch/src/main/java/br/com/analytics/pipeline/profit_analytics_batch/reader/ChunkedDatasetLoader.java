package br.com.analytics.pipeline.profit_analytics_batch.reader;

import br.com.analytics.pipeline.profit_analytics_batch.config.AnalyticsProperties;
import br.com.analytics.pipeline.profit_analytics_batch.model.AdInsight;
import br.com.analytics.pipeline.profit_analytics_batch.model.AnalyticsDataset;
import br.com.analytics.pipeline.profit_analytics_batch.model.AnalyticsSourceData;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostRule;
import br.com.analytics.pipeline.profit_analytics_batch.model.Customer;
import br.com.analytics.pipeline.profit_analytics_batch.model.DateRange;
import br.com.analytics.pipeline.profit_analytics_batch.model.Fulfillment;
import br.com.analytics.pipeline.profit_analytics_batch.model.LoadMetadata;
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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.IntFunction;

/**
 * Streams every dataset an analytics run needs out of a {@link PagedTableReader}. Orders are paged together
 * with their child rows; supplemental datasets are paged independently, optionally in parallel with the order
 * track. A quota failure halves the page size and retries the same cursor until the dataset's floor is reached.
 * When any dataset fails the run is aborted and the other datasets stop paging before their next request.
 */
public class ChunkedDatasetLoader {

    private static final Logger log = LoggerFactory.getLogger(ChunkedDatasetLoader.class);

    private final PagedTableReader reader;
    private final AnalyticsProperties.Loader settings;
    private final Executor executor;

    public ChunkedDatasetLoader(PagedTableReader reader, AnalyticsProperties.Loader settings, Executor executor) {
        this.reader = reader;
        this.settings = settings;
        this.executor = executor;
    }

    public AnalyticsSourceData load(String organizationId, DateRange range, LoaderOptions options) {
        Objects.requireNonNull(organizationId, "organizationId");
        Objects.requireNonNull(range, "range");
        LoaderOptions effective = options == null ? LoaderOptions.all() : options;

        AtomicBoolean aborted = new AtomicBoolean();
        List<CompletableFuture<SupplementalResult>> supplementalFutures = new ArrayList<>();
        List<SupplementalResult> supplementalResults = new ArrayList<>();
        for (AnalyticsDataset dataset : AnalyticsDataset.supplementalDatasets()) {
            if (!effective.shouldFetch(dataset)) {
                continue;
            }
            if (settings.concurrentSupplementalFetch()) {
                CompletableFuture<SupplementalResult> future = CompletableFuture.supplyAsync(
                        () -> loadSupplemental(organizationId, range, dataset, aborted), executor);
                future.whenComplete((result, error) -> {
                    if (error != null) {
                        aborted.set(true);
                    }
                });
                supplementalFutures.add(future);
            }
        }

        OrderTrack orderTrack;
        try {
            orderTrack = loadOrderTrack(organizationId, range, effective);
            if (settings.concurrentSupplementalFetch()) {
                supplementalResults.addAll(joinAll(supplementalFutures));
            } else {
                for (AnalyticsDataset dataset : AnalyticsDataset.supplementalDatasets()) {
                    if (effective.shouldFetch(dataset)) {
                        supplementalResults.add(loadSupplemental(organizationId, range, dataset, aborted));
                    }
                }
            }
        } catch (RuntimeException e) {
            abort(aborted, supplementalFutures);
            throw e;
        }

        Map<AnalyticsDataset, Integer> reducedPageSizes = new EnumMap<>(AnalyticsDataset.class);
        if (orderTrack.pageSize().isReduced()) {
            reducedPageSizes.put(AnalyticsDataset.ORDERS, orderTrack.pageSize().current());
        }
        Map<AnalyticsDataset, List<SourceRecord>> supplemental = new EnumMap<>(AnalyticsDataset.class);
        for (SupplementalResult result : supplementalResults) {
            supplemental.put(result.dataset(), result.records());
            if (result.pageSize().isReduced()) {
                reducedPageSizes.put(result.dataset(), result.pageSize().current());
            }
        }

        LoadMetadata metadata = new LoadMetadata(orderTrack.truncated(), orderTrack.orders().size(), reducedPageSizes);
        AnalyticsSourceData data = new AnalyticsSourceData(
                orderTrack.orders().values(),
                orderTrack.orderItems().values(),
                orderTrack.transactions().values(),
                orderTrack.refunds().values(),
                orderTrack.fulfillments().values(),
                orderTrack.customers().values(),
                orderTrack.products().values(),
                orderTrack.variants().values(),
                orderTrack.costComponents().values(),
                typed(supplemental, AnalyticsDataset.AD_INSIGHTS, AdInsight.class),
                typed(supplemental, AnalyticsDataset.GLOBAL_COSTS, CostRule.class),
                typed(supplemental, AnalyticsDataset.SESSIONS, SessionMetric.class),
                typed(supplemental, AnalyticsDataset.SHOP_ANALYTICS, ShopAnalyticsSnapshot.class),
                metadata
        );

        log.info("Loaded {} orders, {} line items, {} cost rules and {} ad insights for organization {} ({} to {}).",
                data.orders().size(), data.orderItems().size(), data.costRules().size(), data.adInsights().size(),
                organizationId, range.startDate(), range.endDate());
        if (!reducedPageSizes.isEmpty()) {
            log.info("Page sizes reduced during load of organization {}: {}", organizationId, reducedPageSizes);
        }
        return data;
    }

    private OrderTrack loadOrderTrack(String organizationId, DateRange range, LoaderOptions options) {
        OrderTrack track = new OrderTrack(new PageSizeState(AnalyticsDataset.ORDERS,
                settings.initialPageSize(AnalyticsDataset.ORDERS), settings.pageFloor(AnalyticsDataset.ORDERS)));
        Set<AnalyticsDataset> requested = options.requested();
        Integer remaining = options.orderLimit();
        String cursor = null;

        while (true) {
            String requestCursor = cursor;
            Integer cap = remaining;
            OrderChunk chunk = fetchWithBackoff(track.pageSize(), size -> reader.fetchOrderChunk(
                    organizationId, range, requested, requestCursor, cappedPageSize(size, cap, track.pageSize())));

            int newOrders = track.merge(chunk, options);
            boolean hasNext = hasNextPage(requestCursor, chunk.cursor());

            if (remaining != null) {
                remaining -= newOrders;
                if (remaining <= 0) {
                    track.truncated = hasNext;
                    break;
                }
            }
            if (!hasNext) {
                break;
            }
            cursor = chunk.cursor();
        }
        return track;
    }

    private SupplementalResult loadSupplemental(String organizationId, DateRange range, AnalyticsDataset dataset,
                                                AtomicBoolean aborted) {
        PageSizeState pageSize = new PageSizeState(dataset, settings.initialPageSize(dataset),
                settings.pageFloor(dataset));
        IdentityIndex<SourceRecord> index = new IdentityIndex<>();
        String cursor = null;

        while (true) {
            if (aborted.get()) {
                throw new CancellationException("Load aborted before the next " + dataset.key() + " page");
            }
            String requestCursor = cursor;
            Page<SourceRecord> page = fetchWithBackoff(pageSize,
                    size -> reader.fetchPage(organizationId, range, dataset, requestCursor, size));
            index.addAll(page.records());
            if (!hasNextPage(requestCursor, page.cursor())) {
                break;
            }
            cursor = page.cursor();
        }
        return new SupplementalResult(dataset, index.values(), pageSize);
    }

    private <R> R fetchWithBackoff(PageSizeState pageSize, IntFunction<R> request) {
        while (true) {
            try {
                return request.apply(pageSize.current());
            } catch (QuotaExceededException e) {
                pageSize.shrinkOrFail(e);
            } catch (LoaderFatalException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new LoaderFatalException(pageSize.dataset(), pageSize.current(), e);
            }
        }
    }

    private static int cappedPageSize(int pageSize, @Nullable Integer remaining, PageSizeState state) {
        if (remaining == null) {
            return pageSize;
        }
        return Math.max(state.floor(), Math.min(pageSize, remaining));
    }

    /**
     * A page without a cursor ends the dataset whether or not it reports done. A cursor equal to the one just
     * requested cannot make progress and ends it too.
     */
    static boolean hasNextPage(@Nullable String requestedCursor, @Nullable String nextCursor) {
        if (nextCursor == null || nextCursor.isEmpty()) {
            return false;
        }
        return !nextCursor.equals(requestedCursor);
    }

    private static <T> List<T> typed(Map<AnalyticsDataset, List<SourceRecord>> supplemental,
                                     AnalyticsDataset dataset, Class<T> type) {
        List<SourceRecord> records = supplemental.getOrDefault(dataset, List.of());
        List<T> result = new ArrayList<>(records.size());
        for (SourceRecord record : records) {
            if (type.isInstance(record)) {
                result.add(type.cast(record));
            } else {
                log.warn("Ignoring {} record {} of unexpected type {}", dataset.key(), record.id(),
                        record.getClass().getSimpleName());
            }
        }
        return result;
    }

    private static void abort(AtomicBoolean aborted, List<CompletableFuture<SupplementalResult>> futures) {
        aborted.set(true);
        futures.forEach(future -> future.cancel(true));
    }

    /**
     * Waits for every supplemental dataset. A failed dataset aborts its siblings, which then end in cancellation;
     * the first failure that is not such a cancellation is the one rethrown.
     */
    private static List<SupplementalResult> joinAll(List<CompletableFuture<SupplementalResult>> futures) {
        List<SupplementalResult> results = new ArrayList<>();
        RuntimeException failure = null;
        for (CompletableFuture<SupplementalResult> future : futures) {
            try {
                results.add(join(future));
            } catch (RuntimeException e) {
                if (failure == null || (failure instanceof CancellationException
                        && !(e instanceof CancellationException))) {
                    failure = e;
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return results;
    }

    private static SupplementalResult join(CompletableFuture<SupplementalResult> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }

    private static final class PageSizeState {

        private final AnalyticsDataset dataset;
        private final int floor;
        private int current;
        private boolean reduced;

        private PageSizeState(AnalyticsDataset dataset, int initial, int floor) {
            this.dataset = dataset;
            this.floor = Math.max(1, floor);
            this.current = Math.max(this.floor, initial);
        }

        AnalyticsDataset dataset() {
            return dataset;
        }

        int current() {
            return current;
        }

        int floor() {
            return floor;
        }

        boolean isReduced() {
            return reduced;
        }

        void shrinkOrFail(QuotaExceededException e) {
            if (current <= floor) {
                throw new LoaderFatalException(dataset, current, e);
            }
            int previous = current;
            current = Math.max(floor, current / 2);
            reduced = true;
            log.warn("Read quota exceeded for dataset {} at page size {}, retrying same cursor with {}",
                    dataset.key(), previous, current);
        }
    }

    private record SupplementalResult(AnalyticsDataset dataset, List<SourceRecord> records, PageSizeState pageSize) {
    }

    private static final class OrderTrack {

        private final PageSizeState pageSize;
        private final IdentityIndex<Order> orders = new IdentityIndex<>();
        private final IdentityIndex<OrderLineItem> orderItems = new IdentityIndex<>();
        private final IdentityIndex<Transaction> transactions = new IdentityIndex<>();
        private final IdentityIndex<Refund> refunds = new IdentityIndex<>();
        private final IdentityIndex<Fulfillment> fulfillments = new IdentityIndex<>();
        private final IdentityIndex<Customer> customers = new IdentityIndex<>();
        private final IdentityIndex<Product> products = new IdentityIndex<>();
        private final IdentityIndex<Variant> variants = new IdentityIndex<>();
        private final IdentityIndex<VariantCostComponent> costComponents = new IdentityIndex<>();
        private final Set<String> seenOrderIds = new HashSet<>();
        private boolean truncated;

        private OrderTrack(PageSizeState pageSize) {
            this.pageSize = pageSize;
        }

        /**
         * Returns how many orders of the chunk were not seen before. Re-fetched rows from overlapping pages do not
         * count towards the order limit.
         */
        int merge(OrderChunk chunk, LoaderOptions options) {
            int newOrders = 0;
            for (Order order : chunk.orders()) {
                if (order != null && order.id() != null && seenOrderIds.add(order.id())) {
                    newOrders++;
                }
            }
            if (options.shouldFetch(AnalyticsDataset.ORDERS)) {
                orders.addAll(chunk.orders());
            }
            if (options.shouldFetch(AnalyticsDataset.ORDER_ITEMS)) {
                orderItems.addAll(chunk.orderItems());
            }
            if (options.shouldFetch(AnalyticsDataset.TRANSACTIONS)) {
                transactions.addAll(chunk.transactions());
            }
            if (options.shouldFetch(AnalyticsDataset.REFUNDS)) {
                refunds.addAll(chunk.refunds());
            }
            if (options.shouldFetch(AnalyticsDataset.FULFILLMENTS)) {
                fulfillments.addAll(chunk.fulfillments());
            }
            if (options.shouldFetch(AnalyticsDataset.CUSTOMERS)) {
                customers.addAll(chunk.customers());
            }
            if (options.shouldFetch(AnalyticsDataset.PRODUCTS)) {
                products.addAll(chunk.products());
            }
            if (options.shouldFetch(AnalyticsDataset.VARIANTS)) {
                variants.addAll(chunk.variants());
            }
            if (options.shouldFetch(AnalyticsDataset.COST_COMPONENTS)) {
                costComponents.addAll(chunk.costComponents());
            }
            return newOrders;
        }

        PageSizeState pageSize() {
            return pageSize;
        }

        IdentityIndex<Order> orders() {
            return orders;
        }

        IdentityIndex<OrderLineItem> orderItems() {
            return orderItems;
        }

        IdentityIndex<Transaction> transactions() {
            return transactions;
        }

        IdentityIndex<Refund> refunds() {
            return refunds;
        }

        IdentityIndex<Fulfillment> fulfillments() {
            return fulfillments;
        }

        IdentityIndex<Customer> customers() {
            return customers;
        }

        IdentityIndex<Product> products() {
            return products;
        }

        IdentityIndex<Variant> variants() {
            return variants;
        }

        IdentityIndex<VariantCostComponent> costComponents() {
            return costComponents;
        }

        boolean truncated() {
            return truncated;
        }
    }
}
