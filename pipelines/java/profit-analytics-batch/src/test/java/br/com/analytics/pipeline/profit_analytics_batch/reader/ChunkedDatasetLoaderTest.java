package br.com.analytics.pipeline.profit_analytics_batch.reader;

import br.com.analytics.pipeline.profit_analytics_batch.config.AnalyticsProperties;
import br.com.analytics.pipeline.profit_analytics_batch.model.AdInsight;
import br.com.analytics.pipeline.profit_analytics_batch.model.AnalyticsDataset;
import br.com.analytics.pipeline.profit_analytics_batch.model.AnalyticsSourceData;
import br.com.analytics.pipeline.profit_analytics_batch.model.DateRange;
import br.com.analytics.pipeline.profit_analytics_batch.model.Order;
import br.com.analytics.pipeline.profit_analytics_batch.model.SourceRecord;
import br.com.analytics.pipeline.profit_analytics_batch.support.ScriptedPagedTableReader;
import br.com.analytics.pipeline.profit_analytics_batch.support.TestData;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static br.com.analytics.pipeline.profit_analytics_batch.support.TestData.adInsight;
import static br.com.analytics.pipeline.profit_analytics_batch.support.TestData.item;
import static br.com.analytics.pipeline.profit_analytics_batch.support.TestData.order;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChunkedDatasetLoaderTest {

    private static final LocalDate DAY = LocalDate.of(2024, 3, 10);
    private static final DateRange MARCH = DateRange.of(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31));

    @Test
    void load_ShouldReturnEachRecordOnceWhenPagesOverlap() {
        TestData.SourceData source = TestData.data()
                .orders(order("o-1", DAY, "10"), order("o-2", DAY, "20"), order("o-3", DAY, "30"))
                .adInsights(IntStream.rangeClosed(1, 5)
                        .mapToObj(i -> adInsight("ad-" + i, DAY, "1"))
                        .toArray(AdInsight[]::new));
        ScriptedPagedTableReader reader = new ScriptedPagedTableReader(source).overlap(1);
        AnalyticsProperties.Loader settings = new AnalyticsProperties.Loader(2, 1, 2, 2, 1, 4096, false);

        AnalyticsSourceData data = new ChunkedDatasetLoader(reader, settings, Runnable::run)
                .load(TestData.ORG, MARCH, LoaderOptions.all());

        assertThat(data.orders()).extracting(Order::id).containsExactly("o-1", "o-2", "o-3");
        assertThat(data.adInsights()).extracting(AdInsight::id)
                .containsExactly("ad-1", "ad-2", "ad-3", "ad-4", "ad-5");
        assertThat(reader.requests(AnalyticsDataset.AD_INSIGHTS)).hasSize(4);
    }

    @Test
    void load_ShouldHalvePageSizeAndRetrySameCursorOnQuotaErrors() {
        TestData.SourceData source = TestData.data().orders(IntStream.range(0, 12)
                .mapToObj(i -> order("o-" + i, DAY, "10"))
                .toArray(Order[]::new));
        ScriptedPagedTableReader reader = new ScriptedPagedTableReader(source)
                .quotaLimit(AnalyticsDataset.ORDERS, 5);

        AnalyticsSourceData data = new ChunkedDatasetLoader(reader, AnalyticsProperties.Loader.defaults(),
                Runnable::run).load(TestData.ORG, MARCH, LoaderOptions.all());

        assertThat(data.orders()).hasSize(12);
        assertThat(data.metadata().reducedPageSizes()).containsEntry(AnalyticsDataset.ORDERS, 5);
        assertThat(reader.requests(AnalyticsDataset.ORDERS))
                .extracting(ScriptedPagedTableReader.Request::pageSize)
                .containsExactly(20, 10, 5, 5, 5);
        assertThat(reader.requests(AnalyticsDataset.ORDERS))
                .filteredOn(ScriptedPagedTableReader.Request::failed)
                .extracting(ScriptedPagedTableReader.Request::cursor)
                .containsOnlyNulls();
    }

    @Test
    void load_ShouldFailOnceOrderPageFloorStillExceedsQuota() {
        ScriptedPagedTableReader reader = new ScriptedPagedTableReader(
                TestData.data().orders(order("o-1", DAY, "10")))
                .quotaLimit(AnalyticsDataset.ORDERS, 0);
        ChunkedDatasetLoader loader = new ChunkedDatasetLoader(reader, AnalyticsProperties.Loader.defaults(),
                Runnable::run);

        assertThatThrownBy(() -> loader.load(TestData.ORG, MARCH, LoaderOptions.all()))
                .isInstanceOfSatisfying(LoaderFatalException.class, e -> {
                    assertThat(e.getDataset()).isEqualTo(AnalyticsDataset.ORDERS);
                    assertThat(e.getPageSize()).isEqualTo(1);
                    assertThat(e.getCause()).isInstanceOf(QuotaExceededException.class);
                });
        assertThat(reader.requests(AnalyticsDataset.ORDERS))
                .extracting(ScriptedPagedTableReader.Request::pageSize)
                .containsExactly(20, 10, 5, 2, 1);
    }

    @Test
    void load_ShouldStopSupplementalBackoffAtItsFloor() {
        ScriptedPagedTableReader reader = new ScriptedPagedTableReader(
                TestData.data().adInsights(adInsight("ad-1", DAY, "5")))
                .quotaLimit(AnalyticsDataset.AD_INSIGHTS, 10);
        ChunkedDatasetLoader loader = new ChunkedDatasetLoader(reader, AnalyticsProperties.Loader.defaults(),
                Runnable::run);

        assertThatThrownBy(() -> loader.load(TestData.ORG, MARCH, LoaderOptions.all()))
                .isInstanceOfSatisfying(LoaderFatalException.class, e -> {
                    assertThat(e.getDataset()).isEqualTo(AnalyticsDataset.AD_INSIGHTS);
                    assertThat(e.getPageSize()).isEqualTo(25);
                });
    }

    @Test
    void load_ShouldTruncateOrdersAtMaxOrders() {
        TestData.SourceData source = TestData.data().orders(IntStream.range(0, 50)
                .mapToObj(i -> order("o-" + i, DAY, "10"))
                .toArray(Order[]::new));
        ScriptedPagedTableReader reader = new ScriptedPagedTableReader(source);

        AnalyticsSourceData data = new ChunkedDatasetLoader(reader, AnalyticsProperties.Loader.defaults(),
                Runnable::run).load(TestData.ORG, MARCH, LoaderOptions.withMaxOrders(25));

        assertThat(data.orders()).hasSize(25);
        assertThat(data.metadata().truncatedOrders()).isTrue();
        assertThat(data.metadata().processedOrderCount()).isEqualTo(25);
        assertThat(reader.requests(AnalyticsDataset.ORDERS))
                .extracting(ScriptedPagedTableReader.Request::pageSize)
                .containsExactly(20, 5);
    }

    @Test
    void load_ShouldCountOnlyDistinctOrdersTowardsMaxOrders() {
        TestData.SourceData source = TestData.data().orders(IntStream.range(0, 10)
                .mapToObj(i -> order("o-" + i, DAY, "10"))
                .toArray(Order[]::new));
        ScriptedPagedTableReader reader = new ScriptedPagedTableReader(source)
                .overlap(1)
                .quotaLimit(AnalyticsDataset.ORDERS, 2);

        AnalyticsSourceData data = new ChunkedDatasetLoader(reader, AnalyticsProperties.Loader.defaults(),
                Runnable::run).load(TestData.ORG, MARCH, LoaderOptions.withMaxOrders(4));

        assertThat(data.orders()).extracting(Order::id).containsExactly("o-0", "o-1", "o-2", "o-3");
        assertThat(data.metadata().truncatedOrders()).isTrue();
        assertThat(data.metadata().processedOrderCount()).isEqualTo(4);
        assertThat(data.metadata().reducedPageSizes()).containsEntry(AnalyticsDataset.ORDERS, 2);
    }

    @Test
    void load_ShouldNotFlagTruncationWhenLimitMatchesLastPage() {
        TestData.SourceData source = TestData.data().orders(IntStream.range(0, 20)
                .mapToObj(i -> order("o-" + i, DAY, "10"))
                .toArray(Order[]::new));

        AnalyticsSourceData data = new ChunkedDatasetLoader(new ScriptedPagedTableReader(source),
                AnalyticsProperties.Loader.defaults(), Runnable::run)
                .load(TestData.ORG, MARCH, LoaderOptions.withMaxOrders(20));

        assertThat(data.orders()).hasSize(20);
        assertThat(data.metadata().truncatedOrders()).isFalse();
    }

    @Test
    void load_ShouldReturnEmptyListsForDatasetsOutsideAllowList() {
        TestData.SourceData source = TestData.data()
                .orders(order("o-1", DAY, "10"))
                .items(item("li-1", "o-1", "v-1", 1, "10", "0"))
                .adInsights(adInsight("ad-1", DAY, "3"));
        ScriptedPagedTableReader reader = new ScriptedPagedTableReader(source);

        AnalyticsSourceData data = new ChunkedDatasetLoader(reader, AnalyticsProperties.Loader.defaults(),
                Runnable::run).load(TestData.ORG, MARCH,
                new LoaderOptions(Set.of(AnalyticsDataset.ORDERS, AnalyticsDataset.AD_INSIGHTS), null));

        assertThat(data.orders()).hasSize(1);
        assertThat(data.adInsights()).hasSize(1);
        assertThat(data.orderItems()).isEmpty();
        assertThat(data.sessions()).isEmpty();
        assertThat(data.costRules()).isEmpty();
        assertThat(reader.requests(AnalyticsDataset.SESSIONS)).isEmpty();
        assertThat(reader.requests(AnalyticsDataset.GLOBAL_COSTS)).isEmpty();
    }

    @Test
    void load_ShouldStopWhenReaderRepeatsTheRequestedCursor() {
        PagedTableReader reader = mock(PagedTableReader.class);
        when(reader.fetchOrderChunk(anyString(), any(), any(), any(), anyInt()))
                .thenReturn(OrderChunk.ofOrders(List.of(), null, true));
        when(reader.fetchPage(anyString(), any(), eq(AnalyticsDataset.AD_INSIGHTS), any(), anyInt()))
                .thenReturn(new Page<SourceRecord>(List.of(adInsight("ad-1", DAY, "2")), "c-1", false));

        AnalyticsSourceData data = new ChunkedDatasetLoader(reader, AnalyticsProperties.Loader.defaults(),
                Runnable::run).load(TestData.ORG, MARCH,
                new LoaderOptions(Set.of(AnalyticsDataset.AD_INSIGHTS), null));

        assertThat(data.adInsights()).hasSize(1);
        verify(reader, times(2)).fetchPage(anyString(), any(), eq(AnalyticsDataset.AD_INSIGHTS), any(), anyInt());
    }

    @Test
    void load_ShouldFollowCursorOfPageReportedDone() {
        PagedTableReader reader = mock(PagedTableReader.class);
        when(reader.fetchOrderChunk(anyString(), any(), any(), any(), anyInt()))
                .thenReturn(OrderChunk.ofOrders(List.of(), null, true));
        when(reader.fetchPage(anyString(), any(), eq(AnalyticsDataset.AD_INSIGHTS), isNull(), anyInt()))
                .thenReturn(new Page<SourceRecord>(List.of(adInsight("ad-1", DAY, "2")), "c-1", true));
        when(reader.fetchPage(anyString(), any(), eq(AnalyticsDataset.AD_INSIGHTS), eq("c-1"), anyInt()))
                .thenReturn(new Page<SourceRecord>(List.of(adInsight("ad-2", DAY, "2")), null, true));

        AnalyticsSourceData data = new ChunkedDatasetLoader(reader, AnalyticsProperties.Loader.defaults(),
                Runnable::run).load(TestData.ORG, MARCH,
                new LoaderOptions(Set.of(AnalyticsDataset.AD_INSIGHTS), null));

        assertThat(data.adInsights()).extracting(AdInsight::id).containsExactly("ad-1", "ad-2");
    }

    @Test
    void load_ShouldTreatNonQuotaStoreErrorsAsFatal() {
        PagedTableReader reader = mock(PagedTableReader.class);
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("connection refused");
        when(reader.fetchOrderChunk(anyString(), any(), any(), any(), anyInt())).thenThrow(failure);
        ChunkedDatasetLoader loader = new ChunkedDatasetLoader(reader,
                new AnalyticsProperties.Loader(20, 1, 400, 200, 25, 4096, false), Runnable::run);

        assertThatThrownBy(() -> loader.load(TestData.ORG, MARCH, new LoaderOptions(Set.of(AnalyticsDataset.ORDERS), null)))
                .isInstanceOf(LoaderFatalException.class)
                .hasCause(failure);
        verify(reader, times(1)).fetchOrderChunk(anyString(), any(), any(), any(), anyInt());
    }

    @Test
    void load_ShouldStopSupplementalPagingOnceOrderTrackFails() throws InterruptedException {
        PagedTableReader reader = mock(PagedTableReader.class);
        CountDownLatch adPageStarted = new CountDownLatch(1);
        CountDownLatch orderTrackFailed = new CountDownLatch(1);
        AtomicInteger adPages = new AtomicInteger();
        when(reader.fetchPage(anyString(), any(), eq(AnalyticsDataset.AD_INSIGHTS), any(), anyInt()))
                .thenAnswer(invocation -> {
                    int page = adPages.incrementAndGet();
                    adPageStarted.countDown();
                    orderTrackFailed.await(5, TimeUnit.SECONDS);
                    return endlessAdPage(page);
                });
        when(reader.fetchOrderChunk(anyString(), any(), any(), any(), anyInt()))
                .thenAnswer(invocation -> {
                    adPageStarted.await(5, TimeUnit.SECONDS);
                    throw new DataAccessResourceFailureException("connection refused");
                });
        ExecutorService executor = Executors.newSingleThreadExecutor();
        ChunkedDatasetLoader loader = new ChunkedDatasetLoader(reader, AnalyticsProperties.Loader.defaults(), executor);

        try {
            assertThatThrownBy(() -> loader.load(TestData.ORG, MARCH,
                    new LoaderOptions(Set.of(AnalyticsDataset.ORDERS, AnalyticsDataset.AD_INSIGHTS), null)))
                    .isInstanceOfSatisfying(LoaderFatalException.class,
                            e -> assertThat(e.getDataset()).isEqualTo(AnalyticsDataset.ORDERS));
            orderTrackFailed.countDown();
        } finally {
            executor.shutdown();
        }

        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(adPages).hasValue(1);
    }

    @Test
    void load_ShouldStopSiblingDatasetsOnceOneSupplementalDatasetFails() throws InterruptedException {
        PagedTableReader reader = mock(PagedTableReader.class);
        CountDownLatch adPageStarted = new CountDownLatch(1);
        AtomicInteger adPages = new AtomicInteger();
        when(reader.fetchOrderChunk(anyString(), any(), any(), any(), anyInt()))
                .thenReturn(OrderChunk.ofOrders(List.of(), null, true));
        when(reader.fetchPage(anyString(), any(), eq(AnalyticsDataset.AD_INSIGHTS), any(), anyInt()))
                .thenAnswer(invocation -> {
                    int page = adPages.incrementAndGet();
                    adPageStarted.countDown();
                    if (page == 1) {
                        Thread.sleep(200);
                    }
                    return endlessAdPage(page);
                });
        when(reader.fetchPage(anyString(), any(), eq(AnalyticsDataset.SESSIONS), any(), anyInt()))
                .thenAnswer(invocation -> {
                    adPageStarted.await(5, TimeUnit.SECONDS);
                    throw new DataAccessResourceFailureException("sessions table unavailable");
                });
        ExecutorService executor = Executors.newFixedThreadPool(2);
        ChunkedDatasetLoader loader = new ChunkedDatasetLoader(reader, AnalyticsProperties.Loader.defaults(), executor);

        try {
            assertThatThrownBy(() -> loader.load(TestData.ORG, MARCH,
                    new LoaderOptions(Set.of(AnalyticsDataset.AD_INSIGHTS, AnalyticsDataset.SESSIONS), null)))
                    .isInstanceOfSatisfying(LoaderFatalException.class,
                            e -> assertThat(e.getDataset()).isEqualTo(AnalyticsDataset.SESSIONS));
        } finally {
            executor.shutdown();
        }

        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(adPages).hasValue(1);
    }

    // Keeps handing out fresh cursors, capped so a loader that ignores aborts still terminates.
    private static Page<SourceRecord> endlessAdPage(int page) {
        String cursor = page < 50 ? "c-" + page : null;
        return new Page<SourceRecord>(List.of(adInsight("ad-" + page, DAY, "1")), cursor, false);
    }

    @Test
    void hasNextPage_ShouldRequireAFreshCursor() {
        assertThat(ChunkedDatasetLoader.hasNextPage(null, "c-1")).isTrue();
        assertThat(ChunkedDatasetLoader.hasNextPage("c-1", "c-2")).isTrue();
        assertThat(ChunkedDatasetLoader.hasNextPage("c-1", "c-1")).isFalse();
        assertThat(ChunkedDatasetLoader.hasNextPage("c-1", null)).isFalse();
        assertThat(ChunkedDatasetLoader.hasNextPage(null, "")).isFalse();
    }
}
