package br.com.analytics.pipeline.profit_analytics_batch.service;

import br.com.analytics.pipeline.profit_analytics_batch.model.AnalyticsFilters;
import br.com.analytics.pipeline.profit_analytics_batch.model.AnalyticsSourceData;
import br.com.analytics.pipeline.profit_analytics_batch.model.DailyMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.DateRange;
import br.com.analytics.pipeline.profit_analytics_batch.model.InvalidDateRangeException;
import br.com.analytics.pipeline.profit_analytics_batch.model.MetricField;
import br.com.analytics.pipeline.profit_analytics_batch.model.OrderProfitability;
import br.com.analytics.pipeline.profit_analytics_batch.model.PeriodRow;
import br.com.analytics.pipeline.profit_analytics_batch.model.RangeAnalytics;
import br.com.analytics.pipeline.profit_analytics_batch.model.RangeCostAllocation;
import br.com.analytics.pipeline.profit_analytics_batch.model.RangeOverview;
import br.com.analytics.pipeline.profit_analytics_batch.processor.DailyMetricsAggregator;
import br.com.analytics.pipeline.profit_analytics_batch.processor.MetricRollup;
import br.com.analytics.pipeline.profit_analytics_batch.processor.TimeBoundCostAllocator;
import br.com.analytics.pipeline.profit_analytics_batch.reader.ChunkedDatasetLoader;
import br.com.analytics.pipeline.profit_analytics_batch.reader.LoaderOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Read-only range analytics for the dashboard: overview, per order breakdown and period table computed from
 * the source tables on every call. Nothing is written or cached.
 */
public class RangeAnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(RangeAnalyticsService.class);

    private final ChunkedDatasetLoader loader;
    private final DailyMetricsAggregator aggregator;
    private final MetricRollup rollup;
    private final TimeBoundCostAllocator costAllocator;

    public RangeAnalyticsService(ChunkedDatasetLoader loader, DailyMetricsAggregator aggregator, MetricRollup rollup,
                                 TimeBoundCostAllocator costAllocator) {
        this.loader = loader;
        this.aggregator = aggregator;
        this.rollup = rollup;
        this.costAllocator = costAllocator;
    }

    /**
     * Validates the wire format range before anything is fetched.
     */
    public RangeAnalytics computeRangeAnalytics(String organizationId, String startDate, String endDate,
                                                AnalyticsFilters filters) {
        return computeRangeAnalytics(organizationId, DateRange.parse(startDate, endDate), filters);
    }

    public RangeAnalytics computeRangeAnalytics(String organizationId, DateRange range, AnalyticsFilters filters) {
        if (range == null) {
            throw new InvalidDateRangeException("Date range is required");
        }
        AnalyticsFilters effective = filters == null ? AnalyticsFilters.defaults() : filters;

        AnalyticsSourceData data = loader.load(organizationId, range, LoaderOptions.withMaxOrders(effective.maxOrders()));
        DailyMetricsAggregator.Run run = aggregator.prepare(organizationId, range.dates(), data);

        List<DailyMetric> dailyMetrics = new ArrayList<>();
        for (LocalDate date : range.dates()) {
            run.computeDate(date).ifPresent(dailyMetrics::add);
        }

        RangeOverview overview = rollup.overview(range, dailyMetrics);
        List<PeriodRow> periodTable = rollup.periodTable(effective.granularity(), dailyMetrics);
        List<OrderProfitability> perOrder = run.orderBreakdown(effective.includeCancelled());
        List<RangeCostAllocation> costAllocations = costAllocator.allocate(data.costRules(), range,
                overview.totals().orders(), overview.totals().getCount(MetricField.UNITS_SOLD));

        log.info("Computed range analytics for organization {} ({} to {}): {} active days, {} orders.",
                organizationId, range.startDate(), range.endDate(), overview.daysWithActivity(),
                overview.totals().orders());
        return new RangeAnalytics(overview, perOrder, periodTable, costAllocations, data.metadata());
    }
}
