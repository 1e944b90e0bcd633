package br.com.analytics.pipeline.profit_analytics_batch.service;

import br.com.analytics.pipeline.profit_analytics_batch.model.AnalyticsSourceData;
import br.com.analytics.pipeline.profit_analytics_batch.model.DailyMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.DateRange;
import br.com.analytics.pipeline.profit_analytics_batch.model.MetricTotals;
import br.com.analytics.pipeline.profit_analytics_batch.model.RebuildSummary;
import br.com.analytics.pipeline.profit_analytics_batch.processor.DailyMetricsAggregator;
import br.com.analytics.pipeline.profit_analytics_batch.reader.ChunkedDatasetLoader;
import br.com.analytics.pipeline.profit_analytics_batch.reader.LoaderOptions;
import br.com.analytics.pipeline.profit_analytics_batch.writer.MetricRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Recomputes and upserts the daily metrics of an organization for a set of dates. The whole span is loaded
 * before anything is written, so a fatal loader error leaves every stored metric untouched. A date that fails
 * to compute is skipped and the rest of the run carries on; store failures abort the run.
 */
public class DailyMetricsRebuildService {

    private static final Logger log = LoggerFactory.getLogger(DailyMetricsRebuildService.class);

    private final ChunkedDatasetLoader loader;
    private final DailyMetricsAggregator aggregator;
    private final MetricRepository repository;

    public DailyMetricsRebuildService(ChunkedDatasetLoader loader, DailyMetricsAggregator aggregator,
                                      MetricRepository repository) {
        this.loader = loader;
        this.aggregator = aggregator;
        this.repository = repository;
    }

    public RebuildSummary rebuildDailyMetrics(String organizationId, DateRange range) {
        return rebuildDailyMetrics(organizationId, range.dates());
    }

    public RebuildSummary rebuildDailyMetrics(String organizationId, Collection<LocalDate> dates) {
        TreeSet<LocalDate> sorted = new TreeSet<>(dates);
        if (sorted.isEmpty()) {
            return new RebuildSummary(0, 0, 0, List.of());
        }
        DateRange span = DateRange.of(sorted.first(), sorted.last());
        AnalyticsSourceData data = loader.load(organizationId, span, LoaderOptions.all());
        DailyMetricsAggregator.Run run = aggregator.prepare(organizationId, sorted, data);

        List<DailyMetric> toWrite = new ArrayList<>();
        List<LocalDate> skippedDates = new ArrayList<>();
        int processed = 0;
        for (LocalDate date : sorted) {
            processed++;
            Optional<DailyMetric> metric;
            try {
                metric = run.computeDate(date);
            } catch (RuntimeException e) {
                skippedDates.add(date);
                log.warn("Skipping daily metric rebuild of {} for organization {}: {}",
                        date, organizationId, e.getMessage(), e);
                continue;
            }
            if (metric.isPresent()) {
                toWrite.add(metric.get());
            } else if (repository.findDaily(organizationId, date).isPresent()) {
                // contributions vanished since the last run
                toWrite.add(DailyMetric.finish(organizationId, date, MetricTotals.empty()));
            }
        }

        repository.upsertDaily(toWrite);
        RebuildSummary summary = new RebuildSummary(processed, toWrite.size(), skippedDates.size(), skippedDates);
        log.info("Rebuilt daily metrics for organization {}: {} processed, {} updated, {} skipped.",
                organizationId, summary.processed(), summary.updated(), summary.skipped());
        return summary;
    }
}
