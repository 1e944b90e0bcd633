package br.com.analytics.pipeline.profit_analytics_batch.processor;

import br.com.analytics.pipeline.profit_analytics_batch.model.AggregateMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.DailyMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.DateRange;
import br.com.analytics.pipeline.profit_analytics_batch.model.DerivedMetrics;
import br.com.analytics.pipeline.profit_analytics_batch.model.Granularity;
import br.com.analytics.pipeline.profit_analytics_batch.model.MetricTotals;
import br.com.analytics.pipeline.profit_analytics_batch.model.PeriodRow;
import br.com.analytics.pipeline.profit_analytics_batch.model.PeriodType;
import br.com.analytics.pipeline.profit_analytics_batch.model.RangeOverview;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Sums daily metrics into weeks, months or a whole range. Ratios are always derived again from the summed
 * totals, never averaged from the daily ratios.
 */
public class MetricRollup {

    public List<AggregateMetric> rollup(String organizationId, PeriodType periodType,
                                        Collection<DailyMetric> dailyMetrics) {
        Map<String, List<DailyMetric>> byPeriod = new TreeMap<>();
        for (DailyMetric daily : dailyMetrics) {
            byPeriod.computeIfAbsent(periodType.keyOf(daily.date()), key -> new ArrayList<>()).add(daily);
        }
        List<AggregateMetric> aggregates = new ArrayList<>();
        for (Map.Entry<String, List<DailyMetric>> entry : byPeriod.entrySet()) {
            aggregates.add(aggregate(organizationId, periodType, entry.getKey(), entry.getValue()));
        }
        return aggregates;
    }

    public AggregateMetric aggregate(String organizationId, PeriodType periodType, String periodKey,
                                     Collection<DailyMetric> dailyMetrics) {
        MetricTotals totals = sum(dailyMetrics);
        SortedSet<LocalDate> dates = new TreeSet<>();
        dailyMetrics.forEach(daily -> dates.add(daily.date()));
        return new AggregateMetric(organizationId, periodKey, periodType, totals, derive(totals), dates.size(),
                dates, LocalDateTime.now());
    }

    public List<PeriodRow> periodTable(Granularity granularity, Collection<DailyMetric> dailyMetrics) {
        Map<LocalDate, List<DailyMetric>> byPeriodStart = new TreeMap<>();
        for (DailyMetric daily : dailyMetrics) {
            byPeriodStart.computeIfAbsent(granularity.startOf(daily.date()), start -> new ArrayList<>()).add(daily);
        }
        List<PeriodRow> rows = new ArrayList<>();
        for (Map.Entry<LocalDate, List<DailyMetric>> entry : byPeriodStart.entrySet()) {
            LocalDate start = entry.getKey();
            MetricTotals totals = sum(entry.getValue());
            rows.add(new PeriodRow(granularity.keyOf(start), start, granularity.endOf(start), totals,
                    derive(totals), entry.getValue().size()));
        }
        return rows;
    }

    public RangeOverview overview(DateRange range, Collection<DailyMetric> dailyMetrics) {
        List<DailyMetric> inRange = dailyMetrics.stream()
                .filter(daily -> range.contains(daily.date()))
                .sorted(Comparator.comparing(DailyMetric::date))
                .toList();
        MetricTotals totals = sum(inRange);
        return new RangeOverview(totals, derive(totals), inRange.size(), range.dayCount());
    }

    private static MetricTotals sum(Collection<DailyMetric> dailyMetrics) {
        MetricTotals totals = new MetricTotals();
        for (DailyMetric daily : dailyMetrics) {
            totals.merge(daily.totals());
        }
        return totals.rounded();
    }

    private static DerivedMetrics derive(MetricTotals totals) {
        return DerivedMetrics.from(totals).rounded();
    }
}
