package br.com.analytics.pipeline.profit_analytics_batch.service;

import br.com.analytics.pipeline.profit_analytics_batch.model.AggregateMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.DailyMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.PeriodType;
import br.com.analytics.pipeline.profit_analytics_batch.processor.MetricRollup;
import br.com.analytics.pipeline.profit_analytics_batch.writer.MetricRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rebuilds the weekly and monthly aggregates touched by a set of dates. Each period is summed again from the
 * stored daily metrics, so re-running a rollup overwrites the aggregate instead of adding to it.
 */
public class PeriodRollupService {

    private static final Logger log = LoggerFactory.getLogger(PeriodRollupService.class);

    private final MetricRepository repository;
    private final MetricRollup rollup;

    public PeriodRollupService(MetricRepository repository, MetricRollup rollup) {
        this.repository = repository;
        this.rollup = rollup;
    }

    public List<AggregateMetric> rollupPeriods(String organizationId, Collection<LocalDate> dates) {
        List<AggregateMetric> aggregates = new ArrayList<>();
        for (PeriodType periodType : PeriodType.values()) {
            Map<String, LocalDate> touched = new LinkedHashMap<>();
            dates.stream().sorted().forEach(date -> touched.putIfAbsent(periodType.keyOf(date), date));

            for (Map.Entry<String, LocalDate> period : touched.entrySet()) {
                LocalDate anyDate = period.getValue();
                List<DailyMetric> dailyMetrics = repository.findDaily(organizationId,
                        periodType.startOf(anyDate), periodType.endOf(anyDate));
                if (dailyMetrics.isEmpty()) {
                    continue;
                }
                aggregates.add(rollup.aggregate(organizationId, periodType, period.getKey(), dailyMetrics));
            }
        }
        repository.upsertAggregates(aggregates);
        log.info("Rolled up {} period aggregates for organization {}.", aggregates.size(), organizationId);
        return aggregates;
    }
}
