package br.com.analytics.pipeline.profit_analytics_batch.support;

import br.com.analytics.pipeline.profit_analytics_batch.model.AggregateMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.DailyMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.PeriodType;
import br.com.analytics.pipeline.profit_analytics_batch.writer.MetricRepository;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

public class InMemoryMetricRepository implements MetricRepository {

    private final Map<String, DailyMetric> daily = new TreeMap<>();
    private final Map<String, AggregateMetric> aggregates = new TreeMap<>();
    private int dailyWrites;

    @Override
    public void upsertDaily(List<DailyMetric> metrics) {
        for (DailyMetric metric : metrics) {
            daily.put(metric.organizationId() + "|" + metric.date(), metric);
            dailyWrites++;
        }
    }

    @Override
    public Optional<DailyMetric> findDaily(String organizationId, LocalDate date) {
        return Optional.ofNullable(daily.get(organizationId + "|" + date));
    }

    @Override
    public List<DailyMetric> findDaily(String organizationId, LocalDate startDate, LocalDate endDate) {
        List<DailyMetric> result = new ArrayList<>();
        for (DailyMetric metric : daily.values()) {
            if (metric.organizationId().equals(organizationId)
                    && !metric.date().isBefore(startDate) && !metric.date().isAfter(endDate)) {
                result.add(metric);
            }
        }
        return result;
    }

    @Override
    public void upsertAggregates(List<AggregateMetric> metrics) {
        for (AggregateMetric metric : metrics) {
            aggregates.put(key(metric.organizationId(), metric.periodType(), metric.periodKey()), metric);
        }
    }

    @Override
    public Optional<AggregateMetric> findAggregate(String organizationId, PeriodType periodType, String periodKey) {
        return Optional.ofNullable(aggregates.get(key(organizationId, periodType, periodKey)));
    }

    public int dailyCount() {
        return daily.size();
    }

    public int dailyWrites() {
        return dailyWrites;
    }

    public int aggregateCount() {
        return aggregates.size();
    }

    private static String key(String organizationId, PeriodType periodType, String periodKey) {
        return organizationId + "|" + periodType + "|" + periodKey;
    }
}
