package br.com.analytics.pipeline.profit_analytics_batch.writer;

import br.com.analytics.pipeline.profit_analytics_batch.model.AggregateMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.DailyMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.PeriodType;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Store for engine owned metrics. Upserts insert a missing key and overwrite an existing one; nothing is ever
 * deleted here.
 */
public interface MetricRepository {

    void upsertDaily(List<DailyMetric> metrics);

    Optional<DailyMetric> findDaily(String organizationId, LocalDate date);

    /**
     * Daily metrics between both dates, inclusive, ordered by date.
     */
    List<DailyMetric> findDaily(String organizationId, LocalDate startDate, LocalDate endDate);

    void upsertAggregates(List<AggregateMetric> metrics);

    Optional<AggregateMetric> findAggregate(String organizationId, PeriodType periodType, String periodKey);
}
