package br.com.analytics.pipeline.profit_analytics_batch.service;

import br.com.analytics.pipeline.profit_analytics_batch.model.AggregateMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.DailyMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.MetricField;
import br.com.analytics.pipeline.profit_analytics_batch.model.MetricTotals;
import br.com.analytics.pipeline.profit_analytics_batch.model.PeriodType;
import br.com.analytics.pipeline.profit_analytics_batch.processor.MetricRollup;
import br.com.analytics.pipeline.profit_analytics_batch.support.InMemoryMetricRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static br.com.analytics.pipeline.profit_analytics_batch.support.TestData.ORG;
import static org.assertj.core.api.Assertions.assertThat;

class PeriodRollupServiceTest {

    private static final LocalDate MARCH_4 = LocalDate.of(2024, 3, 4);
    private static final LocalDate MARCH_5 = LocalDate.of(2024, 3, 5);
    private static final LocalDate MARCH_11 = LocalDate.of(2024, 3, 11);

    private final InMemoryMetricRepository repository = new InMemoryMetricRepository();
    private final PeriodRollupService service = new PeriodRollupService(repository, new MetricRollup());

    @BeforeEach
    void setUp() {
        repository.upsertDaily(List.of(daily(MARCH_4, "100"), daily(MARCH_5, "300"), daily(MARCH_11, "50")));
    }

    @Test
    void rollupPeriods_ShouldRebuildEveryTouchedPeriodFromStoredDailies() {
        List<AggregateMetric> aggregates = service.rollupPeriods(ORG, List.of(MARCH_5));

        assertThat(aggregates).extracting(AggregateMetric::periodKey).containsExactly("2024-W10", "2024-03");
        assertThat(repository.findAggregate(ORG, PeriodType.WEEK, "2024-W10")).get()
                .satisfies(week -> {
                    assertThat(week.totals().revenue()).isEqualByComparingTo("400.00");
                    assertThat(week.daysIncluded()).isEqualTo(2);
                });
        assertThat(repository.findAggregate(ORG, PeriodType.MONTH, "2024-03")).get()
                .satisfies(month -> assertThat(month.totals().revenue()).isEqualByComparingTo("450.00"));
    }

    @Test
    void rollupPeriods_ShouldNotDoubleTotalsWhenRerun() {
        service.rollupPeriods(ORG, List.of(MARCH_4, MARCH_5, MARCH_11));
        service.rollupPeriods(ORG, List.of(MARCH_4, MARCH_5, MARCH_11));

        assertThat(repository.aggregateCount()).isEqualTo(3);
        assertThat(repository.findAggregate(ORG, PeriodType.MONTH, "2024-03")).get()
                .satisfies(month -> {
                    assertThat(month.totals().revenue()).isEqualByComparingTo("450.00");
                    assertThat(month.daysIncluded()).isEqualTo(3);
                });
    }

    @Test
    void rollupPeriods_ShouldSkipPeriodsWithoutDailies() {
        assertThat(service.rollupPeriods(ORG, List.of(LocalDate.of(2024, 4, 2)))).isEmpty();
        assertThat(repository.aggregateCount()).isZero();
    }

    private static DailyMetric daily(LocalDate date, String revenue) {
        return DailyMetric.finish(ORG, date, new MetricTotals()
                .add(MetricField.REVENUE, new BigDecimal(revenue))
                .add(MetricField.ORDERS, 1));
    }
}
