package br.com.analytics.pipeline.profit_analytics_batch.writer;

import br.com.analytics.pipeline.profit_analytics_batch.model.AggregateMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.DailyMetric;
import br.com.analytics.pipeline.profit_analytics_batch.model.DerivedMetrics;
import br.com.analytics.pipeline.profit_analytics_batch.model.MetricTotals;
import br.com.analytics.pipeline.profit_analytics_batch.model.PeriodType;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

import javax.sql.DataSource;
import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * PostgreSQL backed metric store. Writes go through the batch item writers; reads derive the ratios again from
 * the stored totals.
 */
public class JdbcMetricRepository implements MetricRepository {

    private static final String SQL_FIND_DAILY =
            "SELECT * FROM daily_metrics WHERE organization_id = :organizationId AND metric_date = :date";

    private static final String SQL_FIND_DAILY_RANGE =
            "SELECT * FROM daily_metrics WHERE organization_id = :organizationId " +
            "AND metric_date BETWEEN :startDate AND :endDate ORDER BY metric_date";

    private static final String SQL_FIND_AGGREGATE =
            "SELECT * FROM aggregate_metrics WHERE organization_id = :organizationId " +
            "AND period_type = :periodType AND period_key = :periodKey";

    private static final RowMapper<DailyMetric> DAILY_MAPPER = (resultSet, rowNum) -> {
        MetricTotals totals = MetricColumns.readTotals(resultSet);
        return new DailyMetric(
                resultSet.getString("organization_id"),
                resultSet.getObject("metric_date", LocalDate.class),
                totals,
                DerivedMetrics.from(totals).rounded(),
                resultSet.getTimestamp("calculation_date").toLocalDateTime());
    };

    private static final RowMapper<AggregateMetric> AGGREGATE_MAPPER = (resultSet, rowNum) -> {
        MetricTotals totals = MetricColumns.readTotals(resultSet);
        SortedSet<LocalDate> dates = new TreeSet<>();
        String includedDates = resultSet.getString("included_dates");
        if (includedDates != null && !includedDates.isBlank()) {
            Arrays.stream(includedDates.split(",")).map(String::trim).map(LocalDate::parse).forEach(dates::add);
        }
        return new AggregateMetric(
                resultSet.getString("organization_id"),
                resultSet.getString("period_key"),
                PeriodType.valueOf(resultSet.getString("period_type")),
                totals,
                DerivedMetrics.from(totals).rounded(),
                resultSet.getInt("days_included"),
                dates,
                resultSet.getTimestamp("calculation_date").toLocalDateTime());
    };

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final DailyMetricWriter dailyWriter;
    private final AggregateMetricWriter aggregateWriter;

    public JdbcMetricRepository(DataSource dataSource) {
        this.jdbcTemplate = new NamedParameterJdbcTemplate(dataSource);
        this.dailyWriter = new DailyMetricWriter(dataSource);
        this.aggregateWriter = new AggregateMetricWriter(dataSource);
    }

    @Override
    public void upsertDaily(List<DailyMetric> metrics) {
        try {
            dailyWriter.write(new Chunk<>(metrics));
        } catch (DataAccessException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to upsert " + metrics.size() + " daily metrics", e);
        }
    }

    @Override
    public Optional<DailyMetric> findDaily(String organizationId, LocalDate date) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("organizationId", organizationId)
                .addValue("date", date);
        return jdbcTemplate.query(SQL_FIND_DAILY, params, DAILY_MAPPER).stream().findFirst();
    }

    @Override
    public List<DailyMetric> findDaily(String organizationId, LocalDate startDate, LocalDate endDate) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("organizationId", organizationId)
                .addValue("startDate", startDate)
                .addValue("endDate", endDate);
        return jdbcTemplate.query(SQL_FIND_DAILY_RANGE, params, DAILY_MAPPER);
    }

    @Override
    public void upsertAggregates(List<AggregateMetric> metrics) {
        try {
            aggregateWriter.write(new Chunk<>(metrics));
        } catch (DataAccessException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException("Failed to upsert " + metrics.size() + " period aggregates", e);
        }
    }

    @Override
    public Optional<AggregateMetric> findAggregate(String organizationId, PeriodType periodType, String periodKey) {
        MapSqlParameterSource params = new MapSqlParameterSource()
                .addValue("organizationId", organizationId)
                .addValue("periodType", periodType.name())
                .addValue("periodKey", periodKey);
        return jdbcTemplate.query(SQL_FIND_AGGREGATE, params, AGGREGATE_MAPPER).stream().findFirst();
    }
}
