package br.com.analytics.pipeline.profit_analytics_batch.writer;

import br.com.analytics.pipeline.profit_analytics_batch.model.AggregateMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;
import org.springframework.batch.infrastructure.item.database.builder.JdbcBatchItemWriterBuilder;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import javax.sql.DataSource;
import java.sql.Timestamp;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

public class AggregateMetricWriter implements ItemWriter<AggregateMetric> {

    private static final Logger log = LoggerFactory.getLogger(AggregateMetricWriter.class);

    static final String SQL_UPSERT = MetricColumns.upsertSql("aggregate_metrics",
            List.of("organization_id", "period_type", "period_key"),
            List.of("days_included", "included_dates", "calculation_date"));

    private final JdbcBatchItemWriter<AggregateMetric> delegateWriter;

    public AggregateMetricWriter(DataSource dataSource) {
        this.delegateWriter = new JdbcBatchItemWriterBuilder<AggregateMetric>()
                .itemSqlParameterSourceProvider(metric -> {
                    MapSqlParameterSource params = new MapSqlParameterSource()
                            .addValue("organization_id", metric.organizationId())
                            .addValue("period_type", metric.periodType().name())
                            .addValue("period_key", metric.periodKey())
                            .addValue("days_included", metric.daysIncluded())
                            .addValue("included_dates", metric.dates().stream()
                                    .map(LocalDate::toString)
                                    .collect(Collectors.joining(",")))
                            .addValue("calculation_date", Timestamp.valueOf(metric.calculationDate()));
                    MetricColumns.addValues(params, metric.totals(), metric.derived());
                    return params;
                })
                .sql(SQL_UPSERT)
                .dataSource(dataSource)
                .build();
    }

    @Override
    public void write(Chunk<? extends AggregateMetric> chunk) throws Exception {
        if (chunk.isEmpty()) {
            log.info("No period aggregates to write.");
            return;
        }
        delegateWriter.write(chunk);
        log.info("Upserted {} period aggregates.", chunk.size());
    }
}
