package br.com.analytics.pipeline.profit_analytics_batch.writer;

import br.com.analytics.pipeline.profit_analytics_batch.model.DailyMetric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.infrastructure.item.Chunk;
import org.springframework.batch.infrastructure.item.ItemWriter;
import org.springframework.batch.infrastructure.item.database.JdbcBatchItemWriter;
import org.springframework.batch.infrastructure.item.database.builder.JdbcBatchItemWriterBuilder;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

import javax.sql.DataSource;
import java.sql.Date;
import java.sql.Timestamp;
import java.util.List;

public class DailyMetricWriter implements ItemWriter<DailyMetric> {

    private static final Logger log = LoggerFactory.getLogger(DailyMetricWriter.class);

    static final String SQL_UPSERT = MetricColumns.upsertSql("daily_metrics",
            List.of("organization_id", "metric_date"), List.of("calculation_date"));

    private final JdbcBatchItemWriter<DailyMetric> delegateWriter;

    public DailyMetricWriter(DataSource dataSource) {
        this.delegateWriter = createDelegateWriter(dataSource);
    }

    private JdbcBatchItemWriter<DailyMetric> createDelegateWriter(DataSource dataSource) {
        return new JdbcBatchItemWriterBuilder<DailyMetric>()
                .itemSqlParameterSourceProvider(metric -> {
                    MapSqlParameterSource params = new MapSqlParameterSource()
                            .addValue("organization_id", metric.organizationId())
                            .addValue("metric_date", Date.valueOf(metric.date()))
                            .addValue("calculation_date", Timestamp.valueOf(metric.calculationDate()));
                    MetricColumns.addValues(params, metric.totals(), metric.derived());
                    return params;
                })
                .sql(SQL_UPSERT)
                .dataSource(dataSource)
                .build();
    }

    @Override
    public void write(Chunk<? extends DailyMetric> chunk) throws Exception {
        if (chunk.isEmpty()) {
            log.info("No daily metrics to write.");
            return;
        }
        delegateWriter.write(chunk);
        log.info("Upserted {} daily metrics.", chunk.size());
    }
}
