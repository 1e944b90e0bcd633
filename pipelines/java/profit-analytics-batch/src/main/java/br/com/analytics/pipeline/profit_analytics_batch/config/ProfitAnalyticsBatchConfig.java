package br.com.analytics.pipeline.profit_analytics_batch.config;

import br.com.analytics.pipeline.profit_analytics_batch.processor.CostAllocationEngine;
import br.com.analytics.pipeline.profit_analytics_batch.processor.DailyMetricsAggregator;
import br.com.analytics.pipeline.profit_analytics_batch.processor.MetricRollup;
import br.com.analytics.pipeline.profit_analytics_batch.processor.TimeBoundCostAllocator;
import br.com.analytics.pipeline.profit_analytics_batch.reader.ChunkedDatasetLoader;
import br.com.analytics.pipeline.profit_analytics_batch.reader.JdbcPagedTableReader;
import br.com.analytics.pipeline.profit_analytics_batch.reader.PagedTableReader;
import br.com.analytics.pipeline.profit_analytics_batch.service.DailyMetricsRebuildService;
import br.com.analytics.pipeline.profit_analytics_batch.service.PeriodRollupService;
import br.com.analytics.pipeline.profit_analytics_batch.service.RangeAnalyticsService;
import br.com.analytics.pipeline.profit_analytics_batch.tasklet.DailyMetricsRebuildTasklet;
import br.com.analytics.pipeline.profit_analytics_batch.tasklet.PeriodRollupTasklet;
import br.com.analytics.pipeline.profit_analytics_batch.writer.JdbcMetricRepository;
import br.com.analytics.pipeline.profit_analytics_batch.writer.MetricRepository;
import org.springframework.batch.core.configuration.annotation.EnableBatchProcessing;
import org.springframework.batch.core.configuration.annotation.EnableJdbcJobRepository;
import org.springframework.batch.core.job.Job;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.job.parameters.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.Step;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
@EnableBatchProcessing
@EnableJdbcJobRepository(dataSourceRef = "batchDataSource", transactionManagerRef = "batchTransactionManager")
@EnableConfigurationProperties(AnalyticsProperties.class)
public class ProfitAnalyticsBatchConfig {

    private final JobRepository jobRepository;
    private final PlatformTransactionManager transactionManager;
    private final AnalyticsProperties properties;

    public ProfitAnalyticsBatchConfig(JobRepository jobRepository,
                                      @Qualifier("appTransactionManager") PlatformTransactionManager transactionManager,
                                      AnalyticsProperties properties) {
        this.jobRepository = jobRepository;
        this.transactionManager = transactionManager;
        this.properties = properties;
    }

    @Bean
    public PagedTableReader pagedTableReader(@Qualifier("appDataSource") DataSource appDataSource) {
        return new JdbcPagedTableReader(new NamedParameterJdbcTemplate(appDataSource), properties);
    }

    @Bean
    public ThreadPoolTaskExecutor loaderExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(4);
        executor.setThreadNamePrefix("dataset-loader-");
        executor.initialize();
        return executor;
    }

    @Bean
    public ChunkedDatasetLoader chunkedDatasetLoader(PagedTableReader pagedTableReader,
                                                     ThreadPoolTaskExecutor loaderExecutor) {
        return new ChunkedDatasetLoader(pagedTableReader, properties.loader(), loaderExecutor);
    }

    @Bean
    public CostAllocationEngine costAllocationEngine() {
        return new CostAllocationEngine(properties.zone());
    }

    @Bean
    public DailyMetricsAggregator dailyMetricsAggregator(CostAllocationEngine costAllocationEngine) {
        return new DailyMetricsAggregator(costAllocationEngine, properties.zone());
    }

    @Bean
    public MetricRollup metricRollup() {
        return new MetricRollup();
    }

    @Bean
    public MetricRepository metricRepository(@Qualifier("appDataSource") DataSource appDataSource) {
        return new JdbcMetricRepository(appDataSource);
    }

    @Bean
    public RangeAnalyticsService rangeAnalyticsService(ChunkedDatasetLoader loader, DailyMetricsAggregator aggregator,
                                                       MetricRollup metricRollup) {
        return new RangeAnalyticsService(loader, aggregator, metricRollup,
                new TimeBoundCostAllocator(properties.zone()));
    }

    @Bean
    public DailyMetricsRebuildService dailyMetricsRebuildService(ChunkedDatasetLoader loader,
                                                                 DailyMetricsAggregator aggregator,
                                                                 MetricRepository metricRepository) {
        return new DailyMetricsRebuildService(loader, aggregator, metricRepository);
    }

    @Bean
    public PeriodRollupService periodRollupService(MetricRepository metricRepository, MetricRollup metricRollup) {
        return new PeriodRollupService(metricRepository, metricRollup);
    }

    @Bean
    public Step rebuildDailyMetricsStep(DailyMetricsRebuildService dailyMetricsRebuildService) {
        return new StepBuilder("rebuildDailyMetricsStep", jobRepository)
                .tasklet(new DailyMetricsRebuildTasklet(dailyMetricsRebuildService), transactionManager)
                .build();
    }

    @Bean
    public Step periodRollupStep(PeriodRollupService periodRollupService) {
        return new StepBuilder("periodRollupStep", jobRepository)
                .tasklet(new PeriodRollupTasklet(periodRollupService), transactionManager)
                .build();
    }

    @Bean
    public Job dailyMetricsRebuildJob(Step rebuildDailyMetricsStep, Step periodRollupStep) {
        return new JobBuilder("dailyMetricsRebuildJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .start(rebuildDailyMetricsStep)
                .next(periodRollupStep)
                .build();
    }
}
