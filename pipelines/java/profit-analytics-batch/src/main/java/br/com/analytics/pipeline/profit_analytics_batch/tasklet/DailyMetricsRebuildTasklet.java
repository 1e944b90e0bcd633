package br.com.analytics.pipeline.profit_analytics_batch.tasklet;

import br.com.analytics.pipeline.profit_analytics_batch.model.RebuildSummary;
import br.com.analytics.pipeline.profit_analytics_batch.service.DailyMetricsRebuildService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

public class DailyMetricsRebuildTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(DailyMetricsRebuildTasklet.class);

    private final DailyMetricsRebuildService rebuildService;

    public DailyMetricsRebuildTasklet(DailyMetricsRebuildService rebuildService) {
        this.rebuildService = rebuildService;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        JobParameterRange parameters = JobParameterRange.from(chunkContext);
        log.info("Starting daily metric rebuild for organization {} from {} to {}.",
                parameters.organizationId(), parameters.range().startDate(), parameters.range().endDate());

        RebuildSummary summary = rebuildService.rebuildDailyMetrics(parameters.organizationId(), parameters.range());

        if (summary.skipped() > 0) {
            log.warn("Daily metric rebuild skipped {} dates: {}", summary.skipped(), summary.skippedDates());
        }
        log.info("Daily metric rebuild finished: {} processed, {} updated.", summary.processed(), summary.updated());
        return RepeatStatus.FINISHED;
    }
}
