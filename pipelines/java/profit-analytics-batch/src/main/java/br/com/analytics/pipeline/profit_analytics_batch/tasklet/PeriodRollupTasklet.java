package br.com.analytics.pipeline.profit_analytics_batch.tasklet;

import br.com.analytics.pipeline.profit_analytics_batch.model.AggregateMetric;
import br.com.analytics.pipeline.profit_analytics_batch.service.PeriodRollupService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.util.List;

public class PeriodRollupTasklet implements Tasklet {

    private static final Logger log = LoggerFactory.getLogger(PeriodRollupTasklet.class);

    private final PeriodRollupService rollupService;

    public PeriodRollupTasklet(PeriodRollupService rollupService) {
        this.rollupService = rollupService;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        JobParameterRange parameters = JobParameterRange.from(chunkContext);
        log.info("Starting weekly and monthly rollup for organization {} from {} to {}.",
                parameters.organizationId(), parameters.range().startDate(), parameters.range().endDate());

        List<AggregateMetric> aggregates = rollupService.rollupPeriods(parameters.organizationId(),
                parameters.range().dates());

        log.info("Rollup finished with {} aggregates.", aggregates.size());
        return RepeatStatus.FINISHED;
    }
}
