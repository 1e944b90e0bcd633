package br.com.analytics.pipeline.profit_analytics_batch.tasklet;

import br.com.analytics.pipeline.profit_analytics_batch.service.PeriodRollupService;
import org.junit.jupiter.api.Test;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static br.com.analytics.pipeline.profit_analytics_batch.tasklet.DailyMetricsRebuildTaskletTest.chunkContext;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PeriodRollupTaskletTest {

    @Test
    void execute_ShouldRollUpEveryDateOfTheRange() throws Exception {
        PeriodRollupService rollupService = mock(PeriodRollupService.class);
        List<LocalDate> dates = List.of(LocalDate.of(2024, 2, 28), LocalDate.of(2024, 2, 29), LocalDate.of(2024, 3, 1));
        when(rollupService.rollupPeriods("org-1", dates)).thenReturn(List.of());

        RepeatStatus status = new PeriodRollupTasklet(rollupService).execute(mock(StepContribution.class),
                chunkContext(Map.of("organizationId", "org-1", "startDate", "2024-02-28", "endDate", "2024-03-01")));

        assertThat(status).isEqualTo(RepeatStatus.FINISHED);
        verify(rollupService).rollupPeriods("org-1", dates);
    }
}
