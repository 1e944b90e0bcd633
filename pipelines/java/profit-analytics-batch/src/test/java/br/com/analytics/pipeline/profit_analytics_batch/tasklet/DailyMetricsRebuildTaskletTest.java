package br.com.analytics.pipeline.profit_analytics_batch.tasklet;

import br.com.analytics.pipeline.profit_analytics_batch.model.DateRange;
import br.com.analytics.pipeline.profit_analytics_batch.model.InvalidDateRangeException;
import br.com.analytics.pipeline.profit_analytics_batch.model.RebuildSummary;
import br.com.analytics.pipeline.profit_analytics_batch.service.DailyMetricsRebuildService;
import org.junit.jupiter.api.Test;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.StepContribution;
import org.springframework.batch.infrastructure.repeat.RepeatStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.RETURNS_DEEP_STUBS;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class DailyMetricsRebuildTaskletTest {

    private final DailyMetricsRebuildService rebuildService = mock(DailyMetricsRebuildService.class);
    private final DailyMetricsRebuildTasklet tasklet = new DailyMetricsRebuildTasklet(rebuildService);

    @Test
    void execute_ShouldRebuildTheJobParameterRange() throws Exception {
        DateRange range = DateRange.of(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 3));
        when(rebuildService.rebuildDailyMetrics("org-1", range))
                .thenReturn(new RebuildSummary(3, 2, 1, List.of(LocalDate.of(2024, 3, 2))));

        RepeatStatus status = tasklet.execute(mock(StepContribution.class),
                chunkContext(Map.of("organizationId", "org-1", "startDate", "2024-03-01", "endDate", "2024-03-03")));

        assertThat(status).isEqualTo(RepeatStatus.FINISHED);
        verify(rebuildService).rebuildDailyMetrics("org-1", range);
    }

    @Test
    void execute_ShouldFailWithoutOrganization() {
        ChunkContext context = chunkContext(Map.of("startDate", "2024-03-01", "endDate", "2024-03-03"));

        assertThatThrownBy(() -> tasklet.execute(mock(StepContribution.class), context))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("organizationId");
        verifyNoInteractions(rebuildService);
    }

    @Test
    void execute_ShouldFailOnReversedRange() {
        ChunkContext context =
                chunkContext(Map.of("organizationId", "org-1", "startDate", "2024-03-05", "endDate", "2024-03-01"));

        assertThatThrownBy(() -> tasklet.execute(mock(StepContribution.class), context))
                .isInstanceOf(InvalidDateRangeException.class);
        verify(rebuildService, never()).rebuildDailyMetrics(any(), any(DateRange.class));
    }

    static ChunkContext chunkContext(Map<String, Object> parameters) {
        ChunkContext context = mock(ChunkContext.class, RETURNS_DEEP_STUBS);
        when(context.getStepContext().getJobParameters()).thenReturn(parameters);
        return context;
    }
}
