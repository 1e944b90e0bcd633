package br.com.analytics.pipeline.profit_analytics_batch.tasklet;

import br.com.analytics.pipeline.profit_analytics_batch.model.DateRange;
import org.springframework.batch.core.scope.context.ChunkContext;

import java.util.Map;

/**
 * Reads the organizationId, startDate and endDate job parameters shared by the rebuild job's steps.
 */
record JobParameterRange(String organizationId, DateRange range) {

    static final String ORGANIZATION_ID = "organizationId";
    static final String START_DATE = "startDate";
    static final String END_DATE = "endDate";

    static JobParameterRange from(ChunkContext chunkContext) {
        Map<String, Object> parameters = chunkContext.getStepContext().getJobParameters();
        Object organizationId = parameters.get(ORGANIZATION_ID);
        if (organizationId == null || organizationId.toString().isBlank()) {
            throw new IllegalArgumentException("Job parameter " + ORGANIZATION_ID + " is required");
        }
        DateRange range = DateRange.parse(asString(parameters.get(START_DATE)), asString(parameters.get(END_DATE)));
        return new JobParameterRange(organizationId.toString(), range);
    }

    private static String asString(Object value) {
        return value == null ? null : value.toString();
    }
}
