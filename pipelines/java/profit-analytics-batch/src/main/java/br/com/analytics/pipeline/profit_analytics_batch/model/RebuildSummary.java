package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.time.LocalDate;
import java.util.List;

public record RebuildSummary(
        int processed,
        int updated,
        int skipped,
        List<LocalDate> skippedDates
) {

    public RebuildSummary {
        skippedDates = List.copyOf(skippedDates);
    }
}
