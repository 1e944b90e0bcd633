package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.time.LocalDate;

public enum Granularity {
    DAILY(null),
    WEEKLY(PeriodType.WEEK),
    MONTHLY(PeriodType.MONTH);

    private final PeriodType periodType;

    Granularity(PeriodType periodType) {
        this.periodType = periodType;
    }

    public String keyOf(LocalDate date) {
        return periodType == null ? date.toString() : periodType.keyOf(date);
    }

    public LocalDate startOf(LocalDate date) {
        return periodType == null ? date : periodType.startOf(date);
    }

    public LocalDate endOf(LocalDate date) {
        return periodType == null ? date : periodType.endOf(date);
    }
}
