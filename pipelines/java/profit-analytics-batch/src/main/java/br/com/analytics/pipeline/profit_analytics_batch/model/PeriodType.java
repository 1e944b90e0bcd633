package br.com.analytics.pipeline.profit_analytics_batch.model;

import br.com.analytics.pipeline.profit_analytics_batch.support.CalendarPeriods;

import java.time.LocalDate;
import java.time.temporal.TemporalAdjusters;

public enum PeriodType {
    WEEK,
    MONTH;

    public String keyOf(LocalDate date) {
        return this == WEEK ? CalendarPeriods.isoWeekKey(date) : CalendarPeriods.monthKey(date);
    }

    public LocalDate startOf(LocalDate date) {
        return this == WEEK ? CalendarPeriods.isoWeekStart(date) : date.with(TemporalAdjusters.firstDayOfMonth());
    }

    public LocalDate endOf(LocalDate date) {
        return this == WEEK ? startOf(date).plusDays(6) : date.with(TemporalAdjusters.lastDayOfMonth());
    }
}
