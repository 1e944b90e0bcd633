package br.com.analytics.pipeline.profit_analytics_batch.support;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;

public final class CalendarPeriods {

    private CalendarPeriods() {
    }

    public static int daysInMonth(LocalDate date) {
        return date.lengthOfMonth();
    }

    public static int daysInQuarter(LocalDate date) {
        LocalDate start = quarterStart(date);
        return (int) ChronoUnit.DAYS.between(start, start.plusMonths(3));
    }

    public static int daysInYear(LocalDate date) {
        LocalDate start = date.with(TemporalAdjusters.firstDayOfYear());
        return (int) ChronoUnit.DAYS.between(start, start.plusYears(1));
    }

    public static LocalDate quarterStart(LocalDate date) {
        int firstMonthOfQuarter = ((date.getMonthValue() - 1) / 3) * 3 + 1;
        return LocalDate.of(date.getYear(), firstMonthOfQuarter, 1);
    }

    // ISO-8601: weeks start on Monday, week 1 holds the year's first Thursday.
    public static String isoWeekKey(LocalDate date) {
        int weekYear = date.get(IsoFields.WEEK_BASED_YEAR);
        int week = date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
        return String.format(Locale.ROOT, "%d-W%02d", weekYear, week);
    }

    public static LocalDate isoWeekStart(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public static String monthKey(LocalDate date) {
        return YearMonth.from(date).toString();
    }
}
