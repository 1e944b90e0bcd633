package br.com.analytics.pipeline.profit_analytics_batch.processor;

import br.com.analytics.pipeline.profit_analytics_batch.model.CostFrequency;
import br.com.analytics.pipeline.profit_analytics_batch.support.CalendarPeriods;
import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Spreads a calendar based fixed cost over the exact days of the period that contains the date.
 */
public final class CalendarProRater {

    private static final int DAYS_IN_WEEK = 7;

    private CalendarProRater() {
    }

    public static BigDecimal dailyAmount(CostFrequency frequency, BigDecimal value, LocalDate date) {
        if (frequency == null) {
            return BigDecimal.ZERO;
        }
        return switch (frequency) {
            case DAILY -> value;
            case WEEKLY -> SafeNumbers.divide(value, DAYS_IN_WEEK);
            case MONTHLY -> SafeNumbers.divide(value, CalendarPeriods.daysInMonth(date));
            case QUARTERLY -> SafeNumbers.divide(value, CalendarPeriods.daysInQuarter(date));
            case YEARLY -> SafeNumbers.divide(value, CalendarPeriods.daysInYear(date));
            default -> BigDecimal.ZERO;
        };
    }
}
