package br.com.analytics.pipeline.profit_analytics_batch.model;

import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Inclusive calendar date range. Wire format is {@code {startDate: "YYYY-MM-DD", endDate: "YYYY-MM-DD"}}.
 */
public record DateRange(
        LocalDate startDate,
        LocalDate endDate
) {

    public DateRange {
        if (startDate == null || endDate == null) {
            throw new InvalidDateRangeException("Date range requires both startDate and endDate");
        }
        if (startDate.isAfter(endDate)) {
            throw new InvalidDateRangeException(
                    "Date range start " + startDate + " is after end " + endDate);
        }
    }

    public static DateRange of(LocalDate startDate, LocalDate endDate) {
        return new DateRange(startDate, endDate);
    }

    public static DateRange parse(String startDate, String endDate) {
        return new DateRange(parseDate("startDate", startDate), parseDate("endDate", endDate));
    }

    private static LocalDate parseDate(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidDateRangeException(field + " is required");
        }
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new InvalidDateRangeException(field + " is not a valid ISO date: " + value, e);
        }
    }

    public int dayCount() {
        return (int) ChronoUnit.DAYS.between(startDate, endDate) + 1;
    }

    public List<LocalDate> dates() {
        List<LocalDate> dates = new ArrayList<>(dayCount());
        for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            dates.add(date);
        }
        return dates;
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public long startMillis(ZoneId zone) {
        return startDate.atStartOfDay(zone).toInstant().toEpochMilli();
    }

    public long endMillisExclusive(ZoneId zone) {
        return endDate.plusDays(1).atStartOfDay(zone).toInstant().toEpochMilli();
    }
}
