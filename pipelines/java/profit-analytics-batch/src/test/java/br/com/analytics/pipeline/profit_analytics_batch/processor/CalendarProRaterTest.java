package br.com.analytics.pipeline.profit_analytics_batch.processor;

import br.com.analytics.pipeline.profit_analytics_batch.model.CostFrequency;
import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class CalendarProRaterTest {

    @Test
    void dailyAmount_ShouldSpreadMonthlyCostOverExactMonthLength() {
        BigDecimal total = BigDecimal.ZERO;
        for (LocalDate date = LocalDate.of(2024, 3, 1); date.getMonthValue() == 3; date = date.plusDays(1)) {
            total = total.add(SafeNumbers.round(CalendarProRater.dailyAmount(CostFrequency.MONTHLY,
                    new BigDecimal("310"), date)));
        }

        assertThat(CalendarProRater.dailyAmount(CostFrequency.MONTHLY, new BigDecimal("310"), LocalDate.of(2024, 3, 9)))
                .isEqualByComparingTo("10");
        assertThat(CalendarProRater.dailyAmount(CostFrequency.MONTHLY, new BigDecimal("290"), LocalDate.of(2024, 2, 9)))
                .isEqualByComparingTo("10");
        assertThat(total).isEqualByComparingTo("310.00");
    }

    @Test
    void dailyAmount_ShouldHonourLeapYearsAndQuarterLengths() {
        assertThat(CalendarProRater.dailyAmount(CostFrequency.YEARLY, new BigDecimal("366"), LocalDate.of(2024, 6, 1)))
                .isEqualByComparingTo("1");
        assertThat(CalendarProRater.dailyAmount(CostFrequency.YEARLY, new BigDecimal("365"), LocalDate.of(2023, 6, 1)))
                .isEqualByComparingTo("1");
        assertThat(CalendarProRater.dailyAmount(CostFrequency.QUARTERLY, new BigDecimal("91"), LocalDate.of(2024, 2, 1)))
                .isEqualByComparingTo("1");
        assertThat(CalendarProRater.dailyAmount(CostFrequency.QUARTERLY, new BigDecimal("90"), LocalDate.of(2023, 2, 1)))
                .isEqualByComparingTo("1");
    }

    @Test
    void dailyAmount_ShouldHandleWeeklyDailyAndNonCalendarFrequencies() {
        LocalDate date = LocalDate.of(2024, 3, 9);

        assertThat(CalendarProRater.dailyAmount(CostFrequency.WEEKLY, new BigDecimal("70"), date)).isEqualByComparingTo("10");
        assertThat(CalendarProRater.dailyAmount(CostFrequency.DAILY, new BigDecimal("12.5"), date)).isEqualByComparingTo("12.5");
        assertThat(CalendarProRater.dailyAmount(CostFrequency.PER_ORDER, new BigDecimal("70"), date)).isEqualByComparingTo("0");
        assertThat(CalendarProRater.dailyAmount(null, new BigDecimal("70"), date)).isEqualByComparingTo("0");
    }
}
