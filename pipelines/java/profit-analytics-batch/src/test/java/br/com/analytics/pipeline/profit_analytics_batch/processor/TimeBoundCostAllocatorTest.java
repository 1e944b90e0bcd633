package br.com.analytics.pipeline.profit_analytics_batch.processor;

import br.com.analytics.pipeline.profit_analytics_batch.model.CostCalculation;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostFrequency;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostRule;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostRuleConfig;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostType;
import br.com.analytics.pipeline.profit_analytics_batch.model.DateRange;
import br.com.analytics.pipeline.profit_analytics_batch.model.EffectiveWindow;
import br.com.analytics.pipeline.profit_analytics_batch.model.RangeCostAllocation;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

import static br.com.analytics.pipeline.profit_analytics_batch.support.TestData.UTC;
import static br.com.analytics.pipeline.profit_analytics_batch.support.TestData.at;
import static br.com.analytics.pipeline.profit_analytics_batch.support.TestData.fixed;
import static br.com.analytics.pipeline.profit_analytics_batch.support.TestData.percentage;
import static br.com.analytics.pipeline.profit_analytics_batch.support.TestData.rule;
import static br.com.analytics.pipeline.profit_analytics_batch.support.TestData.startOf;
import static org.assertj.core.api.Assertions.assertThat;

class TimeBoundCostAllocatorTest {

    private static final DateRange FIRST_HALF_OF_MARCH =
            DateRange.of(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 15));

    private final TimeBoundCostAllocator allocator = new TimeBoundCostAllocator(UTC);

    @Test
    void allocate_ShouldShareClosedOneTimeCostByOverlap() {
        CostRule campaign = oneTime("r-1", "100",
                new EffectiveWindow(startOf(LocalDate.of(2024, 3, 11)), startOf(LocalDate.of(2024, 3, 21))));

        List<RangeCostAllocation> allocations = allocator.allocate(List.of(campaign), FIRST_HALF_OF_MARCH, 0, 0);

        assertThat(allocations).singleElement().satisfies(allocation -> {
            assertThat(allocation.costRuleId()).isEqualTo("r-1");
            assertThat(allocation.type()).isEqualTo(CostType.MARKETING);
            assertThat(allocation.amount()).isEqualByComparingTo("50.00");
        });
    }

    @Test
    void allocate_ShouldSkipRulesOutsideTheRange() {
        CostRule february = oneTime("r-1", "100",
                new EffectiveWindow(startOf(LocalDate.of(2024, 2, 1)), startOf(LocalDate.of(2024, 2, 11))));

        assertThat(allocator.allocate(List.of(february), FIRST_HALF_OF_MARCH, 0, 0)).isEmpty();
        assertThat(allocator.overlapShare(february, FIRST_HALF_OF_MARCH)).isEqualByComparingTo("0");
    }

    @Test
    void allocate_ShouldChargeFullValueForOpenOneTimeWindow() {
        CostRule setup = oneTime("r-1", "500", new EffectiveWindow(at(LocalDate.of(2024, 3, 3), 9), null));

        assertThat(allocator.allocate(List.of(setup), FIRST_HALF_OF_MARCH, 0, 0))
                .extracting(RangeCostAllocation::amount)
                .singleElement()
                .satisfies(amount -> assertThat(amount).isEqualByComparingTo("500.00"));
    }

    @Test
    void allocate_ShouldSumDailyShareOfCalendarRulesWhileActive() {
        CostRule rent = fixed("r-1", CostType.OPERATIONAL, CostFrequency.MONTHLY, "310");
        CostRule endsOnTenth = rule("r-2", CostType.OPERATIONAL, CostCalculation.FIXED, CostFrequency.MONTHLY, "310",
                CostRuleConfig.NONE, new EffectiveWindow(null, at(LocalDate.of(2024, 3, 10), 12)));

        List<RangeCostAllocation> allocations =
                allocator.allocate(List.of(rent, endsOnTenth), FIRST_HALF_OF_MARCH, 0, 0);

        assertThat(allocations).extracting(RangeCostAllocation::costRuleId).containsExactly("r-1", "r-2");
        assertThat(allocations.get(0).amount()).isEqualByComparingTo("150.00");
        assertThat(allocations.get(1).amount()).isEqualByComparingTo("100.00");
    }

    @Test
    void allocate_ShouldMultiplyPerOrderAndPerUnitRules() {
        CostRule packaging = fixed("r-1", CostType.HANDLING, CostFrequency.PER_ORDER, "2");
        CostRule labels = rule("r-2", CostType.SHIPPING, CostCalculation.PER_UNIT, null, "0.25",
                CostRuleConfig.NONE, EffectiveWindow.open());

        List<RangeCostAllocation> allocations =
                allocator.allocate(List.of(packaging, labels), FIRST_HALF_OF_MARCH, 7, 10);

        assertThat(allocations).extracting(RangeCostAllocation::amount)
                .usingElementComparator(BigDecimal::compareTo)
                .containsExactly(new BigDecimal("14.00"), new BigDecimal("2.50"));
    }

    @Test
    void allocate_ShouldLeavePercentageRulesOut() {
        assertThat(allocator.allocate(List.of(percentage("r-1", CostType.PAYMENT, "3")), FIRST_HALF_OF_MARCH, 5, 5))
                .isEmpty();
    }

    private static CostRule oneTime(String id, String value, EffectiveWindow window) {
        return rule(id, CostType.MARKETING, CostCalculation.FIXED, CostFrequency.ONE_TIME, value,
                CostRuleConfig.NONE, window);
    }
}
