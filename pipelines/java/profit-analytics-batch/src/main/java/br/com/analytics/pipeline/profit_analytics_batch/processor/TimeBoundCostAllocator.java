package br.com.analytics.pipeline.profit_analytics_batch.processor;

import br.com.analytics.pipeline.profit_analytics_batch.model.CostCalculation;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostFrequency;
import br.com.analytics.pipeline.profit_analytics_batch.model.CostRule;
import br.com.analytics.pipeline.profit_analytics_batch.model.DateRange;
import br.com.analytics.pipeline.profit_analytics_batch.model.RangeCostAllocation;
import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Range level report of what each fixed org rule costs over a date range.
 *
 * <ul>
 *     <li>per order and per item rules: value times the range's orders or units</li>
 *     <li>calendar rules: the calendar pro-rated daily amount of every day the rule is active</li>
 *     <li>one-time rules with a closed window: value times overlap over window length, in milliseconds</li>
 *     <li>one-time rules with an open window: the full value once the window touches the range</li>
 * </ul>
 */
public class TimeBoundCostAllocator {

    private final ZoneId zone;

    public TimeBoundCostAllocator(ZoneId zone) {
        this.zone = zone;
    }

    public List<RangeCostAllocation> allocate(Collection<CostRule> rules, DateRange range, long orders, long units) {
        long rangeStart = range.startMillis(zone);
        long rangeEnd = range.endMillisExclusive(zone);
        List<RangeCostAllocation> allocations = new ArrayList<>();
        for (CostRule rule : rules) {
            if (rule.calculation() == CostCalculation.PERCENTAGE || !rule.isActiveBetween(rangeStart, rangeEnd)) {
                continue;
            }
            BigDecimal amount = amountFor(rule, range, orders, units);
            allocations.add(new RangeCostAllocation(rule.id(), rule.name(), rule.type(), SafeNumbers.round(amount)));
        }
        return allocations;
    }

    BigDecimal amountFor(CostRule rule, DateRange range, long orders, long units) {
        if (rule.calculation() == CostCalculation.PER_UNIT) {
            return rule.value().multiply(BigDecimal.valueOf(units));
        }
        CostFrequency frequency = CostAllocationEngine.frequencyOf(rule);
        return switch (frequency) {
            case PER_ORDER -> rule.value().multiply(BigDecimal.valueOf(orders));
            case PER_ITEM -> rule.value().multiply(BigDecimal.valueOf(units));
            case ONE_TIME -> overlapShare(rule, range);
            default -> calendarShare(rule, frequency, range);
        };
    }

    /**
     * Linear share of a total value: {@code value x overlapMs / windowMs}; zero without overlap.
     */
    public BigDecimal overlapShare(CostRule rule, DateRange range) {
        long rangeStart = range.startMillis(zone);
        long rangeEnd = range.endMillisExclusive(zone);
        Long from = rule.window().from();
        Long to = rule.window().to();
        long start = from == null ? rangeStart : from;
        long end = to == null ? rangeEnd : to;
        long overlap = Math.min(rangeEnd, end) - Math.max(rangeStart, start);
        if (rule.window().isClosed() && end > start) {
            if (overlap <= 0) {
                return BigDecimal.ZERO;
            }
            return SafeNumbers.divide(rule.value().multiply(BigDecimal.valueOf(overlap)), end - start);
        }
        return rule.window().overlaps(rangeStart, rangeEnd) ? rule.value() : BigDecimal.ZERO;
    }

    private BigDecimal calendarShare(CostRule rule, CostFrequency frequency, DateRange range) {
        BigDecimal total = BigDecimal.ZERO;
        for (LocalDate date : range.dates()) {
            long dayStart = date.atStartOfDay(zone).toInstant().toEpochMilli();
            long dayEnd = date.plusDays(1).atStartOfDay(zone).toInstant().toEpochMilli();
            if (rule.isActiveBetween(dayStart, dayEnd)) {
                total = total.add(SafeNumbers.round(CalendarProRater.dailyAmount(frequency, rule.value(), date)));
            }
        }
        return total;
    }
}
