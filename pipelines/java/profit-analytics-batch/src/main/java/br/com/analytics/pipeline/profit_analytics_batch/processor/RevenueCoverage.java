package br.com.analytics.pipeline.profit_analytics_batch.processor;

import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;

/**
 * Revenue already charged by a variant override, per cost type that has an org level percentage fallback.
 * One instance covers exactly one order, or exactly one calendar date.
 */
final class RevenueCoverage {

    private BigDecimal cogsCovered = BigDecimal.ZERO;
    private BigDecimal paymentCovered = BigDecimal.ZERO;

    void coverCogs(BigDecimal lineRevenue) {
        cogsCovered = cogsCovered.add(lineRevenue);
    }

    void coverPayment(BigDecimal lineRevenue) {
        paymentCovered = paymentCovered.add(lineRevenue);
    }

    BigDecimal uncoveredCogs(BigDecimal base) {
        return SafeNumbers.nonNegative(base.subtract(cogsCovered));
    }

    BigDecimal uncoveredPayment(BigDecimal base) {
        return SafeNumbers.nonNegative(base.subtract(paymentCovered));
    }
}
