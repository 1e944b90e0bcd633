package br.com.analytics.pipeline.profit_analytics_batch.model;

import br.com.analytics.pipeline.profit_analytics_batch.support.SafeNumbers;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Typed configuration attached to a cost rule, keyed by its (type, calculation) pair. Only a payment
 * percentage rule carries extra settings today: a flat fee charged once per order next to the percentage.
 */
public interface CostRuleConfig {

    CostRuleConfig NONE = new NoConfig();

    default BigDecimal fixedFee() {
        return BigDecimal.ZERO;
    }

    static CostRuleConfig parse(CostType type, CostCalculation calculation, Map<String, ?> raw) {
        if (raw == null || raw.isEmpty()) {
            return NONE;
        }
        if (type == CostType.PAYMENT && calculation == CostCalculation.PERCENTAGE) {
            BigDecimal fee = SafeNumbers.nonNegative(SafeNumbers.money(raw.get("fixedFee")));
            return fee.signum() > 0 ? new FixedFeeConfig(fee) : NONE;
        }
        return NONE;
    }

    record NoConfig() implements CostRuleConfig {
    }

    record FixedFeeConfig(BigDecimal fixedFee) implements CostRuleConfig {
    }
}
