package br.com.analytics.pipeline.profit_analytics_batch.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CostRuleTest {

    private static final long JAN_1 = 1_704_067_200_000L;
    private static final long DAY = 86_400_000L;

    @Test
    void isActiveAt_ShouldTreatMalformedWindowAsInactive() {
        CostRule rule = rule(CostCalculation.FIXED, new EffectiveWindow(JAN_1 + DAY, JAN_1), true);

        assertThat(rule.isWellFormed()).isFalse();
        assertThat(rule.isActiveAt(JAN_1)).isFalse();
        assertThat(rule.isActiveBetween(Long.MIN_VALUE, Long.MAX_VALUE)).isFalse();
    }

    @Test
    void isActiveAt_ShouldTreatMissingBoundsAsOpen() {
        CostRule openEnded = rule(CostCalculation.FIXED, new EffectiveWindow(JAN_1, null), true);

        assertThat(openEnded.isActiveAt(JAN_1 - 1)).isFalse();
        assertThat(openEnded.isActiveAt(JAN_1)).isTrue();
        assertThat(openEnded.isActiveAt(JAN_1 + 1000 * DAY)).isTrue();
        assertThat(rule(CostCalculation.FIXED, null, false).isActiveAt(JAN_1)).isFalse();
    }

    @Test
    void unsupportedCalculation_ShouldNeverBeActive() {
        CostRule tiered = rule(CostCalculation.fromValue("tiered"), EffectiveWindow.open(), true);

        assertThat(tiered.isWellFormed()).isFalse();
        assertThat(tiered.isActiveAt(JAN_1)).isFalse();
    }

    @Test
    void parsers_ShouldNormalizeLooseValues() {
        assertThat(CostFrequency.fromValue("per_unit")).isEqualTo(CostFrequency.PER_ITEM);
        assertThat(CostFrequency.fromValue(" Monthly ")).isEqualTo(CostFrequency.MONTHLY);
        assertThat(CostFrequency.fromValue("fortnightly")).isNull();
        assertThat(CostType.fromValue("custom")).isEqualTo(CostType.OTHER);
        assertThat(CostCalculation.fromValue("percentage")).isEqualTo(CostCalculation.PERCENTAGE);
    }

    @Test
    void config_ShouldOnlyCarryFixedFeeForPaymentPercentageRules() {
        Map<String, Object> raw = Map.of("fixedFee", "0.30");

        assertThat(CostRuleConfig.parse(CostType.PAYMENT, CostCalculation.PERCENTAGE, raw))
                .isEqualTo(new CostRuleConfig.FixedFeeConfig(new BigDecimal("0.30")));
        assertThat(CostRuleConfig.parse(CostType.SHIPPING, CostCalculation.PERCENTAGE, raw))
                .isSameAs(CostRuleConfig.NONE);
        assertThat(CostRuleConfig.parse(CostType.PAYMENT, CostCalculation.PERCENTAGE, Map.of("fixedFee", "-1")))
                .isSameAs(CostRuleConfig.NONE);
        assertThat(CostRuleConfig.NONE.fixedFee()).isEqualByComparingTo("0");
    }

    private static CostRule rule(CostCalculation calculation, EffectiveWindow window, boolean active) {
        return new CostRule("rule-1", "org-1", "Rent", CostType.OPERATIONAL, calculation, CostFrequency.MONTHLY,
                new BigDecimal("100"), null, window, active);
    }
}
