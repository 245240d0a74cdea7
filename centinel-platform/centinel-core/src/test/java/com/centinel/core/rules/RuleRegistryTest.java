package com.centinel.core.rules;

import com.centinel.core.config.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class RuleRegistryTest {

    private final RuleRegistry registry = RuleRegistry.defaults();

    @Test
    void defaults_registersBuiltInRulesInEvaluationOrder() {
        assertThat(registry.ids()).containsExactly(
                AccumulatedCountIntegrityRule.ID,
                TemporalMonotonicityRule.ID,
                ArithmeticConsistencyRule.ID,
                AtypicalVariationRule.ID,
                ImplicitRewriteRule.ID,
                RelativeVariationRule.ID,
                ScrutinyJumpRule.ID,
                TotalsDiscrepancyRule.ID,
                TurnoutImpossibleRule.ID,
                ProcessedUnitsOverflowRule.ID,
                NullBlankShareRule.ID,
                BenfordFirstDigitRule.ID,
                LastDigitUniformityRule.ID);
    }

    @Test
    void select_returnsRulesInRegistryOrderRegardlessOfRequestOrder() {
        List<IntegrityRule> selected = registry.select(List.of(TotalsDiscrepancyRule.ID, AccumulatedCountIntegrityRule.ID));

        assertThat(selected).extracting(IntegrityRule::id)
                .containsExactly(AccumulatedCountIntegrityRule.ID, TotalsDiscrepancyRule.ID);
    }

    @Test
    void select_rejectsUnknownRule() {
        assertThatThrownBy(() -> registry.select(List.of("benford_law")))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("benford_law");
    }

    @Test
    void enabledIds_honoursSwitches() {
        RuleConfig config = RuleConfig.defaults().withEnabled(AtypicalVariationRule.ID, false);

        assertThat(registry.enabledIds(config))
                .hasSize(12)
                .doesNotContain(AtypicalVariationRule.ID);
    }

    @Test
    void enabledIds_emptyWhenGloballyDisabled() {
        RuleConfig off = RuleConfig.defaults().withGlobalEnabled(false);

        assertThat(registry.enabledIds(off)).isEmpty();
    }

    @Test
    void constructor_rejectsDuplicateIds() {
        assertThatThrownBy(() -> new RuleRegistry(List.of(new ScrutinyJumpRule(), new ScrutinyJumpRule())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ScrutinyJumpRule.ID);
    }
}
