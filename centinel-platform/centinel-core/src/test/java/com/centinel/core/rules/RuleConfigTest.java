package com.centinel.core.rules;

import com.centinel.core.config.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class RuleConfigTest {

    @Test
    void defaults_enableEveryRule() {
        RuleConfig config = RuleConfig.defaults();

        assertThat(config.isEnabled(ScrutinyJumpRule.ID)).isTrue();
        assertThat(config.minHistory()).isEqualTo(3);
        assertThat(config.zScoreThreshold()).isEqualTo(3.0);
        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    void withEnabled_leavesOriginalUntouched() {
        RuleConfig original = RuleConfig.defaults();

        RuleConfig changed = original.withEnabled(ScrutinyJumpRule.ID, false);

        assertThat(changed.isEnabled(ScrutinyJumpRule.ID)).isFalse();
        assertThat(original.isEnabled(ScrutinyJumpRule.ID)).isTrue();
    }

    @Test
    void validate_rejectsNegativeTolerance() {
        RuleConfig config = RuleConfig.fromJson(null, null, -1L, null, null, null, null, null, null);

        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("arithmetic_tolerance");
    }

    @Test
    void validate_rejectsNonPositiveThresholds() {
        assertThatThrownBy(RuleConfig.fromJson(null, null, null, null, 0.0, null, null, null, null)::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("z_score_threshold");
        assertThatThrownBy(RuleConfig.fromJson(null, null, null, null, null, null, Double.NaN, null, null)::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("share_change_threshold_pct");
    }

    @Test
    void validate_rejectsTooShortHistory() {
        assertThatThrownBy(RuleConfig.fromJson(null, null, null, null, null, 1, null, null, null)::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("min_history");
    }

    @Test
    void validateRuleIds_rejectsUnknownSwitch() {
        RuleConfig config = RuleConfig.fromJson(null, Map.of("benford_law", true), null, null, null, null, null, null, null);

        assertThatThrownBy(() -> config.validateRuleIds(List.of(ScrutinyJumpRule.ID)))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("benford_law");
    }

    @Test
    void validate_rejectsSwitchWithoutValue() {
        // Given: a switch map as Jackson builds it from {"enabled": {"scrutiny_jump": null}}
        Map<String, Boolean> enabled = new HashMap<>();
        enabled.put(ScrutinyJumpRule.ID, null);
        RuleConfig config = RuleConfig.fromJson(null, enabled, null, null, null, null, null, null, null);

        // When / Then
        assertThatThrownBy(config::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("rules.enabled." + ScrutinyJumpRule.ID);
        assertThatThrownBy(() -> config.isEnabled(ScrutinyJumpRule.ID))
                .isInstanceOf(ConfigurationException.class);
        assertThat(config.isEnabled(TotalsDiscrepancyRule.ID)).isTrue();
    }

    @Test
    void validate_rejectsDistributionThresholdsOutOfRange() {
        DistributionThresholds d = DistributionThresholds.defaults();

        assertThatThrownBy(RuleConfig.defaults().withDistribution(new DistributionThresholds(
                0, d.benfordMadWarning(), d.benfordMadCritical(), d.benfordChiPvalueCritical(),
                d.lastDigitMinSamples(), d.lastDigitChiPvalueCritical(),
                d.nullBlankWarningPct(), d.nullBlankCriticalPct()))::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("benford_min_samples");
        assertThatThrownBy(RuleConfig.defaults().withDistribution(new DistributionThresholds(
                d.benfordMinSamples(), d.benfordMadWarning(), d.benfordMadCritical(), 1.5,
                d.lastDigitMinSamples(), d.lastDigitChiPvalueCritical(),
                d.nullBlankWarningPct(), d.nullBlankCriticalPct()))::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("benford_chi_pvalue_critical");
        assertThatThrownBy(RuleConfig.defaults().withDistribution(new DistributionThresholds(
                d.benfordMinSamples(), 0.02, 0.01, d.benfordChiPvalueCritical(),
                d.lastDigitMinSamples(), d.lastDigitChiPvalueCritical(),
                d.nullBlankWarningPct(), d.nullBlankCriticalPct()))::validate)
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("benford_mad_warning");
    }

    @Test
    void fromJson_defaultsMissingDistributionSection() {
        RuleConfig config = RuleConfig.fromJson(null, null, null, null, null, null, null, null, null);

        assertThat(config.distribution()).isEqualTo(DistributionThresholds.defaults());
        assertThat(config).isEqualTo(RuleConfig.defaults());
    }
}
