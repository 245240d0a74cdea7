package com.centinel.core.rules;

import com.centinel.core.config.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * Thresholds and enable switches of the integrity rules. Rules absent from
 * {@code enabled} are on; {@code global_enabled = false} turns every rule off.
 */
public record RuleConfig(
        @JsonProperty("global_enabled") boolean globalEnabled,
        @JsonProperty("enabled") Map<String, Boolean> enabled,
        @JsonProperty("arithmetic_tolerance") long arithmeticTolerance,
        @JsonProperty("totals_tolerance") long totalsTolerance,
        @JsonProperty("z_score_threshold") double zScoreThreshold,
        @JsonProperty("min_history") int minHistory,
        @JsonProperty("share_change_threshold_pct") double shareChangeThresholdPct,
        @JsonProperty("scrutiny_jump_threshold_pct") double scrutinyJumpThresholdPct,
        @JsonProperty("distribution") DistributionThresholds distribution
) {

    public static final long DEFAULT_ARITHMETIC_TOLERANCE = 0;
    public static final long DEFAULT_TOTALS_TOLERANCE = 0;
    public static final double DEFAULT_Z_SCORE_THRESHOLD = 3.0;
    public static final int DEFAULT_MIN_HISTORY = 3;
    public static final double DEFAULT_SHARE_CHANGE_THRESHOLD_PCT = 5.0;
    public static final double DEFAULT_SCRUTINY_JUMP_THRESHOLD_PCT = 5.0;

    public RuleConfig {
        enabled = enabled != null ? Collections.unmodifiableSortedMap(new TreeMap<>(enabled)) : Map.of();
        distribution = distribution != null ? distribution : DistributionThresholds.defaults();
    }

    public static RuleConfig defaults() {
        return new RuleConfig(true, Map.of(),
                DEFAULT_ARITHMETIC_TOLERANCE,
                DEFAULT_TOTALS_TOLERANCE,
                DEFAULT_Z_SCORE_THRESHOLD,
                DEFAULT_MIN_HISTORY,
                DEFAULT_SHARE_CHANGE_THRESHOLD_PCT,
                DEFAULT_SCRUTINY_JUMP_THRESHOLD_PCT,
                DistributionThresholds.defaults());
    }

    @JsonCreator
    static RuleConfig fromJson(
            @JsonProperty("global_enabled") Boolean globalEnabled,
            @JsonProperty("enabled") Map<String, Boolean> enabled,
            @JsonProperty("arithmetic_tolerance") Long arithmeticTolerance,
            @JsonProperty("totals_tolerance") Long totalsTolerance,
            @JsonProperty("z_score_threshold") Double zScoreThreshold,
            @JsonProperty("min_history") Integer minHistory,
            @JsonProperty("share_change_threshold_pct") Double shareChangeThresholdPct,
            @JsonProperty("scrutiny_jump_threshold_pct") Double scrutinyJumpThresholdPct,
            @JsonProperty("distribution") DistributionThresholds distribution) {
        return new RuleConfig(
                globalEnabled == null || globalEnabled,
                enabled,
                arithmeticTolerance != null ? arithmeticTolerance : DEFAULT_ARITHMETIC_TOLERANCE,
                totalsTolerance != null ? totalsTolerance : DEFAULT_TOTALS_TOLERANCE,
                zScoreThreshold != null ? zScoreThreshold : DEFAULT_Z_SCORE_THRESHOLD,
                minHistory != null ? minHistory : DEFAULT_MIN_HISTORY,
                shareChangeThresholdPct != null ? shareChangeThresholdPct : DEFAULT_SHARE_CHANGE_THRESHOLD_PCT,
                scrutinyJumpThresholdPct != null ? scrutinyJumpThresholdPct : DEFAULT_SCRUTINY_JUMP_THRESHOLD_PCT,
                distribution);
    }

    /**
     * Whether {@code ruleId} runs. Call {@link #validate()} first: a switch
     * without a value cannot be read.
     */
    public boolean isEnabled(String ruleId) {
        Boolean on = enabled.getOrDefault(ruleId, Boolean.TRUE);
        if (on == null) {
            throw new ConfigurationException("rules.enabled." + ruleId + " has no value");
        }
        return globalEnabled && on;
    }

    public RuleConfig withEnabled(String ruleId, boolean on) {
        Map<String, Boolean> copy = new HashMap<>(enabled);
        copy.put(ruleId, on);
        return new RuleConfig(globalEnabled, copy, arithmeticTolerance, totalsTolerance,
                zScoreThreshold, minHistory, shareChangeThresholdPct, scrutinyJumpThresholdPct, distribution);
    }

    public RuleConfig withGlobalEnabled(boolean on) {
        return new RuleConfig(on, enabled, arithmeticTolerance, totalsTolerance,
                zScoreThreshold, minHistory, shareChangeThresholdPct, scrutinyJumpThresholdPct, distribution);
    }

    public RuleConfig withArithmeticTolerance(long tolerance) {
        return new RuleConfig(globalEnabled, enabled, tolerance, totalsTolerance,
                zScoreThreshold, minHistory, shareChangeThresholdPct, scrutinyJumpThresholdPct, distribution);
    }

    public RuleConfig withDistribution(DistributionThresholds thresholds) {
        return new RuleConfig(globalEnabled, enabled, arithmeticTolerance, totalsTolerance,
                zScoreThreshold, minHistory, shareChangeThresholdPct, scrutinyJumpThresholdPct, thresholds);
    }

    public void validate() {
        for (Map.Entry<String, Boolean> entry : enabled.entrySet()) {
            if (entry.getValue() == null) {
                throw new ConfigurationException("rules.enabled." + entry.getKey() + " must be true or false, got null");
            }
        }
        if (arithmeticTolerance < 0) {
            throw new ConfigurationException("rules.arithmetic_tolerance cannot be negative: " + arithmeticTolerance);
        }
        if (totalsTolerance < 0) {
            throw new ConfigurationException("rules.totals_tolerance cannot be negative: " + totalsTolerance);
        }
        requirePositive("rules.z_score_threshold", zScoreThreshold);
        requirePositive("rules.share_change_threshold_pct", shareChangeThresholdPct);
        requirePositive("rules.scrutiny_jump_threshold_pct", scrutinyJumpThresholdPct);
        if (minHistory < 2) {
            throw new ConfigurationException("rules.min_history must be at least 2: " + minHistory);
        }
        distribution.validate();
    }

    /**
     * Rejects enable switches naming rules that do not exist.
     */
    public void validateRuleIds(Collection<String> knownIds) {
        for (String id : enabled.keySet()) {
            if (!knownIds.contains(id)) {
                throw new ConfigurationException("rules.enabled: unknown rule '" + id + "', known rules: " + knownIds);
            }
        }
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new ConfigurationException(name + " must be a positive number: " + value);
        }
    }
}
