package com.centinel.core.rules;

import com.centinel.core.config.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Thresholds of the single-snapshot distribution tests: first-digit Benford
 * conformity, last-digit uniformity and the share of null plus blank votes.
 * P-value limits are compared against the upper tail of the chi-square
 * distribution of each test.
 */
public record DistributionThresholds(
        @JsonProperty("benford_min_samples") int benfordMinSamples,
        @JsonProperty("benford_mad_warning") double benfordMadWarning,
        @JsonProperty("benford_mad_critical") double benfordMadCritical,
        @JsonProperty("benford_chi_pvalue_critical") double benfordChiPvalueCritical,
        @JsonProperty("last_digit_min_samples") int lastDigitMinSamples,
        @JsonProperty("last_digit_chi_pvalue_critical") double lastDigitChiPvalueCritical,
        @JsonProperty("null_blank_warning_pct") double nullBlankWarningPct,
        @JsonProperty("null_blank_critical_pct") double nullBlankCriticalPct
) {

    public static final int DEFAULT_BENFORD_MIN_SAMPLES = 15;
    public static final double DEFAULT_BENFORD_MAD_WARNING = 0.008;
    public static final double DEFAULT_BENFORD_MAD_CRITICAL = 0.015;
    public static final double DEFAULT_BENFORD_CHI_PVALUE_CRITICAL = 0.01;
    public static final int DEFAULT_LAST_DIGIT_MIN_SAMPLES = 20;
    public static final double DEFAULT_LAST_DIGIT_CHI_PVALUE_CRITICAL = 0.001;
    public static final double DEFAULT_NULL_BLANK_WARNING_PCT = 8.0;
    public static final double DEFAULT_NULL_BLANK_CRITICAL_PCT = 12.0;

    public static DistributionThresholds defaults() {
        return new DistributionThresholds(
                DEFAULT_BENFORD_MIN_SAMPLES,
                DEFAULT_BENFORD_MAD_WARNING,
                DEFAULT_BENFORD_MAD_CRITICAL,
                DEFAULT_BENFORD_CHI_PVALUE_CRITICAL,
                DEFAULT_LAST_DIGIT_MIN_SAMPLES,
                DEFAULT_LAST_DIGIT_CHI_PVALUE_CRITICAL,
                DEFAULT_NULL_BLANK_WARNING_PCT,
                DEFAULT_NULL_BLANK_CRITICAL_PCT);
    }

    @JsonCreator
    static DistributionThresholds fromJson(
            @JsonProperty("benford_min_samples") Integer benfordMinSamples,
            @JsonProperty("benford_mad_warning") Double benfordMadWarning,
            @JsonProperty("benford_mad_critical") Double benfordMadCritical,
            @JsonProperty("benford_chi_pvalue_critical") Double benfordChiPvalueCritical,
            @JsonProperty("last_digit_min_samples") Integer lastDigitMinSamples,
            @JsonProperty("last_digit_chi_pvalue_critical") Double lastDigitChiPvalueCritical,
            @JsonProperty("null_blank_warning_pct") Double nullBlankWarningPct,
            @JsonProperty("null_blank_critical_pct") Double nullBlankCriticalPct) {
        return new DistributionThresholds(
                benfordMinSamples != null ? benfordMinSamples : DEFAULT_BENFORD_MIN_SAMPLES,
                benfordMadWarning != null ? benfordMadWarning : DEFAULT_BENFORD_MAD_WARNING,
                benfordMadCritical != null ? benfordMadCritical : DEFAULT_BENFORD_MAD_CRITICAL,
                benfordChiPvalueCritical != null ? benfordChiPvalueCritical : DEFAULT_BENFORD_CHI_PVALUE_CRITICAL,
                lastDigitMinSamples != null ? lastDigitMinSamples : DEFAULT_LAST_DIGIT_MIN_SAMPLES,
                lastDigitChiPvalueCritical != null ? lastDigitChiPvalueCritical : DEFAULT_LAST_DIGIT_CHI_PVALUE_CRITICAL,
                nullBlankWarningPct != null ? nullBlankWarningPct : DEFAULT_NULL_BLANK_WARNING_PCT,
                nullBlankCriticalPct != null ? nullBlankCriticalPct : DEFAULT_NULL_BLANK_CRITICAL_PCT);
    }

    public void validate() {
        if (benfordMinSamples < 1) {
            throw new ConfigurationException("rules.distribution.benford_min_samples must be at least 1: "
                    + benfordMinSamples);
        }
        if (lastDigitMinSamples < 1) {
            throw new ConfigurationException("rules.distribution.last_digit_min_samples must be at least 1: "
                    + lastDigitMinSamples);
        }
        requireProbability("rules.distribution.benford_mad_warning", benfordMadWarning);
        requireProbability("rules.distribution.benford_mad_critical", benfordMadCritical);
        requireProbability("rules.distribution.benford_chi_pvalue_critical", benfordChiPvalueCritical);
        requireProbability("rules.distribution.last_digit_chi_pvalue_critical", lastDigitChiPvalueCritical);
        if (benfordMadWarning > benfordMadCritical) {
            throw new ConfigurationException("rules.distribution.benford_mad_warning (" + benfordMadWarning
                    + ") cannot exceed benford_mad_critical (" + benfordMadCritical + ")");
        }
        requirePercentage("rules.distribution.null_blank_warning_pct", nullBlankWarningPct);
        requirePercentage("rules.distribution.null_blank_critical_pct", nullBlankCriticalPct);
        if (nullBlankWarningPct > nullBlankCriticalPct) {
            throw new ConfigurationException("rules.distribution.null_blank_warning_pct (" + nullBlankWarningPct
                    + ") cannot exceed null_blank_critical_pct (" + nullBlankCriticalPct + ")");
        }
    }

    private static void requireProbability(String name, double value) {
        if (!(value > 0 && value < 1)) {
            throw new ConfigurationException(name + " must be between 0 and 1 (exclusive): " + value);
        }
    }

    private static void requirePercentage(String name, double value) {
        if (!(value > 0 && value <= 100)) {
            throw new ConfigurationException(name + " must be in (0, 100]: " + value);
        }
    }
}
