package com.centinel.core.audit;

import com.centinel.core.rules.RuleDiagnostic;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.*;

/**
 * What a report was computed from, so a third party can reproduce it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RunMetadata(
        @JsonProperty("rule_set_version") String ruleSetVersion,
        @JsonProperty("config_hash") String configHash,
        @JsonProperty("enabled_rules") List<String> enabledRules,
        @JsonProperty("snapshot_count") int snapshotCount,
        @JsonProperty("group_count") int groupCount,
        @JsonProperty("first_observed") Instant firstObserved,
        @JsonProperty("last_observed") Instant lastObserved,
        @JsonProperty("normalization_failures") List<NormalizationFailure> normalizationFailures,
        @JsonProperty("chain_failures") List<ChainFailure> chainFailures,
        @JsonProperty("rule_diagnostics") List<RuleDiagnostic> ruleDiagnostics,
        @JsonProperty("generated_at") Instant generatedAt
) {

    public RunMetadata {
        Objects.requireNonNull(ruleSetVersion, "Rule set version cannot be null");
        Objects.requireNonNull(configHash, "Config hash cannot be null");
        Objects.requireNonNull(generatedAt, "Generated-at cannot be null");
        enabledRules = enabledRules != null ? List.copyOf(enabledRules) : List.of();
        normalizationFailures = normalizationFailures != null ? List.copyOf(normalizationFailures) : List.of();
        chainFailures = chainFailures != null ? List.copyOf(chainFailures) : List.of();
        ruleDiagnostics = ruleDiagnostics != null ? List.copyOf(ruleDiagnostics) : List.of();
    }
}
