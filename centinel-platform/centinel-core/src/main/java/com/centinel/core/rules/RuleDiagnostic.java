package com.centinel.core.rules;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Record of a rule that failed while evaluating one snapshot. Reported next to
 * the alerts, never as one.
 */
public record RuleDiagnostic(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("snapshot_ref") String snapshotRef,
        @JsonProperty("error_type") String errorType,
        @JsonProperty("message") String message
) {

    public RuleDiagnostic {
        Objects.requireNonNull(ruleId, "Rule ID cannot be null");
        Objects.requireNonNull(snapshotRef, "Snapshot ref cannot be null");
        Objects.requireNonNull(errorType, "Error type cannot be null");
        message = message != null ? message : "";
    }
}
