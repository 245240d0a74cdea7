package com.centinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Typed, severity-tagged finding emitted by a rule. The justification always
 * carries the concrete values that triggered it so a third party re-running
 * the rule over the same two snapshots can reproduce it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Alert(
        @JsonProperty("type") String type,
        @JsonProperty("severity") Severity severity,
        @JsonProperty("justification") String justification,
        @JsonProperty("department") String department,
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("snapshot_ref") String snapshotRef
) {

    public Alert {
        Objects.requireNonNull(type, "Type cannot be null");
        Objects.requireNonNull(severity, "Severity cannot be null");
        Objects.requireNonNull(justification, "Justification cannot be null");
        Objects.requireNonNull(ruleId, "Rule ID cannot be null");
        Objects.requireNonNull(snapshotRef, "Snapshot ref cannot be null");
    }
}
