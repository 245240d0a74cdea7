package com.centinel.core.rules;

import com.centinel.core.CentinelException;

/**
 * Failure of a single rule on a single snapshot. Converted into a
 * {@link RuleDiagnostic} by the engine and never propagated.
 */
public class RuleExecutionException extends CentinelException {

    private final String ruleId;
    private final String snapshotRef;

    public RuleExecutionException(String ruleId, String snapshotRef, Throwable cause) {
        super("Rule " + ruleId + " failed on " + snapshotRef + ": " + cause, cause);
        this.ruleId = ruleId;
        this.snapshotRef = snapshotRef;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getSnapshotRef() {
        return snapshotRef;
    }

    public RuleDiagnostic toDiagnostic() {
        Throwable cause = getCause();
        return new RuleDiagnostic(ruleId, snapshotRef,
                cause != null ? cause.getClass().getSimpleName() : getClass().getSimpleName(),
                cause != null ? cause.getMessage() : getMessage());
    }
}
