package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.Severity;

import java.util.List;

/**
 * A deterministic check over a snapshot and its predecessor.
 *
 * <p>Implementations must be pure: the same context always yields the same
 * alerts in the same order. A rule that cannot decide (missing predecessor,
 * missing counters) returns an empty list.
 */
public interface IntegrityRule {

    /**
     * Stable identifier used in configuration and alerts.
     */
    String id();

    String description();

    Severity severity();

    List<Alert> evaluate(RuleContext context);

    default List<Alert> apply(NormalizedSnapshot current, NormalizedSnapshot previous, RuleConfig config) {
        return evaluate(RuleContext.pair(current, previous, config));
    }
}
