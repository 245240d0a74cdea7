package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.Severity;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Counting progress must advance gradually. The completion percentage is
 * recomputed from processed and expected units.
 */
public class ScrutinyJumpRule extends AbstractIntegrityRule {

    public static final String ID = "scrutiny_jump";
    public static final String TYPE = "SCRUTINY_JUMP";

    public ScrutinyJumpRule() {
        super(ID, "Completion percentage must not jump between snapshots", Severity.MEDIUM);
    }

    @Override
    protected void check(RuleContext context, List<Alert> alerts) {
        NormalizedSnapshot current = context.current();
        NormalizedSnapshot previous = context.previous();
        OptionalDouble before = previous.progress().completionPercentage();
        OptionalDouble now = current.progress().completionPercentage();
        if (before.isEmpty() || now.isEmpty()) {
            return;
        }
        double change = now.getAsDouble() - before.getAsDouble();
        double threshold = context.config().scrutinyJumpThresholdPct();
        if (Math.abs(change) > threshold) {
            alerts.add(alert(current, TYPE,
                    "previous_pct=" + decimal(before.getAsDouble())
                            + " current_pct=" + decimal(now.getAsDouble())
                            + " change_pp=" + decimal(change)
                            + " threshold_pp=" + decimal(threshold)
                            + " previous_processed_units=" + previous.progress().processedUnits()
                            + " current_processed_units=" + current.progress().processedUnits()
                            + " total_units=" + current.progress().totalUnits()));
        }
    }
}
