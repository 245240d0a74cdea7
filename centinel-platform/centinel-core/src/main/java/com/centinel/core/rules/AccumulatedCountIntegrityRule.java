package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.Severity;

import java.util.List;
import java.util.Map;

/**
 * Accumulated votes of a ballot position must never go down between two
 * observations of the same series.
 */
public class AccumulatedCountIntegrityRule extends AbstractIntegrityRule {

    public static final String ID = "accumulated_count_integrity";
    public static final String TYPE = "ACCUMULATED_COUNT_DECREASE";

    public AccumulatedCountIntegrityRule() {
        super(ID, "Candidate vote counts must not decrease between snapshots", Severity.HIGH);
    }

    @Override
    protected void check(RuleContext context, List<Alert> alerts) {
        NormalizedSnapshot current = context.current();
        Map<Integer, Long> before = context.previous().votesBySlot();

        for (Map.Entry<Integer, Long> entry : current.votesBySlot().entrySet()) {
            Long previousVotes = before.get(entry.getKey());
            if (previousVotes == null) {
                continue;
            }
            long currentVotes = entry.getValue();
            if (currentVotes < previousVotes) {
                alerts.add(alert(current, TYPE,
                        "slot=" + entry.getKey()
                                + " previous_votes=" + previousVotes
                                + " current_votes=" + currentVotes
                                + " delta=" + (currentVotes - previousVotes)
                                + " previous_ref=" + context.previous().snapshotRef()));
            }
        }
    }
}
