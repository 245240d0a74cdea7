package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.Severity;

import java.util.List;
import java.util.Map;

/**
 * A candidate's share of the candidate vote must not swing by more than
 * {@code share_change_threshold_pct} percentage points between snapshots.
 * Shares are recomputed from the integer counts.
 */
public class RelativeVariationRule extends AbstractIntegrityRule {

    public static final String ID = "relative_variation";
    public static final String TYPE = "SHARE_SHIFT";

    public RelativeVariationRule() {
        super(ID, "Candidate vote shares must not shift abruptly", Severity.MEDIUM);
    }

    @Override
    protected void check(RuleContext context, List<Alert> alerts) {
        NormalizedSnapshot current = context.current();
        NormalizedSnapshot previous = context.previous();
        long totalBefore = previous.candidateVoteSum();
        long totalNow = current.candidateVoteSum();
        if (totalBefore <= 0 || totalNow <= 0) {
            return;
        }

        double threshold = context.config().shareChangeThresholdPct();
        Map<Integer, Long> before = previous.votesBySlot();
        for (Map.Entry<Integer, Long> entry : current.votesBySlot().entrySet()) {
            Long old = before.get(entry.getKey());
            if (old == null) {
                continue;
            }
            double shareBefore = old * 100.0 / totalBefore;
            double shareNow = entry.getValue() * 100.0 / totalNow;
            double change = shareNow - shareBefore;
            if (Math.abs(change) > threshold) {
                alerts.add(alert(current, TYPE,
                        "slot=" + entry.getKey()
                                + " previous_share_pct=" + decimal(shareBefore)
                                + " current_share_pct=" + decimal(shareNow)
                                + " change_pp=" + decimal(change)
                                + " threshold_pp=" + decimal(threshold)));
            }
        }
    }
}
