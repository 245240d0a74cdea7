package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.Severity;
import com.centinel.core.model.Totals;

import java.util.List;

/**
 * Share of null plus blank votes in the total. Above the warning percentage
 * the alert is MEDIUM, above the critical percentage HIGH.
 */
public class NullBlankShareRule extends AbstractIntegrityRule {

    public static final String ID = "null_blank_share";
    public static final String TYPE = "NULL_BLANK_SHARE_HIGH";

    public NullBlankShareRule() {
        super(ID, "null plus blank votes must stay below a share of the total", Severity.HIGH);
    }

    @Override
    protected boolean requiresPrevious() {
        return false;
    }

    @Override
    protected void check(RuleContext context, List<Alert> alerts) {
        Totals totals = context.current().totals();
        if (totals.totalVotes() <= 0) {
            return;
        }
        DistributionThresholds thresholds = context.config().distribution();
        long invalid = totals.nullVotes() + totals.blankVotes();
        double sharePct = 100.0 * invalid / totals.totalVotes();

        Severity graded;
        if (sharePct > thresholds.nullBlankCriticalPct()) {
            graded = Severity.HIGH;
        } else if (sharePct > thresholds.nullBlankWarningPct()) {
            graded = Severity.MEDIUM;
        } else {
            return;
        }
        alerts.add(alert(context.current(), TYPE, graded,
                "null_votes=" + totals.nullVotes()
                        + " blank_votes=" + totals.blankVotes()
                        + " total_votes=" + totals.totalVotes()
                        + " share_pct=" + decimal(sharePct)
                        + " warning_pct=" + thresholds.nullBlankWarningPct()
                        + " critical_pct=" + thresholds.nullBlankCriticalPct()));
    }
}
