package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.Severity;

import java.util.List;

/**
 * Candidate votes must add up to the reported valid votes.
 */
public class ArithmeticConsistencyRule extends AbstractIntegrityRule {

    public static final String ID = "arithmetic_consistency";
    public static final String TYPE = "ARITHMETIC_MISMATCH";

    public ArithmeticConsistencyRule() {
        super(ID, "Sum of candidate votes must equal valid votes", Severity.HIGH);
    }

    @Override
    protected boolean requiresPrevious() {
        return false;
    }

    @Override
    protected void check(RuleContext context, List<Alert> alerts) {
        NormalizedSnapshot current = context.current();
        if (current.candidates().isEmpty()) {
            return;
        }
        long sum = current.candidateVoteSum();
        long valid = current.totals().validVotes();
        long difference = sum - valid;
        long tolerance = context.config().arithmeticTolerance();
        if (Math.abs(difference) > tolerance) {
            alerts.add(alert(current, TYPE,
                    "candidate_sum=" + sum
                            + " valid_votes=" + valid
                            + " difference=" + difference
                            + " tolerance=" + tolerance));
        }
    }
}
