package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.Severity;
import com.centinel.core.model.Totals;

import java.util.List;

/**
 * Valid, null and blank votes must add up to the reported total.
 */
public class TotalsDiscrepancyRule extends AbstractIntegrityRule {

    public static final String ID = "totals_discrepancy";
    public static final String TYPE = "TOTALS_MISMATCH";

    public TotalsDiscrepancyRule() {
        super(ID, "valid + null + blank votes must equal total votes", Severity.HIGH);
    }

    @Override
    protected boolean requiresPrevious() {
        return false;
    }

    @Override
    protected void check(RuleContext context, List<Alert> alerts) {
        Totals totals = context.current().totals();
        long difference = totals.componentSum() - totals.totalVotes();
        long tolerance = context.config().totalsTolerance();
        if (Math.abs(difference) > tolerance) {
            alerts.add(alert(context.current(), TYPE,
                    "valid_votes=" + totals.validVotes()
                            + " null_votes=" + totals.nullVotes()
                            + " blank_votes=" + totals.blankVotes()
                            + " component_sum=" + totals.componentSum()
                            + " total_votes=" + totals.totalVotes()
                            + " difference=" + difference
                            + " tolerance=" + tolerance));
        }
    }
}
