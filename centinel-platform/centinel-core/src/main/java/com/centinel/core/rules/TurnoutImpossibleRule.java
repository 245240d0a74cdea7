package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.Severity;
import com.centinel.core.model.Totals;

import java.util.List;

/**
 * More votes than registered voters. Skipped when the source does not
 * report the register size.
 */
public class TurnoutImpossibleRule extends AbstractIntegrityRule {

    public static final String ID = "turnout_impossible";
    public static final String TYPE = "TURNOUT_IMPOSSIBLE";

    public TurnoutImpossibleRule() {
        super(ID, "Total votes cannot exceed registered voters", Severity.HIGH);
    }

    @Override
    protected boolean requiresPrevious() {
        return false;
    }

    @Override
    protected void check(RuleContext context, List<Alert> alerts) {
        Totals totals = context.current().totals();
        if (totals.registeredVoters() <= 0 || totals.totalVotes() <= totals.registeredVoters()) {
            return;
        }
        alerts.add(alert(context.current(), TYPE,
                "total_votes=" + totals.totalVotes()
                        + " registered_voters=" + totals.registeredVoters()
                        + " excess=" + (totals.totalVotes() - totals.registeredVoters())
                        + " turnout_pct=" + decimal(totals.totalVotes() * 100.0 / totals.registeredVoters())));
    }
}
