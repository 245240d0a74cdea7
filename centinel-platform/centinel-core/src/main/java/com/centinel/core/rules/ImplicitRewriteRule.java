package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.Severity;

import java.util.*;

/**
 * Vote counts changed although no additional tally sheets were processed:
 * previously published figures were rewritten.
 */
public class ImplicitRewriteRule extends AbstractIntegrityRule {

    public static final String ID = "implicit_rewrite";
    public static final String TYPE = "IMPLICIT_REWRITE";

    public ImplicitRewriteRule() {
        super(ID, "Votes must not change unless processed units increase", Severity.HIGH);
    }

    @Override
    protected void check(RuleContext context, List<Alert> alerts) {
        NormalizedSnapshot current = context.current();
        NormalizedSnapshot previous = context.previous();
        Long processedBefore = previous.progress().processedUnits();
        Long processedNow = current.progress().processedUnits();
        if (processedBefore == null || processedNow == null || processedNow > processedBefore) {
            return;
        }

        Map<Integer, Long> before = previous.votesBySlot();
        List<String> changed = new ArrayList<>();
        for (Map.Entry<Integer, Long> entry : current.votesBySlot().entrySet()) {
            Long old = before.get(entry.getKey());
            if (old != null && !old.equals(entry.getValue())) {
                changed.add(entry.getKey() + ":" + old + "->" + entry.getValue());
            }
        }
        if (!changed.isEmpty()) {
            alerts.add(alert(current, TYPE,
                    "previous_processed_units=" + processedBefore
                            + " current_processed_units=" + processedNow
                            + " changed_slots=" + changed));
        }
    }
}
