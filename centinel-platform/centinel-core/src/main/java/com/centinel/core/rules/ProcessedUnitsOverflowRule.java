package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.Progress;
import com.centinel.core.model.Severity;

import java.util.List;

/**
 * More tally sheets processed than exist.
 */
public class ProcessedUnitsOverflowRule extends AbstractIntegrityRule {

    public static final String ID = "processed_units_overflow";
    public static final String TYPE = "PROCESSED_UNITS_OVERFLOW";

    public ProcessedUnitsOverflowRule() {
        super(ID, "Processed units cannot exceed total units", Severity.HIGH);
    }

    @Override
    protected boolean requiresPrevious() {
        return false;
    }

    @Override
    protected void check(RuleContext context, List<Alert> alerts) {
        Progress progress = context.current().progress();
        if (progress.processedUnits() == null || progress.totalUnits() == null) {
            return;
        }
        if (progress.processedUnits() > progress.totalUnits()) {
            alerts.add(alert(context.current(), TYPE,
                    "processed_units=" + progress.processedUnits()
                            + " total_units=" + progress.totalUnits()
                            + " excess=" + (progress.processedUnits() - progress.totalUnits())));
        }
    }
}
