package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.Severity;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * The source-reported timestamp must not move backwards. Snapshots whose
 * timestamp is missing or unparsable are skipped.
 */
public class TemporalMonotonicityRule extends AbstractIntegrityRule {

    public static final String ID = "temporal_monotonicity";
    public static final String TYPE = "TIMESTAMP_REGRESSION";

    public TemporalMonotonicityRule() {
        super(ID, "Source timestamps must be non-decreasing", Severity.HIGH);
    }

    @Override
    protected void check(RuleContext context, List<Alert> alerts) {
        Optional<Instant> before = TimestampParser.parse(context.previous().timestampSource());
        Optional<Instant> now = TimestampParser.parse(context.current().timestampSource());
        if (before.isEmpty() || now.isEmpty()) {
            return;
        }
        if (now.get().isBefore(before.get())) {
            long seconds = Duration.between(now.get(), before.get()).getSeconds();
            alerts.add(alert(context.current(), TYPE,
                    "previous_timestamp=" + context.previous().timestampSource()
                            + " current_timestamp=" + context.current().timestampSource()
                            + " regression_seconds=" + seconds));
        }
    }
}
