package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Runs rules against a context, isolating each one: an exception thrown by a
 * rule becomes a {@link RuleDiagnostic} and the remaining rules still run.
 */
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    public Evaluation evaluate(List<IntegrityRule> rules, RuleContext context) {
        Objects.requireNonNull(rules, "Rules cannot be null");
        Objects.requireNonNull(context, "Rule context cannot be null");

        List<Alert> alerts = new ArrayList<>();
        List<RuleDiagnostic> diagnostics = new ArrayList<>();
        for (IntegrityRule rule : rules) {
            try {
                List<Alert> produced = rule.evaluate(context);
                if (produced == null) {
                    throw new IllegalStateException("rule returned null instead of a list");
                }
                for (Alert alert : produced) {
                    if (alert == null) {
                        throw new IllegalStateException("rule returned a null alert");
                    }
                }
                alerts.addAll(produced);
            } catch (RuntimeException e) {
                RuleExecutionException failure =
                        new RuleExecutionException(rule.id(), context.current().snapshotRef(), e);
                log.warn("Rule {} failed on {}: {}", rule.id(), context.current().snapshotRef(), e.toString());
                diagnostics.add(failure.toDiagnostic());
            }
        }
        return new Evaluation(alerts, diagnostics);
    }

    // ==================== Inner Types ====================

    public record Evaluation(List<Alert> alerts, List<RuleDiagnostic> diagnostics) {
        public Evaluation {
            alerts = List.copyOf(alerts);
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
