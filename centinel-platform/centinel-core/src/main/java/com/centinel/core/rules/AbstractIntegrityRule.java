package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.CandidateResult;
import com.centinel.core.model.Geography;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.Severity;

import java.util.*;

/**
 * Base class for rules with common utilities.
 */
public abstract class AbstractIntegrityRule implements IntegrityRule {

    private final String id;
    private final String description;
    private final Severity severity;

    protected AbstractIntegrityRule(String id, String description, Severity severity) {
        this.id = Objects.requireNonNull(id, "Rule ID cannot be null");
        this.description = Objects.requireNonNull(description, "Description cannot be null");
        this.severity = Objects.requireNonNull(severity, "Severity cannot be null");
    }

    @Override
    public final String id() {
        return id;
    }

    @Override
    public final String description() {
        return description;
    }

    @Override
    public final Severity severity() {
        return severity;
    }

    @Override
    public final List<Alert> evaluate(RuleContext context) {
        Objects.requireNonNull(context, "Rule context cannot be null");
        if (requiresPrevious() && !context.hasPrevious()) {
            return List.of();
        }
        List<Alert> alerts = new ArrayList<>();
        check(context, alerts);
        return List.copyOf(alerts);
    }

    /**
     * Whether the rule compares against a predecessor. Such rules are skipped
     * for the first snapshot of a series.
     */
    protected boolean requiresPrevious() {
        return true;
    }

    protected abstract void check(RuleContext context, List<Alert> alerts);

    // ==================== Utility Methods ====================

    protected Alert alert(NormalizedSnapshot snapshot, String type, String justification) {
        return alert(snapshot, type, severity, justification);
    }

    /**
     * Alert graded below the rule's declared severity, for rules with a
     * warning and a critical threshold.
     */
    protected Alert alert(NormalizedSnapshot snapshot, String type, Severity graded, String justification) {
        return new Alert(type, graded, justification, department(snapshot), id, snapshot.snapshotRef());
    }

    /**
     * Candidate vote counts followed by the total votes, the sample the
     * digit tests run on. A zero total means none was reported and is left out.
     */
    protected static List<Long> voteCounts(NormalizedSnapshot snapshot) {
        List<Long> counts = new ArrayList<>(snapshot.candidates().size() + 1);
        for (CandidateResult candidate : snapshot.candidates()) {
            counts.add(candidate.votes());
        }
        if (snapshot.totals().totalVotes() > 0) {
            counts.add(snapshot.totals().totalVotes());
        }
        return counts;
    }

    /**
     * Department name of a sub-national snapshot, {@code null} for the national level.
     */
    protected static String department(NormalizedSnapshot snapshot) {
        Geography geography = snapshot.geography();
        return Geography.NATIONAL_CODE.equals(geography.code()) ? null : geography.name();
    }

    protected static String decimal(double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
