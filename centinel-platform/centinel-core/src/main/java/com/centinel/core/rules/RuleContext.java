package com.centinel.core.rules;

import com.centinel.core.model.NormalizedSnapshot;

import java.util.*;

/**
 * Input of one rule evaluation.
 *
 * @param current  snapshot under evaluation
 * @param previous preceding snapshot of the same series, {@code null} for the first one
 * @param history  earlier snapshots of the series, oldest first, ending with {@code previous}
 * @param config   thresholds
 */
public record RuleContext(
        NormalizedSnapshot current,
        NormalizedSnapshot previous,
        List<NormalizedSnapshot> history,
        RuleConfig config
) {

    public RuleContext {
        Objects.requireNonNull(current, "Current snapshot cannot be null");
        Objects.requireNonNull(config, "Rule config cannot be null");
        history = history != null ? List.copyOf(history) : List.of();
    }

    public static RuleContext pair(NormalizedSnapshot current, NormalizedSnapshot previous, RuleConfig config) {
        return new RuleContext(current, previous, previous == null ? List.of() : List.of(previous), config);
    }

    public boolean hasPrevious() {
        return previous != null;
    }

    /**
     * History followed by the current snapshot.
     */
    public List<NormalizedSnapshot> series() {
        List<NormalizedSnapshot> series = new ArrayList<>(history);
        if (series.isEmpty() && previous != null) {
            series.add(previous);
        }
        series.add(current);
        return series;
    }
}
