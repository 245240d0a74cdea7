package com.centinel.core.rules;

import com.centinel.core.model.Alert;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.Severity;

import java.util.*;

/**
 * Flags a ballot position whose latest vote increment is a statistical outlier
 * against the increments seen earlier in the same series.
 *
 * <p>For each slot the deltas between consecutive snapshots are collected. The
 * latest delta is scored against the mean and population standard deviation
 * of the prior ones; {@code |z| > z_score_threshold} raises an alert. At least
 * {@code min_history} prior deltas are required and a zero deviation is skipped.
 */
public class AtypicalVariationRule extends AbstractIntegrityRule {

    public static final String ID = "atypical_variation";
    public static final String TYPE = "ATYPICAL_VARIATION";

    public AtypicalVariationRule() {
        super(ID, "Vote increments must stay within the series' statistical range", Severity.MEDIUM);
    }

    @Override
    protected void check(RuleContext context, List<Alert> alerts) {
        RuleConfig config = context.config();
        List<NormalizedSnapshot> series = context.series();
        NormalizedSnapshot current = context.current();
        Map<Integer, Long> previousVotes = context.previous().votesBySlot();

        for (Map.Entry<Integer, Long> entry : current.votesBySlot().entrySet()) {
            int slot = entry.getKey();
            if (!previousVotes.containsKey(slot)) {
                continue;
            }
            long latest = entry.getValue() - previousVotes.get(slot);
            List<Long> prior = priorDeltas(series, slot);
            if (prior.size() < config.minHistory()) {
                continue;
            }

            double mean = prior.stream().mapToLong(Long::longValue).average().orElse(0);
            double variance = 0;
            for (long delta : prior) {
                variance += (delta - mean) * (delta - mean);
            }
            double stdDev = Math.sqrt(variance / prior.size());
            if (stdDev == 0) {
                continue;
            }

            double z = (latest - mean) / stdDev;
            if (Math.abs(z) > config.zScoreThreshold()) {
                alerts.add(alert(current, TYPE,
                        "slot=" + slot
                                + " delta=" + latest
                                + " mean=" + decimal(mean)
                                + " std_dev=" + decimal(stdDev)
                                + " z_score=" + decimal(z)
                                + " threshold=" + decimal(config.zScoreThreshold())
                                + " history=" + prior.size()));
            }
        }
    }

    /**
     * Deltas of {@code slot} between consecutive snapshots, excluding the
     * last pair (previous to current).
     */
    private static List<Long> priorDeltas(List<NormalizedSnapshot> series, int slot) {
        List<Long> deltas = new ArrayList<>();
        for (int i = 1; i < series.size() - 1; i++) {
            Map<Integer, Long> before = series.get(i - 1).votesBySlot();
            Map<Integer, Long> after = series.get(i).votesBySlot();
            if (before.containsKey(slot) && after.containsKey(slot)) {
                deltas.add(after.get(slot) - before.get(slot));
            }
        }
        return deltas;
    }
}
