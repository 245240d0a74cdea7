package com.centinel.core.rules;

import com.centinel.core.SnapshotFixtures;
import com.centinel.core.model.Alert;
import com.centinel.core.model.CandidateResult;
import com.centinel.core.model.NormalizedSnapshot;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.LongRange;
import net.jqwik.api.constraints.Size;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests over the built-in rule set.
 */
class RulePropertyTest {

    private static final RuleConfig CONFIG = RuleConfig.defaults();

    @Property(tries = 100)
    void rulesNeverFailWithoutPredecessor(@ForAll("snapshots") NormalizedSnapshot current) {
        // Property: every rule evaluates the first snapshot of a series without throwing,
        // and rules comparing against a predecessor stay silent
        for (IntegrityRule rule : RuleRegistry.defaults().rules()) {
            List<Alert> alerts = rule.apply(current, null, CONFIG);

            assertThat(alerts).isNotNull();
            if (rule instanceof AbstractIntegrityRule base && base.requiresPrevious()) {
                assertThat(alerts).as(rule.id()).isEmpty();
            }
        }
    }

    @Property(tries = 100)
    void rulesAreDeterministic(@ForAll("snapshots") NormalizedSnapshot previous,
                               @ForAll("snapshots") NormalizedSnapshot current) {
        // Property: evaluating the same pair twice yields identical alerts in the same order
        RuleEngine engine = new RuleEngine();
        List<IntegrityRule> rules = RuleRegistry.defaults().rules();

        RuleEngine.Evaluation first = engine.evaluate(rules, RuleContext.pair(current, previous, CONFIG));
        RuleEngine.Evaluation second = engine.evaluate(rules, RuleContext.pair(current, previous, CONFIG));

        assertThat(second.alerts()).isEqualTo(first.alerts());
        assertThat(first.diagnostics()).isEmpty();
    }

    @Property(tries = 100)
    void arithmeticConsistencyIgnoresCandidateOrder(
            @ForAll @Size(min = 1, max = 8) List<@LongRange(min = 0, max = 1_000_000) Long> votes,
            @ForAll @LongRange(min = 0, max = 8_000_000) long validVotes,
            @ForAll Random random) {
        // Property: the arithmetic check depends on the candidate sum only
        List<CandidateResult> candidates = new ArrayList<>();
        for (int i = 0; i < votes.size(); i++) {
            candidates.add(CandidateResult.of(i, votes.get(i)));
        }
        List<CandidateResult> shuffled = new ArrayList<>(candidates);
        Collections.shuffle(shuffled, random);

        NormalizedSnapshot ordered = SnapshotFixtures.snapshot().candidates(candidates)
                .totals(validVotes, 0, 0, validVotes, 0).build();
        NormalizedSnapshot permuted = SnapshotFixtures.snapshot().candidates(shuffled)
                .totals(validVotes, 0, 0, validVotes, 0).build();

        ArithmeticConsistencyRule rule = new ArithmeticConsistencyRule();
        assertThat(rule.apply(permuted, null, CONFIG)).isEqualTo(rule.apply(ordered, null, CONFIG));
    }

    @Property(tries = 100)
    void nonDecreasingCountsNeverRaiseAccumulatedAlert(
            @ForAll @Size(min = 1, max = 6) List<@LongRange(min = 0, max = 1_000_000) Long> base,
            @ForAll @IntRange(min = 0, max = 10_000) int increment) {
        // Property: growing every slot never triggers the accumulated count rule
        long[] before = base.stream().mapToLong(Long::longValue).toArray();
        long[] after = Arrays.stream(before).map(v -> v + increment).toArray();

        List<Alert> alerts = new AccumulatedCountIntegrityRule()
                .apply(SnapshotFixtures.at(5, after), SnapshotFixtures.at(0, before), CONFIG);

        assertThat(alerts).isEmpty();
    }

    @Provide
    Arbitrary<NormalizedSnapshot> snapshots() {
        Arbitrary<long[]> votes = Arbitraries.longs().between(0, 1_000_000)
                .list().ofMaxSize(6)
                .map(list -> list.stream().mapToLong(Long::longValue).toArray());
        Arbitrary<Long> units = Arbitraries.longs().between(0, 5_000).injectNull(0.2);
        Arbitrary<String> timestamps = Arbitraries.of(
                "2025-11-30T20:00:00Z", "2025-11-30 21:15:00", "not a date").injectNull(0.25);
        Arbitrary<Integer> minutes = Arbitraries.integers().between(0, 600);

        return Combinators.combine(votes, units, units, timestamps, minutes)
                .as((v, processed, total, timestamp, offset) -> SnapshotFixtures.snapshot()
                        .observedAt(SnapshotFixtures.T0.plusSeconds(60L * offset))
                        .timestampSource(timestamp)
                        .progress(processed, total)
                        .votes(v)
                        .build());
    }
}
