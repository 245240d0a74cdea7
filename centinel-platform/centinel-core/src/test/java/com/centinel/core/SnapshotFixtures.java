package com.centinel.core;

import com.centinel.core.model.*;

import java.time.Instant;
import java.util.*;

/**
 * Builders for snapshots used across tests. Unless overridden, totals are
 * consistent with the candidate votes so that only the rule under test fires.
 */
public final class SnapshotFixtures {

    public static final Instant T0 = Instant.parse("2025-11-30T20:00:00Z");

    private SnapshotFixtures() {
    }

    public static Builder snapshot() {
        return new Builder();
    }

    /**
     * National snapshot of source {@code cne} observed {@code minutes} after T0.
     */
    public static NormalizedSnapshot at(int minutes, long... votes) {
        return snapshot().observedAt(T0.plusSeconds(60L * minutes)).votes(votes).build();
    }

    public static final class Builder {
        private String sourceId = "cne";
        private String electionLevel = "PRESIDENTIAL";
        private Geography geography = Geography.national();
        private String timestampSource;
        private Instant observed = T0;
        private Totals totals;
        private Progress progress = Progress.unknown();
        private List<CandidateResult> candidates = List.of();
        private Map<String, Object> metadata = Map.of();

        public Builder source(String value) {
            this.sourceId = value;
            return this;
        }

        public Builder geography(String code, String name) {
            this.geography = new Geography(code, name);
            return this;
        }

        public Builder timestampSource(String value) {
            this.timestampSource = value;
            return this;
        }

        public Builder observedAt(Instant value) {
            this.observed = value;
            return this;
        }

        public Builder totals(long valid, long nulls, long blank, long total, long registered) {
            this.totals = new Totals(valid, nulls, blank, total, registered);
            return this;
        }

        public Builder progress(Long processed, Long total) {
            this.progress = new Progress(processed, total);
            return this;
        }

        public Builder votes(long... votes) {
            List<CandidateResult> list = new ArrayList<>();
            for (int i = 0; i < votes.length; i++) {
                list.add(CandidateResult.of(i, votes[i]));
            }
            this.candidates = list;
            return this;
        }

        public Builder candidates(List<CandidateResult> value) {
            this.candidates = value;
            return this;
        }

        public Builder metadata(Map<String, Object> value) {
            this.metadata = value;
            return this;
        }

        public NormalizedSnapshot build() {
            Totals effective = totals;
            if (effective == null) {
                long sum = candidates.stream().mapToLong(CandidateResult::votes).sum();
                effective = new Totals(sum, 0, 0, sum, 0);
            }
            return new NormalizedSnapshot(sourceId, electionLevel, geography, timestampSource,
                    observed, effective, progress, candidates, metadata);
        }
    }
}
