package com.centinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.*;

/**
 * Canonical representation derived from exactly one {@link RawDocument}.
 *
 * <p>All counts are integers. Percentages are never stored; rules recompute
 * them from the integer counters. Metadata keys are kept sorted so the
 * canonical serialization does not depend on insertion order.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NormalizedSnapshot(
        @JsonProperty("source_id") String sourceId,
        @JsonProperty("election_level") String electionLevel,
        @JsonProperty("geography") Geography geography,
        @JsonProperty("timestamp_source") String timestampSource,
        @JsonProperty("timestamp_observed") Instant timestampObserved,
        @JsonProperty("totals") Totals totals,
        @JsonProperty("progress") Progress progress,
        @JsonProperty("candidates") List<CandidateResult> candidates,
        @JsonProperty("metadata") Map<String, Object> metadata
) {

    public static final String COERCION_WARNINGS = "coercion_warnings";
    public static final String CANDIDATE_COUNT_WARNING = "candidate_count_warning";
    public static final String DERIVED_FIELDS = "derived_fields";
    public static final String DUPLICATE_SLOTS = "duplicate_slots";

    public NormalizedSnapshot {
        Objects.requireNonNull(sourceId, "Source ID cannot be null");
        Objects.requireNonNull(electionLevel, "Election level cannot be null");
        Objects.requireNonNull(geography, "Geography cannot be null");
        Objects.requireNonNull(timestampObserved, "Observed timestamp cannot be null");
        Objects.requireNonNull(totals, "Totals cannot be null");
        progress = progress != null ? progress : Progress.unknown();
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        metadata = MetadataValues.normalizeMap(metadata);
    }

    /**
     * Stable identifier of this observation:
     * {@code <source>@<observed instant>#<geography code>}. One retrieval may
     * yield several departments, so the instant alone is not unique.
     */
    @JsonIgnore
    public String snapshotRef() {
        return sourceId + "@" + timestampObserved + "#" + geography.code();
    }

    /**
     * Key that groups consecutive observations of the same source and geography.
     */
    @JsonIgnore
    public String seriesKey() {
        return sourceId + "|" + geography.code();
    }

    @JsonIgnore
    public Optional<CandidateResult> candidate(int slot) {
        for (CandidateResult candidate : candidates) {
            if (candidate.slot() == slot) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Votes by slot, first occurrence wins for duplicated slots.
     */
    @JsonIgnore
    public Map<Integer, Long> votesBySlot() {
        Map<Integer, Long> result = new LinkedHashMap<>();
        for (CandidateResult candidate : candidates) {
            result.putIfAbsent(candidate.slot(), candidate.votes());
        }
        return result;
    }

    @JsonIgnore
    public long candidateVoteSum() {
        long sum = 0;
        for (CandidateResult candidate : candidates) {
            sum += candidate.votes();
        }
        return sum;
    }

    @JsonIgnore
    public List<String> coercionWarnings() {
        Object value = metadata.get(COERCION_WARNINGS);
        if (value instanceof List<?> list) {
            List<String> result = new ArrayList<>(list.size());
            for (Object item : list) {
                result.add(String.valueOf(item));
            }
            return List.copyOf(result);
        }
        return List.of();
    }
}
