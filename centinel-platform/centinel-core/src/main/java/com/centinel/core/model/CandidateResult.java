package com.centinel.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Votes recorded for one ballot position.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CandidateResult(
        @JsonProperty("slot") int slot,
        @JsonProperty("votes") long votes,
        @JsonProperty("candidate_id") String candidateId,
        @JsonProperty("name") String name,
        @JsonProperty("party") String party
) {

    public static CandidateResult of(int slot, long votes) {
        return new CandidateResult(slot, votes, null, null, null);
    }

    /**
     * Human-readable label used in alert justifications.
     */
    public String label() {
        if (name != null && !name.isBlank()) {
            return "slot " + slot + " (" + name + ")";
        }
        return "slot " + slot;
    }
}
