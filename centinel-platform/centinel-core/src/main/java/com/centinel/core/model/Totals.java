package com.centinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Aggregate integer vote counts of a snapshot.
 */
public record Totals(
        @JsonProperty("valid_votes") long validVotes,
        @JsonProperty("null_votes") long nullVotes,
        @JsonProperty("blank_votes") long blankVotes,
        @JsonProperty("total_votes") long totalVotes,
        @JsonProperty("registered_voters") long registeredVoters
) {

    public static Totals empty() {
        return new Totals(0, 0, 0, 0, 0);
    }

    /**
     * Sum of valid, null and blank votes.
     */
    public long componentSum() {
        return validVotes + nullVotes + blankVotes;
    }
}
