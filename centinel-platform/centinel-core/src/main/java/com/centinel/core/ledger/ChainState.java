package com.centinel.core.ledger;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Tip of a source's chain: index and hashes of the last appended record.
 * An empty chain has index {@code -1} and the genesis sentinel as chain hash.
 * Exposed read-only for anchoring collaborators.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChainState(
        @JsonProperty("sequence_index") long sequenceIndex,
        @JsonProperty("chain_hash") String chainHash,
        @JsonProperty("content_hash") String contentHash
) {

    public ChainState {
        Objects.requireNonNull(chainHash, "Chain hash cannot be null");
        if (sequenceIndex < -1) {
            throw new IllegalArgumentException("Sequence index cannot be below -1");
        }
    }

    public static ChainState genesis() {
        return new ChainState(-1, HashChain.GENESIS_HASH, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sequenceIndex < 0;
    }

    public long nextIndex() {
        return sequenceIndex + 1;
    }
}
