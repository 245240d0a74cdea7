package com.centinel.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * One link of a source's hash chain. Produced only by the ledger and never
 * mutated or deleted after it has been persisted.
 */
public record HashRecord(
        @JsonProperty("sequence_index") long sequenceIndex,
        @JsonProperty("content_hash") String contentHash,
        @JsonProperty("previous_hash") String previousHash,
        @JsonProperty("chain_hash") String chainHash,
        @JsonProperty("snapshot_ref") String snapshotRef,
        @JsonProperty("created_at") Instant createdAt
) {

    public HashRecord {
        if (sequenceIndex < 0) {
            throw new IllegalArgumentException("Sequence index cannot be negative");
        }
        Objects.requireNonNull(contentHash, "Content hash cannot be null");
        Objects.requireNonNull(previousHash, "Previous hash cannot be null");
        Objects.requireNonNull(chainHash, "Chain hash cannot be null");
        Objects.requireNonNull(snapshotRef, "Snapshot ref cannot be null");
        Objects.requireNonNull(createdAt, "Created-at cannot be null");
    }
}
