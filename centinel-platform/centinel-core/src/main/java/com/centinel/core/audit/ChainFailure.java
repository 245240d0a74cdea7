package com.centinel.core.audit;

import com.centinel.core.ledger.ChainIntegrityException;
import com.centinel.core.store.SnapshotStoreException;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A source whose evidence chain could not be extended or verified.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChainFailure(
        @JsonProperty("source_id") String sourceId,
        @JsonProperty("kind") String kind,
        @JsonProperty("index") Integer index,
        @JsonProperty("message") String message
) {

    public static final String STORE_FAILURE = "STORE_FAILURE";

    public ChainFailure {
        Objects.requireNonNull(sourceId, "Source ID cannot be null");
        Objects.requireNonNull(kind, "Kind cannot be null");
        message = message != null ? message : "";
    }

    public static ChainFailure of(ChainIntegrityException e) {
        return new ChainFailure(e.getSourceId(), e.getKind().name(), e.getIndex(), e.getMessage());
    }

    public static ChainFailure of(String sourceId, SnapshotStoreException e) {
        return new ChainFailure(sourceId, STORE_FAILURE, null, e.getMessage());
    }
}
