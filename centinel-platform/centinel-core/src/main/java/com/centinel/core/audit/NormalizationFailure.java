package com.centinel.core.audit;

import com.centinel.core.model.RawDocument;
import com.centinel.core.normalizer.NormalizationException;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * A raw document that could not be normalized.
 */
public record NormalizationFailure(
        @JsonProperty("source_id") String sourceId,
        @JsonProperty("retrieved_at") Instant retrievedAt,
        @JsonProperty("reason") String reason,
        @JsonProperty("message") String message
) {

    public NormalizationFailure {
        Objects.requireNonNull(sourceId, "Source ID cannot be null");
        Objects.requireNonNull(retrievedAt, "Retrieved-at cannot be null");
        Objects.requireNonNull(reason, "Reason cannot be null");
        message = message != null ? message : "";
    }

    public static NormalizationFailure of(RawDocument raw, NormalizationException e) {
        return new NormalizationFailure(raw.sourceId(), raw.retrievedAt(), e.getReason().name(), e.getMessage());
    }
}
