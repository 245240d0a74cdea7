package com.centinel.core.model;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Unmodified bytes retrieved from a source at a point in time.
 * Handed to the core by the fetch collaborator; never altered afterwards.
 */
public record RawDocument(
        String sourceId,
        Instant retrievedAt,
        String contentType,
        int status,
        byte[] content
) {

    public static final String JSON = "application/json";

    public RawDocument {
        Objects.requireNonNull(sourceId, "Source ID cannot be null");
        Objects.requireNonNull(retrievedAt, "Retrieved-at cannot be null");
        Objects.requireNonNull(content, "Content cannot be null");
        if (sourceId.isBlank()) {
            throw new IllegalArgumentException("Source ID cannot be blank");
        }
        contentType = contentType != null ? contentType : JSON;
        content = content.clone();
    }

    /**
     * Convenience factory for a JSON document fetched with HTTP 200.
     */
    public static RawDocument json(String sourceId, Instant retrievedAt, String json) {
        return new RawDocument(sourceId, retrievedAt, JSON, 200,
                json.getBytes(StandardCharsets.UTF_8));
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public String contentAsString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    public int size() {
        return content.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RawDocument other)) return false;
        return status == other.status
                && sourceId.equals(other.sourceId)
                && retrievedAt.equals(other.retrievedAt)
                && contentType.equals(other.contentType)
                && Arrays.equals(content, other.content);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(sourceId, retrievedAt, contentType, status);
        return 31 * result + Arrays.hashCode(content);
    }

    @Override
    public String toString() {
        return "RawDocument[sourceId=" + sourceId + ", retrievedAt=" + retrievedAt
                + ", contentType=" + contentType + ", status=" + status
                + ", bytes=" + content.length + "]";
    }
}
