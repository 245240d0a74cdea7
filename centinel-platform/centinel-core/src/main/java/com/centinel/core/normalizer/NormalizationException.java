package com.centinel.core.normalizer;

import com.centinel.core.CentinelException;

import java.util.Objects;

/**
 * A raw document could not be turned into a snapshot. Recovered per document:
 * the pipeline records it and moves on to the next one.
 */
public class NormalizationException extends CentinelException {

    private final Reason reason;

    public NormalizationException(Reason reason, String message) {
        super(message);
        this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
    }

    public NormalizationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = Objects.requireNonNull(reason, "Reason cannot be null");
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        MISSING_REQUIRED_KEY,
        UNPARSABLE_DOCUMENT,
        CANDIDATE_ROOT_NOT_FOUND
    }
}
