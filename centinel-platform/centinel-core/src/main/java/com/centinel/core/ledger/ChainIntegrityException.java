package com.centinel.core.ledger;

import com.centinel.core.CentinelException;

import java.util.Objects;

/**
 * A stored chain failed verification. Appends for the affected source stop.
 */
public class ChainIntegrityException extends CentinelException {

    private final String sourceId;
    private final Kind kind;
    private final int index;

    public ChainIntegrityException(String sourceId, Kind kind, int index, String message) {
        super(message);
        this.sourceId = Objects.requireNonNull(sourceId, "Source ID cannot be null");
        this.kind = Objects.requireNonNull(kind, "Kind cannot be null");
        this.index = index;
    }

    public String getSourceId() {
        return sourceId;
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * Index of the first record that failed verification.
     */
    public int getIndex() {
        return index;
    }

    public enum Kind {
        /** Record 0 does not start from the genesis sentinel. */
        GENESIS_MISMATCH,
        /** Sequence, previous-hash or chain-hash check failed at {@link #getIndex()}. */
        BROKEN_LINK
    }
}
