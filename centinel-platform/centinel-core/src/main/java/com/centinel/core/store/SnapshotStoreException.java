package com.centinel.core.store;

import com.centinel.core.CentinelException;

/**
 * Persistence failure, including attempts to overwrite evidence already on record.
 */
public class SnapshotStoreException extends CentinelException {

    public SnapshotStoreException(String message) {
        super(message);
    }

    public SnapshotStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
