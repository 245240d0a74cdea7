package com.centinel.core;

/**
 * Base type for every failure raised by the evidence pipeline.
 */
public class CentinelException extends RuntimeException {

    public CentinelException(String message) {
        super(message);
    }

    public CentinelException(String message, Throwable cause) {
        super(message, cause);
    }
}
