package com.centinel.core.model;

/**
 * Severity attached to an alert.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH
}
