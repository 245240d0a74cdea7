package com.centinel.core.ledger;

import java.util.*;

/**
 * Outcome of a chain verification. {@code firstBreakIndex} is the lowest
 * record index at which any check failed.
 */
public record VerificationResult(
        boolean valid,
        OptionalInt firstBreakIndex,
        List<String> errors,
        int recordsVerified
) {

    public VerificationResult {
        Objects.requireNonNull(firstBreakIndex, "First break index cannot be null");
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static VerificationResult success(int recordsVerified) {
        return new VerificationResult(true, OptionalInt.empty(), List.of(), recordsVerified);
    }

    public static VerificationResult failure(int firstBreakIndex, List<String> errors, int recordsVerified) {
        return new VerificationResult(false, OptionalInt.of(firstBreakIndex), errors, recordsVerified);
    }
}
