package com.centinel.core.audit;

import com.centinel.core.ledger.ChainState;
import com.centinel.core.model.NormalizedSnapshot;

import java.util.*;

/**
 * Outcome of {@link AuditPipeline#run(List)}.
 *
 * @param report         the audit report, {@code null} only for configuration errors
 * @param exitCode       process exit status
 * @param reportLocation where the store wrote the report
 * @param snapshots      snapshots normalized in this run, by source then observation time
 * @param tips           chain tip per source after the run
 * @param error          configuration error message, otherwise {@code null}
 */
public record AuditRun(
        AuditReport report,
        AuditExitCode exitCode,
        String reportLocation,
        List<NormalizedSnapshot> snapshots,
        Map<String, ChainState> tips,
        String error
) {

    public AuditRun {
        Objects.requireNonNull(exitCode, "Exit code cannot be null");
        snapshots = snapshots != null ? List.copyOf(snapshots) : List.of();
        tips = tips != null ? Collections.unmodifiableSortedMap(new TreeMap<>(tips)) : Map.of();
    }

    static AuditRun configurationError(String message) {
        return new AuditRun(null, AuditExitCode.CONFIGURATION_ERROR, null, List.of(), Map.of(), message);
    }
}
