package com.centinel.core.audit;

import com.centinel.core.model.Alert;
import com.centinel.core.model.Severity;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * Alerts of one audit run, a per-severity count and the run metadata.
 * The summary always lists every severity, including those with no alerts.
 */
public record AuditReport(
        @JsonProperty("alerts") List<Alert> alerts,
        @JsonProperty("summary") Map<Severity, Long> summary,
        @JsonProperty("run_metadata") RunMetadata runMetadata
) {

    public AuditReport {
        alerts = alerts != null ? List.copyOf(alerts) : List.of();
        Objects.requireNonNull(runMetadata, "Run metadata cannot be null");
        summary = summarize(alerts);
    }

    public static AuditReport of(List<Alert> alerts, RunMetadata runMetadata) {
        return new AuditReport(alerts, null, runMetadata);
    }

    public long count(Severity severity) {
        return summary.get(severity);
    }

    public List<Alert> alertsOf(String ruleId) {
        return alerts.stream().filter(alert -> alert.ruleId().equals(ruleId)).toList();
    }

    private static Map<Severity, Long> summarize(List<Alert> alerts) {
        EnumMap<Severity, Long> counts = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            counts.put(severity, 0L);
        }
        for (Alert alert : alerts) {
            counts.merge(alert.severity(), 1L, Long::sum);
        }
        return Collections.unmodifiableMap(counts);
    }
}
