package com.centinel.core.audit;

import com.centinel.core.ledger.Digests;
import com.centinel.core.model.Alert;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.Severity;
import com.centinel.core.normalizer.CanonicalJson;
import com.centinel.core.rules.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.*;

/**
 * Runs the enabled rules over every series of snapshots and builds the audit report.
 *
 * <p>Snapshots are grouped by series ({@code source_id} and geography code).
 * Series are processed in key order, snapshots in input order, rules in
 * registry order, so the alert list is a deterministic function of the input.
 * Identical alerts are reported once.
 */
public class AnomalyAggregator {

    private static final Logger log = LoggerFactory.getLogger(AnomalyAggregator.class);

    private final RuleRegistry registry;
    private final RuleEngine engine;
    private final Clock clock;

    public AnomalyAggregator(RuleRegistry registry, RuleEngine engine, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.engine = Objects.requireNonNull(engine, "Engine cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
    }

    public AnomalyAggregator(Clock clock) {
        this(RuleRegistry.defaults(), new RuleEngine(), clock);
    }

    public AuditReport runAudit(List<NormalizedSnapshot> snapshots,
                                Collection<String> enabledRules,
                                RuleConfig config) {
        return runAudit(snapshots, List.of(), enabledRules, config, List.of(), List.of());
    }

    /**
     * @param snapshots             snapshots under audit
     * @param baseline              earlier snapshots used only as history; they produce no alerts
     * @param enabledRules          ids of the rules to run
     * @param config                rule thresholds
     * @param normalizationFailures recorded in the run metadata
     * @param chainFailures         recorded in the run metadata
     * @throws com.centinel.core.config.ConfigurationException if a rule id is unknown
     */
    public AuditReport runAudit(List<NormalizedSnapshot> snapshots,
                                List<NormalizedSnapshot> baseline,
                                Collection<String> enabledRules,
                                RuleConfig config,
                                List<NormalizationFailure> normalizationFailures,
                                List<ChainFailure> chainFailures) {
        Objects.requireNonNull(snapshots, "Snapshots cannot be null");
        Objects.requireNonNull(config, "Rule config cannot be null");
        List<IntegrityRule> rules = registry.select(enabledRules);

        Map<String, List<NormalizedSnapshot>> series = group(snapshots);
        Map<String, List<NormalizedSnapshot>> history = groupBaseline(baseline, snapshots);

        Set<AlertKey> seen = new HashSet<>();
        List<Alert> alerts = new ArrayList<>();
        List<RuleDiagnostic> diagnostics = new ArrayList<>();

        for (Map.Entry<String, List<NormalizedSnapshot>> entry : series.entrySet()) {
            List<NormalizedSnapshot> prior = new ArrayList<>(history.getOrDefault(entry.getKey(), List.of()));
            for (NormalizedSnapshot current : entry.getValue()) {
                NormalizedSnapshot previous = prior.isEmpty() ? null : prior.get(prior.size() - 1);
                RuleEngine.Evaluation evaluation = engine.evaluate(rules,
                        new RuleContext(current, previous, prior, config));
                for (Alert alert : evaluation.alerts()) {
                    if (seen.add(AlertKey.of(alert))) {
                        alerts.add(alert);
                    }
                }
                diagnostics.addAll(evaluation.diagnostics());
                prior.add(current);
            }
        }

        List<String> ruleIds = rules.stream().map(IntegrityRule::id).toList();
        RunMetadata metadata = new RunMetadata(
                RuleRegistry.RULE_SET_VERSION,
                configHash(config, ruleIds),
                ruleIds,
                snapshots.size(),
                series.size(),
                snapshots.stream().map(NormalizedSnapshot::timestampObserved).min(Comparator.naturalOrder()).orElse(null),
                snapshots.stream().map(NormalizedSnapshot::timestampObserved).max(Comparator.naturalOrder()).orElse(null),
                normalizationFailures,
                chainFailures,
                diagnostics,
                clock.instant());
        AuditReport report = AuditReport.of(alerts, metadata);

        log.info("Audit of {} snapshots in {} series with {} rules: {} alerts (HIGH={}, MEDIUM={}, LOW={}), {} rule failures",
                snapshots.size(), series.size(), ruleIds.size(), alerts.size(),
                report.count(Severity.HIGH), report.count(Severity.MEDIUM), report.count(Severity.LOW),
                diagnostics.size());
        return report;
    }

    /**
     * SHA-256 over the canonical form of the rule configuration and the
     * enabled rule ids.
     */
    public static String configHash(RuleConfig config, List<String> enabledRules) {
        Map<String, Object> material = new TreeMap<>();
        material.put("rules", config);
        material.put("enabled_rules", enabledRules);
        material.put("rule_set_version", RuleRegistry.RULE_SET_VERSION);
        return Digests.sha256Hex(CanonicalJson.serialize(material));
    }

    // ==================== Private Methods ====================

    private static Map<String, List<NormalizedSnapshot>> group(List<NormalizedSnapshot> snapshots) {
        Map<String, List<NormalizedSnapshot>> groups = new TreeMap<>();
        for (NormalizedSnapshot snapshot : snapshots) {
            Objects.requireNonNull(snapshot, "Snapshot cannot be null");
            groups.computeIfAbsent(snapshot.seriesKey(), k -> new ArrayList<>()).add(snapshot);
        }
        return groups;
    }

    private static Map<String, List<NormalizedSnapshot>> groupBaseline(List<NormalizedSnapshot> baseline,
                                                                       List<NormalizedSnapshot> audited) {
        if (baseline == null || baseline.isEmpty()) {
            return Map.of();
        }
        Set<String> auditedRefs = new HashSet<>();
        for (NormalizedSnapshot snapshot : audited) {
            auditedRefs.add(snapshot.snapshotRef());
        }
        List<NormalizedSnapshot> remaining = new ArrayList<>();
        for (NormalizedSnapshot snapshot : baseline) {
            if (!auditedRefs.contains(snapshot.snapshotRef())) {
                remaining.add(snapshot);
            }
        }
        remaining.sort(Comparator.comparing(NormalizedSnapshot::timestampObserved));
        return group(remaining);
    }

    private record AlertKey(String ruleId, String snapshotRef, String type, String department, String justification) {
        static AlertKey of(Alert alert) {
            return new AlertKey(alert.ruleId(), alert.snapshotRef(), alert.type(),
                    alert.department(), alert.justification());
        }
    }
}
