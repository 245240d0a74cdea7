package com.centinel.core.audit;

import com.centinel.core.CentinelException;
import com.centinel.core.config.CentinelConfig;
import com.centinel.core.config.ConfigurationException;
import com.centinel.core.ledger.ChainIntegrityException;
import com.centinel.core.ledger.ChainState;
import com.centinel.core.ledger.HashChainLedger;
import com.centinel.core.ledger.VerificationResult;
import com.centinel.core.model.HashRecord;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.RawDocument;
import com.centinel.core.normalizer.CanonicalNormalizer;
import com.centinel.core.normalizer.NormalizationException;
import com.centinel.core.rules.RuleEngine;
import com.centinel.core.rules.RuleRegistry;
import com.centinel.core.store.SnapshotStore;
import com.centinel.core.store.SnapshotStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Turns a batch of raw documents into evidence and an audit report.
 *
 * <p>Each source is processed on its own worker: documents in retrieval
 * order are stored raw, normalized, stored normalized and appended to the
 * source's hash chain. A document that fails normalization is recorded and
 * skipped. A chain that fails verification stops its source; other sources
 * continue. Results are merged in source order before the rules run, so the
 * report does not depend on worker scheduling.
 */
public class AuditPipeline {

    private static final Logger log = LoggerFactory.getLogger(AuditPipeline.class);

    private final CentinelConfig config;
    private final SnapshotStore store;
    private final Clock clock;
    private final RuleRegistry registry;
    private final AnomalyAggregator aggregator;

    public AuditPipeline(CentinelConfig config, SnapshotStore store, Clock clock) {
        this(config, store, clock, RuleRegistry.defaults());
    }

    public AuditPipeline(CentinelConfig config, SnapshotStore store, Clock clock, RuleRegistry registry) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.store = Objects.requireNonNull(store, "Store cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.registry = Objects.requireNonNull(registry, "Registry cannot be null");
        this.aggregator = new AnomalyAggregator(registry, new RuleEngine(), clock);
    }

    public AuditRun run(List<RawDocument> documents) {
        Objects.requireNonNull(documents, "Documents cannot be null");
        try {
            config.validate(registry.ids());
        } catch (ConfigurationException e) {
            log.error("Audit aborted, invalid configuration: {}", e.getMessage());
            return AuditRun.configurationError(e.getMessage());
        }

        List<String> enabledRules = registry.enabledIds(config.rules());
        if (enabledRules.isEmpty()) {
            log.warn("No rules enabled; the report will contain no alerts");
        }

        Map<String, List<RawDocument>> bySource = documents.stream()
                .collect(Collectors.groupingBy(RawDocument::sourceId, TreeMap::new, Collectors.toList()));
        log.info("Audit started: {} documents from {} sources", documents.size(), bySource.size());

        List<SourceResult> results = processAll(bySource);

        List<NormalizedSnapshot> snapshots = new ArrayList<>();
        List<NormalizedSnapshot> baseline = new ArrayList<>();
        List<NormalizationFailure> normalizationFailures = new ArrayList<>();
        List<ChainFailure> chainFailures = new ArrayList<>();
        Map<String, ChainState> tips = new TreeMap<>();
        for (SourceResult result : results) {
            snapshots.addAll(result.snapshots());
            baseline.addAll(result.baseline());
            normalizationFailures.addAll(result.normalizationFailures());
            result.chainFailure().ifPresent(chainFailures::add);
            if (result.tip() != null) {
                tips.put(result.sourceId(), result.tip());
            }
        }

        AuditReport report = aggregator.runAudit(snapshots, baseline, enabledRules, config.rules(),
                normalizationFailures, chainFailures);
        String location = store.saveReport(report);

        AuditExitCode exitCode = AuditExitCode.of(
                enabledRules.isEmpty(), !chainFailures.isEmpty(), !normalizationFailures.isEmpty());
        log.info("Audit finished with {} ({}): {} snapshots, {} normalization failures, {} chain failures",
                exitCode, exitCode.code(), snapshots.size(), normalizationFailures.size(), chainFailures.size());
        return new AuditRun(report, exitCode, location, snapshots, tips, null);
    }

    // ==================== Per-source Processing ====================

    private List<SourceResult> processAll(Map<String, List<RawDocument>> bySource) {
        if (bySource.isEmpty()) {
            return List.of();
        }
        int workers = Math.min(config.pipeline().workers(), bySource.size());
        ExecutorService executor = Executors.newFixedThreadPool(workers, new WorkerThreadFactory());
        try {
            Map<String, Future<SourceResult>> futures = new LinkedHashMap<>();
            bySource.forEach((sourceId, docs) ->
                    futures.put(sourceId, executor.submit(() -> processSource(sourceId, docs))));

            List<SourceResult> results = new ArrayList<>();
            for (Map.Entry<String, Future<SourceResult>> entry : futures.entrySet()) {
                results.add(await(entry.getKey(), entry.getValue()));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private SourceResult await(String sourceId, Future<SourceResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CentinelException("Interrupted while processing source " + sourceId, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new CentinelException("Processing of source " + sourceId + " failed", cause);
        }
    }

    SourceResult processSource(String sourceId, List<RawDocument> documents) {
        List<RawDocument> ordered = new ArrayList<>(documents);
        ordered.sort(Comparator.comparing(RawDocument::retrievedAt));

        CanonicalNormalizer normalizer = new CanonicalNormalizer(config.candidateCount(), config.requiredKeys());
        List<NormalizedSnapshot> snapshots = new ArrayList<>();
        List<NormalizationFailure> failures = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        List<NormalizedSnapshot> baseline;
        HashChainLedger ledger;
        Set<String> recorded = new HashSet<>();
        try {
            baseline = store.loadNormalized(sourceId);
            ledger = HashChainLedger.open(sourceId, store, clock);
            for (HashRecord record : store.readHashRecords(sourceId)) {
                recorded.add(record.snapshotRef());
            }
            // stored snapshots must still match their records before anything is linked to them
            VerificationResult stored = ledger.verify();
            if (!stored.valid()) {
                return SourceResult.halted(sourceId, List.of(), List.of(), failures,
                        brokenChain(sourceId, stored));
            }
        } catch (ChainIntegrityException e) {
            return SourceResult.halted(sourceId, List.of(), List.of(), failures, ChainFailure.of(e));
        } catch (SnapshotStoreException e) {
            log.error("Cannot open evidence of {}: {}", sourceId, e.getMessage());
            return SourceResult.halted(sourceId, List.of(), List.of(), failures, ChainFailure.of(sourceId, e));
        }

        for (RawDocument raw : ordered) {
            NormalizedSnapshot snapshot;
            try {
                store.saveRaw(raw);
                snapshot = normalizer.normalize(raw, config.fieldMap());
            } catch (NormalizationException e) {
                log.warn("Skipping document of {} retrieved at {}: {} ({})",
                        sourceId, raw.retrievedAt(), e.getMessage(), e.getReason());
                failures.add(NormalizationFailure.of(raw, e));
                continue;
            } catch (SnapshotStoreException e) {
                log.error("Stopping {}: {}", sourceId, e.getMessage());
                return SourceResult.halted(sourceId, snapshots, baseline, failures, ChainFailure.of(sourceId, e));
            }

            if (!seen.add(snapshot.snapshotRef())) {
                log.debug("Ignoring repeated document {}", snapshot.snapshotRef());
                continue;
            }
            try {
                store.saveNormalized(snapshot);
                if (recorded.add(snapshot.snapshotRef())) {
                    ledger.append(snapshot);
                } else {
                    log.debug("{} already on the chain of {}", snapshot.snapshotRef(), sourceId);
                }
            } catch (ChainIntegrityException e) {
                log.error("Stopping {}: {}", sourceId, e.getMessage());
                return SourceResult.halted(sourceId, snapshots, baseline, failures, ChainFailure.of(e));
            } catch (SnapshotStoreException e) {
                log.error("Stopping {}: {}", sourceId, e.getMessage());
                return SourceResult.halted(sourceId, snapshots, baseline, failures, ChainFailure.of(sourceId, e));
            }
            snapshots.add(snapshot);
        }

        VerificationResult verification = ledger.verify();
        if (!verification.valid()) {
            return new SourceResult(sourceId, snapshots, baseline, failures,
                    Optional.of(brokenChain(sourceId, verification)), ledger.tip());
        }
        log.debug("Source {} done: {} snapshots, chain length {}",
                sourceId, snapshots.size(), ledger.tip().nextIndex());
        return new SourceResult(sourceId, snapshots, baseline, failures, Optional.empty(), ledger.tip());
    }

    private static ChainFailure brokenChain(String sourceId, VerificationResult verification) {
        return new ChainFailure(sourceId, ChainIntegrityException.Kind.BROKEN_LINK.name(),
                verification.firstBreakIndex().orElse(0), String.join("; ", verification.errors()));
    }

    // ==================== Inner Types ====================

    record SourceResult(
            String sourceId,
            List<NormalizedSnapshot> snapshots,
            List<NormalizedSnapshot> baseline,
            List<NormalizationFailure> normalizationFailures,
            Optional<ChainFailure> chainFailure,
            ChainState tip
    ) {
        SourceResult {
            snapshots = List.copyOf(snapshots);
            baseline = List.copyOf(baseline);
            normalizationFailures = List.copyOf(normalizationFailures);
        }

        static SourceResult halted(String sourceId, List<NormalizedSnapshot> snapshots,
                                   List<NormalizedSnapshot> baseline,
                                   List<NormalizationFailure> failures, ChainFailure failure) {
            return new SourceResult(sourceId, snapshots, baseline, failures, Optional.of(failure), null);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "centinel-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
