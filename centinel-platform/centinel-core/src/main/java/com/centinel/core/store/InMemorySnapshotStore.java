package com.centinel.core.store;

import com.centinel.core.audit.AuditReport;
import com.centinel.core.model.HashRecord;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.RawDocument;

import java.util.*;

/**
 * Thread-safe in-memory store with the same write-once semantics as
 * {@link FileSystemSnapshotStore}.
 */
public class InMemorySnapshotStore implements SnapshotStore {

    private final Map<String, Map<String, RawDocument>> raw = new HashMap<>();
    private final Map<String, Map<String, NormalizedSnapshot>> normalized = new HashMap<>();
    private final Map<String, List<HashRecord>> chains = new HashMap<>();
    private final List<AuditReport> reports = new ArrayList<>();

    @Override
    public synchronized void saveRaw(RawDocument document) {
        Objects.requireNonNull(document, "Raw document cannot be null");
        putOnce(raw.computeIfAbsent(document.sourceId(), k -> new HashMap<>()),
                StoreKeys.rawKey(document.retrievedAt(), document.content()), document, "raw document");
    }

    @Override
    public synchronized void saveNormalized(NormalizedSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        putOnce(normalized.computeIfAbsent(snapshot.sourceId(), k -> new HashMap<>()),
                StoreKeys.normalizedKey(snapshot), snapshot, "snapshot");
    }

    @Override
    public synchronized List<NormalizedSnapshot> loadNormalized(String sourceId) {
        Map<String, NormalizedSnapshot> stored = normalized.get(sourceId);
        if (stored == null) {
            return List.of();
        }
        List<NormalizedSnapshot> snapshots = new ArrayList<>(stored.values());
        snapshots.sort(StoreKeys.OBSERVATION_ORDER);
        return List.copyOf(snapshots);
    }

    @Override
    public synchronized Optional<NormalizedSnapshot> findNormalized(String sourceId, String snapshotRef) {
        Map<String, NormalizedSnapshot> stored = normalized.get(sourceId);
        if (stored == null) {
            return Optional.empty();
        }
        return StoreKeys.normalizedKey(snapshotRef).map(stored::get)
                .filter(snapshot -> snapshot.snapshotRef().equals(snapshotRef));
    }

    @Override
    public synchronized void appendHashRecord(String sourceId, HashRecord record) {
        Objects.requireNonNull(record, "Hash record cannot be null");
        List<HashRecord> chain = chains.computeIfAbsent(sourceId, k -> new ArrayList<>());
        if (record.sequenceIndex() != chain.size()) {
            throw new SnapshotStoreException("Hash record " + record.sequenceIndex() + " of " + sourceId
                    + " does not extend the stored chain of " + chain.size() + " records");
        }
        chain.add(record);
    }

    @Override
    public synchronized List<HashRecord> readHashRecords(String sourceId) {
        List<HashRecord> chain = chains.get(sourceId);
        return chain == null ? List.of() : List.copyOf(chain);
    }

    @Override
    public synchronized String saveReport(AuditReport report) {
        Objects.requireNonNull(report, "Report cannot be null");
        reports.add(report);
        return "memory:reports/" + (reports.size() - 1);
    }

    @Override
    public synchronized Set<String> sources() {
        Set<String> sources = new TreeSet<>(raw.keySet());
        sources.addAll(normalized.keySet());
        sources.addAll(chains.keySet());
        return Collections.unmodifiableSet(sources);
    }

    public synchronized List<AuditReport> reports() {
        return List.copyOf(reports);
    }

    /**
     * Replaces the stored chain of a source. Test hook for simulating
     * tampering with persisted records.
     */
    public synchronized void replaceHashRecords(String sourceId, List<HashRecord> records) {
        chains.put(sourceId, new ArrayList<>(records));
    }

    private static <T> void putOnce(Map<String, T> target, String key, T value, String what) {
        T existing = target.putIfAbsent(key, value);
        if (existing != null && !existing.equals(value)) {
            throw new SnapshotStoreException("Refusing to overwrite " + what + " stored as " + key);
        }
    }
}
