package com.centinel.core.store;

import com.centinel.core.audit.AuditReport;
import com.centinel.core.model.HashRecord;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.RawDocument;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence boundary of the pipeline. Raw documents, normalized snapshots
 * and hash records are write-once: saving a different value under an existing
 * key fails, saving identical content again is a no-op.
 */
public interface SnapshotStore {

    void saveRaw(RawDocument raw);

    void saveNormalized(NormalizedSnapshot snapshot);

    /**
     * All stored snapshots of a source, ordered by observation time and then
     * geography code.
     */
    List<NormalizedSnapshot> loadNormalized(String sourceId);

    Optional<NormalizedSnapshot> findNormalized(String sourceId, String snapshotRef);

    void appendHashRecord(String sourceId, HashRecord record);

    /**
     * Hash records of a source in append order; empty when none exist.
     */
    List<HashRecord> readHashRecords(String sourceId);

    /**
     * Persists a report and returns where it was written.
     */
    String saveReport(AuditReport report);

    Set<String> sources();
}
