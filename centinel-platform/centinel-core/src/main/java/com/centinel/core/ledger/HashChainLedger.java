package com.centinel.core.ledger;

import com.centinel.core.model.HashRecord;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Append-only hash chain of one source, persisted through a {@link SnapshotStore}.
 *
 * <p>Opening verifies the links of the stored chain; {@link #verify()} also
 * checks every record against its stored snapshot and should run before the
 * first append. A ledger that detected a broken chain is halted and refuses
 * every further append. An
 * append computes both hashes, persists the record in one store call, and
 * only then advances the tip; a failed write leaves the tip unchanged.
 */
public class HashChainLedger {

    private static final Logger log = LoggerFactory.getLogger(HashChainLedger.class);

    private final String sourceId;
    private final SnapshotStore store;
    private final Clock clock;
    private ChainState state;
    private ChainIntegrityException haltedBy;

    private HashChainLedger(String sourceId, SnapshotStore store, Clock clock, ChainState state) {
        this.sourceId = sourceId;
        this.store = store;
        this.clock = clock;
        this.state = state;
    }

    /**
     * Opens the ledger of {@code sourceId}, verifying every stored record.
     *
     * @throws ChainIntegrityException if the stored chain is broken
     */
    public static HashChainLedger open(String sourceId, SnapshotStore store, Clock clock) {
        Objects.requireNonNull(sourceId, "Source ID cannot be null");
        Objects.requireNonNull(store, "Store cannot be null");
        Objects.requireNonNull(clock, "Clock cannot be null");

        List<HashRecord> records = store.readHashRecords(sourceId);
        VerificationResult result = HashChain.verifyChain(records);
        if (!result.valid()) {
            ChainIntegrityException failure = toException(sourceId, result);
            log.error("Hash chain of {} failed verification at index {}: {}",
                    sourceId, failure.getIndex(), result.errors());
            throw failure;
        }
        ChainState state = HashChain.stateAfter(records);
        log.debug("Opened ledger for {} with {} records", sourceId, records.size());
        return new HashChainLedger(sourceId, store, clock, state);
    }

    /**
     * Links and persists a new record for {@code snapshot}.
     */
    public synchronized HashRecord append(NormalizedSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        ensureNotHalted();
        if (!sourceId.equals(snapshot.sourceId())) {
            throw new IllegalArgumentException("Snapshot of " + snapshot.sourceId()
                    + " cannot be appended to the ledger of " + sourceId);
        }

        HashRecord record = HashChain.link(snapshot, state, clock.instant());
        store.appendHashRecord(sourceId, record);
        state = new ChainState(record.sequenceIndex(), record.chainHash(), record.contentHash());

        log.debug("Appended {} to {} at index {} (chain {})",
                record.snapshotRef(), sourceId, record.sequenceIndex(), record.chainHash());
        return record;
    }

    /**
     * Re-reads the stored chain and verifies it together with the stored
     * snapshots. Halts the ledger when verification fails.
     */
    public synchronized VerificationResult verify() {
        List<HashRecord> records = store.readHashRecords(sourceId);
        VerificationResult result = HashChain.verifyAgainstSnapshots(records,
                ref -> store.findNormalized(sourceId, ref));
        if (!result.valid()) {
            haltedBy = toException(sourceId, result);
            log.error("Hash chain of {} failed verification at index {}: {}",
                    sourceId, haltedBy.getIndex(), result.errors());
        }
        return result;
    }

    public synchronized ChainState tip() {
        return state;
    }

    public synchronized boolean isHalted() {
        return haltedBy != null;
    }

    public String getSourceId() {
        return sourceId;
    }

    private void ensureNotHalted() {
        if (haltedBy != null) {
            throw new ChainIntegrityException(sourceId, haltedBy.getKind(), haltedBy.getIndex(),
                    "Ledger of " + sourceId + " is halted: " + haltedBy.getMessage());
        }
    }

    private static ChainIntegrityException toException(String sourceId, VerificationResult result) {
        int index = result.firstBreakIndex().orElse(0);
        boolean genesis = index == 0 && result.errors().stream().anyMatch(e -> e.startsWith("Genesis"));
        ChainIntegrityException.Kind kind = genesis
                ? ChainIntegrityException.Kind.GENESIS_MISMATCH
                : ChainIntegrityException.Kind.BROKEN_LINK;
        return new ChainIntegrityException(sourceId, kind, index,
                "Hash chain of " + sourceId + " broken at index " + index + ": " + result.errors().get(0));
    }
}
