package com.centinel.core.ledger;

import com.centinel.core.model.HashRecord;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.normalizer.CanonicalJson;

import java.time.Instant;
import java.util.*;
import java.util.function.Function;

/**
 * Hashing and verification rules of the snapshot chain.
 *
 * <pre>
 * content_hash(N)  = SHA-256(canonical_json(snapshot N))
 * previous_hash(N) = chain_hash(N-1), or 64 zeros for N = 0
 * chain_hash(N)    = SHA-256(previous_hash(N) || content_hash(N))
 * </pre>
 *
 * Stateless; {@link HashChainLedger} owns the state of a live chain.
 */
public final class HashChain {

    public static final String GENESIS_HASH = "0000000000000000000000000000000000000000000000000000000000000000";

    private HashChain() {
    }

    public static String contentHash(NormalizedSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        return Digests.sha256Hex(CanonicalJson.serializeToBytes(snapshot));
    }

    public static String chainHash(String previousHash, String contentHash) {
        return Digests.sha256Hex(previousHash + contentHash);
    }

    /**
     * Builds the record that appends {@code snapshot} after {@code state}.
     */
    public static HashRecord link(NormalizedSnapshot snapshot, ChainState state, Instant createdAt) {
        Objects.requireNonNull(state, "Chain state cannot be null");
        String contentHash = contentHash(snapshot);
        String previousHash = state.chainHash();
        return new HashRecord(
                state.nextIndex(),
                contentHash,
                previousHash,
                chainHash(previousHash, contentHash),
                snapshot.snapshotRef(),
                createdAt);
    }

    /**
     * State after the last record of a list assumed to be valid.
     */
    public static ChainState stateAfter(List<HashRecord> records) {
        if (records.isEmpty()) {
            return ChainState.genesis();
        }
        HashRecord last = records.get(records.size() - 1);
        return new ChainState(last.sequenceIndex(), last.chainHash(), last.contentHash());
    }

    /**
     * Checks sequence indexes, links and chain hashes. Any single edit, deletion
     * (other than of the last record) or reordering is reported at the first
     * altered index.
     */
    public static VerificationResult verifyChain(List<HashRecord> records) {
        Objects.requireNonNull(records, "Records cannot be null");
        List<String> errors = new ArrayList<>();
        int firstBreak = -1;
        String expectedPrevious = GENESIS_HASH;

        for (int i = 0; i < records.size(); i++) {
            HashRecord record = records.get(i);
            boolean broken = false;

            if (record.sequenceIndex() != i) {
                errors.add("Sequence index mismatch at index " + i + ": found " + record.sequenceIndex());
                broken = true;
            }
            if (!record.previousHash().equals(expectedPrevious)) {
                errors.add(i == 0
                        ? "Genesis mismatch at index 0: previous hash is not the genesis sentinel"
                        : "Previous hash mismatch at index " + i);
                broken = true;
            }
            if (!record.chainHash().equals(chainHash(record.previousHash(), record.contentHash()))) {
                errors.add("Chain hash mismatch at index " + i + " - possible tampering");
                broken = true;
            }
            if (broken && firstBreak < 0) {
                firstBreak = i;
            }
            expectedPrevious = record.chainHash();
        }

        if (errors.isEmpty()) {
            return VerificationResult.success(records.size());
        }
        return VerificationResult.failure(firstBreak, errors, records.size());
    }

    /**
     * Like {@link #verifyChain(List)}, and additionally recomputes each content
     * hash from the stored snapshot returned by {@code lookup} for the record's
     * snapshot ref.
     */
    public static VerificationResult verifyAgainstSnapshots(
            List<HashRecord> records,
            Function<String, Optional<NormalizedSnapshot>> lookup) {
        Objects.requireNonNull(lookup, "Lookup cannot be null");
        VerificationResult links = verifyChain(records);
        List<String> errors = new ArrayList<>(links.errors());
        int firstBreak = links.firstBreakIndex().orElse(Integer.MAX_VALUE);

        for (int i = 0; i < records.size(); i++) {
            HashRecord record = records.get(i);
            Optional<NormalizedSnapshot> snapshot = lookup.apply(record.snapshotRef());
            String problem = null;
            if (snapshot.isEmpty()) {
                problem = "Snapshot " + record.snapshotRef() + " missing for index " + i;
            } else if (!contentHash(snapshot.get()).equals(record.contentHash())) {
                problem = "Content hash mismatch at index " + i + " for " + record.snapshotRef();
            }
            if (problem != null) {
                errors.add(problem);
                firstBreak = Math.min(firstBreak, i);
            }
        }

        if (errors.isEmpty()) {
            return VerificationResult.success(records.size());
        }
        return VerificationResult.failure(firstBreak, errors, records.size());
    }
}
