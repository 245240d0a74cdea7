package com.centinel.core.store;

import com.centinel.core.ledger.Digests;
import com.centinel.core.model.NormalizedSnapshot;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * File-name safe keys shared by the store implementations.
 */
final class StoreKeys {

    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss.SSSSSSSSS'Z'").withZone(ZoneOffset.UTC);
    private static final Pattern SOURCE_ID = Pattern.compile("[A-Za-z0-9._-]+");
    private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9-]{1,32}");
    private static final int DIGEST_PREFIX = 12;

    static final Comparator<NormalizedSnapshot> OBSERVATION_ORDER =
            Comparator.comparing(NormalizedSnapshot::timestampObserved)
                    .thenComparing(snapshot -> snapshot.geography().code());

    private StoreKeys() {
    }

    /**
     * Fixed-width UTC stamp, so lexical order of file names is chronological.
     */
    static String stamp(Instant instant) {
        return STAMP.format(instant);
    }

    /**
     * Directory name of a source. Ids are used verbatim; an id that is not
     * already a safe name is rejected so two ids never share a directory.
     */
    static String sourceDirectory(String sourceId) {
        if (sourceId == null || sourceId.isBlank()) {
            throw new SnapshotStoreException("Source ID cannot be blank");
        }
        if (!SOURCE_ID.matcher(sourceId).matches() || sourceId.chars().allMatch(c -> c == '.')) {
            throw new SnapshotStoreException("Source ID '" + sourceId
                    + "' is not a valid directory name (allowed: letters, digits, '.', '_', '-')");
        }
        return sourceId;
    }

    /**
     * Key of a raw document: retrieval stamp plus a digest prefix of its bytes,
     * so documents retrieved at the same instant do not collide.
     */
    static String rawKey(Instant retrievedAt, byte[] content) {
        return stamp(retrievedAt) + "_" + Digests.sha256Hex(content).substring(0, DIGEST_PREFIX);
    }

    static String normalizedKey(NormalizedSnapshot snapshot) {
        return normalizedKey(snapshot.timestampObserved(), snapshot.geography().code());
    }

    /**
     * Key of the snapshot a ref points to, empty for a malformed ref.
     */
    static Optional<String> normalizedKey(String snapshotRef) {
        int at = snapshotRef.lastIndexOf('@');
        if (at < 0) {
            return Optional.empty();
        }
        int hash = snapshotRef.indexOf('#', at);
        if (hash < 0) {
            return Optional.empty();
        }
        try {
            Instant observed = Instant.parse(snapshotRef.substring(at + 1, hash));
            return Optional.of(normalizedKey(observed, snapshotRef.substring(hash + 1)));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }

    private static String normalizedKey(Instant observed, String geographyCode) {
        return stamp(observed) + "_" + segment(geographyCode);
    }

    // codes outside the safe alphabet are replaced by a digest prefix
    private static String segment(String value) {
        if (SAFE_SEGMENT.matcher(value).matches()) {
            return value;
        }
        return "h" + Digests.sha256Hex(value).substring(0, DIGEST_PREFIX);
    }
}
