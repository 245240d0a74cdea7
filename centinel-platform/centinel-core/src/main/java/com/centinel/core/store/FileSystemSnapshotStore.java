package com.centinel.core.store;

import com.centinel.core.audit.AuditReport;
import com.centinel.core.ledger.Digests;
import com.centinel.core.model.HashRecord;
import com.centinel.core.model.NormalizedSnapshot;
import com.centinel.core.model.RawDocument;
import com.centinel.core.normalizer.CanonicalJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import java.util.stream.Stream;

/**
 * Directory-backed store:
 *
 * <pre>
 * &lt;root&gt;/&lt;source&gt;/raw/&lt;stamp&gt;_&lt;sha&gt;.json           raw bytes as retrieved
 * &lt;root&gt;/&lt;source&gt;/raw/&lt;stamp&gt;_&lt;sha&gt;.meta.json      retrieval metadata and SHA-256 of the bytes
 * &lt;root&gt;/&lt;source&gt;/normalized/&lt;stamp&gt;_&lt;code&gt;.json   canonical JSON of the snapshot
 * &lt;root&gt;/&lt;source&gt;/hashchain.jsonl          one hash record per line
 * &lt;root&gt;/reports/audit-&lt;stamp&gt;.json
 * </pre>
 *
 * Files are never overwritten and the chain file is only appended to. Source
 * ids are used as directory names and must already be safe ones.
 */
public class FileSystemSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemSnapshotStore.class);

    static final String RAW_DIR = "raw";
    static final String NORMALIZED_DIR = "normalized";
    static final String CHAIN_FILE = "hashchain.jsonl";
    static final String REPORTS_DIR = "reports";

    private final Path root;

    public FileSystemSnapshotStore(Path root) {
        this.root = Objects.requireNonNull(root, "Store root cannot be null");
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot create store root " + root, e);
        }
    }

    public Path getRoot() {
        return root;
    }

    @Override
    public void saveRaw(RawDocument raw) {
        Objects.requireNonNull(raw, "Raw document cannot be null");
        Path dir = sourceDir(raw.sourceId()).resolve(RAW_DIR);
        byte[] content = raw.content();
        String key = StoreKeys.rawKey(raw.retrievedAt(), content);

        Map<String, Object> meta = new TreeMap<>();
        meta.put("source_id", raw.sourceId());
        meta.put("retrieved_at", raw.retrievedAt().toString());
        meta.put("content_type", raw.contentType());
        meta.put("status", raw.status());
        meta.put("sha256", Digests.sha256Hex(content));

        writeOnce(dir.resolve(key + ".json"), content);
        writeOnce(dir.resolve(key + ".meta.json"), CanonicalJson.serializeToBytes(meta));
    }

    @Override
    public void saveNormalized(NormalizedSnapshot snapshot) {
        Objects.requireNonNull(snapshot, "Snapshot cannot be null");
        Path file = sourceDir(snapshot.sourceId()).resolve(NORMALIZED_DIR)
                .resolve(StoreKeys.normalizedKey(snapshot) + ".json");
        writeOnce(file, CanonicalJson.serializeToBytes(snapshot));
    }

    @Override
    public List<NormalizedSnapshot> loadNormalized(String sourceId) {
        Path dir = sourceDir(sourceId).resolve(NORMALIZED_DIR);
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<NormalizedSnapshot> snapshots = new ArrayList<>();
        for (Path file : listJson(dir)) {
            snapshots.add(readSnapshot(file));
        }
        snapshots.sort(StoreKeys.OBSERVATION_ORDER);
        return List.copyOf(snapshots);
    }

    @Override
    public Optional<NormalizedSnapshot> findNormalized(String sourceId, String snapshotRef) {
        Objects.requireNonNull(snapshotRef, "Snapshot ref cannot be null");
        return StoreKeys.normalizedKey(snapshotRef)
                .map(key -> sourceDir(sourceId).resolve(NORMALIZED_DIR).resolve(key + ".json"))
                .filter(Files::isRegularFile)
                .map(this::readSnapshot)
                .filter(snapshot -> snapshot.snapshotRef().equals(snapshotRef));
    }

    @Override
    public synchronized void appendHashRecord(String sourceId, HashRecord record) {
        Objects.requireNonNull(record, "Hash record cannot be null");
        Path file = sourceDir(sourceId).resolve(CHAIN_FILE);
        long existing = countRecords(file);
        if (record.sequenceIndex() != existing) {
            throw new SnapshotStoreException("Hash record " + record.sequenceIndex() + " of " + sourceId
                    + " does not extend the stored chain of " + existing + " records");
        }
        String line = CanonicalJson.serialize(record) + "\n";
        try {
            Files.createDirectories(file.getParent());
            Files.write(file, line.getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot append hash record to " + file, e);
        }
    }

    @Override
    public synchronized List<HashRecord> readHashRecords(String sourceId) {
        Path file = sourceDir(sourceId).resolve(CHAIN_FILE);
        if (!Files.isRegularFile(file)) {
            return List.of();
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot read hash chain " + file, e);
        }
        List<HashRecord> records = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            try {
                records.add(CanonicalJson.read(line, HashRecord.class));
            } catch (IllegalArgumentException e) {
                throw new SnapshotStoreException("Unreadable hash record at line " + (i + 1) + " of " + file, e);
            }
        }
        return List.copyOf(records);
    }

    @Override
    public String saveReport(AuditReport report) {
        Objects.requireNonNull(report, "Report cannot be null");
        Path file = root.resolve(REPORTS_DIR)
                .resolve("audit-" + StoreKeys.stamp(report.runMetadata().generatedAt()) + ".json");
        writeOnce(file, CanonicalJson.pretty(report).getBytes(StandardCharsets.UTF_8));
        log.info("Audit report written to {}", file);
        return file.toString();
    }

    @Override
    public Set<String> sources() {
        Set<String> sources = new TreeSet<>();
        try (Stream<Path> children = Files.list(root)) {
            children.filter(Files::isDirectory)
                    .map(path -> path.getFileName().toString())
                    .filter(name -> !REPORTS_DIR.equals(name))
                    .forEach(sources::add);
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot list sources under " + root, e);
        }
        return Collections.unmodifiableSet(sources);
    }

    // ==================== Private Methods ====================

    private Path sourceDir(String sourceId) {
        return root.resolve(StoreKeys.sourceDirectory(sourceId));
    }

    private void writeOnce(Path file, byte[] content) {
        try {
            Files.createDirectories(file.getParent());
            if (Files.exists(file)) {
                verifyIdentical(file, content);
                return;
            }
            Files.write(file, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
        } catch (FileAlreadyExistsException e) {
            verifyIdentical(file, content);
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot write " + file, e);
        }
    }

    private void verifyIdentical(Path file, byte[] content) {
        try {
            if (!Arrays.equals(Files.readAllBytes(file), content)) {
                throw new SnapshotStoreException("Refusing to overwrite " + file + " with different content");
            }
            log.debug("{} already stored with identical content", file);
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot read " + file, e);
        }
    }

    private NormalizedSnapshot readSnapshot(Path file) {
        try {
            return CanonicalJson.read(Files.readString(file, StandardCharsets.UTF_8), NormalizedSnapshot.class);
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot read snapshot " + file, e);
        } catch (IllegalArgumentException e) {
            throw new SnapshotStoreException("Unreadable snapshot " + file, e);
        }
    }

    private List<Path> listJson(Path dir) {
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(path -> path.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new SnapshotStoreException("Cannot list " + dir, e);
        }
    }

    private long countRecords(Path file) {
        if (!Files.isRegularFile(file)) {
            return 0;
        }
        try (Stream<String> lines = Files.lines(file, StandardCharsets.UTF_8)) {
            return lines.filter(line -> !line.isBlank()).count();
        } catch (IOException | UncheckedIOException e) {
            throw new SnapshotStoreException("Cannot read hash chain " + file, e);
        }
    }
}
