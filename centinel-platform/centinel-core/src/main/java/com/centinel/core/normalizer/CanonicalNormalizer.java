package com.centinel.core.normalizer;

import com.centinel.core.model.*;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.*;

/**
 * Maps a raw JSON document onto the canonical snapshot schema.
 *
 * <p>The mapping is a pure function of the raw document and the field map:
 * the same inputs always give a snapshot with byte-identical canonical
 * serialization. Missing or malformed counters never abort normalization;
 * they become zero and are listed in {@code metadata.coercion_warnings}.
 */
public final class CanonicalNormalizer {

    private static final Logger log = LoggerFactory.getLogger(CanonicalNormalizer.class);

    private static final List<String> CANDIDATE_WRAPPERS = List.of("candidatos", "candidates");
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper mapper = CanonicalJson.mapper();
    private final int candidateCount;
    private final List<String> requiredKeys;

    /**
     * @param candidateCount expected number of candidates, {@code 0} disables the check
     * @param requiredKeys   paths that must resolve in every raw document
     */
    public CanonicalNormalizer(int candidateCount, List<String> requiredKeys) {
        if (candidateCount < 0) {
            throw new IllegalArgumentException("Candidate count cannot be negative");
        }
        this.candidateCount = candidateCount;
        this.requiredKeys = requiredKeys != null ? List.copyOf(requiredKeys) : List.of();
    }

    public CanonicalNormalizer() {
        this(0, List.of());
    }

    public NormalizedSnapshot normalize(RawDocument raw, FieldMapConfig fieldMap) {
        Objects.requireNonNull(raw, "Raw document cannot be null");
        Objects.requireNonNull(fieldMap, "Field map cannot be null");

        JsonNode root = parse(raw);
        checkRequiredKeys(root, raw);

        List<String> warnings = new ArrayList<>();
        List<String> derived = new ArrayList<>();

        Totals totals = extractTotals(root, fieldMap, warnings, derived);
        Progress progress = new Progress(
                optionalCount(root, fieldMap.processedUnits(), warnings),
                optionalCount(root, fieldMap.totalUnits(), warnings));
        List<Integer> duplicateSlots = new ArrayList<>();
        List<CandidateResult> candidates = extractCandidates(root, fieldMap, warnings, duplicateSlots);

        Map<String, Object> metadata = extractMetadata(root, fieldMap);
        if (!warnings.isEmpty()) {
            metadata.put(NormalizedSnapshot.COERCION_WARNINGS, List.copyOf(warnings));
        }
        if (!derived.isEmpty()) {
            metadata.put(NormalizedSnapshot.DERIVED_FIELDS, List.copyOf(derived));
        }
        if (!duplicateSlots.isEmpty()) {
            metadata.put(NormalizedSnapshot.DUPLICATE_SLOTS, List.copyOf(duplicateSlots));
        }
        if (candidateCount > 0 && candidates.size() != candidateCount) {
            metadata.put(NormalizedSnapshot.CANDIDATE_COUNT_WARNING,
                    "expected " + candidateCount + " candidates, found " + candidates.size());
        }

        NormalizedSnapshot snapshot = new NormalizedSnapshot(
                raw.sourceId(),
                text(root, fieldMap.electionLevel()).orElse(fieldMap.defaultElectionLevel()),
                extractGeography(root, fieldMap),
                text(root, fieldMap.timestamp()).orElse(null),
                raw.retrievedAt(),
                totals,
                progress,
                candidates,
                metadata);

        if (warnings.isEmpty()) {
            log.debug("Normalized {} with {} candidates", snapshot.snapshotRef(), candidates.size());
        } else {
            log.warn("Normalized {} with {} coercion warning(s): {}",
                    snapshot.snapshotRef(), warnings.size(), warnings);
        }
        return snapshot;
    }

    // ==================== Parsing ====================

    private JsonNode parse(RawDocument raw) {
        JsonNode root;
        try {
            root = mapper.readTree(raw.content());
        } catch (IOException e) {
            throw new NormalizationException(NormalizationException.Reason.UNPARSABLE_DOCUMENT,
                    "Document from " + raw.sourceId() + " at " + raw.retrievedAt()
                            + " is not valid JSON: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new NormalizationException(NormalizationException.Reason.UNPARSABLE_DOCUMENT,
                    "Document from " + raw.sourceId() + " at " + raw.retrievedAt()
                            + " must contain a JSON object at its root");
        }
        return root;
    }

    private void checkRequiredKeys(JsonNode root, RawDocument raw) {
        for (String key : requiredKeys) {
            if (!JsonPathResolver.isPresent(root, key)) {
                throw new NormalizationException(NormalizationException.Reason.MISSING_REQUIRED_KEY,
                        "Required key '" + key + "' missing in document from " + raw.sourceId()
                                + " at " + raw.retrievedAt());
            }
        }
    }

    // ==================== Totals & Progress ====================

    private Totals extractTotals(JsonNode root, FieldMapConfig fieldMap,
                                 List<String> warnings, List<String> derived) {
        OptionalLong valid = count(root, fieldMap.totalsPaths(FieldMapConfig.VALID_VOTES), warnings);
        OptionalLong nulls = count(root, fieldMap.totalsPaths(FieldMapConfig.NULL_VOTES), warnings);
        OptionalLong blank = count(root, fieldMap.totalsPaths(FieldMapConfig.BLANK_VOTES), warnings);
        OptionalLong total = count(root, fieldMap.totalsPaths(FieldMapConfig.TOTAL_VOTES), warnings);
        OptionalLong registered = count(root, fieldMap.totalsPaths(FieldMapConfig.REGISTERED_VOTERS), warnings);

        long totalVotes;
        if (total.isPresent()) {
            totalVotes = total.getAsLong();
        } else if (valid.isPresent() || nulls.isPresent() || blank.isPresent()) {
            totalVotes = valid.orElse(0) + nulls.orElse(0) + blank.orElse(0);
            derived.add(FieldMapConfig.TOTAL_VOTES);
        } else {
            totalVotes = 0;
        }
        return new Totals(valid.orElse(0), nulls.orElse(0), blank.orElse(0),
                totalVotes, registered.orElse(0));
    }

    /**
     * First present value among {@code paths}, coerced to an integer. A present
     * but non-numeric value counts as zero and is reported; an absent one is
     * empty.
     */
    private OptionalLong count(JsonNode root, List<String> paths, List<String> warnings) {
        Optional<JsonPathResolver.Match> match = JsonPathResolver.firstPresent(root, paths);
        if (match.isEmpty()) {
            return OptionalLong.empty();
        }
        OptionalLong value = NumericCoercion.coerce(match.get().value());
        if (value.isEmpty()) {
            warnings.add(nonNumeric(match.get().path(), match.get().value()) + ", coerced to 0");
            return OptionalLong.of(0);
        }
        return value;
    }

    private Long optionalCount(JsonNode root, List<String> paths, List<String> warnings) {
        Optional<JsonPathResolver.Match> match = JsonPathResolver.firstPresent(root, paths);
        if (match.isEmpty()) {
            return null;
        }
        OptionalLong value = NumericCoercion.coerce(match.get().value());
        if (value.isEmpty()) {
            warnings.add(nonNumeric(match.get().path(), match.get().value()) + ", treated as unknown");
            return null;
        }
        return value.getAsLong();
    }

    // ==================== Candidates ====================

    private List<CandidateResult> extractCandidates(JsonNode root, FieldMapConfig fieldMap,
                                                    List<String> warnings, List<Integer> duplicateSlots) {
        if (fieldMap.candidateRoots().isEmpty()) {
            return List.of();
        }
        JsonPathResolver.Match match = JsonPathResolver.firstPresent(root, fieldMap.candidateRoots())
                .orElseThrow(() -> new NormalizationException(
                        NormalizationException.Reason.CANDIDATE_ROOT_NOT_FOUND,
                        "None of the candidate roots " + fieldMap.candidateRoots() + " is present"));

        JsonNode container = match.value();
        String basePath = match.path();
        if (container.isObject()) {
            for (String wrapper : CANDIDATE_WRAPPERS) {
                JsonNode inner = container.get(wrapper);
                if (inner != null && inner.isArray()) {
                    container = inner;
                    basePath = basePath + "." + wrapper;
                    break;
                }
            }
        }

        List<CandidateResult> candidates = new ArrayList<>();
        if (container.isArray()) {
            for (int i = 0; i < container.size(); i++) {
                candidates.add(readCandidate(container.get(i), i, basePath + "." + i,
                        fieldMap.candidateFields(), warnings));
            }
        } else if (container.isObject()) {
            int position = 0;
            Iterator<Map.Entry<String, JsonNode>> entries = container.fields();
            while (entries.hasNext()) {
                Map.Entry<String, JsonNode> entry = entries.next();
                OptionalLong keySlot = NumericCoercion.coerce(entry.getKey());
                int defaultSlot = keySlot.isPresent() && fitsInt(keySlot.getAsLong())
                        ? (int) keySlot.getAsLong() : position;
                candidates.add(readCandidate(entry.getValue(), defaultSlot,
                        basePath + "." + entry.getKey(), fieldMap.candidateFields(), warnings));
                position++;
            }
        } else {
            throw new NormalizationException(NormalizationException.Reason.CANDIDATE_ROOT_NOT_FOUND,
                    "Candidate root '" + basePath + "' is neither an array nor an object");
        }

        Set<Integer> seen = new HashSet<>();
        for (CandidateResult candidate : candidates) {
            if (!seen.add(candidate.slot()) && !duplicateSlots.contains(candidate.slot())) {
                duplicateSlots.add(candidate.slot());
            }
        }
        return candidates;
    }

    private CandidateResult readCandidate(JsonNode entry, int defaultSlot, String path,
                                          FieldMapConfig.CandidateFieldPaths fields, List<String> warnings) {
        if (entry == null || entry.isNull()) {
            warnings.add(path + ": missing candidate entry");
            return CandidateResult.of(defaultSlot, 0);
        }
        if (!entry.isObject()) {
            OptionalLong votes = NumericCoercion.coerce(entry);
            if (votes.isEmpty()) {
                warnings.add(nonNumeric(path, entry) + ", coerced to 0");
            }
            return CandidateResult.of(defaultSlot, votes.orElse(0));
        }

        int slot = defaultSlot;
        Optional<JsonPathResolver.Match> slotMatch = JsonPathResolver.firstPresent(entry, fields.slot());
        if (slotMatch.isPresent()) {
            OptionalLong parsed = NumericCoercion.coerce(slotMatch.get().value());
            if (parsed.isPresent() && fitsInt(parsed.getAsLong())) {
                slot = (int) parsed.getAsLong();
            } else {
                warnings.add(nonNumeric(path + "." + slotMatch.get().path(), slotMatch.get().value())
                        + ", using position " + defaultSlot);
            }
        }

        long votes = 0;
        Optional<JsonPathResolver.Match> votesMatch = JsonPathResolver.firstPresent(entry, fields.votes());
        if (votesMatch.isEmpty()) {
            warnings.add(path + ": missing votes, coerced to 0");
        } else {
            OptionalLong parsed = NumericCoercion.coerce(votesMatch.get().value());
            if (parsed.isEmpty()) {
                warnings.add(nonNumeric(path + "." + votesMatch.get().path(), votesMatch.get().value())
                        + ", coerced to 0");
            }
            votes = parsed.orElse(0);
        }

        return new CandidateResult(slot, votes,
                text(entry, fields.candidateId()).orElse(null),
                text(entry, fields.name()).orElse(null),
                text(entry, fields.party()).orElse(null));
    }

    // ==================== Geography & Metadata ====================

    private Geography extractGeography(JsonNode root, FieldMapConfig fieldMap) {
        Optional<String> code = JsonPathResolver.firstPresent(root, fieldMap.geographyCode())
                .map(match -> departmentCode(match.value()))
                .filter(value -> !value.isEmpty());
        Optional<String> name = text(root, fieldMap.geographyName()).map(String::strip).filter(value -> !value.isEmpty());

        if (code.isPresent()) {
            String resolvedName = name.or(() -> DepartmentCodes.nameFor(code.get())).orElse(code.get());
            return new Geography(code.get(), resolvedName);
        }
        if (name.isPresent()) {
            return new Geography(DepartmentCodes.codeFor(name.get()), name.get());
        }
        return Geography.national();
    }

    private Map<String, Object> extractMetadata(JsonNode root, FieldMapConfig fieldMap) {
        Map<String, Object> metadata = new TreeMap<>();
        if (fieldMap.metadataRoot() != null) {
            JsonPathResolver.resolve(root, fieldMap.metadataRoot())
                    .filter(JsonNode::isObject)
                    .ifPresent(node -> metadata.putAll(toMap(node)));
        }
        fieldMap.metadata().forEach((key, paths) ->
                JsonPathResolver.firstPresent(root, paths)
                        .ifPresent(match -> metadata.put(key, toValue(match.value()))));
        return metadata;
    }

    // ==================== Utility Methods ====================

    private Optional<String> text(JsonNode root, List<String> paths) {
        return JsonPathResolver.firstPresent(root, paths)
                .map(match -> match.value().isValueNode() ? match.value().asText() : match.value().toString());
    }

    private static String departmentCode(JsonNode node) {
        if (node.isIntegralNumber()) {
            return String.format(Locale.ROOT, "%02d", node.asLong());
        }
        String value = node.isValueNode() ? node.asText().strip() : node.toString();
        if (value.length() == 1 && Character.isDigit(value.charAt(0))) {
            return "0" + value;
        }
        return value;
    }

    private Map<String, Object> toMap(JsonNode node) {
        return mapper.convertValue(node, MAP_TYPE);
    }

    private Object toValue(JsonNode node) {
        return mapper.convertValue(node, Object.class);
    }

    private static String nonNumeric(String path, JsonNode value) {
        String shown = value.isValueNode() ? value.asText() : value.getNodeType().name().toLowerCase(Locale.ROOT);
        return path + ": non-numeric value '" + shown + "'";
    }

    private static boolean fitsInt(long value) {
        return value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE;
    }
}
