package com.centinel.core.normalizer;

import com.centinel.core.config.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.*;

/**
 * Declares where each canonical field lives in a source document.
 *
 * <p>Every field has an ordered list of dot-delimited candidate paths; the
 * normalizer takes the first one that resolves. Source shapes drift over an
 * election night, so operators edit this mapping instead of code. Fields left
 * out of a configuration file fall back to {@link #defaults()}.
 */
public record FieldMapConfig(
        @JsonProperty("totals") Map<String, List<String>> totals,
        @JsonProperty("candidate_roots") List<String> candidateRoots,
        @JsonProperty("candidate_fields") CandidateFieldPaths candidateFields,
        @JsonProperty("timestamp") List<String> timestamp,
        @JsonProperty("election_level") List<String> electionLevel,
        @JsonProperty("geography_code") List<String> geographyCode,
        @JsonProperty("geography_name") List<String> geographyName,
        @JsonProperty("processed_units") List<String> processedUnits,
        @JsonProperty("total_units") List<String> totalUnits,
        @JsonProperty("metadata") Map<String, List<String>> metadata,
        @JsonProperty("metadata_root") String metadataRoot,
        @JsonProperty("default_election_level") String defaultElectionLevel
) {

    public static final String VALID_VOTES = "valid_votes";
    public static final String NULL_VOTES = "null_votes";
    public static final String BLANK_VOTES = "blank_votes";
    public static final String TOTAL_VOTES = "total_votes";
    public static final String REGISTERED_VOTERS = "registered_voters";

    public static final List<String> TOTALS_FIELDS = List.of(
            VALID_VOTES, NULL_VOTES, BLANK_VOTES, TOTAL_VOTES, REGISTERED_VOTERS);

    private static final Map<String, List<String>> DEFAULT_TOTALS = Map.of(
            REGISTERED_VOTERS, List.of("registered_voters", "inscritos", "padron"),
            TOTAL_VOTES, List.of("total_votes", "total_votos", "votos_emitidos"),
            VALID_VOTES, List.of("valid_votes", "votos_validos", "validos"),
            NULL_VOTES, List.of("null_votes", "votos_nulos", "nulos"),
            BLANK_VOTES, List.of("blank_votes", "votos_blancos", "blancos"));

    public FieldMapConfig {
        totals = immutableSorted(totals);
        candidateRoots = candidateRoots != null ? List.copyOf(candidateRoots) : List.of();
        Objects.requireNonNull(candidateFields, "Candidate field paths cannot be null");
        timestamp = copy(timestamp);
        electionLevel = copy(electionLevel);
        geographyCode = copy(geographyCode);
        geographyName = copy(geographyName);
        processedUnits = copy(processedUnits);
        totalUnits = copy(totalUnits);
        metadata = immutableSorted(metadata);
        defaultElectionLevel = defaultElectionLevel != null ? defaultElectionLevel : "NATIONAL";
    }

    /**
     * Mapping that accepts the key aliases seen in published result files.
     */
    public static FieldMapConfig defaults() {
        return new FieldMapConfig(
                DEFAULT_TOTALS,
                List.of("candidatos", "candidates", "resultados", "partidos"),
                CandidateFieldPaths.defaults(),
                List.of("timestamp", "timestamp_utc", "fecha", "meta.timestamp_utc", "metadata.timestamp_utc"),
                List.of("nivel", "level", "election_level"),
                List.of("department_code", "codigo_departamento", "meta.department_code"),
                List.of("departamento", "department", "dep", "meta.department"),
                List.of("actas.divulgadas", "actas.procesadas", "actas_procesadas", "totals.actas_procesadas"),
                List.of("actas.totales", "actas.total", "actas_totales", "totals.actas_totales"),
                Map.of(),
                null,
                "NATIONAL");
    }

    /**
     * Mapping that reads the canonical snapshot layout itself, so that an
     * already-normalized document re-normalizes to an equal snapshot.
     */
    public static FieldMapConfig identity() {
        Map<String, List<String>> totals = new LinkedHashMap<>();
        for (String field : TOTALS_FIELDS) {
            totals.put(field, List.of("totals." + field));
        }
        return new FieldMapConfig(
                totals,
                List.of("candidates"),
                new CandidateFieldPaths(
                        List.of("slot"), List.of("votes"), List.of("candidate_id"),
                        List.of("name"), List.of("party")),
                List.of("timestamp_source"),
                List.of("election_level"),
                List.of("geography.code"),
                List.of("geography.name"),
                List.of("progress.processed_units"),
                List.of("progress.total_units"),
                Map.of(),
                "metadata",
                "NATIONAL");
    }

    /**
     * Jackson entry point: absent sections fall back to {@link #defaults()};
     * a partial {@code totals} section only overrides the fields it names.
     */
    @JsonCreator
    static FieldMapConfig fromJson(
            @JsonProperty("totals") Map<String, List<String>> totals,
            @JsonProperty("candidate_roots") List<String> candidateRoots,
            @JsonProperty("candidate_fields") CandidateFieldPaths candidateFields,
            @JsonProperty("timestamp") List<String> timestamp,
            @JsonProperty("election_level") List<String> electionLevel,
            @JsonProperty("geography_code") List<String> geographyCode,
            @JsonProperty("geography_name") List<String> geographyName,
            @JsonProperty("processed_units") List<String> processedUnits,
            @JsonProperty("total_units") List<String> totalUnits,
            @JsonProperty("metadata") Map<String, List<String>> metadata,
            @JsonProperty("metadata_root") String metadataRoot,
            @JsonProperty("default_election_level") String defaultElectionLevel) {
        FieldMapConfig base = defaults();
        Map<String, List<String>> mergedTotals = new LinkedHashMap<>(base.totals());
        if (totals != null) {
            mergedTotals.putAll(totals);
        }
        return new FieldMapConfig(
                mergedTotals,
                candidateRoots != null ? candidateRoots : base.candidateRoots(),
                candidateFields != null ? candidateFields : base.candidateFields(),
                timestamp != null ? timestamp : base.timestamp(),
                electionLevel != null ? electionLevel : base.electionLevel(),
                geographyCode != null ? geographyCode : base.geographyCode(),
                geographyName != null ? geographyName : base.geographyName(),
                processedUnits != null ? processedUnits : base.processedUnits(),
                totalUnits != null ? totalUnits : base.totalUnits(),
                metadata != null ? metadata : base.metadata(),
                metadataRoot,
                defaultElectionLevel != null ? defaultElectionLevel : base.defaultElectionLevel());
    }

    public List<String> totalsPaths(String field) {
        return totals.getOrDefault(field, List.of());
    }

    /**
     * Rejects mappings that cannot produce a meaningful snapshot.
     */
    public void validate() {
        for (String field : totals.keySet()) {
            if (!TOTALS_FIELDS.contains(field)) {
                throw new ConfigurationException("field_map.totals: unknown field '" + field
                        + "', expected one of " + TOTALS_FIELDS);
            }
        }
        for (String field : TOTALS_FIELDS) {
            if (totalsPaths(field).isEmpty()) {
                throw new ConfigurationException("field_map.totals." + field + " must list at least one path");
            }
        }
        if (candidateFields.votes().isEmpty()) {
            throw new ConfigurationException("field_map.candidate_fields.votes must list at least one path");
        }
        List<List<String>> all = new ArrayList<>(totals.values());
        all.add(candidateRoots);
        all.addAll(List.of(timestamp, electionLevel, geographyCode, geographyName, processedUnits, totalUnits));
        all.addAll(metadata.values());
        all.addAll(candidateFields.all());
        for (List<String> paths : all) {
            for (String path : paths) {
                if (path == null || path.isBlank() || path.startsWith(".") || path.endsWith(".")
                        || path.contains("..")) {
                    throw new ConfigurationException("field_map: malformed path '" + path + "'");
                }
            }
        }
    }

    private static List<String> copy(List<String> paths) {
        return paths != null ? List.copyOf(paths) : List.of();
    }

    private static Map<String, List<String>> immutableSorted(Map<String, List<String>> source) {
        TreeMap<String, List<String>> result = new TreeMap<>();
        if (source != null) {
            source.forEach((key, value) -> result.put(key, copy(value)));
        }
        return Collections.unmodifiableSortedMap(result);
    }

    // ==================== Inner Types ====================

    /**
     * Paths relative to one candidate entry.
     */
    public record CandidateFieldPaths(
            @JsonProperty("slot") List<String> slot,
            @JsonProperty("votes") List<String> votes,
            @JsonProperty("candidate_id") List<String> candidateId,
            @JsonProperty("name") List<String> name,
            @JsonProperty("party") List<String> party
    ) {
        public CandidateFieldPaths {
            slot = copy(slot);
            votes = copy(votes);
            candidateId = copy(candidateId);
            name = copy(name);
            party = copy(party);
        }

        public static CandidateFieldPaths defaults() {
            return new CandidateFieldPaths(
                    List.of("posicion", "orden", "slot"),
                    List.of("votos", "votes"),
                    List.of("id", "candidate_id"),
                    List.of("candidato", "nombre", "name"),
                    List.of("partido", "party"));
        }

        @JsonCreator
        static CandidateFieldPaths fromJson(
                @JsonProperty("slot") List<String> slot,
                @JsonProperty("votes") List<String> votes,
                @JsonProperty("candidate_id") List<String> candidateId,
                @JsonProperty("name") List<String> name,
                @JsonProperty("party") List<String> party) {
            CandidateFieldPaths base = defaults();
            return new CandidateFieldPaths(
                    slot != null ? slot : base.slot(),
                    votes != null ? votes : base.votes(),
                    candidateId != null ? candidateId : base.candidateId(),
                    name != null ? name : base.name(),
                    party != null ? party : base.party());
        }

        List<List<String>> all() {
            return List.of(slot, votes, candidateId, name, party);
        }
    }
}
