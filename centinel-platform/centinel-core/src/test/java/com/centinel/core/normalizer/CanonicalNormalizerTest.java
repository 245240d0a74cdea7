package com.centinel.core.normalizer;

import com.centinel.core.config.ConfigLoader;
import com.centinel.core.ledger.HashChain;
import com.centinel.core.model.*;
import net.jqwik.api.*;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the canonical normalizer: field-map driven extraction, coercion
 * warnings, failure reasons and determinism.
 */
class CanonicalNormalizerTest {

    private static final Instant RETRIEVED = Instant.parse("2025-11-30T20:05:00Z");

    private static final String CNE_DOCUMENT = """
            {
              "departamento": "Francisco Morazán",
              "fecha_corte": "2025-11-30T20:00:00Z",
              "corte": 1,
              "estadisticas": {
                "padron": 1500,
                "actas": {"divulgadas": 40, "totales": 100},
                "distribucion_votos": {"validos": 950, "nulos": 30, "blancos": 20, "total": 1000}
              },
              "resultados": [
                {"candidato": "Candidata A", "partido": "P1", "votos": 500},
                {"candidato": "Candidato B", "partido": "P2", "votos": "450"}
              ]
            }
            """;

    private final FieldMapConfig cneFieldMap =
            new ConfigLoader().loadResource("fixtures/cne-config.json").fieldMap();

    // ==================== Field Map Extraction ====================

    @Test
    void normalize_mapsNestedSourceFieldsOntoCanonicalSchema() {
        // Given
        CanonicalNormalizer normalizer = new CanonicalNormalizer(2, List.of("estadisticas"));
        RawDocument raw = RawDocument.json("cne-fm", RETRIEVED, CNE_DOCUMENT);

        // When
        NormalizedSnapshot snapshot = normalizer.normalize(raw, cneFieldMap);

        // Then
        assertThat(snapshot.sourceId()).isEqualTo("cne-fm");
        assertThat(snapshot.electionLevel()).isEqualTo("PRESIDENTIAL");
        assertThat(snapshot.geography()).isEqualTo(new Geography("08", "Francisco Morazán"));
        assertThat(snapshot.timestampSource()).isEqualTo("2025-11-30T20:00:00Z");
        assertThat(snapshot.timestampObserved()).isEqualTo(RETRIEVED);
        assertThat(snapshot.totals()).isEqualTo(new Totals(950, 30, 20, 1000, 1500));
        assertThat(snapshot.progress()).isEqualTo(new Progress(40L, 100L));
        assertThat(snapshot.candidates()).containsExactly(
                new CandidateResult(0, 500, null, "Candidata A", "P1"),
                new CandidateResult(1, 450, null, "Candidato B", "P2"));
        assertThat(snapshot.metadata()).containsEntry("corte", 1L)
                .doesNotContainKeys(NormalizedSnapshot.COERCION_WARNINGS,
                        NormalizedSnapshot.CANDIDATE_COUNT_WARNING);
    }

    @Test
    void normalize_coercesNonNumericVotesToZeroWithWarning() {
        // Given
        String json = """
                {"candidatos": [{"votos": 10}, {"votos": "n/a"}, {"nombre": "sin votos"}],
                 "votos_validos": "1,234"}
                """;

        // When
        NormalizedSnapshot snapshot = new CanonicalNormalizer()
                .normalize(RawDocument.json("cne", RETRIEVED, json), FieldMapConfig.defaults());

        // Then
        assertThat(snapshot.votesBySlot()).containsExactly(entry(0, 10L), entry(1, 0L), entry(2, 0L));
        assertThat(snapshot.totals().validVotes()).isEqualTo(1234);
        assertThat(snapshot.coercionWarnings()).containsExactly(
                "candidatos.1.votos: non-numeric value 'n/a', coerced to 0",
                "candidatos.2: missing votes, coerced to 0");
    }

    @Test
    void normalize_coercesCountsBeyondLongRangeToZeroWithWarning() {
        String json = """
                {"candidatos": [{"votos": 10}, {"votos": 1e30}, {"votos": 18446744073709551616}]}
                """;

        NormalizedSnapshot snapshot = new CanonicalNormalizer()
                .normalize(RawDocument.json("cne", RETRIEVED, json), FieldMapConfig.defaults());

        assertThat(snapshot.votesBySlot()).containsExactly(entry(0, 10L), entry(1, 0L), entry(2, 0L));
        assertThat(snapshot.coercionWarnings()).hasSize(2)
                .anySatisfy(warning -> assertThat(warning).startsWith("candidatos.1.votos").endsWith("coerced to 0"))
                .anySatisfy(warning -> assertThat(warning).startsWith("candidatos.2.votos").endsWith("coerced to 0"));
    }

    @Test
    void normalize_truncatesFractionalCounts() {
        String json = """
                {"candidatos": [{"votos": 12.9}, {"votos": "7.5"}, {"votos": " 3 000 "}]}
                """;

        NormalizedSnapshot snapshot = new CanonicalNormalizer()
                .normalize(RawDocument.json("cne", RETRIEVED, json), FieldMapConfig.defaults());

        assertThat(snapshot.votesBySlot().values()).containsExactly(12L, 7L, 3000L);
        assertThat(snapshot.coercionWarnings()).isEmpty();
    }

    @Test
    void normalize_derivesTotalVotesWhenAbsent() {
        String json = """
                {"candidatos": [], "votos_validos": 90, "votos_nulos": 6, "votos_blancos": 4}
                """;

        NormalizedSnapshot snapshot = new CanonicalNormalizer()
                .normalize(RawDocument.json("cne", RETRIEVED, json), FieldMapConfig.defaults());

        assertThat(snapshot.totals().totalVotes()).isEqualTo(100);
        assertThat(snapshot.metadata().get(NormalizedSnapshot.DERIVED_FIELDS))
                .isEqualTo(List.of("total_votes"));
    }

    @Test
    void normalize_readsKeyedCandidateObjectsWithNumericKeysAsSlots() {
        String json = """
                {"resultados": {"1": 40, "2": {"votos": 30, "partido": "P2"}}}
                """;

        NormalizedSnapshot snapshot = new CanonicalNormalizer()
                .normalize(RawDocument.json("cne", RETRIEVED, json), FieldMapConfig.defaults());

        assertThat(snapshot.candidates()).containsExactly(
                CandidateResult.of(1, 40),
                new CandidateResult(2, 30, null, null, "P2"));
    }

    @Test
    void normalize_unwrapsCandidateArrayHeldInsideRootObject() {
        String json = """
                {"resultados": {"candidatos": [{"posicion": 7, "votos": 5}], "total": 5}}
                """;

        NormalizedSnapshot snapshot = new CanonicalNormalizer()
                .normalize(RawDocument.json("cne", RETRIEVED, json), FieldMapConfig.defaults());

        assertThat(snapshot.candidates()).containsExactly(CandidateResult.of(7, 5));
    }

    @Test
    void normalize_recordsDuplicateSlots() {
        String json = """
                {"candidatos": [{"slot": 1, "votos": 5}, {"slot": 1, "votos": 6}]}
                """;

        NormalizedSnapshot snapshot = new CanonicalNormalizer()
                .normalize(RawDocument.json("cne", RETRIEVED, json), FieldMapConfig.defaults());

        assertThat(snapshot.metadata().get(NormalizedSnapshot.DUPLICATE_SLOTS)).isEqualTo(List.of(1L));
        assertThat(snapshot.votesBySlot()).containsExactly(entry(1, 5L));
    }

    @Test
    void normalize_resolvesDepartmentCodeFromName() {
        String json = """
                {"departamento": "  atlantida ", "candidatos": []}
                """;

        NormalizedSnapshot snapshot = new CanonicalNormalizer()
                .normalize(RawDocument.json("cne", RETRIEVED, json), FieldMapConfig.defaults());

        assertThat(snapshot.geography().code()).isEqualTo("01");
        assertThat(snapshot.geography().name()).isEqualTo("atlantida");
    }

    @Test
    void normalize_padsNumericDepartmentCodeAndNamesIt() {
        String json = """
                {"department_code": 5, "candidatos": []}
                """;

        NormalizedSnapshot snapshot = new CanonicalNormalizer()
                .normalize(RawDocument.json("cne", RETRIEVED, json), FieldMapConfig.defaults());

        assertThat(snapshot.geography()).isEqualTo(new Geography("05", "Copán"));
    }

    @Test
    void normalize_defaultsToNationalGeography() {
        NormalizedSnapshot snapshot = new CanonicalNormalizer()
                .normalize(RawDocument.json("cne", RETRIEVED, "{\"candidatos\": []}"), FieldMapConfig.defaults());

        assertThat(snapshot.geography()).isEqualTo(Geography.national());
        assertThat(snapshot.timestampSource()).isNull();
        assertThat(snapshot.progress()).isEqualTo(Progress.unknown());
    }

    // ==================== Candidate Count ====================

    @Test
    void normalize_recordsFewerCandidatesThanConfiguredAsWarning() {
        CanonicalNormalizer normalizer = new CanonicalNormalizer(3, List.of());

        NormalizedSnapshot snapshot = normalizer.normalize(
                RawDocument.json("cne", RETRIEVED, CNE_DOCUMENT), cneFieldMap);

        assertThat(snapshot.candidates()).hasSize(2);
        assertThat(snapshot.metadata().get(NormalizedSnapshot.CANDIDATE_COUNT_WARNING))
                .isEqualTo("expected 3 candidates, found 2");
    }

    @Test
    void normalize_recordsMoreCandidatesThanConfiguredAsWarning() {
        CanonicalNormalizer normalizer = new CanonicalNormalizer(1, List.of());

        NormalizedSnapshot snapshot = normalizer.normalize(
                RawDocument.json("cne", RETRIEVED, CNE_DOCUMENT), cneFieldMap);

        assertThat(snapshot.candidates()).hasSize(2);
        assertThat(snapshot.metadata()).containsKey(NormalizedSnapshot.CANDIDATE_COUNT_WARNING);
    }

    // ==================== Failures ====================

    @Test
    void normalize_failsWhenRequiredKeyMissing() {
        CanonicalNormalizer normalizer = new CanonicalNormalizer(0, List.of("estadisticas.padron"));

        assertThatThrownBy(() -> normalizer.normalize(
                RawDocument.json("cne", RETRIEVED, "{\"candidatos\": []}"), FieldMapConfig.defaults()))
                .isInstanceOf(NormalizationException.class)
                .satisfies(e -> assertThat(((NormalizationException) e).getReason())
                        .isEqualTo(NormalizationException.Reason.MISSING_REQUIRED_KEY))
                .hasMessageContaining("estadisticas.padron");
    }

    @Test
    void normalize_failsOnInvalidJson() {
        assertThatThrownBy(() -> new CanonicalNormalizer().normalize(
                RawDocument.json("cne", RETRIEVED, "{\"candidatos\": [1, 2"), FieldMapConfig.defaults()))
                .isInstanceOf(NormalizationException.class)
                .satisfies(e -> assertThat(((NormalizationException) e).getReason())
                        .isEqualTo(NormalizationException.Reason.UNPARSABLE_DOCUMENT));
    }

    @Test
    void normalize_failsWhenRootIsNotAnObject() {
        assertThatThrownBy(() -> new CanonicalNormalizer().normalize(
                RawDocument.json("cne", RETRIEVED, "[1, 2, 3]"), FieldMapConfig.defaults()))
                .isInstanceOf(NormalizationException.class)
                .satisfies(e -> assertThat(((NormalizationException) e).getReason())
                        .isEqualTo(NormalizationException.Reason.UNPARSABLE_DOCUMENT));
    }

    @Test
    void normalize_failsWhenNoCandidateRootResolves() {
        assertThatThrownBy(() -> new CanonicalNormalizer().normalize(
                RawDocument.json("cne", RETRIEVED, "{\"votos_validos\": 10}"), FieldMapConfig.defaults()))
                .isInstanceOf(NormalizationException.class)
                .satisfies(e -> assertThat(((NormalizationException) e).getReason())
                        .isEqualTo(NormalizationException.Reason.CANDIDATE_ROOT_NOT_FOUND));
    }

    // ==================== Determinism Properties ====================

    @Property(tries = 100)
    void normalize_isDeterministic(@ForAll("rawDocuments") Map<String, Object> document) throws Exception {
        // Property: same raw bytes and field map give byte-identical canonical output
        String json = CanonicalJson.mapper().writeValueAsString(document);
        RawDocument raw = RawDocument.json("cne", RETRIEVED, json);

        NormalizedSnapshot first = new CanonicalNormalizer(3, List.of()).normalize(raw, FieldMapConfig.defaults());
        NormalizedSnapshot second = new CanonicalNormalizer(3, List.of()).normalize(raw, FieldMapConfig.defaults());

        assertThat(CanonicalJson.serialize(second)).isEqualTo(CanonicalJson.serialize(first));
        assertThat(HashChain.contentHash(second)).isEqualTo(HashChain.contentHash(first));
    }

    @Property(tries = 100)
    void normalize_identityMapReproducesSerializedSnapshot(
            @ForAll("rawDocuments") Map<String, Object> document) throws Exception {
        // Property: normalize -> serialize -> parse -> re-normalize with identity map is equal
        CanonicalNormalizer normalizer = new CanonicalNormalizer(3, List.of());
        RawDocument raw = RawDocument.json("cne", RETRIEVED, CanonicalJson.mapper().writeValueAsString(document));
        NormalizedSnapshot original = normalizer.normalize(raw, FieldMapConfig.defaults());

        RawDocument serialized = RawDocument.json("cne", RETRIEVED, CanonicalJson.serialize(original));
        NormalizedSnapshot reparsed = normalizer.normalize(serialized, FieldMapConfig.identity());

        assertThat(reparsed).isEqualTo(original);
    }

    @Provide
    Arbitrary<Map<String, Object>> rawDocuments() {
        Arbitrary<Object> count = Arbitraries.oneOf(
                Arbitraries.longs().between(0, 5_000_000).map(v -> (Object) v),
                Arbitraries.longs().between(0, 5_000_000).map(v -> (Object) String.format(Locale.US, "%,d", v)),
                Arbitraries.strings().alpha().ofMinLength(1).ofMaxLength(5).map(s -> (Object) s));
        Arbitrary<List<Map<String, Object>>> candidates = Combinators.combine(
                        count, Arbitraries.of("Ana", "Luis", "Marta"))
                .as((votes, name) -> Map.<String, Object>of("votos", votes, "nombre", name))
                .list().ofMaxSize(6);
        Arbitrary<String> department = Arbitraries.of("Yoro", "Colón", "Valle", "Lugar Desconocido");

        return Combinators.combine(candidates, count, count, department).as((list, valid, total, dep) -> {
            Map<String, Object> doc = new LinkedHashMap<>();
            doc.put("departamento", dep);
            doc.put("timestamp", "2025-11-30 20:00:00");
            doc.put("candidatos", list);
            doc.put("votos_validos", valid);
            doc.put("total_votos", total);
            doc.put("actas", Map.of("divulgadas", 10, "totales", 20));
            return doc;
        });
    }
}
