package com.centinel.core.normalizer;

import com.centinel.core.SnapshotFixtures;
import com.centinel.core.model.NormalizedSnapshot;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.assertj.core.api.Assertions.*;

class CanonicalJsonTest {

    @Test
    void serialize_sortsKeysRecursivelyWithoutWhitespace() {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("b", 1);
        value.put("a", Map.of("z", true, "m", List.of(Map.of("y", 1, "x", 2))));

        assertThat(CanonicalJson.serialize(value))
                .isEqualTo("{\"a\":{\"m\":[{\"x\":2,\"y\":1}],\"z\":true},\"b\":1}");
    }

    @Test
    void serialize_writesSnapshotWithSnakeCaseKeysAndIsoInstants() {
        NormalizedSnapshot snapshot = SnapshotFixtures.at(0, 5, 7);

        String json = CanonicalJson.serialize(snapshot);

        assertThat(json).contains("\"timestamp_observed\":\"2025-11-30T20:00:00Z\"")
                .contains("\"valid_votes\":12")
                .doesNotContain("snapshotRef")
                .doesNotContain(" ");
        assertThat(json.indexOf("\"candidates\"")).isLessThan(json.indexOf("\"election_level\""));
    }

    @Test
    void read_restoresEqualSnapshot() {
        NormalizedSnapshot snapshot = SnapshotFixtures.snapshot()
                .votes(500, 450)
                .progress(40L, 100L)
                .metadata(Map.of("corte", 3, "tags", List.of("a", "b")))
                .build();

        NormalizedSnapshot restored = CanonicalJson.read(CanonicalJson.serialize(snapshot), NormalizedSnapshot.class);

        assertThat(restored).isEqualTo(snapshot);
    }
}
