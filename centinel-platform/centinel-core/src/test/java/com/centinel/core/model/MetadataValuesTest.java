package com.centinel.core.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class MetadataValuesTest {

    @Test
    void normalize_bringsIntegralNumbersToLong() {
        assertThat(MetadataValues.normalize(7)).isEqualTo(7L);
        assertThat(MetadataValues.normalize(new BigInteger("42"))).isEqualTo(42L);
        assertThat(MetadataValues.normalize(new BigDecimal("12.000"))).isEqualTo(12L);
        assertThat(MetadataValues.normalize(3.0)).isEqualTo(3L);
        assertThat(MetadataValues.normalize(2.5)).isEqualTo(2.5);
    }

    @Test
    void normalize_keepsIntegersBeyondLongRangeAsDecimalText() {
        // Given
        BigInteger huge = BigInteger.TWO.pow(64);

        // When / Then: no silent wrap to a small or negative long
        assertThat(MetadataValues.normalize(huge)).isEqualTo("18446744073709551616");
        assertThat(MetadataValues.normalize(new BigDecimal(huge))).isEqualTo("18446744073709551616");
        assertThat(MetadataValues.normalize(BigInteger.valueOf(Long.MIN_VALUE))).isEqualTo(Long.MIN_VALUE);
        assertThat(MetadataValues.normalize(1e19)).isEqualTo(1e19);
        assertThat(MetadataValues.normalize(-1e30)).isEqualTo(-1e30);
    }

    @Test
    void normalizeMap_sortsKeysAndDropsNulls() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("z", List.of(1, 2));
        source.put("a", null);
        source.put("m", Map.of("y", 1, "b", true));

        Map<String, Object> normalized = MetadataValues.normalizeMap(source);

        assertThat(normalized).containsOnlyKeys("m", "z");
        assertThat(normalized.keySet()).containsExactly("m", "z");
        assertThat(normalized.get("z")).isEqualTo(List.of(1L, 2L));
        assertThat(normalized.get("m")).isEqualTo(Map.of("b", true, "y", 1L));
    }
}
