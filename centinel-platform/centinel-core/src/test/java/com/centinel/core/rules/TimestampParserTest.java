package com.centinel.core.rules;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class TimestampParserTest {

    @Test
    void parse_readsInstantWithOffset() {
        assertThat(TimestampParser.parse("2025-11-30T14:00:00-06:00"))
                .contains(Instant.parse("2025-11-30T20:00:00Z"));
    }

    @Test
    void parse_readsLocalDateTimeAsUtc() {
        assertThat(TimestampParser.parse("2025-11-30 20:00:00"))
                .contains(Instant.parse("2025-11-30T20:00:00Z"));
        assertThat(TimestampParser.parse("2025-11-30T20:00"))
                .contains(Instant.parse("2025-11-30T20:00:00Z"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "30/11/2025 20:00", "ayer", "2025-11-30"})
    void parse_returnsEmptyForUnsupportedValues(String text) {
        assertThat(TimestampParser.parse(text)).isEmpty();
    }

    @Test
    void parse_returnsEmptyForNull() {
        assertThat(TimestampParser.parse(null)).isEmpty();
    }
}
