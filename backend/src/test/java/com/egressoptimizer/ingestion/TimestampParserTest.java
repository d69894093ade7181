package com.egressoptimizer.ingestion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampParserTest {

    private static final Instant TEN_AM = Instant.parse("2024-01-15T10:00:00Z");

    @ParameterizedTest
    @ValueSource(strings = {
            "2024-01-15T10:00:00Z",
            "2024-01-15T12:00:00+02:00",
            "2024-01-15T10:00:00",
            "2024-01-15 10:00:00",
            " 2024-01-15T10:00:00.000Z ",
            "1705312800",
            "1705312800000"
    })
    @DisplayName("Should parse supported timestamp forms to the same instant")
    void shouldParseSupportedForms(String text) {
        assertThat(TimestampParser.parse(text)).contains(TEN_AM);
    }

    @Test
    @DisplayName("Should read a bare date as midnight UTC")
    void shouldParseDate() {
        assertThat(TimestampParser.parse("2024-01-15")).contains(Instant.parse("2024-01-15T00:00:00Z"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "yesterday", "2024-13-45", "12:00"})
    @DisplayName("Should reject unparseable input")
    void shouldRejectGarbage(String text) {
        assertThat(TimestampParser.parse(text)).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(strings = {"-9223372036854775808", "-99999999999999999"})
    @DisplayName("Should reject epoch values outside the instant range instead of throwing")
    void shouldRejectOutOfRangeEpochs(String text) {
        assertThat(TimestampParser.parse(text)).isEmpty();
    }

    @Test
    @DisplayName("Should read the largest epoch value as milliseconds without throwing")
    void shouldAcceptLargestEpoch() {
        assertThat(TimestampParser.parse("9223372036854775807")).contains(Instant.ofEpochMilli(Long.MAX_VALUE));
    }

    @Test
    @DisplayName("Should treat null as absent")
    void shouldHandleNull() {
        assertThat(TimestampParser.parse(null)).isEmpty();
    }
}
