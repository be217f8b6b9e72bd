package com.fintech.signals.domain;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Interval Tests")
class IntervalTest {

    @ParameterizedTest(name = "{0} should have {1} milliseconds")
    @MethodSource("intervalMillisProvider")
    @DisplayName("toMillis() should return the bucket duration")
    void testToMillis(Interval interval, long expectedMillis) {
        assertThat(interval.toMillis()).isEqualTo(expectedMillis);
    }

    static Stream<Arguments> intervalMillisProvider() {
        return Stream.of(
            Arguments.of(Interval.S1, 1_000L),
            Arguments.of(Interval.M1, 60_000L),
            Arguments.of(Interval.M5, 300_000L),
            Arguments.of(Interval.H1, 3_600_000L),
            Arguments.of(Interval.W1, 604_800_000L),
            Arguments.of(Interval.MO1, 2_592_000_000L)
        );
    }

    @ParameterizedTest(name = "{0}: {1} should align to {2}")
    @MethodSource("alignTimestampProvider")
    @DisplayName("alignTimestamp() should floor to the bucket start")
    void testAlignTimestamp(Interval interval, long timestamp, long expectedAligned) {
        assertThat(interval.alignTimestamp(timestamp)).isEqualTo(expectedAligned);
    }

    static Stream<Arguments> alignTimestampProvider() {
        return Stream.of(
            Arguments.of(Interval.S1, 1_500L, 1_000L),
            Arguments.of(Interval.S1, 2_000L, 2_000L),
            Arguments.of(Interval.M5, 299_999L, 0L),
            Arguments.of(Interval.M5, 300_000L, 300_000L),
            Arguments.of(Interval.M5, 1_700_000_123_456L, 1_700_000_100_000L),
            Arguments.of(Interval.H1, 7_199_999L, 3_600_000L),
            Arguments.of(Interval.S1, -1L, -1_000L)
        );
    }

    @Test
    @DisplayName("fromCode() should tell minutes from months")
    void testFromCodeIsCaseSensitiveForMonth() {
        assertThat(Interval.fromCode("1m")).isEqualTo(Interval.M1);
        assertThat(Interval.fromCode("1M")).isEqualTo(Interval.MO1);
        assertThat(Interval.fromCode("5m")).isEqualTo(Interval.M5);
        assertThat(Interval.fromCode(" 1h ")).isEqualTo(Interval.H1);
    }

    @Test
    @DisplayName("fromCode() should accept enum names")
    void testFromCodeAcceptsEnumName() {
        assertThat(Interval.fromCode("W1")).isEqualTo(Interval.W1);
        assertThat(Interval.fromCode("h1")).isEqualTo(Interval.H1);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "15m", "2h", "daily"})
    @DisplayName("fromCode() should reject unsupported values")
    void testFromCodeRejectsUnsupported(String value) {
        assertThatThrownBy(() -> Interval.fromCode(value))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Supported");
    }
}
