package com.fintech.signals.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Candle intervals with epoch-aligned bucket calculations.
 * Every observation is folded into all intervals simultaneously.
 */
public enum Interval {

    S1("1s", 1_000L),
    M1("1m", 60_000L),
    M5("5m", 300_000L),
    H1("1h", 3_600_000L),
    W1("1w", 604_800_000L),
    MO1("1M", 2_592_000_000L);

    private final String code;
    private final long milliseconds;

    Interval(String code, long milliseconds) {
        this.code = code;
        this.milliseconds = milliseconds;
    }

    /** Returns the wire code, e.g. "5m". Case matters: "1m" is a minute, "1M" a month. */
    @JsonValue
    public String code() {
        return code;
    }

    /** Returns interval duration in milliseconds. */
    public long toMillis() {
        return milliseconds;
    }

    /**
     * Aligns timestamp to bucket start: floor(timestamp / intervalMs) * intervalMs.
     * Math.floorDiv keeps pre-epoch timestamps on the lower boundary.
     */
    public long alignTimestamp(long timestamp) {
        return Math.floorDiv(timestamp, milliseconds) * milliseconds;
    }

    /**
     * Resolves a wire code ("1s", "5m", "1M") or enum name ("M5").
     *
     * @throws IllegalArgumentException for unsupported values
     */
    public static Interval fromCode(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Interval must not be blank. Supported: " + supportedCodes());
        }
        String trimmed = value.trim();
        for (Interval interval : values()) {
            if (interval.code.equals(trimmed) || interval.name().equalsIgnoreCase(trimmed)) {
                return interval;
            }
        }
        throw new IllegalArgumentException(
            "Unsupported interval '" + value + "'. Supported: " + supportedCodes());
    }

    public static String supportedCodes() {
        return Arrays.stream(values()).map(Interval::code).collect(Collectors.joining(", "));
    }
}
