package com.fintech.signals.aggregation;

import com.fintech.signals.domain.Interval;

import java.util.Objects;

/**
 * Identifies one candle series: instrument id plus interval.
 */
public record SeriesKey(String instrumentId, Interval interval) {

    public SeriesKey {
        Objects.requireNonNull(instrumentId, "Instrument id cannot be null");
        Objects.requireNonNull(interval, "Interval cannot be null");
    }

    @Override
    public String toString() {
        return instrumentId + "-" + interval.name();
    }
}
