package com.fintech.signals.indicator;

import java.util.Arrays;
import java.util.OptionalDouble;

/**
 * RSI values aligned 1:1 with the candles they were computed from.
 * Positions without enough history hold no value.
 */
public final class RsiSeries {

    private final int period;
    private final double[] values;

    RsiSeries(int period, double[] values) {
        this.period = period;
        this.values = values;
    }

    /** Builds a series from raw values; {@code Double.NaN} marks an undefined position. */
    public static RsiSeries fromValues(int period, double... values) {
        return new RsiSeries(period, values.clone());
    }

    public int period() {
        return period;
    }

    public int size() {
        return values.length;
    }

    public boolean isDefined(int index) {
        return !Double.isNaN(values[index]);
    }

    public OptionalDouble valueAt(int index) {
        double value = values[index];
        return Double.isNaN(value) ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /** Value at the newest position. */
    public OptionalDouble latest() {
        return values.length == 0 ? OptionalDouble.empty() : valueAt(values.length - 1);
    }

    /** Value one position before the newest. */
    public OptionalDouble previous() {
        return values.length < 2 ? OptionalDouble.empty() : valueAt(values.length - 2);
    }

    public boolean hasAnyValue() {
        return Arrays.stream(values).anyMatch(value -> !Double.isNaN(value));
    }

    /** Copy of the raw values, {@code NaN} where undefined. */
    public double[] toArray() {
        return values.clone();
    }

    @Override
    public String toString() {
        return "RsiSeries{period=" + period + ", size=" + values.length + ", latest=" + latest() + "}";
    }
}
