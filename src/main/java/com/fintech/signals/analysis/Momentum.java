package com.fintech.signals.analysis;

import com.fintech.signals.indicator.RsiSeries;

import java.util.OptionalDouble;

/**
 * RSI momentum over the newest few values.
 */
public enum Momentum {
    BUILDING,
    WEAKENING,
    STRONG,
    WEAK,
    NEUTRAL;

    public static final int DEFAULT_LOOKBACK = 5;

    /**
     * Change between the oldest and newest defined RSI in the last {@code lookback} positions:
     * above +10 building, below -10 weakening; otherwise the level decides (above 60 strong,
     * below 40 weak). Fewer than two defined values is neutral.
     */
    public static Momentum of(RsiSeries rsi, int lookback) {
        int from = Math.max(0, rsi.size() - lookback);
        OptionalDouble first = OptionalDouble.empty();
        OptionalDouble last = OptionalDouble.empty();
        int defined = 0;
        for (int i = from; i < rsi.size(); i++) {
            OptionalDouble value = rsi.valueAt(i);
            if (value.isPresent()) {
                if (first.isEmpty()) first = value;
                last = value;
                defined++;
            }
        }
        if (defined < 2) {
            return NEUTRAL;
        }

        double current = last.getAsDouble();
        double change = current - first.getAsDouble();
        if (change > 10) return BUILDING;
        if (change < -10) return WEAKENING;
        if (current > 60) return STRONG;
        if (current < 40) return WEAK;
        return NEUTRAL;
    }
}
