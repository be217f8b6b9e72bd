package com.fintech.signals.indicator;

import java.util.Arrays;
import java.util.List;

/**
 * Moving averages over oldest-first price lists.
 */
public final class MovingAverages {

    private MovingAverages() {}

    /**
     * Exponential moving average aligned with {@code prices}. Seeded with the simple mean of the
     * first {@code period} prices at index {@code period - 1}; earlier positions are {@code NaN}.
     */
    public static double[] ema(List<Double> prices, int period) {
        if (period < 1) {
            throw new IllegalArgumentException("EMA period must be positive, got " + period);
        }
        double[] ema = new double[prices.size()];
        Arrays.fill(ema, Double.NaN);
        if (prices.size() < period) {
            return ema;
        }

        double multiplier = 2.0 / (period + 1);
        double sum = 0;
        for (int i = 0; i < period; i++) sum += prices.get(i);
        ema[period - 1] = sum / period;

        for (int i = period; i < prices.size(); i++) {
            ema[i] = (prices.get(i) - ema[i - 1]) * multiplier + ema[i - 1];
        }
        return ema;
    }

    /** Latest EMA value, or {@code NaN} with fewer than {@code period} prices. */
    public static double latestEma(List<Double> prices, int period) {
        double[] ema = ema(prices, period);
        return ema.length == 0 ? Double.NaN : ema[ema.length - 1];
    }
}
