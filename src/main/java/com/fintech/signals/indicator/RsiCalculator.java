package com.fintech.signals.indicator;

import com.fintech.signals.domain.Candle;
import com.fintech.signals.error.InsufficientDataException;

import java.util.Arrays;
import java.util.List;

/**
 * Relative Strength Index over candle closes using Wilder's smoothing.
 * Input candles are oldest-first.
 */
public final class RsiCalculator {

    public static final int DEFAULT_PERIOD = 14;

    private RsiCalculator() {}

    /**
     * Full RSI series, same length as {@code candles}.
     *
     * <p>Index {@code period} holds the first value, seeded from simple means of the first
     * {@code period} gains and losses; later values use
     * {@code avg' = (avg * (period - 1) + x) / period}. With fewer than {@code period + 1}
     * candles every position is undefined.
     */
    public static RsiSeries calculate(List<Candle> candles, int period) {
        if (period < 1) {
            throw new IllegalArgumentException("RSI period must be positive, got " + period);
        }
        int n = candles.size();
        double[] rsi = new double[n];
        Arrays.fill(rsi, Double.NaN);
        if (n < period + 1) {
            return new RsiSeries(period, rsi);
        }

        double avgGain = 0;
        double avgLoss = 0;
        for (int i = 1; i <= period; i++) {
            double change = candles.get(i).close() - candles.get(i - 1).close();
            if (change > 0) avgGain += change;
            else avgLoss -= change;
        }
        avgGain /= period;
        avgLoss /= period;
        rsi[period] = toRsi(avgGain, avgLoss);

        for (int i = period + 1; i < n; i++) {
            double change = candles.get(i).close() - candles.get(i - 1).close();
            double gain = Math.max(change, 0);
            double loss = Math.max(-change, 0);
            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
            rsi[i] = toRsi(avgGain, avgLoss);
        }
        return new RsiSeries(period, rsi);
    }

    public static RsiSeries calculate(List<Candle> candles) {
        return calculate(candles, DEFAULT_PERIOD);
    }

    /**
     * Newest RSI value.
     *
     * @throws InsufficientDataException with fewer than {@code period + 1} candles
     */
    public static double currentRsi(List<Candle> candles, int period) {
        if (candles.size() < period + 1) {
            throw new InsufficientDataException(
                "RSI(" + period + ") needs at least " + (period + 1) + " candles, have " + candles.size());
        }
        return calculate(candles, period).latest().orElseThrow();
    }

    private static double toRsi(double avgGain, double avgLoss) {
        if (avgLoss == 0) return 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }
}
