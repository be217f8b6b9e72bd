package com.fintech.signals.signal;

import com.fintech.signals.domain.Candle;
import com.fintech.signals.indicator.RsiSeries;

import java.util.ArrayList;
import java.util.List;

/**
 * Price/RSI divergence over the newest {@code lookback} candles.
 *
 * <p>Interior candles whose low is strictly below both neighbours' lows are minima; whose
 * high is strictly above both neighbours' highs are maxima. Bullish: the last minimum is
 * lower than the one before while its RSI is higher. Bearish: the mirror on maxima.
 */
public class DivergenceDetector {

    public static final int DEFAULT_LOOKBACK = 10;
    static final double DETECTED_STRENGTH = 0.7;

    public DivergenceResult detect(RsiSeries rsi, List<Candle> candles) {
        return detect(rsi, candles, DEFAULT_LOOKBACK);
    }

    /**
     * Returns {@link DivergenceResult#none()} when the window is shorter than {@code lookback}
     * or holds an undefined RSI value.
     */
    public DivergenceResult detect(RsiSeries rsi, List<Candle> candles, int lookback) {
        if (lookback < 3) {
            throw new IllegalArgumentException("Lookback must be at least 3, got " + lookback);
        }
        if (rsi.size() < lookback || candles.size() < lookback) {
            return DivergenceResult.none();
        }

        int rsiOffset = rsi.size() - lookback;
        int candleOffset = candles.size() - lookback;
        for (int i = 0; i < lookback; i++) {
            if (!rsi.isDefined(rsiOffset + i)) {
                return DivergenceResult.none();
            }
        }

        List<double[]> lows = new ArrayList<>();
        List<double[]> highs = new ArrayList<>();
        for (int i = 1; i < lookback - 1; i++) {
            Candle before = candles.get(candleOffset + i - 1);
            Candle point = candles.get(candleOffset + i);
            Candle after = candles.get(candleOffset + i + 1);
            double rsiValue = rsi.valueAt(rsiOffset + i).getAsDouble();

            if (point.low() < before.low() && point.low() < after.low()) {
                lows.add(new double[] {point.low(), rsiValue});
            }
            if (point.high() > before.high() && point.high() > after.high()) {
                highs.add(new double[] {point.high(), rsiValue});
            }
        }

        boolean bullish = false;
        if (lows.size() >= 2) {
            double[] last = lows.get(lows.size() - 1);
            double[] prior = lows.get(lows.size() - 2);
            bullish = last[0] < prior[0] && last[1] > prior[1];
        }

        boolean bearish = false;
        if (highs.size() >= 2) {
            double[] last = highs.get(highs.size() - 1);
            double[] prior = highs.get(highs.size() - 2);
            bearish = last[0] > prior[0] && last[1] < prior[1];
        }

        if (!bullish && !bearish) {
            return DivergenceResult.none();
        }
        return new DivergenceResult(bullish, bearish, DETECTED_STRENGTH);
    }
}
