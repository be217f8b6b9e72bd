package com.fintech.signals.signal;

import com.fintech.signals.TestCandles;
import com.fintech.signals.domain.Candle;
import com.fintech.signals.indicator.RsiCalculator;
import com.fintech.signals.indicator.RsiSeries;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("DivergenceDetector Tests")
class DivergenceDetectorTest {

    private final DivergenceDetector detector = new DivergenceDetector();

    @Test
    @DisplayName("Strictly monotonic data should show no divergence")
    void testMonotonic() {
        List<Candle> candles = TestCandles.fromCloses(TestCandles.rising(40, 100.0, 1.0));
        RsiSeries rsi = RsiCalculator.calculate(candles, 14);

        DivergenceResult result = detector.detect(rsi, candles, 10);

        assertThat(result.bullish()).isFalse();
        assertThat(result.bearish()).isFalse();
        assertThat(result.strength()).isNull();
    }

    @Test
    @DisplayName("Lower price low with higher RSI low should be bullish")
    void testBullish() {
        List<Candle> candles = TestCandles.fromCloses(105, 100, 104, 103, 98, 102, 103);
        RsiSeries rsi = RsiSeries.fromValues(14, 50, 30, 45, 44, 35, 48, 50);

        DivergenceResult result = detector.detect(rsi, candles, 7);

        assertThat(result.bullish()).isTrue();
        assertThat(result.bearish()).isFalse();
        assertThat(result.strength()).isEqualTo(0.7);
        assertThat(result.isDetected()).isTrue();
    }

    @Test
    @DisplayName("Higher price high with lower RSI high should be bearish")
    void testBearish() {
        List<Candle> candles = TestCandles.fromCloses(100, 106, 102, 103, 108, 104, 103);
        RsiSeries rsi = RsiSeries.fromValues(14, 50, 75, 60, 62, 68, 55, 52);

        DivergenceResult result = detector.detect(rsi, candles, 7);

        assertThat(result.bearish()).isTrue();
        assertThat(result.bullish()).isFalse();
    }

    @Test
    @DisplayName("Undefined RSI inside the window should yield no divergence")
    void testUndefinedRsiInWindow() {
        List<Candle> candles = TestCandles.fromCloses(105, 100, 104, 103, 98, 102, 103);
        RsiSeries rsi = RsiSeries.fromValues(14, Double.NaN, 30, 45, 44, 35, 48, 50);

        assertThat(detector.detect(rsi, candles, 7).isDetected()).isFalse();
    }

    @Test
    @DisplayName("Window shorter than the lookback should yield no divergence")
    void testShortWindow() {
        List<Candle> candles = TestCandles.fromCloses(105, 100, 104);
        RsiSeries rsi = RsiSeries.fromValues(14, 50, 30, 45);

        assertThat(detector.detect(rsi, candles, 10)).isEqualTo(DivergenceResult.none());
    }

    @Test
    @DisplayName("Should reject lookback below 3")
    void testRejectsTinyLookback() {
        assertThatThrownBy(() -> detector.detect(RsiSeries.fromValues(14), List.of(), 2))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
