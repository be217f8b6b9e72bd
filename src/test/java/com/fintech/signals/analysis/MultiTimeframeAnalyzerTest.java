package com.fintech.signals.analysis;

import com.fintech.signals.TestCandles;
import com.fintech.signals.aggregation.CandleAggregator;
import com.fintech.signals.domain.Interval;
import com.fintech.signals.signal.ThresholdPolicy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.fintech.signals.TestInstruments.TSLAX;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("MultiTimeframeAnalyzer Tests")
class MultiTimeframeAnalyzerTest {

    private final CandleAggregator aggregator = new CandleAggregator(100, new SimpleMeterRegistry());
    private final MultiTimeframeAnalyzer analyzer = new MultiTimeframeAnalyzer(aggregator, ThresholdPolicy.defaults());

    @Test
    @DisplayName("Should report every interval with enough history, in request order")
    void testReadings() {
        // Given: falling closes, one per five minutes
        double[] closes = TestCandles.rising(20, 300.0, -1.0);
        for (int i = 0; i < closes.length; i++) {
            aggregator.ingest(TSLAX.id(), closes[i], TestCandles.BASE + i * Interval.M5.toMillis());
        }

        // When
        List<TimeframeRsi> readings = analyzer.multiTimeframeRsi(TSLAX, List.of(Interval.H1, Interval.M1, Interval.M5));

        // Then
        assertThat(readings).extracting(TimeframeRsi::interval).containsExactly(Interval.M1, Interval.M5);
        assertThat(readings).allSatisfy(reading -> {
            assertThat(reading.rsi()).isZero();
            assertThat(reading.status()).isEqualTo(RsiStatus.OVERSOLD);
        });
    }

    @Test
    @DisplayName("An instrument without history should yield an empty result")
    void testNoHistory() {
        assertThat(analyzer.multiTimeframeRsi(TSLAX, List.of(Interval.M5, Interval.H1))).isEmpty();
    }
}
