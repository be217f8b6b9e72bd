package com.fintech.signals.indicator;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("MovingAverages Tests")
class MovingAveragesTest {

    @Test
    @DisplayName("EMA should be seeded with the simple mean")
    void testSeed() {
        double[] ema = MovingAverages.ema(List.of(2.0, 4.0, 6.0, 8.0), 3);

        assertThat(Double.isNaN(ema[0])).isTrue();
        assertThat(Double.isNaN(ema[1])).isTrue();
        assertThat(ema[2]).isEqualTo(4.0);
        // multiplier 0.5: (8 - 4) * 0.5 + 4
        assertThat(ema[3]).isCloseTo(6.0, within(1e-12));
    }

    @Test
    @DisplayName("latestEma() should be NaN with short history")
    void testShortHistory() {
        assertThat(MovingAverages.latestEma(List.of(1.0, 2.0), 50)).isNaN();
        assertThat(MovingAverages.latestEma(List.of(), 3)).isNaN();
    }
}
