package com.fintech.signals.analysis;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.fintech.signals.MutableClock;
import com.fintech.signals.TestInstruments;
import com.fintech.signals.concurrent.BatchExecutor;
import com.fintech.signals.domain.Instrument;
import com.fintech.signals.domain.Interval;
import com.fintech.signals.error.InsufficientDataException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.fintech.signals.TestInstruments.AAPLX;
import static com.fintech.signals.TestInstruments.CBBTC;
import static com.fintech.signals.TestInstruments.PAXG;
import static com.fintech.signals.TestInstruments.TSLAX;
import static com.fintech.signals.TestInstruments.WBTC;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

@DisplayName("PortfolioAggregator Tests")
class PortfolioAggregatorTest {

    private AssetAnalyzer analyzer;
    private ExecutorService executor;
    private PortfolioAggregator aggregator;
    private ListAppender<ILoggingEvent> appender;
    private Logger logger;

    @BeforeEach
    void setUp() {
        analyzer = mock(AssetAnalyzer.class);
        executor = Executors.newFixedThreadPool(4);
        aggregator = new PortfolioAggregator(analyzer, new BatchExecutor(executor, Duration.ofSeconds(5)),
            new MutableClock(1_700_000_000_000L));

        logger = (Logger) LoggerFactory.getLogger(PortfolioAggregator.class);
        appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        logger.detachAppender(appender);
        executor.shutdownNow();
    }

    static AssetAnalysis analysis(Instrument instrument, SignalResult signal) {
        return new AssetAnalysis(
            instrument.id(),
            instrument.displayName(),
            instrument.symbol(),
            instrument.category(),
            100.0,
            new RsiReading(50.0, 14, Interval.H1, RsiStatus.NEUTRAL),
            signal,
            null,
            Momentum.NEUTRAL,
            Map.of(),
            1_700_000_000_000L);
    }

    static SignalResult buy(double confidence) {
        return new SignalResult(SignalAction.BUY, confidence, 100.0, 97.0, 105.0, 1.67, "RSI oversold reversal");
    }

    @Test
    @DisplayName("A failing instrument should be left out and logged, never raised")
    void testFailureIsolation() {
        // Given
        when(analyzer.analyze(WBTC, null)).thenReturn(analysis(WBTC, buy(0.8)));
        when(analyzer.analyze(CBBTC, null)).thenReturn(analysis(CBBTC, SignalResult.hold("RSI in neutral zone (50.00)")));
        when(analyzer.analyze(TSLAX, null)).thenThrow(new InsufficientDataException("Not enough candles for TSLAx"));
        when(analyzer.analyze(AAPLX, null)).thenReturn(analysis(AAPLX, SignalResult.sell(0.6, "RSI overbought at 71.00")));
        when(analyzer.analyze(PAXG, null)).thenReturn(analysis(PAXG, buy(0.6)));

        // When
        PortfolioSignals result = aggregator.portfolioSignals(TestInstruments.ALL, 0.0);

        // Then
        assertThat(result.signals()).extracting(AssetAnalysis::symbol).containsExactly("WBTC", "cbBTC", "AAPLx", "PAXG");
        assertThat(appender.list)
            .anySatisfy(event -> {
                assertThat(event.getLevel()).isEqualTo(Level.WARN);
                assertThat(event.getFormattedMessage()).isEqualTo("Failed to analyze TSLAx: Not enough candles for TSLAx");
            });
    }

    @Test
    @DisplayName("Should drop BUY and SELL below the minimum confidence but keep every HOLD")
    void testConfidenceFilter() {
        when(analyzer.analyze(WBTC, null)).thenReturn(analysis(WBTC, buy(0.8)));
        when(analyzer.analyze(CBBTC, null)).thenReturn(analysis(CBBTC, SignalResult.hold("neutral")));
        when(analyzer.analyze(TSLAX, null)).thenReturn(analysis(TSLAX, buy(0.5)));
        when(analyzer.analyze(AAPLX, null)).thenReturn(analysis(AAPLX, SignalResult.sell(0.6, "overbought")));
        when(analyzer.analyze(PAXG, null)).thenReturn(analysis(PAXG, SignalResult.hold("neutral")));

        PortfolioSignals result = aggregator.portfolioSignals(TestInstruments.ALL, 0.7);

        assertThat(result.signals()).extracting(AssetAnalysis::symbol).containsExactly("WBTC", "cbBTC", "PAXG");
        assertThat(result.summary().totalBuySignals()).isEqualTo(1);
        assertThat(result.summary().totalSellSignals()).isZero();
        assertThat(result.summary().totalHoldSignals()).isEqualTo(2);
        assertThat(result.summary().byCategory())
            .containsEntry("wrapped-btc", new PortfolioSignals.ActionCounts(1, 0, 1))
            .containsEntry("gold", new PortfolioSignals.ActionCounts(0, 0, 1))
            .doesNotContainKey("rwa-stocks");
        assertThat(result.timestamp()).isEqualTo(1_700_000_000_000L);
    }

    @Test
    @DisplayName("analyzeAll should pass the interval through")
    void testAnalyzeAllInterval() {
        when(analyzer.analyze(WBTC, Interval.M5)).thenReturn(analysis(WBTC, SignalResult.hold("neutral")));

        assertThat(aggregator.analyzeAll(List.of(WBTC), Interval.M5)).hasSize(1);
    }

    @Test
    @DisplayName("All instruments failing should give an empty result")
    void testAllFail() {
        when(analyzer.analyze(WBTC, null)).thenThrow(new InsufficientDataException("no data"));

        PortfolioSignals result = aggregator.portfolioSignals(List.of(WBTC), 0.5);

        assertThat(result.signals()).isEmpty();
        assertThat(result.summary().byCategory()).isEmpty();
    }

    @ParameterizedTest
    @ValueSource(doubles = {-0.1, 1.01, Double.NaN})
    @DisplayName("Should reject minConfidence outside [0, 1]")
    void testRejectsBadMinConfidence(double minConfidence) {
        assertThatThrownBy(() -> aggregator.portfolioSignals(TestInstruments.ALL, minConfidence))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
