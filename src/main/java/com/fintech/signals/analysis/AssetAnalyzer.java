package com.fintech.signals.analysis;

import com.fintech.signals.aggregation.CandleAggregator;
import com.fintech.signals.domain.Candle;
import com.fintech.signals.domain.Instrument;
import com.fintech.signals.domain.Interval;
import com.fintech.signals.error.InsufficientDataException;
import com.fintech.signals.indicator.RsiCalculator;
import com.fintech.signals.indicator.RsiSeries;
import com.fintech.signals.signal.BuySignal;
import com.fintech.signals.signal.CategoryPolicy;
import com.fintech.signals.signal.DivergenceDetector;
import com.fintech.signals.signal.DivergenceResult;
import com.fintech.signals.signal.SignalDetector;
import com.fintech.signals.signal.ThresholdPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Full per-instrument analysis: RSI, buy signal, divergence, momentum and multi-timeframe RSI.
 * Reads candle snapshots only.
 */
public class AssetAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(AssetAnalyzer.class);

    static final double SELL_CONFIDENCE = 0.6;

    private final CandleAggregator aggregator;
    private final ThresholdPolicy thresholds;
    private final SignalDetector signalDetector;
    private final DivergenceDetector divergenceDetector;
    private final MultiTimeframeAnalyzer multiTimeframeAnalyzer;
    private final List<Interval> multiTimeframeIntervals;
    private final int candleWindow;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public AssetAnalyzer(
            CandleAggregator aggregator,
            ThresholdPolicy thresholds,
            SignalDetector signalDetector,
            DivergenceDetector divergenceDetector,
            MultiTimeframeAnalyzer multiTimeframeAnalyzer,
            List<Interval> multiTimeframeIntervals,
            int candleWindow,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.aggregator = aggregator;
        this.thresholds = thresholds;
        this.signalDetector = signalDetector;
        this.divergenceDetector = divergenceDetector;
        this.multiTimeframeAnalyzer = multiTimeframeAnalyzer;
        this.multiTimeframeIntervals = List.copyOf(multiTimeframeIntervals);
        this.candleWindow = candleWindow;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public AssetAnalysis analyze(Instrument instrument) {
        return analyze(instrument, null);
    }

    /**
     * @param interval analysed interval, or null for the category default
     * @throws InsufficientDataException when no current RSI can be computed
     */
    public AssetAnalysis analyze(Instrument instrument, Interval interval) {
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            CategoryPolicy policy = thresholds.forCategory(instrument.category());
            Interval timeframe = interval != null ? interval : policy.timeframe();

            List<Candle> candles = aggregator.getCandles(instrument.id(), timeframe, candleWindow);
            RsiSeries rsi = RsiCalculator.calculate(candles, policy.period());
            double currentRsi = rsi.latest().orElseThrow(() -> new InsufficientDataException(String.format(
                Locale.ROOT, "Unable to calculate RSI(%d) for %s on %s: %d of %d candles collected",
                policy.period(), instrument.symbol(), timeframe.code(), candles.size(), policy.period() + 1)));

            double currentPrice = candles.get(candles.size() - 1).close();
            RsiStatus status = RsiStatus.of(currentRsi, policy);
            DivergenceResult divergence = divergenceDetector.detect(rsi, candles);
            BuySignal buy = signalDetector.detectBuySignal(instrument.category(), rsi, candles, divergence);
            SignalResult signal = chooseAction(buy, status, currentRsi, currentPrice, policy);

            Map<String, Double> multiTimeframe = new LinkedHashMap<>();
            multiTimeframeAnalyzer.multiTimeframeRsi(instrument, multiTimeframeIntervals)
                .forEach(reading -> multiTimeframe.put(reading.interval().code(), reading.rsi()));

            log.debug("Analyzed {}: interval={}, rsi={}, action={}, confidence={}",
                    instrument.symbol(), timeframe.code(), currentRsi, signal.action(), signal.confidence());

            return new AssetAnalysis(
                instrument.id(),
                instrument.displayName(),
                instrument.symbol(),
                instrument.category(),
                currentPrice,
                new RsiReading(currentRsi, policy.period(), timeframe, status),
                signal,
                divergence.isDetected() ? divergence : null,
                Momentum.of(rsi, Momentum.DEFAULT_LOOKBACK),
                multiTimeframe,
                clock.millis()
            );
        } finally {
            sample.stop(meterRegistry.timer("analysis.asset.time", "category", instrument.category().code()));
        }
    }

    private SignalResult chooseAction(
            BuySignal buy, RsiStatus status, double currentRsi, double currentPrice, CategoryPolicy policy) {
        if (buy.signal()) {
            return new SignalResult(
                SignalAction.BUY,
                buy.confidence(),
                currentPrice,
                policy.stopLossPrice(currentPrice),
                policy.takeProfitPrice(currentPrice),
                policy.riskRewardRatio(),
                buy.reason());
        }
        if (status == RsiStatus.OVERBOUGHT) {
            return SignalResult.sell(SELL_CONFIDENCE,
                String.format(Locale.ROOT, "RSI overbought at %.2f", currentRsi));
        }
        return SignalResult.hold(buy.reason());
    }
}
