package com.fintech.signals.service;

import com.fintech.signals.aggregation.CandleAggregator;
import com.fintech.signals.analysis.AssetAnalysis;
import com.fintech.signals.analysis.AssetAnalyzer;
import com.fintech.signals.analysis.PortfolioAggregator;
import com.fintech.signals.analysis.PortfolioSignals;
import com.fintech.signals.domain.AssetCategory;
import com.fintech.signals.domain.Candle;
import com.fintech.signals.domain.Instrument;
import com.fintech.signals.domain.Interval;
import com.fintech.signals.error.InsufficientDataException;
import com.fintech.signals.indicator.RsiCalculator;
import com.fintech.signals.indicator.RsiSeries;
import com.fintech.signals.payment.MeteredOperation;
import com.fintech.signals.payment.OperationGuard;
import com.fintech.signals.payment.RequestContext;
import com.fintech.signals.quote.InstrumentPrice;
import com.fintech.signals.quote.QuoteService;
import com.fintech.signals.registry.InstrumentRegistry;
import com.fintech.signals.signal.DivergenceDetector;
import com.fintech.signals.signal.DivergenceResult;
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
import java.util.function.Supplier;

/**
 * The externally exposed operations. Each call consults the payment gate exactly once
 * and only then touches quotes, candles or analysis.
 */
public class SignalOperations {

    private static final Logger log = LoggerFactory.getLogger(SignalOperations.class);

    public static final int MAX_OHLC_COUNT = 1000;
    public static final int MIN_DIVERGENCE_LOOKBACK = 5;
    public static final int MAX_DIVERGENCE_LOOKBACK = 50;
    static final int DIVERGENCE_MIN_CANDLES = 50;
    static final int DIVERGENCE_CANDLE_MARGIN = 20;

    private final InstrumentRegistry registry;
    private final QuoteService quoteService;
    private final CandleAggregator aggregator;
    private final AssetAnalyzer analyzer;
    private final PortfolioAggregator portfolioAggregator;
    private final DivergenceDetector divergenceDetector;
    private final ThresholdPolicy thresholds;
    private final OperationGuard guard;
    private final double defaultMinConfidence;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    public SignalOperations(
            InstrumentRegistry registry,
            QuoteService quoteService,
            CandleAggregator aggregator,
            AssetAnalyzer analyzer,
            PortfolioAggregator portfolioAggregator,
            DivergenceDetector divergenceDetector,
            ThresholdPolicy thresholds,
            OperationGuard guard,
            double defaultMinConfidence,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.registry = registry;
        this.quoteService = quoteService;
        this.aggregator = aggregator;
        this.analyzer = analyzer;
        this.portfolioAggregator = portfolioAggregator;
        this.divergenceDetector = divergenceDetector;
        this.thresholds = thresholds;
        this.guard = guard;
        this.defaultMinConfidence = defaultMinConfidence;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * @param category category code or name, null for every instrument
     */
    public CurrentPricesResponse getCurrentPrices(String category, RequestContext context) {
        return metered(MeteredOperation.GET_CURRENT_PRICES, context, () -> {
            AssetCategory filter = category == null || category.isBlank() ? null : AssetCategory.fromCode(category);
            List<InstrumentPrice> prices = quoteService.getCurrentPrices(filter);
            return new CurrentPricesResponse(
                clock.millis(),
                filter == null ? "all" : filter.code(),
                prices.size(),
                prices,
                CurrentPricesResponse.PriceSummary.of(prices));
        });
    }

    /**
     * Newest {@code count} candles, oldest first, with window statistics.
     */
    public OhlcDataResponse getOhlcData(String asset, Interval interval, int count, RequestContext context) {
        return metered(MeteredOperation.GET_OHLC_DATA, context, () -> {
            requireRange("count", count, 1, MAX_OHLC_COUNT);
            Instrument instrument = registry.resolve(asset);
            List<Candle> candles = aggregator.getCandles(instrument.id(), interval, count);
            return new OhlcDataResponse(
                instrument,
                interval,
                count,
                candles.size(),
                candles,
                OhlcStatistics.of(candles),
                candles.get(0).bucketStart(),
                candles.get(candles.size() - 1).bucketStart());
        });
    }

    public OhlcStatsResponse getOhlcStats(RequestContext context) {
        return metered(MeteredOperation.GET_OHLC_STATS, context, () -> {
            Map<String, Map<String, Integer>> bySymbol = new LinkedHashMap<>();
            long total = 0;
            for (Map.Entry<String, Map<String, Integer>> entry : aggregator.stats().entrySet()) {
                String symbol = registry.find(entry.getKey()).map(Instrument::symbol).orElse(entry.getKey());
                bySymbol.put(symbol, entry.getValue());
                total += entry.getValue().values().stream().mapToLong(Integer::longValue).sum();
            }
            return new OhlcStatsResponse(clock.millis(), total, aggregator.getMaxCandlesPerSeries(), bySymbol);
        });
    }

    /**
     * Analysis of one asset when {@code asset} is given (its failure propagates), otherwise of a
     * category or the whole universe with failing members left out.
     *
     * @param interval analysed interval, null for each category default
     * @throws InsufficientDataException when no asset could be analysed
     */
    public RsiAnalysisResponse getRsiAnalysis(String asset, String category, Interval interval, RequestContext context) {
        return metered(MeteredOperation.GET_RSI_ANALYSIS, context, () -> {
            List<AssetAnalysis> analyses;
            String filter;
            if (asset != null && !asset.isBlank()) {
                analyses = List.of(analyzer.analyze(registry.resolve(asset), interval));
                filter = "asset: " + asset;
            } else if (category != null && !category.isBlank()) {
                AssetCategory target = AssetCategory.fromCode(category);
                analyses = portfolioAggregator.analyzeAll(registry.byCategory(target), interval);
                filter = "category: " + target.code();
            } else {
                analyses = portfolioAggregator.analyzeAll(registry.all(), interval);
                filter = "all assets";
            }

            if (analyses.isEmpty()) {
                throw new InsufficientDataException(
                    "No RSI analysis available. Ensure sufficient OHLC data has been collected.");
            }
            return new RsiAnalysisResponse(
                clock.millis(), filter, analyses.size(), analyses, RsiAnalysisResponse.Summary.of(analyses));
        });
    }

    /**
     * RSI(14) divergence over the last {@code lookback} candles.
     *
     * @param interval analysed interval, null for the category default
     */
    public DivergenceResponse getRsiDivergence(String asset, Interval interval, int lookback, RequestContext context) {
        return metered(MeteredOperation.GET_RSI_DIVERGENCE, context, () -> {
            requireRange("lookback", lookback, MIN_DIVERGENCE_LOOKBACK, MAX_DIVERGENCE_LOOKBACK);
            Instrument instrument = registry.resolve(asset);
            Interval timeframe = interval != null
                ? interval
                : thresholds.forCategory(instrument.category()).timeframe();

            int window = Math.max(lookback + DIVERGENCE_CANDLE_MARGIN, DIVERGENCE_MIN_CANDLES);
            List<Candle> candles = aggregator.getCandles(instrument.id(), timeframe, window);
            RsiSeries rsi = RsiCalculator.calculate(candles, RsiCalculator.DEFAULT_PERIOD);
            double currentRsi = rsi.latest().orElseThrow(() -> new InsufficientDataException(String.format(
                Locale.ROOT, "Unable to calculate RSI(%d) for %s on %s: %d of %d candles collected",
                RsiCalculator.DEFAULT_PERIOD, instrument.symbol(), timeframe.code(),
                candles.size(), RsiCalculator.DEFAULT_PERIOD + 1)));

            DivergenceResult divergence = divergenceDetector.detect(rsi, candles, lookback);
            return new DivergenceResponse(
                instrument.symbol(),
                instrument.category(),
                timeframe,
                lookback,
                divergence,
                currentRsi,
                candles.get(candles.size() - 1).close(),
                interpretation(divergence),
                tradingImplication(divergence),
                clock.millis());
        });
    }

    /**
     * @param minConfidence confidence floor in [0, 1], null for the configured default
     */
    public PortfolioSignalsResponse getPortfolioSignals(Double minConfidence, RequestContext context) {
        return metered(MeteredOperation.GET_PORTFOLIO_SIGNALS, context, () -> {
            double floor = minConfidence != null ? minConfidence : defaultMinConfidence;
            List<Instrument> universe = registry.all();
            PortfolioSignals portfolio = portfolioAggregator.portfolioSignals(universe, floor);
            return PortfolioSignalsResponse.of(portfolio, floor, universe.size());
        });
    }

    static String interpretation(DivergenceResult divergence) {
        if (divergence.bullish()) {
            return "Bullish divergence detected - potential reversal to upside";
        }
        if (divergence.bearish()) {
            return "Bearish divergence detected - potential reversal to downside";
        }
        return "No divergence detected";
    }

    static String tradingImplication(DivergenceResult divergence) {
        if (divergence.bullish()) {
            return "Consider LONG positions - price may reverse upward";
        }
        if (divergence.bearish()) {
            return "Consider closing LONG positions or SHORTING - price may reverse downward";
        }
        return "No clear divergence signal - use other indicators";
    }

    private <T> T metered(MeteredOperation operation, RequestContext context, Supplier<T> body) {
        guard.check(operation, context);
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            T result = body.get();
            log.debug("Completed operation={}", operation.operationName());
            return result;
        } finally {
            sample.stop(meterRegistry.timer("signals.operation.time", "operation", operation.operationName()));
        }
    }

    private static void requireRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(
                String.format("%s must be between %d and %d, got %d", name, min, max, value));
        }
    }
}
