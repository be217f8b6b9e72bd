package com.fintech.signals.analysis;

import com.fintech.signals.concurrent.BatchExecutor;
import com.fintech.signals.concurrent.BatchOutcome;
import com.fintech.signals.domain.Instrument;
import com.fintech.signals.domain.Interval;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Analyses the whole universe concurrently. A failing instrument is logged and left out;
 * it never fails the batch.
 */
public class PortfolioAggregator {

    private static final Logger log = LoggerFactory.getLogger(PortfolioAggregator.class);

    private final AssetAnalyzer analyzer;
    private final BatchExecutor batchExecutor;
    private final Clock clock;

    public PortfolioAggregator(AssetAnalyzer analyzer, BatchExecutor batchExecutor, Clock clock) {
        this.analyzer = analyzer;
        this.batchExecutor = batchExecutor;
        this.clock = clock;
    }

    /**
     * Analyses every instrument on {@code interval} (null for each category default).
     * Failures are logged and left out; the result keeps input order.
     */
    public List<AssetAnalysis> analyzeAll(List<Instrument> instruments, Interval interval) {
        List<BatchOutcome<Instrument, AssetAnalysis>> outcomes =
            batchExecutor.settleAll("asset-analysis", instruments, instrument -> analyzer.analyze(instrument, interval));

        List<AssetAnalysis> analyses = new ArrayList<>(outcomes.size());
        for (BatchOutcome<Instrument, AssetAnalysis> outcome : outcomes) {
            if (outcome.isSuccess()) {
                analyses.add(outcome.value());
            } else {
                log.warn("Failed to analyze {}: {}", outcome.key().symbol(), outcome.error().getMessage());
            }
        }
        return analyses;
    }

    /**
     * Keeps results with confidence at or above {@code minConfidence}, and every HOLD.
     */
    public PortfolioSignals portfolioSignals(List<Instrument> instruments, double minConfidence) {
        if (Double.isNaN(minConfidence) || minConfidence < 0 || minConfidence > 1) {
            throw new IllegalArgumentException("minConfidence must be in [0, 1], got " + minConfidence);
        }

        List<AssetAnalysis> retained = new ArrayList<>();
        int buy = 0;
        int sell = 0;
        int hold = 0;
        Map<String, PortfolioSignals.ActionCounts> byCategory = new LinkedHashMap<>();

        for (AssetAnalysis analysis : analyzeAll(instruments, null)) {
            SignalAction action = analysis.signal().action();
            if (analysis.signal().confidence() < minConfidence && action != SignalAction.HOLD) {
                continue;
            }
            retained.add(analysis);
            switch (action) {
                case BUY -> buy++;
                case SELL -> sell++;
                case HOLD -> hold++;
            }
            byCategory.merge(analysis.category().code(),
                new PortfolioSignals.ActionCounts(0, 0, 0).plus(action),
                (current, ignored) -> current.plus(action));
        }

        log.info("Portfolio signals: analysed={}, retained={}, buy={}, sell={}, hold={}",
                instruments.size(), retained.size(), buy, sell, hold);

        return new PortfolioSignals(
            clock.millis(),
            List.copyOf(retained),
            new PortfolioSignals.Summary(buy, sell, hold, byCategory));
    }
}
