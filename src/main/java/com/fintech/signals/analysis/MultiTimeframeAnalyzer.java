package com.fintech.signals.analysis;

import com.fintech.signals.aggregation.CandleAggregator;
import com.fintech.signals.domain.Candle;
import com.fintech.signals.domain.Instrument;
import com.fintech.signals.domain.Interval;
import com.fintech.signals.error.SignalEngineException;
import com.fintech.signals.indicator.RsiCalculator;
import com.fintech.signals.signal.CategoryPolicy;
import com.fintech.signals.signal.ThresholdPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Current RSI of one instrument across several intervals. An interval that cannot be
 * computed (typically too little history) is left out of the result.
 */
public class MultiTimeframeAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(MultiTimeframeAnalyzer.class);

    static final int CANDLE_WINDOW = 50;
    static final int RSI_PERIOD = RsiCalculator.DEFAULT_PERIOD;

    private final CandleAggregator aggregator;
    private final ThresholdPolicy thresholds;

    public MultiTimeframeAnalyzer(CandleAggregator aggregator, ThresholdPolicy thresholds) {
        this.aggregator = aggregator;
        this.thresholds = thresholds;
    }

    public List<TimeframeRsi> multiTimeframeRsi(Instrument instrument, List<Interval> intervals) {
        CategoryPolicy policy = thresholds.forCategory(instrument.category());
        List<TimeframeRsi> results = new ArrayList<>(intervals.size());
        for (Interval interval : intervals) {
            try {
                List<Candle> candles = aggregator.getCandles(instrument.id(), interval, CANDLE_WINDOW);
                double rsi = RsiCalculator.currentRsi(candles, RSI_PERIOD);
                results.add(new TimeframeRsi(interval, rsi, RsiStatus.of(rsi, policy)));
            } catch (SignalEngineException e) {
                log.debug("Skipping {} RSI for {}: {}", interval.code(), instrument.symbol(), e.getMessage());
            }
        }
        return results;
    }
}
