package com.fintech.signals.analysis;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.Map;

/**
 * Portfolio-wide signals plus tallies over the retained results.
 *
 * @param signals Retained analyses, in universe order
 */
@Schema(description = "Signals across the instrument universe")
public record PortfolioSignals(long timestamp, List<AssetAnalysis> signals, Summary summary) {

    /**
     * @param byCategory Counts keyed by category code
     */
    public record Summary(
        int totalBuySignals,
        int totalSellSignals,
        int totalHoldSignals,
        Map<String, ActionCounts> byCategory
    ) {
    }

    public record ActionCounts(int buy, int sell, int hold) {

        ActionCounts plus(SignalAction action) {
            return switch (action) {
                case BUY -> new ActionCounts(buy + 1, sell, hold);
                case SELL -> new ActionCounts(buy, sell + 1, hold);
                case HOLD -> new ActionCounts(buy, sell, hold + 1);
            };
        }
    }
}
