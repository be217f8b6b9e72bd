package com.fintech.signals.service;

import com.fintech.signals.analysis.AssetAnalysis;
import com.fintech.signals.analysis.SignalAction;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Result of get-rsi-analysis.
 */
@Schema(description = "RSI analysis for one asset, a category or the whole universe")
public record RsiAnalysisResponse(
    long timestamp,

    @Schema(description = "Applied filter", example = "category: gold")
    String filter,

    @Schema(description = "Number of analysed assets", example = "3")
    int totalAnalyzed,

    List<AssetAnalysis> analyses,

    Summary summary
) {

    public record Summary(int buySignals, int sellSignals, int holdSignals, double avgConfidence) {

        static Summary of(List<AssetAnalysis> analyses) {
            return new Summary(
                count(analyses, SignalAction.BUY),
                count(analyses, SignalAction.SELL),
                count(analyses, SignalAction.HOLD),
                analyses.stream().mapToDouble(a -> a.signal().confidence()).average().orElse(0));
        }

        private static int count(List<AssetAnalysis> analyses, SignalAction action) {
            return (int) analyses.stream().filter(a -> a.signal().action() == action).count();
        }
    }
}
