package com.fintech.signals.service;

import com.fintech.signals.analysis.AssetAnalysis;
import com.fintech.signals.analysis.PortfolioSignals;
import com.fintech.signals.analysis.SignalAction;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Result of get-portfolio-signals: retained signals plus the buys and sells worth acting on.
 */
@Schema(description = "Trading signals across every tracked asset")
public record PortfolioSignalsResponse(
    long timestamp,

    @Schema(description = "Applied confidence floor", example = "0.6")
    double minConfidence,

    @Schema(description = "Tracked instruments", example = "11")
    int totalAssets,

    @Schema(description = "Retained signals", example = "9")
    int totalSignals,

    PortfolioSignals.Summary summary,

    List<AssetAnalysis> signals,

    Actionable actionable
) {

    static final double STRONG_BUY_CONFIDENCE = 0.8;
    static final double MODERATE_BUY_CONFIDENCE = 0.6;

    public static PortfolioSignalsResponse of(PortfolioSignals portfolio, double minConfidence, int totalAssets) {
        return new PortfolioSignalsResponse(
            portfolio.timestamp(),
            minConfidence,
            totalAssets,
            portfolio.signals().size(),
            portfolio.summary(),
            portfolio.signals(),
            Actionable.of(portfolio.signals()));
    }

    /**
     * Strong buys have confidence of at least 0.8, moderate buys between 0.6 and 0.8.
     */
    public record Actionable(List<AssetAnalysis> strongBuys, List<AssetAnalysis> moderateBuys, List<AssetAnalysis> sells) {

        static Actionable of(List<AssetAnalysis> signals) {
            return new Actionable(
                signals.stream()
                    .filter(s -> s.signal().action() == SignalAction.BUY
                        && s.signal().confidence() >= STRONG_BUY_CONFIDENCE)
                    .toList(),
                signals.stream()
                    .filter(s -> s.signal().action() == SignalAction.BUY
                        && s.signal().confidence() >= MODERATE_BUY_CONFIDENCE
                        && s.signal().confidence() < STRONG_BUY_CONFIDENCE)
                    .toList(),
                signals.stream().filter(s -> s.signal().action() == SignalAction.SELL).toList());
        }
    }
}
