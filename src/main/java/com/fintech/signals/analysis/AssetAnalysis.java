package com.fintech.signals.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fintech.signals.domain.AssetCategory;
import com.fintech.signals.signal.DivergenceResult;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

/**
 * Complete RSI analysis of one instrument.
 *
 * @param divergence Present only when a divergence was detected
 * @param multiTimeframe RSI keyed by interval code; intervals without enough history are absent
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "RSI analysis and signal for one instrument")
public record AssetAnalysis(
    String id,
    String asset,
    String symbol,
    AssetCategory category,
    double currentPrice,
    RsiReading rsi,
    SignalResult signal,
    DivergenceResult divergence,
    Momentum momentum,
    Map<String, Double> multiTimeframe,
    long timestamp
) {
}
