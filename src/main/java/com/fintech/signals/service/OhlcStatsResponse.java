package com.fintech.signals.service;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.Map;

/**
 * Result of get-ohlc-stats: candle counts per symbol and interval code.
 */
@Schema(description = "Accumulated candle counts")
public record OhlcStatsResponse(
    long timestamp,

    @Schema(description = "Candles held across every series", example = "1830")
    long totalCandles,

    @Schema(description = "Retention cap per series", example = "1000")
    int maxCandlesPerSeries,

    @Schema(description = "Symbol to interval code to candle count")
    Map<String, Map<String, Integer>> series
) {
}
