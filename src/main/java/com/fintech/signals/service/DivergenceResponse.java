package com.fintech.signals.service;

import com.fintech.signals.domain.AssetCategory;
import com.fintech.signals.domain.Interval;
import com.fintech.signals.signal.DivergenceResult;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Result of get-rsi-divergence.
 */
@Schema(description = "RSI/price divergence over a lookback window")
public record DivergenceResponse(
    @Schema(description = "Ticker symbol", example = "WBTC")
    String symbol,

    @Schema(description = "Asset category", example = "wrapped-btc")
    AssetCategory category,

    Interval interval,

    @Schema(description = "Lookback window in candles", example = "10")
    int lookback,

    DivergenceResult divergence,

    @Schema(description = "Current RSI(14)", example = "41.7")
    double currentRsi,

    @Schema(description = "Close of the newest candle", example = "96950.5")
    double currentPrice,

    @Schema(example = "Bullish divergence detected - potential reversal to upside")
    String interpretation,

    @Schema(example = "Consider LONG positions - price may reverse upward")
    String tradingImplication,

    long timestamp
) {
}
