package com.fintech.signals.quote;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fintech.signals.domain.AssetCategory;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Price row returned by get-current-prices.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Current price for one instrument")
public record InstrumentPrice(
    @Schema(description = "Canonical instrument id (mint address)")
    String id,

    @Schema(description = "Ticker symbol", example = "WBTC")
    String symbol,

    @Schema(description = "Display name", example = "Wrapped Bitcoin (Portal)")
    String name,

    @Schema(description = "Asset category", example = "wrapped-btc")
    AssetCategory category,

    @Schema(description = "USD price", example = "97012.55")
    double price,

    @Schema(description = "Change over the last 24 hourly candles in percent, absent with less history")
    Double priceChange24h,

    @Schema(description = "Fetch time (Unix epoch millis)")
    long timestamp,

    @Schema(description = "Upstream feed", example = "jupiter")
    String source
) {
}
