package com.fintech.signals.service;

import com.fintech.signals.quote.InstrumentPrice;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Result of get-current-prices.
 */
@Schema(description = "Current prices with a summary")
public record CurrentPricesResponse(
    @Schema(description = "Response time (Unix epoch millis)")
    long timestamp,

    @Schema(description = "Category filter, or 'all'", example = "rwa-stocks")
    String category,

    @Schema(description = "Number of priced instruments", example = "11")
    int totalAssets,

    List<InstrumentPrice> prices,

    PriceSummary summary
) {

    @Schema(description = "Aggregate over the returned prices")
    public record PriceSummary(double avgPrice, double minPrice, double maxPrice) {

        static PriceSummary of(List<InstrumentPrice> prices) {
            return new PriceSummary(
                prices.stream().mapToDouble(InstrumentPrice::price).average().orElse(0),
                prices.stream().mapToDouble(InstrumentPrice::price).min().orElse(0),
                prices.stream().mapToDouble(InstrumentPrice::price).max().orElse(0));
        }
    }
}
