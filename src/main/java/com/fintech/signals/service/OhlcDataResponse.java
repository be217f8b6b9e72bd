package com.fintech.signals.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fintech.signals.domain.Candle;
import com.fintech.signals.domain.Instrument;
import com.fintech.signals.domain.Interval;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * Result of get-ohlc-data. Candles are oldest first.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "OHLC candles built from polled prices")
public record OhlcDataResponse(
    Instrument asset,

    @Schema(description = "Candle interval", example = "5m")
    Interval interval,

    @Schema(description = "Candles requested", example = "100")
    int requestedCount,

    @Schema(description = "Candles returned; lower while history accumulates", example = "42")
    int actualCount,

    List<Candle> candles,

    OhlcStatistics statistics,

    @Schema(description = "Bucket start of the oldest returned candle")
    long start,

    @Schema(description = "Bucket start of the newest returned candle")
    long end
) {
}
