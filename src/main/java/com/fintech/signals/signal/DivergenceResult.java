package com.fintech.signals.signal;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Price/RSI divergence found in a lookback window.
 *
 * @param bullish Lower price low with a higher RSI low
 * @param bearish Higher price high with a lower RSI high
 * @param strength Present only when a divergence was found
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DivergenceResult(boolean bullish, boolean bearish, Double strength) {

    private static final DivergenceResult NONE = new DivergenceResult(false, false, null);

    public static DivergenceResult none() {
        return NONE;
    }

    @JsonIgnore
    public boolean isDetected() {
        return bullish || bearish;
    }
}
