package com.fintech.signals.payment;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Externally invoked operations that pass through the payment gate.
 * Default prices are USDC micro-units (1 USDC = 1,000,000).
 */
public enum MeteredOperation {

    GET_CURRENT_PRICES("get-current-prices", 10_000L, "Real-time asset prices"),
    GET_OHLC_DATA("get-ohlc-data", 20_000L, "OHLC candlestick data"),
    GET_OHLC_STATS("get-ohlc-stats", 5_000L, "OHLC collection statistics"),
    GET_RSI_ANALYSIS("get-rsi-analysis", 50_000L, "RSI trading signal analysis"),
    GET_PORTFOLIO_SIGNALS("get-portfolio-signals", 100_000L, "Portfolio-wide trading signals"),
    GET_RSI_DIVERGENCE("get-rsi-divergence", 50_000L, "RSI divergence pattern detection");

    private final String operationName;
    private final long defaultAmount;
    private final String defaultDescription;

    MeteredOperation(String operationName, long defaultAmount, String defaultDescription) {
        this.operationName = operationName;
        this.defaultAmount = defaultAmount;
        this.defaultDescription = defaultDescription;
    }

    @JsonValue
    public String operationName() {
        return operationName;
    }

    public long defaultAmount() {
        return defaultAmount;
    }

    public String defaultDescription() {
        return defaultDescription;
    }
}
