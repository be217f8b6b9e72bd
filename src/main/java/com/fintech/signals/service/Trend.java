package com.fintech.signals.service;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.List;

/**
 * Direction of a close-price series, from the mean of its first third against its last third.
 */
public enum Trend {

    STRONGLY_BULLISH("strongly_bullish"),
    BULLISH("bullish"),
    NEUTRAL("neutral"),
    BEARISH("bearish"),
    STRONGLY_BEARISH("strongly_bearish");

    static final double STRONG_MOVE = 0.02;
    static final double MOVE = 0.005;

    private final String code;

    Trend(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static Trend of(List<Double> prices) {
        int third = prices.size() / 3;
        if (prices.size() < 2 || third == 0) {
            return NEUTRAL;
        }
        double firstAvg = prices.subList(0, third).stream().mapToDouble(Double::doubleValue).average().orElse(0);
        double lastAvg = prices.subList(prices.size() - third, prices.size()).stream()
            .mapToDouble(Double::doubleValue).average().orElse(0);
        if (firstAvg == 0) {
            return NEUTRAL;
        }

        double change = (lastAvg - firstAvg) / firstAvg;
        if (change > STRONG_MOVE) {
            return STRONGLY_BULLISH;
        }
        if (change > MOVE) {
            return BULLISH;
        }
        if (change < -STRONG_MOVE) {
            return STRONGLY_BEARISH;
        }
        if (change < -MOVE) {
            return BEARISH;
        }
        return NEUTRAL;
    }
}
