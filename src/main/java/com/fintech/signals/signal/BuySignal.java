package com.fintech.signals.signal;

/**
 * Entry verdict.
 *
 * @param signal Whether the category's entry rule matched
 * @param confidence 0 without a match, otherwise in [0.5, 1]
 * @param reason Sub-conditions that fired, or where RSI sits when nothing did
 */
public record BuySignal(boolean signal, double confidence, String reason) {

    public static BuySignal none(String reason) {
        return new BuySignal(false, 0.0, reason);
    }
}
