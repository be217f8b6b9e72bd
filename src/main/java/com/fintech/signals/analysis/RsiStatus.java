package com.fintech.signals.analysis;

import com.fintech.signals.signal.CategoryPolicy;

/**
 * Where an RSI value sits against a category's thresholds.
 */
public enum RsiStatus {
    OVERSOLD,
    NEUTRAL,
    OVERBOUGHT;

    public static RsiStatus of(double rsi, CategoryPolicy policy) {
        if (rsi < policy.oversold()) return OVERSOLD;
        if (rsi > policy.overbought()) return OVERBOUGHT;
        return NEUTRAL;
    }
}
