package com.fintech.signals.signal;

import com.fintech.signals.domain.Interval;

/**
 * Signal thresholds for one asset category.
 *
 * @param period RSI period
 * @param oversold RSI level a buy crossover must cross upward
 * @param overbought RSI level above which exits and sells trigger
 * @param stopLoss Stop-loss distance as a fraction of entry, e.g. 0.03
 * @param takeProfit Take-profit distance as a fraction of entry, e.g. 0.05
 * @param timeframe Interval analysed when the caller names none
 */
public record CategoryPolicy(
    int period,
    double oversold,
    double overbought,
    double stopLoss,
    double takeProfit,
    Interval timeframe
) {

    public CategoryPolicy {
        if (period < 2) {
            throw new IllegalArgumentException("RSI period must be at least 2, got " + period);
        }
        if (oversold <= 0 || overbought >= 100 || oversold >= overbought) {
            throw new IllegalArgumentException(
                "Require 0 < oversold (" + oversold + ") < overbought (" + overbought + ") < 100");
        }
        if (stopLoss <= 0 || stopLoss >= 1 || takeProfit <= 0) {
            throw new IllegalArgumentException(
                "Stop-loss must be in (0, 1) and take-profit positive, got " + stopLoss + " / " + takeProfit);
        }
        if (timeframe == null) {
            throw new IllegalArgumentException("Default timeframe cannot be null");
        }
    }

    public double stopLossPrice(double entryPrice) {
        return entryPrice * (1 - stopLoss);
    }

    public double takeProfitPrice(double entryPrice) {
        return entryPrice * (1 + takeProfit);
    }

    public double riskRewardRatio() {
        return takeProfit / stopLoss;
    }
}
