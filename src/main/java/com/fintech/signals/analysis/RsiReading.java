package com.fintech.signals.analysis;

import com.fintech.signals.domain.Interval;

/**
 * Newest RSI value of an analysed series.
 */
public record RsiReading(double value, int period, Interval timeframe, RsiStatus status) {
}
