package com.fintech.signals.analysis;

import com.fintech.signals.domain.Interval;

/**
 * Current RSI on one interval.
 */
public record TimeframeRsi(Interval interval, double rsi, RsiStatus status) {
}
