package com.fintech.signals.analysis;

public enum SignalAction {
    BUY,
    SELL,
    HOLD
}
