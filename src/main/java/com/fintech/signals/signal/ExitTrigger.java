package com.fintech.signals.signal;

/**
 * Exit conditions in evaluation order; the first one that holds wins.
 */
public enum ExitTrigger {
    STOP_LOSS,
    TAKE_PROFIT,
    RSI_OVERBOUGHT,
    NONE
}
