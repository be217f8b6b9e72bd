package com.fintech.signals.signal;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Exit verdict for a hypothetical position opened at some entry price.
 *
 * @param shouldExit Whether any exit condition holds
 * @param trigger Condition that fired, {@link ExitTrigger#NONE} otherwise
 * @param reason Human-readable explanation
 * @param triggerLevel Price or RSI level that was breached, null without an exit
 * @param stopLoss Stop-loss price for the entry
 * @param takeProfit Take-profit price for the entry
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExitSignal(
    boolean shouldExit,
    ExitTrigger trigger,
    String reason,
    Double triggerLevel,
    double stopLoss,
    double takeProfit
) {
}
