package com.fintech.signals.analysis;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.swagger.v3.oas.annotations.media.Schema;

/**
 * Advisory trading signal. Derived per request, never an open position.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Advisory trading signal")
public record SignalResult(
    @Schema(description = "Suggested action", example = "BUY")
    SignalAction action,

    @Schema(description = "Confidence in [0, 1]", example = "0.7")
    double confidence,

    @Schema(description = "Entry price (BUY only)")
    Double entryPrice,

    @Schema(description = "Stop-loss price (BUY only)")
    Double stopLoss,

    @Schema(description = "Take-profit price (BUY only)")
    Double takeProfit,

    @Schema(description = "Take-profit distance over stop-loss distance (BUY only)", example = "1.67")
    Double riskRewardRatio,

    @Schema(description = "Why the action was chosen", example = "RSI oversold reversal")
    String reason
) {

    public SignalResult {
        if (confidence < 0 || confidence > 1) {
            throw new IllegalArgumentException("Confidence must be in [0, 1], got " + confidence);
        }
    }

    public static SignalResult hold(String reason) {
        return new SignalResult(SignalAction.HOLD, 0.0, null, null, null, null, reason);
    }

    public static SignalResult sell(double confidence, String reason) {
        return new SignalResult(SignalAction.SELL, confidence, null, null, null, null, reason);
    }
}
