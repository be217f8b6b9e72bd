package com.fintech.signals.api;

import com.fintech.signals.payment.PaymentRequirement;
import com.fintech.signals.payment.RequestContext;
import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

/**
 * 402 body telling the caller what to pay and how to retry.
 */
@Schema(description = "Payment required to invoke the operation")
public record PaymentRequiredResponse(
    @Schema(example = "PAYMENT_REQUIRED")
    String error,

    @Schema(description = "Metered operation", example = "get-rsi-analysis")
    String operation,

    @Schema(description = "Why authorization was refused", example = "Payment Required")
    String reason,

    Pricing pricing,

    List<String> instructions,

    @Schema(description = "Request header carrying the payment proof", example = "X-PAYMENT")
    String header,

    @Schema(example = "https://docs.payai.network/x402")
    String documentation
) {

    static final String DOCUMENTATION_URL = "https://docs.payai.network/x402";

    public static PaymentRequiredResponse of(PaymentRequirement requirement, String reason) {
        return new PaymentRequiredResponse(
            "PAYMENT_REQUIRED",
            requirement.operation().operationName(),
            reason,
            new Pricing(requirement.amount(), requirement.formatted(), requirement.description()),
            List.of(
                "1. Create a signed transaction for " + requirement.formatted(),
                "2. Submit transaction to facilitator",
                "3. Include " + RequestContext.PAYMENT_HEADER + " header with payment proof",
                "4. Retry the request with the payment header"),
            RequestContext.PAYMENT_HEADER,
            DOCUMENTATION_URL);
    }

    @Schema(description = "Operation price")
    public record Pricing(
        @Schema(description = "USDC micro-units", example = "50000")
        long amount,

        @Schema(example = "$0.050 USDC")
        String formatted,

        String description
    ) {}
}
