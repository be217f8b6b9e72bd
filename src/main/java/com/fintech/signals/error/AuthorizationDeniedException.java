package com.fintech.signals.error;

import com.fintech.signals.payment.PaymentRequirement;

/**
 * The payment gate refused a metered operation. Carries what the caller must pay to retry.
 */
public class AuthorizationDeniedException extends SignalEngineException {

    private final PaymentRequirement requirement;

    public AuthorizationDeniedException(PaymentRequirement requirement, String reason) {
        super(ErrorKind.PAYMENT_REQUIRED, reason != null ? reason : "Payment Required");
        this.requirement = requirement;
    }

    public PaymentRequirement requirement() {
        return requirement;
    }
}
