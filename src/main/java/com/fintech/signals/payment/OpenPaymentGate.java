package com.fintech.signals.payment;

/**
 * Grants every request. Active when {@code signals.payment.enabled=false}.
 */
public class OpenPaymentGate implements PaymentAuthorizationGate {

    @Override
    public AuthorizationDecision authorize(MeteredOperation operation, RequestContext context) {
        return AuthorizationDecision.grant();
    }
}
