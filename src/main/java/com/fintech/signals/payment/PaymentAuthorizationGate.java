package com.fintech.signals.payment;

/**
 * Decides whether a caller may invoke a metered operation.
 * Verification and settlement happen behind this interface.
 */
public interface PaymentAuthorizationGate {

    AuthorizationDecision authorize(MeteredOperation operation, RequestContext context);
}
