package com.fintech.signals.payment;

import com.fintech.signals.error.AuthorizationDeniedException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consults the gate exactly once per externally invoked operation.
 */
public class OperationGuard {

    private static final Logger log = LoggerFactory.getLogger(OperationGuard.class);

    private final PaymentAuthorizationGate gate;
    private final OperationPricing pricing;
    private final MeterRegistry meterRegistry;

    public OperationGuard(PaymentAuthorizationGate gate, OperationPricing pricing, MeterRegistry meterRegistry) {
        this.gate = gate;
        this.pricing = pricing;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Returns normally when the gate grants the operation.
     *
     * @throws AuthorizationDeniedException carrying the operation's price when refused
     */
    public void check(MeteredOperation operation, RequestContext context) {
        AuthorizationDecision decision = gate.authorize(operation, context != null ? context : RequestContext.empty());
        if (decision == null || !decision.granted()) {
            String reason = decision != null ? decision.reason() : null;
            meterRegistry.counter("signals.payment.denied", "operation", operation.operationName()).increment();
            log.info("Authorization denied: operation={}, reason={}", operation.operationName(), reason);
            throw new AuthorizationDeniedException(pricing.requirementFor(operation), reason);
        }
        meterRegistry.counter("signals.payment.granted", "operation", operation.operationName()).increment();
    }

    public PaymentRequirement requirementFor(MeteredOperation operation) {
        return pricing.requirementFor(operation);
    }
}
