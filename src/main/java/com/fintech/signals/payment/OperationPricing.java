package com.fintech.signals.payment;

import com.fintech.signals.config.SignalProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Price table for metered operations: built-in defaults overlaid with
 * {@code signals.payment.pricing.<operation-name>} overrides.
 */
public class OperationPricing {

    private final Map<MeteredOperation, PaymentRequirement> requirements = new EnumMap<>(MeteredOperation.class);

    public OperationPricing(SignalProperties properties) {
        Map<String, SignalProperties.Payment.Pricing> overrides = properties.getPayment().getPricing();
        for (MeteredOperation operation : MeteredOperation.values()) {
            SignalProperties.Payment.Pricing override = overrides.get(operation.operationName());
            long amount = operation.defaultAmount();
            String description = operation.defaultDescription();
            if (override != null) {
                if (override.getAmount() != null) {
                    if (override.getAmount() < 0) {
                        throw new IllegalArgumentException(
                            "Price for " + operation.operationName() + " must not be negative");
                    }
                    amount = override.getAmount();
                }
                if (override.getDescription() != null && !override.getDescription().isBlank()) {
                    description = override.getDescription();
                }
            }
            requirements.put(operation, PaymentRequirement.of(operation, amount, description));
        }
    }

    public PaymentRequirement requirementFor(MeteredOperation operation) {
        return requirements.get(operation);
    }

    public Map<MeteredOperation, PaymentRequirement> all() {
        return Map.copyOf(requirements);
    }
}
