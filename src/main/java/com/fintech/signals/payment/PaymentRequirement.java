package com.fintech.signals.payment;

import java.util.Locale;

/**
 * What a caller must pay to invoke one operation.
 *
 * @param operation Metered operation
 * @param amount Price in USDC micro-units
 * @param formatted Display price, e.g. "$0.050 USDC"
 * @param description What the caller buys
 */
public record PaymentRequirement(
    MeteredOperation operation,
    long amount,
    String formatted,
    String description
) {

    public static PaymentRequirement of(MeteredOperation operation, long amount, String description) {
        return new PaymentRequirement(operation, amount, format(amount), description);
    }

    /** Formats micro-units as dollars with three decimals. */
    public static String format(long amount) {
        return String.format(Locale.ROOT, "$%.3f USDC", amount / 1_000_000.0);
    }
}
