package com.fintech.signals.payment;

/**
 * Gate verdict for one invocation.
 *
 * @param granted Whether the operation may run
 * @param reason Why it was refused, null when granted
 */
public record AuthorizationDecision(boolean granted, String reason) {

    public static AuthorizationDecision grant() {
        return new AuthorizationDecision(true, null);
    }

    public static AuthorizationDecision deny(String reason) {
        return new AuthorizationDecision(false, reason);
    }
}
