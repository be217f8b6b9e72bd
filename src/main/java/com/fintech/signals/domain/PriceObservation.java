package com.fintech.signals.domain;

/**
 * Immutable price sample produced by one upstream fetch.
 *
 * @param instrumentId Canonical instrument id (mint address)
 * @param price Observed USD price
 * @param observedAt Observation time (Unix epoch millis)
 * @param source Feed that produced the price, e.g. "jupiter"
 */
public record PriceObservation(
    String instrumentId,
    double price,
    long observedAt,
    String source
) {

    /** Validates price is finite and positive, timestamp is positive, id is present. */
    public boolean isValid() {
        return instrumentId != null
            && !instrumentId.isBlank()
            && Double.isFinite(price)
            && price > 0
            && observedAt > 0;
    }
}
