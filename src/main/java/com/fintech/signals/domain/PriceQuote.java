package com.fintech.signals.domain;

/**
 * Current price for one instrument as returned by the quote service.
 *
 * @param instrument Priced instrument
 * @param price USD price
 * @param timestamp Fetch time (Unix epoch millis)
 * @param source Upstream feed name
 * @param priceChange24h 24h change in percent as reported by the feed, null when it has none
 */
public record PriceQuote(
    Instrument instrument,
    double price,
    long timestamp,
    String source,
    Double priceChange24h
) {

    public PriceQuote(Instrument instrument, double price, long timestamp, String source) {
        this(instrument, price, timestamp, source, null);
    }

    public PriceObservation toObservation() {
        return new PriceObservation(instrument.id(), price, timestamp, source);
    }
}
