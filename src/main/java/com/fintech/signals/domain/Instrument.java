package com.fintech.signals.domain;

import java.util.Objects;

/**
 * Tracked tradable instrument. Loaded once at startup from static configuration.
 *
 * @param id Canonical id (token mint address), unique and stable
 * @param symbol Ticker symbol, e.g. "WBTC"
 * @param displayName Human-readable name
 * @param category Asset class driving signal policy
 * @param description Free-form description
 */
public record Instrument(
    String id,
    String symbol,
    String displayName,
    AssetCategory category,
    String description
) {

    public Instrument {
        Objects.requireNonNull(id, "Instrument id cannot be null");
        Objects.requireNonNull(symbol, "Instrument symbol cannot be null");
        Objects.requireNonNull(category, "Instrument category cannot be null");
        if (id.isBlank() || symbol.isBlank()) {
            throw new IllegalArgumentException("Instrument id and symbol must not be blank");
        }
        displayName = displayName != null ? displayName : symbol;
        description = description != null ? description : "";
    }
}
