package com.fintech.signals.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Closed set of asset classes. Each carries its own signal policy.
 */
public enum AssetCategory {

    WRAPPED_BTC("wrapped-btc"),
    TOKENIZED_STOCK("rwa-stocks"),
    GOLD_TOKEN("gold");

    private final String code;

    AssetCategory(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Resolves a wire code ("rwa-stocks") or enum name ("TOKENIZED_STOCK"), case-insensitive.
     *
     * @throws IllegalArgumentException for unknown categories
     */
    public static AssetCategory fromCode(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (AssetCategory category : values()) {
                if (category.code.equalsIgnoreCase(trimmed) || category.name().equalsIgnoreCase(trimmed)) {
                    return category;
                }
            }
        }
        throw new IllegalArgumentException("Unknown category '" + value + "'. Supported: "
            + Arrays.stream(values()).map(AssetCategory::code).collect(Collectors.joining(", ")));
    }
}
