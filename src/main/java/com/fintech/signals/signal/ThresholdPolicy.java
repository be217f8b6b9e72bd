package com.fintech.signals.signal;

import com.fintech.signals.config.SignalProperties;
import com.fintech.signals.domain.AssetCategory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Per-category signal policy, validated once at startup.
 */
public class ThresholdPolicy {

    private final Map<AssetCategory, CategoryPolicy> policies;

    public ThresholdPolicy(Map<AssetCategory, CategoryPolicy> policies) {
        EnumMap<AssetCategory, CategoryPolicy> copy = new EnumMap<>(AssetCategory.class);
        copy.putAll(policies);
        for (AssetCategory category : AssetCategory.values()) {
            if (!copy.containsKey(category)) {
                throw new IllegalStateException("No signal thresholds configured for " + category.code());
            }
        }
        this.policies = Collections.unmodifiableMap(copy);
    }

    public static ThresholdPolicy fromProperties(SignalProperties properties) {
        SignalProperties.Thresholds thresholds = properties.getThresholds();
        Map<AssetCategory, CategoryPolicy> policies = new EnumMap<>(AssetCategory.class);
        policies.put(AssetCategory.WRAPPED_BTC, toPolicy(thresholds.getWrappedBtc()));
        policies.put(AssetCategory.TOKENIZED_STOCK, toPolicy(thresholds.getTokenizedStock()));
        policies.put(AssetCategory.GOLD_TOKEN, toPolicy(thresholds.getGoldToken()));
        return new ThresholdPolicy(policies);
    }

    /** Built-in table, used by tests and as configuration defaults. */
    public static ThresholdPolicy defaults() {
        return fromProperties(new SignalProperties());
    }

    public CategoryPolicy forCategory(AssetCategory category) {
        return policies.get(category);
    }

    private static CategoryPolicy toPolicy(SignalProperties.CategoryThresholds config) {
        return new CategoryPolicy(
            config.getPeriod(),
            config.getOversold(),
            config.getOverbought(),
            config.getStopLoss(),
            config.getTakeProfit(),
            config.getTimeframe());
    }
}
