package com.crypto.rebalance.market;

import java.util.Arrays;

/**
 * Scaling applied to the synthetic per-asset return distribution.
 */
public enum VolatilityMode {

    LOW_VOLATILITY("low_volatility", 1.0, 1.0),
    AVERAGE_VOLATILITY("average_volatility", 1.3, 1.2),
    HIGH_VOLATILITY("high_volatility", 1.6, 1.5);

    private final String key;
    private final double baseMultiplier;
    private final double trendMultiplier;

    VolatilityMode(String key, double baseMultiplier, double trendMultiplier) {
        this.key = key;
        this.baseMultiplier = baseMultiplier;
        this.trendMultiplier = trendMultiplier;
    }

    public String getKey() {
        return key;
    }

    public double getBaseMultiplier() {
        return baseMultiplier;
    }

    public double getTrendMultiplier() {
        return trendMultiplier;
    }

    public static VolatilityMode fromKey(String key) {
        return Arrays.stream(values())
                .filter(mode -> mode.key.equalsIgnoreCase(key) || mode.name().equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown volatility mode: " + key));
    }
}
