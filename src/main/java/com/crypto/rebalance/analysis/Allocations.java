package com.crypto.rebalance.analysis;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for symbol to weight maps.
 */
public final class Allocations {

    private Allocations() {}

    public static double total(Map<String, Double> allocations) {
        double sum = 0.0;
        for (double weight : allocations.values()) {
            sum += weight;
        }
        return sum;
    }

    /**
     * Scale weights to sum to 1.0. Falls back to equal weights when the total is not positive.
     */
    public static Map<String, Double> normalize(Map<String, Double> allocations) {
        Map<String, Double> normalized = new LinkedHashMap<>();
        if (allocations.isEmpty()) {
            return normalized;
        }
        double total = total(allocations);
        if (total <= 0 || !Double.isFinite(total)) {
            double equal = 1.0 / allocations.size();
            allocations.keySet().forEach(symbol -> normalized.put(symbol, equal));
            return normalized;
        }
        allocations.forEach((symbol, weight) -> normalized.put(symbol, weight / total));
        return normalized;
    }
}
