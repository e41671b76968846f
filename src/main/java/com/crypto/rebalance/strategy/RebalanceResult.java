package com.crypto.rebalance.strategy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Output of one rebalance: target weights plus cost and execution metadata.
 * Weights sum to 1.0, or are {@code {reserve: 1.0}} under protection.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RebalanceResult {

    private boolean success;

    private String reason;

    private Map<String, Double> allocations;

    private double tradingCosts;

    private MarketRegime marketRegime;

    private boolean protectionActive;

    /**
     * Simulated execution delay in seconds.
     */
    private double executionDelay;

    private int failedOrders;

    private List<String> actionsTaken;

    private List<String> selectedCoins;

    public static RebalanceResult failure(String reason, MarketRegime regime) {
        return RebalanceResult.builder()
                .success(false)
                .reason(reason)
                .allocations(Map.of())
                .marketRegime(regime)
                .actionsTaken(List.of())
                .selectedCoins(List.of())
                .build();
    }
}
