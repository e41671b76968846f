package com.crypto.rebalance.strategy;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * Immutable strategy and market parameters for one simulation run.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class StrategySettings {

    public static final String RESERVE = "reserve";

    private final List<String> universe;

    private final List<String> initialSelection;

    /**
     * Always selected when present in the universe. The first two also drive regime detection.
     */
    @Builder.Default
    private final List<String> anchors = List.of("BTC", "ETH");

    @Builder.Default
    private final int targetCoins = 9;

    @Builder.Default
    private final int selectionInterval = 5;

    @Builder.Default
    private final int minCoinsForSelection = 10;

    @Builder.Default
    private final int minSelectionChanges = 2;

    @Builder.Default
    private final double minAllocation = 0.05;

    @Builder.Default
    private final double maxAllocation = 0.25;

    @Builder.Default
    private final double tradingFeeRate = 0.001;

    @Builder.Default
    private final double conversionFeeRate = 0.001;

    /**
     * Share of capital held in reserve outside protection.
     */
    @Builder.Default
    private final double reserveRatio = 0.05;

    /**
     * Per-cycle return earned by reserve holdings.
     */
    @Builder.Default
    private final double reserveYield = 0.0001;

    @Builder.Default
    private final int historyMaxLength = 30;

    @Builder.Default
    private final int warmupPoints = 30;

    @Builder.Default
    private final boolean protectionEnabled = true;

    @Builder.Default
    private final boolean realisticMode = false;

    public String primaryAnchor() {
        return anchors.isEmpty() ? universe.get(0) : anchors.get(0);
    }

    public String secondaryAnchor() {
        return anchors.size() > 1 ? anchors.get(1) : primaryAnchor();
    }
}
