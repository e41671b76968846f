package com.crypto.rebalance.simulation;

import com.crypto.rebalance.strategy.MarketRegime;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one cycle. Immutable; calibration produces new records via {@code toBuilder()}.
 * {@code totalValue == portfolioValue + reserveValue == endingCapital}.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class SimulationCycleRecord {

    /**
     * 1-based.
     */
    private final int cycleNumber;

    private final LocalDateTime cycleDate;

    private final double startingCapital;

    private final double endingCapital;

    private final double portfolioValue;

    private final double reserveValue;

    private final double totalValue;

    /**
     * endingCapital / startingCapital - 1, net of trading costs.
     */
    private final double cycleReturn;

    private final Map<String, Double> allocationBreakdown;

    private final double tradingCosts;

    private final double executionDelay;

    private final int failedOrders;

    private final boolean failed;

    private final MarketRegime marketRegime;

    private final boolean protectionActive;

    private final List<String> actionsTaken;

    private final boolean calibrated;

    private final String calibrationProfile;

    public double getMultiplier() {
        return startingCapital == 0 ? 1.0 : endingCapital / startingCapital;
    }
}
