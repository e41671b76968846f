package com.crypto.rebalance.simulation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinalSummary {

    private double startingCapital;

    private double finalCapital;

    private double finalPortfolioValue;

    private double finalReserveValue;

    /**
     * Percent.
     */
    private double totalReturn;

    private double totalTradingCosts;

    private int protectionCycles;

    public double getRealizedPnl() {
        return finalCapital - startingCapital;
    }

    public static FinalSummary of(double startingCapital, List<SimulationCycleRecord> cycles) {
        if (cycles.isEmpty()) {
            return FinalSummary.builder()
                    .startingCapital(startingCapital)
                    .finalCapital(startingCapital)
                    .build();
        }

        SimulationCycleRecord last = cycles.get(cycles.size() - 1);
        double costs = 0.0;
        int protectionCycles = 0;
        for (SimulationCycleRecord cycle : cycles) {
            costs += cycle.getTradingCosts();
            if (cycle.isProtectionActive()) {
                protectionCycles++;
            }
        }

        return FinalSummary.builder()
                .startingCapital(startingCapital)
                .finalCapital(last.getTotalValue())
                .finalPortfolioValue(last.getPortfolioValue())
                .finalReserveValue(last.getReserveValue())
                .totalReturn(startingCapital == 0 ? 0.0 : (last.getTotalValue() / startingCapital - 1) * 100)
                .totalTradingCosts(costs)
                .protectionCycles(protectionCycles)
                .build();
    }
}
