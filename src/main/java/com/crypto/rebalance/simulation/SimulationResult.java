package com.crypto.rebalance.simulation;

import com.crypto.rebalance.calibration.CalibrationInfo;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of a run. A failed run keeps the cycles completed before the failure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationResult {

    private String runName;

    private boolean success;

    private String failureReason;

    private List<SimulationCycleRecord> cycles;

    private int totalCycles;

    private FinalSummary finalSummary;

    private CalibrationInfo calibrationInfo;

    /**
     * Regime label per cycle, in order.
     */
    private List<String> regimeHistory;

    private List<String> finalCoinSelection;

    /**
     * Coin closes generated synthetically (warm-up coins count once).
     */
    private int syntheticDataPoints;
}
