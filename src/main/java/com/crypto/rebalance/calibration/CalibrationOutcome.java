package com.crypto.rebalance.calibration;

import com.crypto.rebalance.simulation.SimulationCycleRecord;

import java.util.List;

/**
 * Rewritten cycle sequence plus its diagnostic summary.
 */
public record CalibrationOutcome(List<SimulationCycleRecord> cycles, CalibrationInfo info) {
}
