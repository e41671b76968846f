package com.crypto.rebalance.simulation;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Parameters of one named simulation run.
 * Nullable overrides fall back to the configured defaults in {@link SimulationEngineFactory}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationRequest {

    private String runName;

    private LocalDateTime startDate;

    private int durationDays;

    @Builder.Default
    private int cycleLengthMinutes = 1440;

    private double startingCapital;

    /**
     * Hard cap on the number of cycles, independent of the horizon.
     */
    @Builder.Default
    private int maxCycles = 50_000;

    /**
     * Profile name, or null / "none" for no calibration.
     */
    private String calibrationProfile;

    private Boolean protectionEnabled;

    private Boolean realisticMode;

    private Long randomSeed;
}
