package com.crypto.rebalance.calibration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Diagnostic summary of a calibration pass. Returns are in percent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalibrationInfo {

    private boolean profileApplied;

    private String profileName;

    private String profileVersion;

    private double originalReturn;

    private double calibratedReturn;

    /**
     * calibratedReturn - originalReturn, in percentage points.
     */
    private double adjustment;

    private double totalTradingCosts;

    /**
     * Why calibration was skipped, if it was.
     */
    private String error;

    private Map<String, Double> parameters;

    public static CalibrationInfo notApplied(String profileName, double originalReturn, String error) {
        return CalibrationInfo.builder()
                .profileApplied(false)
                .profileName(profileName)
                .originalReturn(originalReturn)
                .calibratedReturn(originalReturn)
                .adjustment(0.0)
                .error(error)
                .parameters(Map.of())
                .build();
    }
}
