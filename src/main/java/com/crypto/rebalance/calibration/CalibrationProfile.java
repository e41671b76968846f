package com.crypto.rebalance.calibration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Named, versioned calibration profile as stored in {@code calibration-profiles/<name>.json}.
 * Read-only once loaded.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CalibrationProfile {

    public static final String STATUS_INSUFFICIENT_DATA = "insufficient_data";

    @JsonProperty("profile_name")
    private String profileName;

    private String version;

    private String description;

    @JsonProperty("created_date")
    private String createdDate;

    @JsonProperty("profile_type")
    private String profileType;

    private String status;

    @JsonProperty("calibration_parameters")
    private CalibrationParameters calibrationParameters;

    @JsonProperty("market_conditions")
    private Map<String, Object> marketConditions;

    @JsonProperty("expected_performance")
    private Map<String, Object> expectedPerformance;

    private Map<String, Object> metadata;

    public boolean hasInsufficientData() {
        return STATUS_INSUFFICIENT_DATA.equalsIgnoreCase(status);
    }

    public String marketRegime() {
        Object regime = marketConditions == null ? null : marketConditions.get("market_regime");
        return regime == null ? "unknown" : regime.toString();
    }

    public double minimumCapital() {
        Object value = metadata == null ? null : metadata.get("minimum_capital");
        return value instanceof Number ? ((Number) value).doubleValue() : 0.0;
    }
}
