package com.crypto.rebalance.calibration;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileSummary {

    private String name;

    private String version;

    private String description;

    private String createdDate;

    private String profileType;

    private String marketRegime;

    private Map<String, Object> expectedPerformance;

    private Map<String, Double> parameters;
}
