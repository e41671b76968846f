package com.crypto.rebalance.calibration;

import java.util.List;
import java.util.Optional;

/**
 * Lookup of calibration profiles by name.
 */
public interface CalibrationProfileStore {

    Optional<CalibrationProfile> loadProfile(String name);

    /**
     * Names of usable profiles, sorted. Profiles with insufficient data are left out.
     */
    List<String> listProfiles();
}
