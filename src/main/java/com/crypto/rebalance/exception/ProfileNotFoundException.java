package com.crypto.rebalance.exception;

import java.util.List;

/**
 * Calibration profile missing or unusable. Always recovered by skipping calibration.
 */
public class ProfileNotFoundException extends SimulationException {

    private static final String DEFAULT_ERROR_CODE = "ERR-SIM-PROFILE";

    public ProfileNotFoundException(String profileName) {
        super("Calibration profile not found: " + profileName);
    }

    public ProfileNotFoundException(String profileName, List<String> problems) {
        super("Calibration profile " + profileName + " is invalid: " + String.join("; ", problems));
    }

    public ProfileNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
