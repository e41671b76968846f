package com.crypto.rebalance.exception;

/**
 * Malformed run parameters (horizon, cycle length, capital).
 * Raised before the first cycle executes.
 */
public class InvalidConfigurationException extends SimulationException {

    private static final String DEFAULT_ERROR_CODE = "ERR-SIM-CONFIG";

    public InvalidConfigurationException(String message) {
        super(message);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
