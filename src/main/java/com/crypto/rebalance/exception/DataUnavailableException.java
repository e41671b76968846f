package com.crypto.rebalance.exception;

/**
 * The price-history collaborator could not supply enough rows.
 * Always recovered by switching to synthetic generation.
 */
public class DataUnavailableException extends SimulationException {

    private static final String DEFAULT_ERROR_CODE = "ERR-SIM-DATA";

    public DataUnavailableException(String message) {
        super(message);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
