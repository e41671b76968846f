package com.crypto.rebalance.exception;

/**
 * Allocation computation failed inside a cycle. Fatal for the run.
 */
public class StrategyExecutionException extends SimulationException {

    private static final String DEFAULT_ERROR_CODE = "ERR-SIM-STRATEGY";

    public StrategyExecutionException(String message) {
        super(message);
    }

    public StrategyExecutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    protected String getDefaultErrorCode() {
        return DEFAULT_ERROR_CODE;
    }
}
