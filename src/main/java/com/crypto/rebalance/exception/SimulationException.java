package com.crypto.rebalance.exception;

import lombok.Getter;

/**
 * Base exception for the simulation core.
 * Carries a short error code so run records can store a stable failure category.
 */
@Getter
public abstract class SimulationException extends RuntimeException {

    private final String errorCode;

    protected SimulationException(String message) {
        super(message);
        this.errorCode = getDefaultErrorCode();
    }

    protected SimulationException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = getDefaultErrorCode();
    }

    protected abstract String getDefaultErrorCode();
}
