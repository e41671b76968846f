package com.crypto.rebalance.persistence;

public enum SimulationStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
