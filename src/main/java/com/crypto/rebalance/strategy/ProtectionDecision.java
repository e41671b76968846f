package com.crypto.rebalance.strategy;

/**
 * Outcome of one capital-protection evaluation.
 */
public enum ProtectionDecision {
    ENTERED,
    EXITED,
    STAY_PROTECTED,
    STAY_UNPROTECTED,
    COOLDOWN
}
