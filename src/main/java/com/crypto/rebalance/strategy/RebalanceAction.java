package com.crypto.rebalance.strategy;

/**
 * Actions reported per cycle in {@code actions_taken}.
 */
public enum RebalanceAction {
    CRYPTO_REBALANCE,
    RESERVE_PROTECTION,
    PROTECTION_ENTERED,
    PROTECTION_EXITED,
    COIN_SELECTION_UPDATED
}
