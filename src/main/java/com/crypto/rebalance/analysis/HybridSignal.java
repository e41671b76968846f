package com.crypto.rebalance.analysis;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Blended momentum + mean-reversion indicator for one asset.
 */
@Getter
@ToString
@Builder
public class HybridSignal {

    /**
     * Weighted blend in [-1, 1].
     */
    private final double hybridSignal;

    private final double momentumComponent;

    private final double meanReversionComponent;

    private final double momentumWeight;

    private final double meanReversionWeight;

    public double getStrength() {
        return Math.abs(hybridSignal);
    }
}
