package com.crypto.rebalance.strategy;

/**
 * Market regime classification.
 * Each regime carries the parameters the strategy and the synthetic market use for it,
 * so every regime is handled explicitly wherever those parameters are read.
 */
public enum MarketRegime {

    /**
     * Consistent uptrend with the anchor assets moving together.
     */
    BULL("bull", "Trend-following strategy", 0.8, 1.08, 1.4),

    /**
     * Consistent, controlled downtrend.
     */
    BEAR("bear", "Capital preservation strategy", 0.3, 0.92, 0.6),

    /**
     * Daily volatility above 6% regardless of direction.
     */
    VOLATILE("volatile", "Volatility management strategy", 0.4, 0.95, 1.1),

    /**
     * No clear direction. Also the default when history is insufficient.
     */
    SIDEWAYS("sideways", "Balanced range-trading strategy", 0.6, 1.0, 1.0);

    private final String label;
    private final String description;
    private final double momentumWeight;
    private final double riskMultiplier;
    private final double syntheticReturnMultiplier;

    MarketRegime(String label, String description, double momentumWeight,
                 double riskMultiplier, double syntheticReturnMultiplier) {
        this.label = label;
        this.description = description;
        this.momentumWeight = momentumWeight;
        this.riskMultiplier = riskMultiplier;
        this.syntheticReturnMultiplier = syntheticReturnMultiplier;
    }

    public String getLabel() {
        return label;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Weight of the momentum component in the hybrid signal.
     */
    public double getMomentumWeight() {
        return momentumWeight;
    }

    public double getMeanReversionWeight() {
        return 1.0 - momentumWeight;
    }

    /**
     * Scale applied to hybrid-adjusted allocations before they are bounded and renormalised.
     */
    public double getRiskMultiplier() {
        return riskMultiplier;
    }

    /**
     * Scale applied to synthetic per-asset returns generated while this regime is detected.
     */
    public double getSyntheticReturnMultiplier() {
        return syntheticReturnMultiplier;
    }
}
