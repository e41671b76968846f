package com.crypto.rebalance.market;

import com.crypto.rebalance.indicator.PriceStatistics;
import com.crypto.rebalance.strategy.MarketRegime;

import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Per-asset daily return generator used when real prices are unavailable.
 *
 * return = ((mean + std * N(0,1)) * baseMultiplier + trend * trendMultiplier)
 *          * regimeMultiplier * signalAdjustment
 */
public class SyntheticReturnModel {

    public static final AssetReturnProfile DEFAULT_PROFILE = new AssetReturnProfile(0.0010, 0.050, 0.0005);

    private static final Map<String, AssetReturnProfile> PROFILES = Map.of(
            "BTC", new AssetReturnProfile(0.0010, 0.030, 0.0005),
            "ETH", new AssetReturnProfile(0.0012, 0.040, 0.0005),
            "BNB", new AssetReturnProfile(0.0010, 0.035, 0.0005)
    );

    /**
     * A single step can lose at most 95%, keeping prices positive.
     */
    public static final double MIN_STEP_RETURN = -0.95;

    private static final double MIN_SIGNAL_CONFIDENCE = 0.3;
    private static final double MIN_MOMENTUM_CONFIDENCE = 0.5;
    private static final double MOMENTUM_SCORE_SCALE = 0.1;
    private static final double MAX_SIGNAL_ADJUSTMENT = 0.12;
    private static final double SIGNAL_ADJUSTMENT_SCALE = 0.15;

    private final RandomGenerator random;
    private final VolatilityMode volatilityMode;

    public SyntheticReturnModel(RandomGenerator random, VolatilityMode volatilityMode) {
        this.random = random;
        this.volatilityMode = volatilityMode;
    }

    public AssetReturnProfile profileFor(String symbol) {
        return PROFILES.getOrDefault(symbol, DEFAULT_PROFILE);
    }

    /**
     * One draw from the asset's base distribution, scaled by the volatility mode.
     */
    public double baseReturn(String symbol) {
        AssetReturnProfile profile = profileFor(symbol);
        double draw = profile.mean() + profile.std() * random.nextGaussian();
        return draw * volatilityMode.getBaseMultiplier() + profile.trend() * volatilityMode.getTrendMultiplier();
    }

    public double assetReturn(String symbol, MarketRegime regime, double signalAdjustment) {
        double value = baseReturn(symbol) * regime.getSyntheticReturnMultiplier() * signalAdjustment;
        return Math.max(MIN_STEP_RETURN, value);
    }

    /**
     * Multiplier in [0.88, 1.12] applied when both the hybrid signal and the momentum score
     * are confident. Returns 1.0 otherwise.
     */
    public double signalAdjustment(double hybridSignal, double momentumScore) {
        double signalConfidence = Math.abs(hybridSignal);
        double momentumConfidence = Math.min(1.0, Math.abs(momentumScore) / MOMENTUM_SCORE_SCALE);

        if (signalConfidence <= MIN_SIGNAL_CONFIDENCE || momentumConfidence <= MIN_MOMENTUM_CONFIDENCE) {
            return 1.0;
        }

        double combined = PriceStatistics.clamp(hybridSignal * 0.6 + momentumScore * 0.4, -1, 1);
        double magnitude = Math.min(MAX_SIGNAL_ADJUSTMENT, signalConfidence * momentumConfidence * SIGNAL_ADJUSTMENT_SCALE);
        return 1.0 + combined * magnitude;
    }

    public VolatilityMode getVolatilityMode() {
        return volatilityMode;
    }
}
