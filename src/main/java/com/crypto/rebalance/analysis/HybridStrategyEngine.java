package com.crypto.rebalance.analysis;

import com.crypto.rebalance.indicator.PriceStatistics;
import com.crypto.rebalance.strategy.MarketRegime;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Hybrid strategy combining momentum and mean reversion, weighted by market regime.
 */
public class HybridStrategyEngine {

    public static final int MOMENTUM_LOOKBACK = 7;
    public static final int MEAN_REVERSION_LOOKBACK = 14;

    private static final double MOMENTUM_SCALE = 5.0;
    private static final double MEAN_REVERSION_SCALE = 0.5;
    private static final double Z_SCORE_EPSILON = 1e-8;
    private static final double MAX_ADJUSTMENT = 0.20;
    private static final double BASE_TOLERANCE = 0.15;
    private static final double CONFIDENCE_TOLERANCE = 0.10;
    private static final double MIN_ENHANCED_ALLOCATION = 0.02;
    private static final double MAX_ENHANCED_ALLOCATION = 0.25;

    /**
     * Fraction of same-direction daily moves rescaled to [0, 1]:
     * |upMoves / moves - 0.5| * 2.
     */
    public double calculateTrendConsistency(List<Double> prices) {
        if (prices.size() < 3) {
            return 0.0;
        }
        int moves = prices.size() - 1;
        int upMoves = 0;
        for (int i = 1; i < prices.size(); i++) {
            if (prices.get(i) > prices.get(i - 1)) {
                upMoves++;
            }
        }
        return Math.abs((double) upMoves / moves - 0.5) * 2;
    }

    /**
     * (p[-1] / p[-7] - 1) * consistency, scaled x5 and clamped to [-1, 1].
     */
    public double calculateMomentumSignal(List<Double> prices) {
        if (prices.size() < MOMENTUM_LOOKBACK) {
            return 0.0;
        }
        List<Double> window = PriceStatistics.tail(prices, MOMENTUM_LOOKBACK);
        double first = window.get(0);
        if (first == 0) {
            return 0.0;
        }
        double priceMomentum = window.get(window.size() - 1) / first - 1;
        double signal = priceMomentum * calculateTrendConsistency(window);
        return PriceStatistics.clamp(signal * MOMENTUM_SCALE, -1, 1);
    }

    /**
     * Negated z-score of the latest price against the 14-day mean and stdev, scaled by 0.5.
     * Positive when price sits below its mean.
     */
    public double calculateMeanReversionSignal(List<Double> prices) {
        if (prices.size() < MEAN_REVERSION_LOOKBACK) {
            return 0.0;
        }
        List<Double> window = PriceStatistics.tail(prices, MEAN_REVERSION_LOOKBACK);
        double movingAverage = PriceStatistics.mean(window);
        double stdDev = PriceStatistics.stdDev(window);
        double zScore = (window.get(window.size() - 1) - movingAverage) / (stdDev + Z_SCORE_EPSILON);
        return PriceStatistics.clamp(-zScore * MEAN_REVERSION_SCALE, -1, 1);
    }

    public HybridSignal getHybridSignal(List<Double> prices, MarketRegime regime) {
        double momentum = calculateMomentumSignal(prices);
        double meanReversion = calculateMeanReversionSignal(prices);

        double momentumWeight = regime.getMomentumWeight();
        double meanReversionWeight = regime.getMeanReversionWeight();

        return HybridSignal.builder()
                .hybridSignal(momentum * momentumWeight + meanReversion * meanReversionWeight)
                .momentumComponent(momentum)
                .meanReversionComponent(meanReversion)
                .momentumWeight(momentumWeight)
                .meanReversionWeight(meanReversionWeight)
                .build();
    }

    /**
     * Scale a base allocation by up to +/-20% according to signal strength and direction,
     * bounded to a tolerance band of 15-25% around the base that widens with confidence.
     */
    public double calculatePositionAdjustment(double hybridSignal, double baseAllocation) {
        double strength = Math.abs(hybridSignal);
        double direction = hybridSignal > 0 ? 1.0 : -1.0;

        double confidence = Math.min(strength * 2, 1.0);
        double maxAdjustment = MAX_ADJUSTMENT * confidence;
        double adjusted = baseAllocation * (1 + direction * strength * maxAdjustment);

        double tolerance = BASE_TOLERANCE + confidence * CONFIDENCE_TOLERANCE;
        return PriceStatistics.clamp(adjusted,
                baseAllocation * (1 - tolerance),
                baseAllocation * (1 + tolerance));
    }

    /**
     * Apply hybrid adjustment and the regime risk multiplier to every asset with
     * at least 14 prices, bound each to [2%, 25%] and renormalise to 1.0.
     * <p>
     * The bounds apply before renormalisation, so a final weight can leave [2%, 25%]
     * (two capped assets end at 50% each).
     */
    public Map<String, Double> enhanceAllocations(Map<String, Double> baseAllocations,
                                                  Map<String, List<Double>> marketData,
                                                  MarketRegime regime) {
        Map<String, Double> enhanced = new LinkedHashMap<>();
        for (Map.Entry<String, Double> entry : baseAllocations.entrySet()) {
            String symbol = entry.getKey();
            double base = entry.getValue();
            List<Double> prices = marketData.get(symbol);

            if (prices == null || prices.size() < MEAN_REVERSION_LOOKBACK) {
                enhanced.put(symbol, base);
                continue;
            }

            HybridSignal signal = getHybridSignal(prices, regime);
            double adjusted = calculatePositionAdjustment(signal.getHybridSignal(), base) * regime.getRiskMultiplier();
            enhanced.put(symbol, PriceStatistics.clamp(adjusted, MIN_ENHANCED_ALLOCATION, MAX_ENHANCED_ALLOCATION));
        }
        return Allocations.normalize(enhanced);
    }
}
