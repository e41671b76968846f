package com.crypto.rebalance.analysis;

import com.crypto.rebalance.indicator.PriceStatistics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ranks coins by a composite momentum score and selects a fixed-size universe.
 *
 * Score = (0.25 * r1d + 0.35 * r3d + 0.25 * r7d + 0.15 * acceleration) * volumeWeight
 *         / max(volatility, 0.01) * trendStrength * meanReversionFactor
 *
 * acceleration = (p[-1] - p[-4]) / 3 - (p[-4] - p[-7]) / 3, in price units, from 10 prices on.
 */
@Slf4j
public class MomentumCoinSelector {

    public static final int MIN_POINTS = 7;

    private static final int ACCELERATION_MIN_POINTS = 10;
    private static final double SHORT_WEIGHT = 0.25;
    private static final double MEDIUM_WEIGHT = 0.35; // 3-day return, most predictive
    private static final double LONG_WEIGHT = 0.25;
    private static final double ACCELERATION_WEIGHT = 0.15;
    private static final double MAX_VOLUME_WEIGHT = 1.5;
    private static final double VOLATILITY_FLOOR = 0.01;
    private static final double MAX_MEAN_REVERSION_PENALTY = 0.3;

    private final List<String> anchors;

    public MomentumCoinSelector(List<String> anchors) {
        this.anchors = List.copyOf(anchors);
    }

    /**
     * Composite momentum score. 0 for fewer than 7 prices.
     */
    public double calculateMomentumScore(List<Double> prices) {
        if (prices == null || prices.size() < MIN_POINTS) {
            return 0.0;
        }

        int n = prices.size();
        double last = prices.get(n - 1);
        double shortMomentum = (last / prices.get(n - 2) - 1) * SHORT_WEIGHT;
        double mediumMomentum = (last / prices.get(n - 4) - 1) * MEDIUM_WEIGHT;
        double longMomentum = (last / prices.get(n - 7) - 1) * LONG_WEIGHT;

        // Price-unit slopes: unlike the other terms this one scales with the price level
        double acceleration = 0.0;
        if (n >= ACCELERATION_MIN_POINTS) {
            double recentSlope = (last - prices.get(n - 4)) / 3;
            double olderSlope = (prices.get(n - 4) - prices.get(n - 7)) / 3;
            acceleration = (recentSlope - olderSlope) * ACCELERATION_WEIGHT;
        }

        List<Double> window = PriceStatistics.tail(prices, MIN_POINTS);
        double volatility = PriceStatistics.volatility(window);
        double volumeWeight = Math.min(MAX_VOLUME_WEIGHT, 1.0 + volatility * 2);

        double meanPrice = PriceStatistics.mean(window);
        double deviation = meanPrice == 0 ? 0.0 : (last - meanPrice) / meanPrice;
        double meanReversionFactor = 1.0 - Math.min(MAX_MEAN_REVERSION_PENALTY, Math.abs(deviation));

        double trendStrength = PriceStatistics.trendStrength(window);

        double baseMomentum = (shortMomentum + mediumMomentum + longMomentum + acceleration) * volumeWeight;
        double riskAdjusted = baseMomentum / Math.max(volatility, VOLATILITY_FLOOR);

        return riskAdjusted * trendStrength * meanReversionFactor;
    }

    /**
     * Scores every universe coin with at least 7 prices.
     * Coins with less history are left out of the ranking.
     */
    public Map<String, Double> scoreUniverse(Map<String, List<Double>> marketData, List<String> universe) {
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String coin : universe) {
            List<Double> prices = marketData.get(coin);
            if (prices != null && prices.size() >= MIN_POINTS) {
                scores.put(coin, calculateMomentumScore(prices));
            }
        }
        return scores;
    }

    /**
     * Select the top {@code count} coins by momentum score.
     * Anchors in the universe are always included, each replacing the lowest-ranked non-anchor.
     * The result lists anchors first, then the remaining coins by rank.
     */
    public List<String> selectTopCoins(Map<String, List<Double>> marketData, List<String> universe, int count) {
        Map<String, Double> scores = scoreUniverse(marketData, universe);

        // Stable sort keeps universe order for ties
        List<String> ranked = new ArrayList<>(scores.keySet());
        ranked.sort(Comparator.comparingDouble((String coin) -> scores.get(coin)).reversed());

        List<String> others = new ArrayList<>();
        for (String coin : ranked.subList(0, Math.min(count, ranked.size()))) {
            if (!anchors.contains(coin)) {
                others.add(coin);
            }
        }

        List<String> selected = new ArrayList<>();
        for (String anchor : anchors) {
            if (universe.contains(anchor) && selected.size() < count) {
                selected.add(anchor);
            }
        }

        int room = count - selected.size();
        while (others.size() > room) {
            String dropped = others.remove(others.size() - 1);
            log.debug("Anchor forced in, dropping lowest-ranked {}", dropped);
        }
        selected.addAll(others);
        return selected;
    }

    public List<String> getAnchors() {
        return anchors;
    }
}
