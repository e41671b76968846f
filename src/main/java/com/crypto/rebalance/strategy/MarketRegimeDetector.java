package com.crypto.rebalance.strategy;

import com.crypto.rebalance.indicator.PriceStatistics;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Detects the market regime from the recent prices of two reference assets.
 * Stateless: identical inputs always produce the identical regime.
 *
 * Classification priority: VOLATILE > BULL > BEAR > SIDEWAYS.
 */
@Slf4j
public class MarketRegimeDetector {

    public static final int REQUIRED_POINTS = 14;

    private static final int SHORT_WINDOW = 3;
    private static final int MEDIUM_WINDOW = 7;
    private static final int LONG_WINDOW = 14;

    private static final double VOLATILE_THRESHOLD = 0.06;
    private static final double BULL_SHORT_TREND = 0.012;
    private static final double BULL_MEDIUM_TREND = 0.006;
    private static final double BULL_MIN_CORRELATION = 0.7;
    private static final double BULL_MAX_VOLATILITY = 0.08;
    private static final double BEAR_SHORT_TREND = -0.012;
    private static final double BEAR_MEDIUM_TREND = -0.006;
    private static final double BEAR_MAX_VOLATILITY = 0.10;

    /**
     * Detect regime from the primary and secondary anchor histories (oldest first).
     * Only the last 14 points of each are read.
     */
    public MarketRegimeResult detect(List<Double> primaryPrices, List<Double> secondaryPrices) {
        if (primaryPrices == null || secondaryPrices == null
                || primaryPrices.size() < REQUIRED_POINTS || secondaryPrices.size() < REQUIRED_POINTS) {
            log.debug("Not enough history for regime detection: primary={}, secondary={}",
                    primaryPrices == null ? 0 : primaryPrices.size(),
                    secondaryPrices == null ? 0 : secondaryPrices.size());
            return MarketRegimeResult.insufficientData();
        }

        double shortTrend = PriceStatistics.trend(PriceStatistics.tail(primaryPrices, SHORT_WINDOW));
        double mediumTrend = PriceStatistics.trend(PriceStatistics.tail(primaryPrices, MEDIUM_WINDOW));
        double longTrend = PriceStatistics.trend(PriceStatistics.tail(primaryPrices, LONG_WINDOW));
        double volatility = PriceStatistics.volatility(PriceStatistics.tail(primaryPrices, MEDIUM_WINDOW));
        double correlation = PriceStatistics.returnCorrelation(
                PriceStatistics.tail(primaryPrices, MEDIUM_WINDOW),
                PriceStatistics.tail(secondaryPrices, MEDIUM_WINDOW));

        MarketRegime regime = classify(shortTrend, mediumTrend, volatility, correlation);

        log.debug("Regime {}: short={}, medium={}, long={}, vol={}, corr={}",
                regime, shortTrend, mediumTrend, longTrend, volatility, correlation);

        return MarketRegimeResult.builder()
                .regime(regime)
                .shortTrend(shortTrend)
                .mediumTrend(mediumTrend)
                .longTrend(longTrend)
                .volatility(volatility)
                .correlation(correlation)
                .sufficientData(true)
                .build();
    }

    /**
     * First match wins.
     */
    static MarketRegime classify(double shortTrend, double mediumTrend, double volatility, double correlation) {
        if (volatility > VOLATILE_THRESHOLD) {
            return MarketRegime.VOLATILE;
        }
        if (shortTrend > BULL_SHORT_TREND && mediumTrend > BULL_MEDIUM_TREND
                && correlation > BULL_MIN_CORRELATION && volatility < BULL_MAX_VOLATILITY) {
            return MarketRegime.BULL;
        }
        if (shortTrend < BEAR_SHORT_TREND && mediumTrend < BEAR_MEDIUM_TREND
                && volatility < BEAR_MAX_VOLATILITY) {
            return MarketRegime.BEAR;
        }
        return MarketRegime.SIDEWAYS;
    }
}
