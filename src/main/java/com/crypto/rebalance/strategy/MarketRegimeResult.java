package com.crypto.rebalance.strategy;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of market regime detection with the signals it was derived from.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MarketRegimeResult {

    private MarketRegime regime;

    /**
     * 3-day trend of the primary anchor: (last / first - 1) / 3.
     */
    private double shortTrend;

    private double mediumTrend;

    private double longTrend;

    /**
     * Stdev of the primary anchor's daily returns over 7 days.
     */
    private double volatility;

    /**
     * Correlation of both anchors' daily returns over 7 days.
     */
    private double correlation;

    /**
     * False when fewer than 14 points were available and the default regime was returned.
     */
    private boolean sufficientData;

    public String getLabel() {
        return regime.getLabel();
    }

    public static MarketRegimeResult insufficientData() {
        return MarketRegimeResult.builder()
                .regime(MarketRegime.SIDEWAYS)
                .sufficientData(false)
                .build();
    }
}
