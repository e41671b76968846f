package com.crypto.rebalance.calibration;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The six scalars that turn a raw daily return into a calibrated one.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CalibrationParameters {

    /**
     * Share of positive returns actually captured, in [0, 1].
     */
    @JsonProperty("market_timing_efficiency")
    private Double marketTimingEfficiency;

    @JsonProperty("daily_slippage")
    private Double dailySlippage;

    /**
     * Per-trade fee; charged twice per cycle (sell + buy).
     */
    @JsonProperty("trading_fee")
    private Double tradingFee;

    @JsonProperty("volatility_drag")
    private Double volatilityDrag;

    @JsonProperty("max_daily_return")
    private Double maxDailyReturn;

    @JsonProperty("min_daily_return")
    private Double minDailyReturn;

    /**
     * Problems that make the parameters unusable. Empty when valid.
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (marketTimingEfficiency == null || dailySlippage == null || tradingFee == null
                || volatilityDrag == null || maxDailyReturn == null || minDailyReturn == null) {
            problems.add("all six calibration parameters are required");
            return problems;
        }
        if (marketTimingEfficiency < 0 || marketTimingEfficiency > 1) {
            problems.add("market_timing_efficiency must be in [0, 1]: " + marketTimingEfficiency);
        }
        if (dailySlippage < 0) {
            problems.add("daily_slippage must be >= 0: " + dailySlippage);
        }
        if (tradingFee < 0) {
            problems.add("trading_fee must be >= 0: " + tradingFee);
        }
        if (volatilityDrag < 0) {
            problems.add("volatility_drag must be >= 0: " + volatilityDrag);
        }
        if (minDailyReturn > maxDailyReturn) {
            problems.add("min_daily_return " + minDailyReturn + " exceeds max_daily_return " + maxDailyReturn);
        }
        return problems;
    }

    public Map<String, Double> toMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        map.put("market_timing_efficiency", marketTimingEfficiency);
        map.put("daily_slippage", dailySlippage);
        map.put("trading_fee", tradingFee);
        map.put("volatility_drag", volatilityDrag);
        map.put("max_daily_return", maxDailyReturn);
        map.put("min_daily_return", minDailyReturn);
        return map;
    }
}
