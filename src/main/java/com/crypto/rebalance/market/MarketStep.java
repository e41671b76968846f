package com.crypto.rebalance.market;

import java.util.Map;

/**
 * Closes and returns of every universe coin for one cycle.
 *
 * @param closes        symbol to new close
 * @param returns       symbol to close-over-previous-close return
 * @param syntheticCoins number of coins whose close was generated
 */
public record MarketStep(Map<String, Double> closes, Map<String, Double> returns, int syntheticCoins) {

    public double returnOf(String symbol) {
        return returns.getOrDefault(symbol, 0.0);
    }

    /**
     * Average return of the given symbols that moved this step. 0 when none did.
     */
    public double averageReturn(Iterable<String> symbols) {
        double sum = 0.0;
        int count = 0;
        for (String symbol : symbols) {
            Double value = returns.get(symbol);
            if (value != null) {
                sum += value;
                count++;
            }
        }
        return count == 0 ? 0.0 : sum / count;
    }
}
