package com.crypto.rebalance.market;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Source of historical OHLCV rows, ordered oldest first.
 * Implementations return an empty or short list instead of failing;
 * callers fall back to synthetic generation.
 */
public interface PriceHistoryProvider {

    List<PriceBar> getHistory(String symbol, String interval, int lookback);

    /**
     * Rows ending at (and including) the bar that contains {@code endTime}.
     */
    default List<PriceBar> getHistory(String symbol, String interval, LocalDateTime endTime, int lookback) {
        return getHistory(symbol, interval, lookback);
    }

    /**
     * Provider that never has data. Used when the run is configured for synthetic data only.
     */
    static PriceHistoryProvider unavailable() {
        return (symbol, interval, lookback) -> List.of();
    }
}
