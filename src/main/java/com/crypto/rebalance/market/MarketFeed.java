package com.crypto.rebalance.market;

import com.crypto.rebalance.analysis.HybridStrategyEngine;
import com.crypto.rebalance.analysis.MomentumCoinSelector;
import com.crypto.rebalance.exception.DataUnavailableException;
import com.crypto.rebalance.strategy.MarketRegime;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Moves the per-run price history forward one cycle at a time.
 * Closes come from the price-history collaborator; when it has nothing for a coin and date,
 * the synthetic return model generates the close instead.
 * <p>
 * The first real close after a synthetic stretch re-bases the coin: its stored history is
 * scaled to the real price level and the step return is 0.
 */
@Slf4j
public class MarketFeed {

    public static final double SYNTHETIC_BASE_PRICE = 100.0;

    private final PriceHistoryProvider provider;
    private final SyntheticReturnModel returnModel;
    private final PriceHistoryStore store;
    private final HybridStrategyEngine hybridEngine;
    private final MomentumCoinSelector coinSelector;
    private final int cycleLengthMinutes;
    private final String interval;
    private final Set<String> syntheticTails = new HashSet<>();

    public MarketFeed(PriceHistoryProvider provider,
                      SyntheticReturnModel returnModel,
                      PriceHistoryStore store,
                      HybridStrategyEngine hybridEngine,
                      MomentumCoinSelector coinSelector,
                      int cycleLengthMinutes) {
        this.provider = provider;
        this.returnModel = returnModel;
        this.store = store;
        this.hybridEngine = hybridEngine;
        this.coinSelector = coinSelector;
        this.cycleLengthMinutes = cycleLengthMinutes;
        this.interval = intervalFor(cycleLengthMinutes);
    }

    /**
     * Seed the store with up to {@code points} closes per coin ending one cycle before {@code start}.
     *
     * @return number of coins seeded from synthetic data
     */
    public int warmUp(List<String> universe, LocalDateTime start, int points) {
        if (points <= 0) {
            return 0;
        }
        int synthetic = 0;
        LocalDateTime end = start.minusMinutes(cycleLengthMinutes);

        for (String coin : universe) {
            List<Double> closes;
            try {
                closes = fetchCloses(coin, end, points);
            } catch (DataUnavailableException e) {
                log.warn("Warm-up data unavailable for {}: {}. Using synthetic history", coin, e.getMessage());
                closes = syntheticWalk(coin, points);
                synthetic++;
                syntheticTails.add(coin);
            }
            store.appendAll(coin, closes);
        }

        log.info("Warmed up {} coins with {} points each ({} synthetic)", universe.size(), points, synthetic);
        return synthetic;
    }

    /**
     * Append the close of {@code date} for every coin and return the step.
     */
    public MarketStep advance(List<String> universe, LocalDateTime date, MarketRegime regime) {
        Map<String, Double> closes = new LinkedHashMap<>();
        Map<String, Double> returns = new LinkedHashMap<>();
        int synthetic = 0;

        for (String coin : universe) {
            double previous = store.latest(coin).orElse(SYNTHETIC_BASE_PRICE);
            double close;
            try {
                close = fetchClose(coin, date);
                if (syntheticTails.remove(coin) || store.size(coin) == 0) {
                    previous = rebase(coin, previous, close, date);
                }
            } catch (DataUnavailableException e) {
                log.debug("No close for {} at {}: {}", coin, date, e.getMessage());
                double stepReturn = returnModel.assetReturn(coin, regime, signalAdjustment(coin, regime));
                close = previous * (1 + stepReturn);
                synthetic++;
                syntheticTails.add(coin);
            }

            store.append(coin, close);
            closes.put(coin, close);
            returns.put(coin, previous == 0 ? 0.0 : close / previous - 1);
        }

        if (synthetic > 0 && synthetic < universe.size()) {
            log.warn("Synthetic closes used for {}/{} coins at {}", synthetic, universe.size(), date);
        }
        return new MarketStep(closes, returns, synthetic);
    }

    /**
     * @return the previous close on the real price level, i.e. {@code close}
     */
    private double rebase(String coin, double previous, double close, LocalDateTime date) {
        if (previous > 0 && close > 0) {
            store.rescale(coin, close / previous);
        }
        log.info("Re-based {} from synthetic {} to real close {} at {}", coin, previous, close, date);
        return close;
    }

    private double signalAdjustment(String coin, MarketRegime regime) {
        List<Double> history = store.getHistory(coin);
        if (history.size() < 10) {
            return 1.0;
        }
        double hybrid = hybridEngine.getHybridSignal(history, regime).getHybridSignal();
        double score = coinSelector.calculateMomentumScore(history);
        return returnModel.signalAdjustment(hybrid, score);
    }

    private double fetchClose(String coin, LocalDateTime date) {
        List<PriceBar> bars = provider.getHistory(coin, interval, date, 1);
        if (bars == null || bars.isEmpty()) {
            throw new DataUnavailableException("No rows returned");
        }
        PriceBar bar = bars.get(bars.size() - 1);
        if (bar.getOpenTime() == null || bar.getClosePrice() == null
                || bar.getOpenTime().isAfter(date)
                || !bar.getOpenTime().isAfter(date.minusMinutes(cycleLengthMinutes))) {
            throw new DataUnavailableException("No bar covering " + date);
        }
        return bar.getClosePrice().doubleValue();
    }

    private List<Double> fetchCloses(String coin, LocalDateTime end, int points) {
        List<PriceBar> bars = provider.getHistory(coin, interval, end, points);
        if (bars == null || bars.size() < 2) {
            throw new DataUnavailableException("Only " + (bars == null ? 0 : bars.size()) + " rows returned");
        }
        List<Double> closes = new ArrayList<>(bars.size());
        for (PriceBar bar : bars) {
            if (bar.getClosePrice() == null) {
                throw new DataUnavailableException("Row without close price at " + bar.getOpenTime());
            }
            closes.add(bar.getClosePrice().doubleValue());
        }
        return closes;
    }

    private List<Double> syntheticWalk(String coin, int points) {
        List<Double> closes = new ArrayList<>(points);
        double price = SYNTHETIC_BASE_PRICE;
        closes.add(price);
        for (int i = 1; i < points; i++) {
            double stepReturn = Math.max(SyntheticReturnModel.MIN_STEP_RETURN, returnModel.baseReturn(coin));
            price = price * (1 + stepReturn);
            closes.add(price);
        }
        return closes;
    }

    /**
     * Kline interval matching the cycle length. Falls back to daily.
     */
    static String intervalFor(int cycleLengthMinutes) {
        return switch (cycleLengthMinutes) {
            case 15 -> "15m";
            case 30 -> "30m";
            case 60 -> "1h";
            case 240 -> "4h";
            case 720 -> "12h";
            default -> "1d";
        };
    }
}
