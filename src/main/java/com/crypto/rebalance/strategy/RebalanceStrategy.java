package com.crypto.rebalance.strategy;

import com.crypto.rebalance.analysis.Allocations;
import com.crypto.rebalance.analysis.HybridStrategyEngine;
import com.crypto.rebalance.analysis.MomentumCoinSelector;
import com.crypto.rebalance.exception.StrategyExecutionException;
import com.crypto.rebalance.indicator.PriceStatistics;
import com.crypto.rebalance.market.PriceHistoryStore;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.random.RandomGenerator;

/**
 * Daily rebalance orchestration.
 *
 * Flow per cycle:
 * 1. Capital protection entry/exit
 * 2. Regime detection on the anchor assets
 * 3. Protected: 100% reserve, done
 * 4. Coin selection (every 5 cycles)
 * 5. Momentum-weighted base allocation, clamped to [5%, 25%]
 * 6. Hybrid signal adjustment and renormalisation
 *
 * Holds per-run state (selection, protection) and must not be shared between runs.
 */
@Slf4j
public class RebalanceStrategy {

    private static final double MIN_MOMENTUM_WEIGHT = 0.1;
    private static final double WEIGHT_TOLERANCE = 1e-6;

    private static final double MIN_EXECUTION_DELAY = 0.5;
    private static final double MAX_EXECUTION_DELAY = 3.0;
    private static final double ORDER_FAILURE_PROBABILITY = 0.02;

    private final StrategySettings settings;
    private final PriceHistoryStore historyStore;
    private final MomentumCoinSelector coinSelector;
    private final MarketRegimeDetector regimeDetector;
    private final HybridStrategyEngine hybridEngine;
    private final CapitalProtection protection;
    private final RandomGenerator random;

    private List<String> selectedCoins;
    private MarketRegime lastRegime;

    public RebalanceStrategy(StrategySettings settings,
                             PriceHistoryStore historyStore,
                             MomentumCoinSelector coinSelector,
                             MarketRegimeDetector regimeDetector,
                             HybridStrategyEngine hybridEngine,
                             CapitalProtection protection,
                             RandomGenerator random) {
        this.settings = settings;
        this.historyStore = historyStore;
        this.coinSelector = coinSelector;
        this.regimeDetector = regimeDetector;
        this.hybridEngine = hybridEngine;
        this.protection = protection;
        this.random = random;
        this.selectedCoins = new ArrayList<>(settings.getInitialSelection());
    }

    public RebalanceResult rebalance(LocalDateTime date, double capital, int cycleIndex) {
        MarketRegime regime = lastRegime == null ? MarketRegime.SIDEWAYS : lastRegime;
        try {
            List<String> actions = new ArrayList<>();

            if (settings.isProtectionEnabled()) {
                ProtectionDecision decision = protection.evaluate();
                if (decision == ProtectionDecision.ENTERED) {
                    actions.add(RebalanceAction.PROTECTION_ENTERED.name());
                } else if (decision == ProtectionDecision.EXITED) {
                    actions.add(RebalanceAction.PROTECTION_EXITED.name());
                }
            }

            MarketRegimeResult regimeResult = regimeDetector.detect(
                    historyStore.getHistory(settings.primaryAnchor()),
                    historyStore.getHistory(settings.secondaryAnchor()));
            regime = regimeResult.getRegime();
            if (lastRegime != null && lastRegime != regime) {
                log.info("Regime changed at {}: {} -> {}", date, lastRegime, regime);
            }
            lastRegime = regime;

            if (protection.isProtectionActive()) {
                actions.add(RebalanceAction.RESERVE_PROTECTION.name());
                return RebalanceResult.builder()
                        .success(true)
                        .allocations(Map.of(StrategySettings.RESERVE, 1.0))
                        .tradingCosts(capital * settings.getConversionFeeRate())
                        .marketRegime(regime)
                        .protectionActive(true)
                        .actionsTaken(actions)
                        .selectedCoins(List.copyOf(selectedCoins))
                        .build();
            }

            if (cycleIndex % settings.getSelectionInterval() == 0 && updateSelection(date)) {
                actions.add(RebalanceAction.COIN_SELECTION_UPDATED.name());
            }
            if (selectedCoins.isEmpty()) {
                throw new StrategyExecutionException("No coins selected");
            }

            Map<String, Double> baseAllocations = baseAllocations();
            Map<String, Double> allocations = hybridEngine.enhanceAllocations(
                    baseAllocations, historyStore.snapshot(), regime);
            validate(allocations);

            actions.add(RebalanceAction.CRYPTO_REBALANCE.name());

            double executionDelay = 0.0;
            int failedOrders = 0;
            if (settings.isRealisticMode()) {
                executionDelay = random.nextDouble(MIN_EXECUTION_DELAY, MAX_EXECUTION_DELAY);
                for (int i = 0; i < allocations.size(); i++) {
                    if (random.nextDouble() < ORDER_FAILURE_PROBABILITY) {
                        failedOrders++;
                    }
                }
            }

            log.debug("Cycle {} rebalanced into {} coins, regime={}", cycleIndex, allocations.size(), regime);

            return RebalanceResult.builder()
                    .success(true)
                    .allocations(allocations)
                    .tradingCosts(capital * settings.getTradingFeeRate())
                    .marketRegime(regime)
                    .protectionActive(false)
                    .executionDelay(executionDelay)
                    .failedOrders(failedOrders)
                    .actionsTaken(actions)
                    .selectedCoins(List.copyOf(selectedCoins))
                    .build();

        } catch (RuntimeException e) {
            log.error("Rebalance failed at cycle {} ({}): {}", cycleIndex, date, e.getMessage(), e);
            return RebalanceResult.failure(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), regime);
        }
    }

    /**
     * Feed the finished cycle's outcome into the protection state machine.
     */
    public void recordOutcome(double capital, double portfolioReturn, double marketReturn) {
        protection.recordCycle(capital, portfolioReturn, marketReturn);
    }

    /**
     * Re-rank the universe. The selection is only replaced when enough coins have history
     * and at least {@code minSelectionChanges} coins differ.
     */
    boolean updateSelection(LocalDateTime date) {
        Map<String, List<Double>> marketData = historyStore.snapshot();
        long eligible = settings.getUniverse().stream()
                .filter(coin -> historyStore.hasAtLeast(coin, MomentumCoinSelector.MIN_POINTS))
                .count();
        if (eligible < settings.getMinCoinsForSelection()) {
            log.debug("Skipping coin selection at {}: only {} coins with history", date, eligible);
            return false;
        }

        List<String> candidates = coinSelector.selectTopCoins(marketData, settings.getUniverse(), settings.getTargetCoins());
        long changes = candidates.stream().filter(coin -> !selectedCoins.contains(coin)).count();
        if (changes < settings.getMinSelectionChanges()) {
            return false;
        }

        log.info("Coin selection updated at {}: {} -> {}", date, selectedCoins, candidates);
        selectedCoins = new ArrayList<>(candidates);
        return true;
    }

    /**
     * Weight = max(0.1, 1 + momentum score), 1.0 without enough history; normalised,
     * clamped to [minAllocation, maxAllocation] and normalised again.
     * The clamp precedes the final normalisation, so returned weights may exceed maxAllocation.
     */
    Map<String, Double> baseAllocations() {
        Map<String, Double> weights = new LinkedHashMap<>();
        for (String coin : selectedCoins) {
            List<Double> history = historyStore.getHistory(coin);
            double weight = history.size() >= MomentumCoinSelector.MIN_POINTS
                    ? Math.max(MIN_MOMENTUM_WEIGHT, 1 + coinSelector.calculateMomentumScore(history))
                    : 1.0;
            weights.put(coin, weight);
        }

        Map<String, Double> clamped = new LinkedHashMap<>();
        Allocations.normalize(weights).forEach((coin, weight) ->
                clamped.put(coin, PriceStatistics.clamp(weight, settings.getMinAllocation(), settings.getMaxAllocation())));
        return Allocations.normalize(clamped);
    }

    private void validate(Map<String, Double> allocations) {
        if (allocations.isEmpty()) {
            throw new StrategyExecutionException("Empty allocation");
        }
        for (Map.Entry<String, Double> entry : allocations.entrySet()) {
            if (!Double.isFinite(entry.getValue()) || entry.getValue() < 0) {
                throw new StrategyExecutionException("Invalid weight for " + entry.getKey() + ": " + entry.getValue());
            }
        }
        double total = Allocations.total(allocations);
        if (Math.abs(total - 1.0) > WEIGHT_TOLERANCE) {
            throw new StrategyExecutionException("Allocation weights sum to " + total);
        }
    }

    public List<String> getSelectedCoins() {
        return List.copyOf(selectedCoins);
    }

    public CapitalProtection getProtection() {
        return protection;
    }
}
