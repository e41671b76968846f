package com.crypto.rebalance.simulation;

import com.crypto.rebalance.analysis.HybridStrategyEngine;
import com.crypto.rebalance.analysis.MomentumCoinSelector;
import com.crypto.rebalance.calibration.CalibrationInfo;
import com.crypto.rebalance.calibration.CalibrationManager;
import com.crypto.rebalance.calibration.CalibrationOutcome;
import com.crypto.rebalance.exception.InvalidConfigurationException;
import com.crypto.rebalance.market.MarketFeed;
import com.crypto.rebalance.market.MarketStep;
import com.crypto.rebalance.market.PriceHistoryProvider;
import com.crypto.rebalance.market.PriceHistoryStore;
import com.crypto.rebalance.market.SyntheticReturnModel;
import com.crypto.rebalance.market.VolatilityMode;
import com.crypto.rebalance.strategy.CapitalProtection;
import com.crypto.rebalance.strategy.MarketRegimeDetector;
import com.crypto.rebalance.strategy.RebalanceResult;
import com.crypto.rebalance.strategy.RebalanceStrategy;
import com.crypto.rebalance.strategy.StrategySettings;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.random.RandomGenerator;

/**
 * Steps a portfolio through consecutive rebalance cycles.
 *
 * Per cycle:
 * 1. Strategy computes allocations from history up to the previous close
 * 2. Market advances one cycle (real close, or synthetic on unavailability)
 * 3. Capital grows by the allocation-weighted return, minus trading costs
 * 4. Cycle record appended, outcome fed back to capital protection
 *
 * Stops at {@code startDate + durationDays}, at {@code maxCycles}, or at the first failed cycle.
 * Every run builds its own history store, protection state and strategy, so one engine
 * can serve several runs but a run is never shared between threads.
 */
@Slf4j
public class DailyRebalanceSimulationEngine {

    private final StrategySettings settings;
    private final PriceHistoryProvider priceHistoryProvider;
    private final VolatilityMode volatilityMode;
    private final RandomGenerator random;
    private final CalibrationManager calibrationManager;

    public DailyRebalanceSimulationEngine(StrategySettings settings,
                                          PriceHistoryProvider priceHistoryProvider,
                                          VolatilityMode volatilityMode,
                                          RandomGenerator random,
                                          CalibrationManager calibrationManager) {
        this.settings = settings;
        this.priceHistoryProvider = priceHistoryProvider;
        this.volatilityMode = volatilityMode;
        this.random = random;
        this.calibrationManager = calibrationManager;
    }

    public SimulationResult run(SimulationRequest request) {
        validate(request);

        String runName = request.getRunName() == null ? "simulation" : request.getRunName();
        LocalDateTime start = request.getStartDate();
        LocalDateTime end = start.plusDays(request.getDurationDays());
        double startingCapital = request.getStartingCapital();

        List<String> coins = marketCoins();
        PriceHistoryStore historyStore = new PriceHistoryStore(settings.getHistoryMaxLength());
        MomentumCoinSelector coinSelector = new MomentumCoinSelector(settings.getAnchors());
        HybridStrategyEngine hybridEngine = new HybridStrategyEngine();
        CapitalProtection protection = new CapitalProtection(startingCapital);
        RebalanceStrategy strategy = new RebalanceStrategy(settings, historyStore, coinSelector,
                new MarketRegimeDetector(), hybridEngine, protection, random);
        MarketFeed marketFeed = new MarketFeed(priceHistoryProvider,
                new SyntheticReturnModel(random, volatilityMode),
                historyStore, hybridEngine, coinSelector, request.getCycleLengthMinutes());

        log.info("Starting simulation '{}': {} to {}, capital={}, cycle={}min, calibration={}",
                runName, start, end, startingCapital, request.getCycleLengthMinutes(), request.getCalibrationProfile());

        int syntheticPoints = marketFeed.warmUp(coins, start, settings.getWarmupPoints());

        List<SimulationCycleRecord> cycles = new ArrayList<>();
        List<String> regimeHistory = new ArrayList<>();
        double capital = startingCapital;
        String failureReason = null;

        for (int cycleIndex = 0; ; cycleIndex++) {
            LocalDateTime cycleDate = start.plusMinutes((long) cycleIndex * request.getCycleLengthMinutes());
            if (!cycleDate.isBefore(end)) {
                break;
            }
            if (cycleIndex >= request.getMaxCycles()) {
                log.warn("Simulation '{}' reached the cycle cap of {}", runName, request.getMaxCycles());
                break;
            }

            try {
                RebalanceResult rebalance = strategy.rebalance(cycleDate, capital, cycleIndex);
                if (!rebalance.isSuccess()) {
                    failureReason = "Cycle " + (cycleIndex + 1) + " failed: " + rebalance.getReason();
                    log.error("Simulation '{}' stopped: {}", runName, failureReason);
                    break;
                }

                MarketStep step = marketFeed.advance(coins, cycleDate, rebalance.getMarketRegime());
                syntheticPoints += step.syntheticCoins();

                SimulationCycleRecord record = buildRecord(cycleIndex, cycleDate, capital, rebalance, step);
                cycles.add(record);
                regimeHistory.add(rebalance.getMarketRegime().getLabel());

                double marketReturn = step.averageReturn(List.of(settings.primaryAnchor(), settings.secondaryAnchor()));
                strategy.recordOutcome(record.getTotalValue(), record.getCycleReturn(), marketReturn);

                log.debug("Cycle {} {}: {} -> {} ({}), regime={}, protected={}",
                        record.getCycleNumber(), cycleDate,
                        String.format("%.4f", capital), String.format("%.4f", record.getTotalValue()),
                        String.format("%+.4f%%", record.getCycleReturn() * 100),
                        record.getMarketRegime(), record.isProtectionActive());

                capital = record.getTotalValue();

            } catch (RuntimeException e) {
                failureReason = "Cycle " + (cycleIndex + 1) + " failed: " + e.getMessage();
                log.error("Simulation '{}' stopped at cycle {}: {}", runName, cycleIndex + 1, e.getMessage(), e);
                break;
            }
        }

        boolean success = failureReason == null;
        List<SimulationCycleRecord> finalCycles = cycles;
        CalibrationInfo calibrationInfo;

        double rawReturn = FinalSummary.of(startingCapital, cycles).getTotalReturn();
        if (!success) {
            calibrationInfo = CalibrationInfo.notApplied(request.getCalibrationProfile(), rawReturn, "Run failed");
        } else if (calibrationManager == null) {
            calibrationInfo = CalibrationInfo.notApplied(request.getCalibrationProfile(), rawReturn, "Calibration disabled");
        } else {
            CalibrationOutcome outcome = calibrationManager.calibrate(cycles, startingCapital, request.getCalibrationProfile());
            finalCycles = outcome.cycles();
            calibrationInfo = outcome.info();
        }

        FinalSummary summary = FinalSummary.of(startingCapital, finalCycles);
        if (success) {
            log.info("Simulation '{}' completed: {} cycles, final capital {} ({}%)",
                    runName, finalCycles.size(),
                    String.format("%.2f", summary.getFinalCapital()), String.format("%.2f", summary.getTotalReturn()));
        }

        return SimulationResult.builder()
                .runName(runName)
                .success(success)
                .failureReason(failureReason)
                .cycles(List.copyOf(finalCycles))
                .totalCycles(finalCycles.size())
                .finalSummary(summary)
                .calibrationInfo(calibrationInfo)
                .regimeHistory(regimeHistory)
                .finalCoinSelection(strategy.getSelectedCoins())
                .syntheticDataPoints(syntheticPoints)
                .build();
    }

    private SimulationCycleRecord buildRecord(int cycleIndex, LocalDateTime cycleDate, double capital,
                                              RebalanceResult rebalance, MarketStep step) {
        double grossReturn;
        if (rebalance.isProtectionActive()) {
            grossReturn = settings.getReserveYield();
        } else {
            double cryptoReturn = 0.0;
            for (Map.Entry<String, Double> entry : rebalance.getAllocations().entrySet()) {
                cryptoReturn += entry.getValue() * step.returnOf(entry.getKey());
            }
            grossReturn = (1 - settings.getReserveRatio()) * cryptoReturn
                    + settings.getReserveRatio() * settings.getReserveYield();
        }

        double endingCapital = Math.max(0.0, capital * (1 + grossReturn) - rebalance.getTradingCosts());
        double portfolioValue = rebalance.isProtectionActive() ? 0.0 : endingCapital * (1 - settings.getReserveRatio());

        return SimulationCycleRecord.builder()
                .cycleNumber(cycleIndex + 1)
                .cycleDate(cycleDate)
                .startingCapital(capital)
                .endingCapital(endingCapital)
                .portfolioValue(portfolioValue)
                .reserveValue(endingCapital - portfolioValue)
                .totalValue(endingCapital)
                .cycleReturn(capital == 0 ? 0.0 : endingCapital / capital - 1)
                .allocationBreakdown(rebalance.getAllocations())
                .tradingCosts(rebalance.getTradingCosts())
                .executionDelay(rebalance.getExecutionDelay())
                .failedOrders(rebalance.getFailedOrders())
                .failed(false)
                .marketRegime(rebalance.getMarketRegime())
                .protectionActive(rebalance.isProtectionActive())
                .actionsTaken(rebalance.getActionsTaken())
                .calibrated(false)
                .build();
    }

    private List<String> marketCoins() {
        Set<String> coins = new LinkedHashSet<>(settings.getUniverse());
        coins.addAll(settings.getInitialSelection());
        coins.addAll(settings.getAnchors());
        return new ArrayList<>(coins);
    }

    private void validate(SimulationRequest request) {
        if (request == null) {
            throw new InvalidConfigurationException("Simulation request is required");
        }
        if (request.getStartDate() == null) {
            throw new InvalidConfigurationException("Start date is required");
        }
        if (request.getDurationDays() <= 0) {
            throw new InvalidConfigurationException("Duration must be positive: " + request.getDurationDays());
        }
        if (request.getCycleLengthMinutes() <= 0) {
            throw new InvalidConfigurationException("Cycle length must be positive: " + request.getCycleLengthMinutes());
        }
        if (request.getCycleLengthMinutes() > request.getDurationDays() * 1440L) {
            throw new InvalidConfigurationException("Cycle length " + request.getCycleLengthMinutes()
                    + "min exceeds the " + request.getDurationDays() + "-day horizon");
        }
        if (!(request.getStartingCapital() > 0) || !Double.isFinite(request.getStartingCapital())) {
            throw new InvalidConfigurationException("Starting capital must be positive: " + request.getStartingCapital());
        }
        if (request.getMaxCycles() <= 0) {
            throw new InvalidConfigurationException("Max cycles must be positive: " + request.getMaxCycles());
        }
        if (settings.getUniverse() == null || settings.getUniverse().isEmpty()) {
            throw new InvalidConfigurationException("Coin universe is empty");
        }
        if (settings.getInitialSelection() == null || settings.getInitialSelection().isEmpty()) {
            throw new InvalidConfigurationException("Initial coin selection is empty");
        }
        if (settings.getReserveRatio() < 0 || settings.getReserveRatio() >= 1) {
            throw new InvalidConfigurationException("Reserve ratio must be in [0, 1): " + settings.getReserveRatio());
        }
    }
}
