package com.crypto.rebalance.simulation;

import com.crypto.rebalance.binance.BinancePriceHistoryProvider;
import com.crypto.rebalance.calibration.CalibrationManager;
import com.crypto.rebalance.calibration.CalibrationProfileStore;
import com.crypto.rebalance.market.PriceHistoryProvider;
import com.crypto.rebalance.market.VolatilityMode;
import com.crypto.rebalance.strategy.StrategySettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Random;
import java.util.random.RandomGenerator;

/**
 * Builds a fresh engine per run from configuration plus request overrides.
 */
@Component
@Slf4j
public class SimulationEngineFactory {

    private final BinancePriceHistoryProvider binanceProvider;
    private final CalibrationProfileStore profileStore;

    @Value("${simulation.universe:BTC,ETH,BNB,SOL,ADA,DOT,AVAX,LINK,UNI,ATOM,NEAR,FTM,ALGO,XLM,VET,THETA,AAVE,COMP,MKR,SNX,CRV,YFI,SUSHI,BAL}")
    private List<String> universe;

    @Value("${simulation.initial-selection:BTC,ETH,BNB,SOL,ADA,DOT,AVAX,LINK,UNI}")
    private List<String> initialSelection;

    @Value("${simulation.anchors:BTC,ETH}")
    private List<String> anchors;

    @Value("${simulation.target-coins:9}")
    private int targetCoins;

    @Value("${simulation.trading-fee-rate:0.001}")
    private double tradingFeeRate;

    @Value("${simulation.protection.conversion-fee-rate:0.001}")
    private double conversionFeeRate;

    @Value("${simulation.reserve-ratio:0.05}")
    private double reserveRatio;

    @Value("${simulation.reserve-yield:0.0001}")
    private double reserveYield;

    @Value("${simulation.history.max-length:30}")
    private int historyMaxLength;

    @Value("${simulation.history.warmup-days:30}")
    private int warmupDays;

    @Value("${simulation.protection.enabled:true}")
    private boolean protectionEnabled;

    @Value("${simulation.realistic-mode:false}")
    private boolean realisticMode;

    @Value("${simulation.market-data.source:binance}")
    private String marketDataSource;

    @Value("${simulation.volatility-mode:average_volatility}")
    private String volatilityMode;

    @Value("${simulation.random-seed:#{null}}")
    private Long randomSeed;

    @Value("${simulation.default.duration-days:30}")
    private int defaultDurationDays;

    @Value("${simulation.default.cycle-length-minutes:1440}")
    private int defaultCycleLengthMinutes;

    @Value("${simulation.default.starting-capital:1000}")
    private double defaultStartingCapital;

    @Value("${simulation.max-cycles:50000}")
    private int maxCycles;

    @Value("${calibration.enabled:true}")
    private boolean calibrationEnabled;

    @Value("${calibration.default-profile:none}")
    private String defaultCalibrationProfile;

    public SimulationEngineFactory(BinancePriceHistoryProvider binanceProvider, CalibrationProfileStore profileStore) {
        this.binanceProvider = binanceProvider;
        this.profileStore = profileStore;
    }

    public DailyRebalanceSimulationEngine create(SimulationRequest request) {
        StrategySettings settings = StrategySettings.builder()
                .universe(List.copyOf(universe))
                .initialSelection(List.copyOf(initialSelection))
                .anchors(List.copyOf(anchors))
                .targetCoins(targetCoins)
                .tradingFeeRate(tradingFeeRate)
                .conversionFeeRate(conversionFeeRate)
                .reserveRatio(reserveRatio)
                .reserveYield(reserveYield)
                .historyMaxLength(historyMaxLength)
                .warmupPoints(warmupDays)
                .protectionEnabled(request.getProtectionEnabled() != null ? request.getProtectionEnabled() : protectionEnabled)
                .realisticMode(request.getRealisticMode() != null ? request.getRealisticMode() : realisticMode)
                .build();

        Long seed = request.getRandomSeed() != null ? request.getRandomSeed() : randomSeed;
        RandomGenerator random = seed != null ? new Random(seed) : new Random();

        return new DailyRebalanceSimulationEngine(settings, priceHistoryProvider(),
                VolatilityMode.fromKey(volatilityMode), random,
                calibrationEnabled ? new CalibrationManager(profileStore) : null);
    }

    /**
     * Fill unset (zero / null) request fields with configured defaults.
     * Negative values are kept so validation rejects them.
     */
    public SimulationRequest withDefaults(SimulationRequest request) {
        return SimulationRequest.builder()
                .runName(request.getRunName())
                .startDate(request.getStartDate() != null
                        ? request.getStartDate()
                        : LocalDate.now().minusDays(defaultDurationDays).atStartOfDay())
                .durationDays(request.getDurationDays() != 0 ? request.getDurationDays() : defaultDurationDays)
                .cycleLengthMinutes(request.getCycleLengthMinutes() != 0 ? request.getCycleLengthMinutes() : defaultCycleLengthMinutes)
                .startingCapital(request.getStartingCapital() != 0 ? request.getStartingCapital() : defaultStartingCapital)
                .maxCycles(request.getMaxCycles() > 0 ? Math.min(request.getMaxCycles(), maxCycles) : maxCycles)
                .calibrationProfile(request.getCalibrationProfile() != null
                        ? request.getCalibrationProfile()
                        : defaultCalibrationProfile)
                .protectionEnabled(request.getProtectionEnabled())
                .realisticMode(request.getRealisticMode())
                .randomSeed(request.getRandomSeed())
                .build();
    }

    private PriceHistoryProvider priceHistoryProvider() {
        if ("synthetic".equalsIgnoreCase(marketDataSource)) {
            return PriceHistoryProvider.unavailable();
        }
        return binanceProvider;
    }
}
