package com.crypto.rebalance.simulation;

import com.crypto.rebalance.calibration.CalibrationManager;
import com.crypto.rebalance.calibration.JsonCalibrationProfileStore;
import com.crypto.rebalance.exception.InvalidConfigurationException;
import com.crypto.rebalance.market.PriceHistoryProvider;
import com.crypto.rebalance.market.ScriptedPriceHistoryProvider;
import com.crypto.rebalance.market.VolatilityMode;
import com.crypto.rebalance.strategy.RebalanceAction;
import com.crypto.rebalance.strategy.StrategySettings;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DailyRebalanceSimulationEngine Tests")
class DailyRebalanceSimulationEngineTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 3, 1, 0, 0);
    private static final List<String> COINS = List.of("BTC", "ETH", "SOL", "ADA");

    private final CalibrationManager calibrationManager =
            new CalibrationManager(new JsonCalibrationProfileStore(new ObjectMapper(), "target/no-such-profiles"));

    private static StrategySettings.StrategySettingsBuilder frictionless() {
        return StrategySettings.builder()
                .universe(COINS)
                .initialSelection(COINS)
                .tradingFeeRate(0.0)
                .conversionFeeRate(0.0);
    }

    private DailyRebalanceSimulationEngine engine(StrategySettings settings, PriceHistoryProvider provider, long seed) {
        return new DailyRebalanceSimulationEngine(settings, provider, VolatilityMode.AVERAGE_VOLATILITY,
                new Random(seed), calibrationManager);
    }

    private static SimulationRequest.SimulationRequestBuilder request(int days) {
        return SimulationRequest.builder()
                .runName("test")
                .startDate(START)
                .durationDays(days)
                .startingCapital(100.0)
                .calibrationProfile("zero_cost");
    }

    private static long day(LocalDate date) {
        return ChronoUnit.DAYS.between(START.toLocalDate(), date);
    }

    private static ScriptedPriceHistoryProvider prices(BiFunction<String, LocalDate, Double> prices) {
        return new ScriptedPriceHistoryProvider(prices);
    }

    @Nested
    @DisplayName("Capital Accounting")
    class AccountingTests {

        @Test
        @DisplayName("Uniform +1% days compound through the reserve split")
        void uniformGrowthCompounds() {
            ScriptedPriceHistoryProvider provider = prices((coin, date) -> 100.0 * Math.pow(1.01, day(date)));

            SimulationResult result = engine(frictionless().build(), provider, 1).run(request(7).build());

            assertTrue(result.isSuccess());
            assertEquals(7, result.getTotalCycles());
            double expected = 100.0 * Math.pow(0.95 * 1.01 + 0.05 * 1.0001, 7);
            assertEquals(expected, result.getFinalSummary().getFinalCapital(), 0.005);
            assertEquals(0, result.getSyntheticDataPoints());
            assertThat(result.getRegimeHistory()).containsOnly("sideways");

            double compounded = 100.0;
            for (SimulationCycleRecord cycle : result.getCycles()) {
                compounded *= cycle.getMultiplier();
            }
            assertEquals(compounded, result.getFinalSummary().getFinalCapital(), 1e-9);
        }

        @Test
        @DisplayName("Records are consecutive and keep portfolio plus reserve equal to total")
        void recordsAreConsistent() {
            ScriptedPriceHistoryProvider provider = prices((coin, date) -> 100.0 * Math.pow(1.01, day(date)));

            SimulationResult result = engine(frictionless().build(), provider, 1).run(request(5).build());

            List<SimulationCycleRecord> cycles = result.getCycles();
            for (int i = 0; i < cycles.size(); i++) {
                SimulationCycleRecord cycle = cycles.get(i);
                assertEquals(i + 1, cycle.getCycleNumber());
                assertEquals(START.plusDays(i), cycle.getCycleDate());
                assertEquals(cycle.getTotalValue(), cycle.getPortfolioValue() + cycle.getReserveValue(), 1e-9);
                assertEquals(0.95 * cycle.getTotalValue(), cycle.getPortfolioValue(), 1e-6);
                if (i > 0) {
                    assertEquals(cycles.get(i - 1).getTotalValue(), cycle.getStartingCapital(), 1e-12);
                }
            }
        }

        @Test
        @DisplayName("Trading costs are deducted every cycle")
        void tradingCostsDeducted() {
            ScriptedPriceHistoryProvider provider = prices((coin, date) -> 100.0);
            StrategySettings settings = frictionless().tradingFeeRate(0.001).reserveYield(0.0).build();

            SimulationResult result = engine(settings, provider, 1).run(request(3).calibrationProfile("none").build());

            assertEquals(100.0 * Math.pow(0.999, 3), result.getFinalSummary().getFinalCapital(), 1e-9);
            assertThat(result.getFinalSummary().getTotalTradingCosts()).isGreaterThan(0.29);
        }

        @Test
        @DisplayName("A coin listed mid-run joins at its real price without a jump in capital")
        void coinListedMidRun() {
            LocalDate listing = START.toLocalDate().plusDays(2);
            ScriptedPriceHistoryProvider provider = prices((coin, date) -> {
                if (!coin.equals("SOL")) {
                    return 100.0;
                }
                return date.isBefore(listing) ? null : 6000.0;
            });
            StrategySettings settings = frictionless().reserveYield(0.0).build();

            SimulationResult result = engine(settings, provider, 7).run(request(6).calibrationProfile("none").build());

            assertTrue(result.isSuccess());
            List<SimulationCycleRecord> cycles = result.getCycles();
            assertEquals(6, cycles.size());
            for (SimulationCycleRecord cycle : cycles.subList(2, cycles.size())) {
                assertEquals(1.0, cycle.getMultiplier(), 1e-12);
            }
            for (SimulationCycleRecord cycle : cycles) {
                assertThat(cycle.getMultiplier()).isBetween(0.5, 1.5);
            }
            double beforeListing = cycles.get(1).getTotalValue();
            assertEquals(beforeListing, result.getFinalSummary().getFinalCapital(), 1e-9);
        }

        @Test
        @DisplayName("Missing closes are generated synthetically")
        void syntheticFallback() {
            SimulationResult result = engine(frictionless().build(), PriceHistoryProvider.unavailable(), 9)
                    .run(request(10).build());

            assertTrue(result.isSuccess());
            assertEquals(10, result.getTotalCycles());
            assertEquals(COINS.size() + 10 * COINS.size(), result.getSyntheticDataPoints());
            assertThat(result.getFinalSummary().getFinalCapital()).isPositive();
        }
    }

    @Nested
    @DisplayName("Capital Protection")
    class ProtectionTests {

        private double crashThenRecovery(LocalDate date) {
            long day = day(date);
            if (day < 0) {
                return 100.0;
            }
            double price = 100.0 * Math.pow(0.97, Math.min(day, 3) + 1);
            return day >= 4 ? price * 1.065 : price;
        }

        @Test
        @DisplayName("Three losing days move capital to reserve on the fourth cycle")
        void entersAfterThreeLosses() {
            ScriptedPriceHistoryProvider provider = prices((coin, date) -> crashThenRecovery(date));

            SimulationResult result = engine(frictionless().build(), provider, 1).run(request(8).build());

            List<SimulationCycleRecord> cycles = result.getCycles();
            for (int i = 0; i < 3; i++) {
                assertFalse(cycles.get(i).isProtectionActive(), "cycle index " + i);
            }
            SimulationCycleRecord entered = cycles.get(3);
            assertTrue(entered.isProtectionActive());
            assertEquals(Map.of(StrategySettings.RESERVE, 1.0), entered.getAllocationBreakdown());
            assertTrue(entered.getActionsTaken().contains(RebalanceAction.PROTECTION_ENTERED.name()));
            assertEquals(0.0, entered.getPortfolioValue());
            assertEquals(entered.getTotalValue(), entered.getReserveValue());
            assertEquals(1.0001, entered.getMultiplier(), 1e-12);
        }

        @Test
        @DisplayName("A 6.5% market recovery exits protection on the next cycle")
        void exitsAfterStrongRecovery() {
            ScriptedPriceHistoryProvider provider = prices((coin, date) -> crashThenRecovery(date));

            SimulationResult result = engine(frictionless().build(), provider, 1).run(request(8).build());

            List<SimulationCycleRecord> cycles = result.getCycles();
            assertTrue(cycles.get(4).isProtectionActive());
            SimulationCycleRecord exited = cycles.get(5);
            assertFalse(exited.isProtectionActive());
            assertTrue(exited.getActionsTaken().contains(RebalanceAction.PROTECTION_EXITED.name()));
            assertFalse(exited.getAllocationBreakdown().containsKey(StrategySettings.RESERVE));
            assertEquals(2, result.getFinalSummary().getProtectionCycles());
        }

        @Test
        @DisplayName("Disabled protection stays invested through the crash")
        void protectionDisabled() {
            ScriptedPriceHistoryProvider provider = prices((coin, date) -> crashThenRecovery(date));

            SimulationResult result = engine(frictionless().protectionEnabled(false).build(), provider, 1)
                    .run(request(8).build());

            assertThat(result.getCycles()).noneMatch(SimulationCycleRecord::isProtectionActive);
        }
    }

    @Nested
    @DisplayName("Termination")
    class TerminationTests {

        @Test
        @DisplayName("A failing data source stops the run and keeps completed cycles")
        void partialFailure() {
            LocalDate broken = START.toLocalDate().plusDays(2);
            ScriptedPriceHistoryProvider provider = prices((coin, date) -> {
                if (date.equals(broken)) {
                    throw new IllegalStateException("exchange down");
                }
                return 100.0;
            });

            SimulationResult result = engine(frictionless().build(), provider, 1).run(request(7).build());

            assertFalse(result.isSuccess());
            assertEquals(2, result.getTotalCycles());
            assertEquals("Cycle 3 failed: exchange down", result.getFailureReason());
            assertFalse(result.getCalibrationInfo().isProfileApplied());
            assertEquals("Run failed", result.getCalibrationInfo().getError());
        }

        @Test
        @DisplayName("The cycle cap ends the run early")
        void cycleCap() {
            SimulationResult result = engine(frictionless().build(), PriceHistoryProvider.unavailable(), 1)
                    .run(request(30).maxCycles(5).build());

            assertTrue(result.isSuccess());
            assertEquals(5, result.getTotalCycles());
        }

        @Test
        @DisplayName("Intraday cycles fill the horizon")
        void intradayCycles() {
            SimulationResult result = engine(frictionless().build(), PriceHistoryProvider.unavailable(), 1)
                    .run(request(2).cycleLengthMinutes(240).build());

            assertEquals(12, result.getTotalCycles());
            assertEquals(START.plusHours(44), result.getCycles().get(11).getCycleDate());
        }

        @Test
        @DisplayName("Invalid runs are rejected before the first cycle")
        void invalidConfiguration() {
            DailyRebalanceSimulationEngine engine = engine(frictionless().build(), PriceHistoryProvider.unavailable(), 1);

            assertThrows(InvalidConfigurationException.class, () -> engine.run(request(0).build()));
            assertThrows(InvalidConfigurationException.class, () -> engine.run(request(1).cycleLengthMinutes(2880).build()));
            assertThrows(InvalidConfigurationException.class, () -> engine.run(request(5).startingCapital(-10).build()));
            assertThrows(InvalidConfigurationException.class, () -> engine.run(request(5).startDate(null).build()));
            assertThrows(InvalidConfigurationException.class, () -> engine.run(null));

            DailyRebalanceSimulationEngine noCoins = engine(frictionless().universe(List.of()).build(),
                    PriceHistoryProvider.unavailable(), 1);
            assertThrows(InvalidConfigurationException.class, () -> noCoins.run(request(5).build()));
        }
    }

    @Nested
    @DisplayName("Reproducibility and Calibration")
    class ReproducibilityTests {

        @Test
        @DisplayName("The same seed reproduces the same run")
        void seededRunsAreIdentical() {
            SimulationResult first = engine(frictionless().build(), PriceHistoryProvider.unavailable(), 42)
                    .run(request(20).build());
            SimulationResult second = engine(frictionless().build(), PriceHistoryProvider.unavailable(), 42)
                    .run(request(20).build());

            assertEquals(first.getFinalSummary().getFinalCapital(), second.getFinalSummary().getFinalCapital());
            assertEquals(first.getRegimeHistory(), second.getRegimeHistory());
            for (int i = 0; i < first.getCycles().size(); i++) {
                assertEquals(first.getCycles().get(i).getTotalValue(), second.getCycles().get(i).getTotalValue());
            }
        }

        @Test
        @DisplayName("Different seeds give different runs")
        void differentSeedsDiffer() {
            SimulationResult first = engine(frictionless().build(), PriceHistoryProvider.unavailable(), 1)
                    .run(request(20).build());
            SimulationResult second = engine(frictionless().build(), PriceHistoryProvider.unavailable(), 2)
                    .run(request(20).build());

            assertNotEquals(first.getFinalSummary().getFinalCapital(), second.getFinalSummary().getFinalCapital());
        }

        @Test
        @DisplayName("A missing profile leaves the raw trajectory untouched")
        void missingProfilePassesThrough() {
            ScriptedPriceHistoryProvider provider = prices((coin, date) -> 100.0 * Math.pow(1.01, day(date)));

            SimulationResult result = engine(frictionless().build(), provider, 1)
                    .run(request(5).calibrationProfile("does_not_exist").build());

            assertTrue(result.isSuccess());
            assertFalse(result.getCalibrationInfo().isProfileApplied());
            assertNotNull(result.getCalibrationInfo().getError());
            assertThat(result.getCycles()).noneMatch(SimulationCycleRecord::isCalibrated);
            assertEquals(result.getCalibrationInfo().getOriginalReturn(), result.getFinalSummary().getTotalReturn(), 1e-9);
        }

        @Test
        @DisplayName("A realistic profile bounds every calibrated cycle return")
        void realisticProfileBoundsReturns() {
            SimulationResult result = engine(frictionless().build(), PriceHistoryProvider.unavailable(), 7)
                    .run(request(20).calibrationProfile("conservative_realistic").build());

            assertTrue(result.getCalibrationInfo().isProfileApplied());
            assertThat(result.getCycles()).allMatch(SimulationCycleRecord::isCalibrated);
            assertThat(result.getCycles()).allSatisfy(cycle ->
                    assertThat(cycle.getCycleReturn()).isBetween(-0.03, 0.025));
            assertEquals(result.getCalibrationInfo().getCalibratedReturn(),
                    result.getFinalSummary().getTotalReturn(), 1e-9);
        }

        @Test
        @DisplayName("Without a calibration manager the raw result is returned")
        void calibrationDisabled() {
            DailyRebalanceSimulationEngine engine = new DailyRebalanceSimulationEngine(frictionless().build(),
                    PriceHistoryProvider.unavailable(), VolatilityMode.LOW_VOLATILITY, new Random(1), null);

            SimulationResult result = engine.run(request(5).build());

            assertTrue(result.isSuccess());
            assertEquals("Calibration disabled", result.getCalibrationInfo().getError());
        }
    }
}
