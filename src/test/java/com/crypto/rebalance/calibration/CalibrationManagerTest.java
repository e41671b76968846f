package com.crypto.rebalance.calibration;

import com.crypto.rebalance.exception.ProfileNotFoundException;
import com.crypto.rebalance.simulation.SimulationCycleRecord;
import com.crypto.rebalance.strategy.MarketRegime;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CalibrationManager Tests")
class CalibrationManagerTest {

    private static final CalibrationParameters CONSERVATIVE = CalibrationParameters.builder()
            .marketTimingEfficiency(0.6)
            .dailySlippage(0.006)
            .tradingFee(0.001)
            .volatilityDrag(0.003)
            .maxDailyReturn(0.025)
            .minDailyReturn(-0.03)
            .build();

    private final CalibrationManager manager = new CalibrationManager(
            new JsonCalibrationProfileStore(new ObjectMapper(), "target/no-such-profiles"));

    static List<SimulationCycleRecord> cycles(double startingCapital, double... returns) {
        List<SimulationCycleRecord> cycles = new ArrayList<>();
        double capital = startingCapital;
        LocalDateTime date = LocalDateTime.of(2024, 1, 1, 0, 0);
        for (int i = 0; i < returns.length; i++) {
            double ending = capital * (1 + returns[i]);
            cycles.add(SimulationCycleRecord.builder()
                    .cycleNumber(i + 1)
                    .cycleDate(date.plusDays(i))
                    .startingCapital(capital)
                    .endingCapital(ending)
                    .portfolioValue(ending * 0.95)
                    .reserveValue(ending * 0.05)
                    .totalValue(ending)
                    .cycleReturn(returns[i])
                    .allocationBreakdown(Map.of("BTC", 1.0))
                    .tradingCosts(capital * 0.001)
                    .marketRegime(MarketRegime.SIDEWAYS)
                    .actionsTaken(List.of("CRYPTO_REBALANCE"))
                    .build());
            capital = ending;
        }
        return cycles;
    }

    /**
     * Map-backed store for profiles that should not ship with the application.
     */
    static class InMemoryProfileStore implements CalibrationProfileStore {

        private final Map<String, CalibrationProfile> profiles;

        InMemoryProfileStore(Map<String, CalibrationProfile> profiles) {
            this.profiles = profiles;
        }

        @Override
        public Optional<CalibrationProfile> loadProfile(String name) {
            return Optional.ofNullable(profiles.get(name));
        }

        @Override
        public List<String> listProfiles() {
            return new ArrayList<>(profiles.keySet());
        }
    }

    @Nested
    @DisplayName("Return Formula")
    class FormulaTests {

        @Test
        @DisplayName("Positive returns lose timing efficiency and costs")
        void positiveReturn() {
            assertEquals(0.001, CalibrationManager.calibrateReturn(0.02, CONSERVATIVE), 1e-12);
        }

        @Test
        @DisplayName("Large gains are capped before costs")
        void largeGainCapped() {
            assertEquals(0.014, CalibrationManager.calibrateReturn(0.10, CONSERVATIVE), 1e-12);
        }

        @Test
        @DisplayName("Losses are not softened by timing efficiency")
        void lossesKeepFullSize() {
            assertEquals(-0.021, CalibrationManager.calibrateReturn(-0.01, CONSERVATIVE), 1e-12);
        }

        @Test
        @DisplayName("Deep losses end at the floor")
        void deepLossFloored() {
            assertEquals(-0.03, CalibrationManager.calibrateReturn(-0.05, CONSERVATIVE), 1e-12);
        }

        @Test
        @DisplayName("Calibrated returns always lie within the profile bounds")
        void alwaysWithinBounds() {
            Random random = new Random(21);
            for (int i = 0; i < 10_000; i++) {
                double raw = random.nextGaussian() * 0.2;
                assertThat(CalibrationManager.calibrateReturn(raw, CONSERVATIVE)).isBetween(-0.03, 0.025);
            }
        }
    }

    @Nested
    @DisplayName("Trajectory")
    class TrajectoryTests {

        @Test
        @DisplayName("Capital compounds the calibrated returns")
        void compounding() {
            List<SimulationCycleRecord> raw = cycles(100.0, 0.02, -0.01, 0.10);

            CalibrationOutcome outcome = manager.calibrate(raw, 100.0, "conservative_realistic");

            double expected = 100.0 * 1.001 * (1 - 0.021) * 1.014;
            List<SimulationCycleRecord> calibrated = outcome.cycles();
            assertEquals(expected, calibrated.get(2).getTotalValue(), 1e-9);
            assertEquals(calibrated.get(0).getTotalValue(), calibrated.get(1).getStartingCapital(), 1e-12);
            assertThat(calibrated).allMatch(SimulationCycleRecord::isCalibrated);
            assertThat(calibrated).allMatch(cycle -> "conservative_realistic".equals(cycle.getCalibrationProfile()));
            assertEquals(expected * 0.95, calibrated.get(2).getPortfolioValue(), 1e-9);
        }

        @Test
        @DisplayName("Info reports both returns and their difference in percent")
        void infoReportsAdjustment() {
            List<SimulationCycleRecord> raw = cycles(100.0, 0.02, -0.01, 0.10);

            CalibrationInfo info = manager.calibrate(raw, 100.0, "conservative_realistic").info();

            double original = (1.02 * 0.99 * 1.10 - 1) * 100;
            double calibrated = (1.001 * 0.979 * 1.014 - 1) * 100;
            assertTrue(info.isProfileApplied());
            assertEquals("1.0", info.getProfileVersion());
            assertEquals(original, info.getOriginalReturn(), 1e-9);
            assertEquals(calibrated, info.getCalibratedReturn(), 1e-9);
            assertEquals(calibrated - original, info.getAdjustment(), 1e-9);
            assertEquals(100.0 * 0.002 + 100.1 * 0.002 + 100.1 * 0.979 * 0.002, info.getTotalTradingCosts(), 1e-9);
            assertEquals(0.6, info.getParameters().get("market_timing_efficiency"));
        }

        @Test
        @DisplayName("The input records are left untouched")
        void inputNotMutated() {
            List<SimulationCycleRecord> raw = cycles(100.0, 0.02, -0.01);

            manager.calibrate(raw, 100.0, "conservative_realistic");

            assertFalse(raw.get(0).isCalibrated());
            assertEquals(102.0, raw.get(0).getTotalValue(), 1e-12);
        }

        @Test
        @DisplayName("Calibrating twice applies the costs twice")
        void notIdempotent() {
            List<SimulationCycleRecord> raw = cycles(100.0, 0.02, 0.01, -0.005, 0.015);

            CalibrationOutcome once = manager.calibrate(raw, 100.0, "conservative_realistic");
            CalibrationOutcome twice = manager.calibrate(once.cycles(), 100.0, "conservative_realistic");
            CalibrationOutcome again = manager.calibrate(raw, 100.0, "conservative_realistic");

            assertThat(twice.info().getCalibratedReturn()).isLessThan(once.info().getCalibratedReturn());
            assertEquals(once.info().getAdjustment(), again.info().getAdjustment(), 1e-12);
        }

        @Test
        @DisplayName("The frictionless profile reproduces the raw trajectory")
        void zeroCostProfile() {
            List<SimulationCycleRecord> raw = cycles(100.0, 0.02, -0.04, 0.03);

            CalibrationOutcome outcome = manager.calibrate(raw, 100.0, "zero_cost");

            assertEquals(raw.get(2).getTotalValue(), outcome.cycles().get(2).getTotalValue(), 1e-9);
            assertEquals(0.0, outcome.info().getAdjustment(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Unusable Profiles")
    class UnusableProfileTests {

        @Test
        @DisplayName("A missing profile passes the cycles through")
        void missingProfile() {
            List<SimulationCycleRecord> raw = cycles(100.0, 0.02, -0.01);

            CalibrationOutcome outcome = manager.calibrate(raw, 100.0, "does_not_exist");

            assertEquals(raw, outcome.cycles());
            assertFalse(outcome.info().isProfileApplied());
            assertEquals("Calibration profile not found: does_not_exist", outcome.info().getError());
            assertEquals(outcome.info().getOriginalReturn(), outcome.info().getCalibratedReturn());
        }

        @Test
        @DisplayName("\"none\" disables calibration")
        void noneDisables() {
            CalibrationOutcome outcome = manager.calibrate(cycles(100.0, 0.02), 100.0, "none");

            assertFalse(outcome.info().isProfileApplied());
            assertNull(outcome.info().getError());
            assertTrue(CalibrationManager.isDisabled(null));
            assertTrue(CalibrationManager.isDisabled(" "));
            assertFalse(CalibrationManager.isDisabled("zero_cost"));
        }

        @Test
        @DisplayName("Invalid parameters are treated like a missing profile")
        void invalidProfile() {
            CalibrationProfile broken = CalibrationProfile.builder()
                    .profileName("broken")
                    .calibrationParameters(CalibrationParameters.builder()
                            .marketTimingEfficiency(0.6)
                            .dailySlippage(0.006)
                            .tradingFee(0.001)
                            .volatilityDrag(0.003)
                            .maxDailyReturn(0.025)
                            .minDailyReturn(0.5)
                            .build())
                    .build();
            CalibrationManager brokenManager = new CalibrationManager(
                    new InMemoryProfileStore(Map.of("broken", broken)));

            ProfileNotFoundException exception = assertThrows(ProfileNotFoundException.class,
                    () -> brokenManager.resolveProfile("broken"));
            assertThat(exception.getMessage()).contains("min_daily_return");
            assertEquals("ERR-SIM-PROFILE", exception.getErrorCode());

            CalibrationOutcome outcome = brokenManager.calibrate(cycles(100.0, 0.02), 100.0, "broken");
            assertFalse(outcome.info().isProfileApplied());
        }

        @Test
        @DisplayName("Profile without parameters is rejected")
        void missingParameters() {
            CalibrationManager emptyManager = new CalibrationManager(new InMemoryProfileStore(
                    Map.of("empty", CalibrationProfile.builder().profileName("empty").build())));

            assertThrows(ProfileNotFoundException.class, () -> emptyManager.resolveProfile("empty"));
        }
    }

    @Nested
    @DisplayName("Profile Queries")
    class QueryTests {

        @Test
        @DisplayName("Summary exposes profile metadata")
        void profileSummary() {
            ProfileSummary summary = manager.getProfileSummary("moderate_realistic").orElseThrow();

            assertEquals("moderate_realistic", summary.getName());
            assertEquals("bull_market", summary.getMarketRegime());
            assertEquals(0.7, summary.getParameters().get("market_timing_efficiency"));
            assertTrue(manager.getProfileSummary("nope").isEmpty());
        }

        @Test
        @DisplayName("Compatibility warnings cover duration, capital and regime")
        void compatibilityWarnings() {
            assertThat(manager.checkCompatibility("moderate_realistic", 90, 10.0)).hasSize(3);
            assertThat(manager.checkCompatibility("bear_market_defensive", 30, 1000.0))
                    .containsExactly("Profile was calibrated for bear markets");
            assertThat(manager.checkCompatibility("conservative_realistic", 30, 1000.0)).isEmpty();
            assertThat(manager.checkCompatibility("missing", 30, 1000.0)).hasSize(1);
            assertThat(manager.checkCompatibility("none", 365, 1.0)).isEmpty();
        }

        @Test
        @DisplayName("Bundled profiles are listed")
        void availableProfiles() {
            assertThat(manager.availableProfiles()).contains(
                    "aggressive_realistic", "bear_market_defensive", "conservative_realistic",
                    "high_volatility_scalping", "moderate_realistic", "zero_cost");
        }
    }
}
