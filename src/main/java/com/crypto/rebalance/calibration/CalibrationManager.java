package com.crypto.rebalance.calibration;

import com.crypto.rebalance.exception.ProfileNotFoundException;
import com.crypto.rebalance.indicator.PriceStatistics;
import com.crypto.rebalance.simulation.SimulationCycleRecord;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Rewrites raw cycle returns into a bounded, cost-adjusted trajectory.
 *
 * Per cycle:
 * <pre>
 * timing   = raw > 0 ? raw * market_timing_efficiency : raw
 * capped   = clamp(timing, min_daily_return, max_daily_return)
 * after    = capped - daily_slippage - volatility_drag - 2 * trading_fee
 * final    = clamp(after, min_daily_return, max_daily_return)
 * </pre>
 * Capital compounds {@code final} from the starting capital. The input is never mutated.
 * Calibrating an already calibrated sequence applies the costs a second time.
 */
@Slf4j
public class CalibrationManager {

    public static final String NO_CALIBRATION = "none";

    private static final int LONG_RUN_DAYS = 60;

    private final CalibrationProfileStore profileStore;

    public CalibrationManager(CalibrationProfileStore profileStore) {
        this.profileStore = profileStore;
    }

    public static boolean isDisabled(String profileName) {
        return profileName == null || profileName.isBlank() || NO_CALIBRATION.equalsIgnoreCase(profileName);
    }

    /**
     * Load and validate a profile.
     *
     * @throws ProfileNotFoundException when missing or invalid
     */
    public CalibrationProfile resolveProfile(String profileName) {
        CalibrationProfile profile = profileStore.loadProfile(profileName)
                .orElseThrow(() -> new ProfileNotFoundException(profileName));

        if (profile.getCalibrationParameters() == null) {
            throw new ProfileNotFoundException(profileName, List.of("calibration_parameters missing"));
        }
        List<String> problems = profile.getCalibrationParameters().validate();
        if (!problems.isEmpty()) {
            throw new ProfileNotFoundException(profileName, problems);
        }
        return profile;
    }

    public CalibrationOutcome calibrate(List<SimulationCycleRecord> cycles, double startingCapital, String profileName) {
        double originalReturn = totalReturn(cycles, startingCapital);

        if (isDisabled(profileName)) {
            return new CalibrationOutcome(List.copyOf(cycles),
                    CalibrationInfo.notApplied(NO_CALIBRATION, originalReturn, null));
        }

        CalibrationProfile profile;
        try {
            profile = resolveProfile(profileName);
        } catch (ProfileNotFoundException e) {
            log.warn("Calibration skipped: {}", e.getMessage());
            return new CalibrationOutcome(List.copyOf(cycles),
                    CalibrationInfo.notApplied(profileName, originalReturn, e.getMessage()));
        }

        CalibrationParameters params = profile.getCalibrationParameters();
        List<SimulationCycleRecord> calibrated = new ArrayList<>(cycles.size());
        double capital = startingCapital;
        double previousRawValue = startingCapital;
        double totalCosts = 0.0;

        for (SimulationCycleRecord cycle : cycles) {
            double rawReturn = previousRawValue > 0 ? cycle.getTotalValue() / previousRawValue - 1 : 0.0;
            previousRawValue = cycle.getTotalValue();

            double calibratedReturn = calibrateReturn(rawReturn, params);
            double newCapital = capital * (1 + calibratedReturn);
            double costs = capital * params.getTradingFee() * 2;
            totalCosts += costs;

            double portfolioShare = cycle.getTotalValue() > 0 ? cycle.getPortfolioValue() / cycle.getTotalValue() : 0.0;
            double portfolioValue = newCapital * portfolioShare;

            calibrated.add(cycle.toBuilder()
                    .startingCapital(capital)
                    .endingCapital(newCapital)
                    .portfolioValue(portfolioValue)
                    .reserveValue(newCapital - portfolioValue)
                    .totalValue(newCapital)
                    .cycleReturn(calibratedReturn)
                    .tradingCosts(costs)
                    .calibrated(true)
                    .calibrationProfile(profileName)
                    .build());

            capital = newCapital;
        }

        double calibratedTotal = startingCapital == 0 ? 0.0 : (capital / startingCapital - 1) * 100;

        log.info("Calibration {} applied to {} cycles: {}% -> {}%",
                profileName, cycles.size(),
                String.format("%.2f", originalReturn), String.format("%.2f", calibratedTotal));

        CalibrationInfo info = CalibrationInfo.builder()
                .profileApplied(true)
                .profileName(profileName)
                .profileVersion(profile.getVersion())
                .originalReturn(originalReturn)
                .calibratedReturn(calibratedTotal)
                .adjustment(calibratedTotal - originalReturn)
                .totalTradingCosts(totalCosts)
                .parameters(params.toMap())
                .build();

        return new CalibrationOutcome(calibrated, info);
    }

    /**
     * Calibrated return for one cycle; always within [min_daily_return, max_daily_return].
     */
    public static double calibrateReturn(double rawReturn, CalibrationParameters params) {
        double timingAdjusted = rawReturn > 0 ? rawReturn * params.getMarketTimingEfficiency() : rawReturn;
        double capped = PriceStatistics.clamp(timingAdjusted, params.getMinDailyReturn(), params.getMaxDailyReturn());
        double afterCosts = capped
                - params.getDailySlippage()
                - params.getVolatilityDrag()
                - 2 * params.getTradingFee();
        return PriceStatistics.clamp(afterCosts, params.getMinDailyReturn(), params.getMaxDailyReturn());
    }

    public Optional<ProfileSummary> getProfileSummary(String profileName) {
        return profileStore.loadProfile(profileName).map(profile -> ProfileSummary.builder()
                .name(profile.getProfileName() == null ? profileName : profile.getProfileName())
                .version(profile.getVersion())
                .description(profile.getDescription())
                .createdDate(profile.getCreatedDate())
                .profileType(profile.getProfileType())
                .marketRegime(profile.marketRegime())
                .expectedPerformance(profile.getExpectedPerformance())
                .parameters(profile.getCalibrationParameters() == null
                        ? null : profile.getCalibrationParameters().toMap())
                .build());
    }

    /**
     * Warnings about using a profile for a run of the given shape. Empty when compatible.
     */
    public List<String> checkCompatibility(String profileName, int durationDays, double startingCapital) {
        List<String> warnings = new ArrayList<>();
        if (isDisabled(profileName)) {
            return warnings;
        }

        Optional<CalibrationProfile> loaded = profileStore.loadProfile(profileName);
        if (loaded.isEmpty()) {
            warnings.add("Profile " + profileName + " not found; calibration will be skipped");
            return warnings;
        }
        CalibrationProfile profile = loaded.get();

        if (durationDays > LONG_RUN_DAYS) {
            warnings.add("Long simulation (" + durationDays + " days); calibration accuracy may decrease");
        }
        if (startingCapital < profile.minimumCapital()) {
            warnings.add("Starting capital " + startingCapital + " is below the profile minimum of "
                    + profile.minimumCapital());
        }
        String regime = profile.marketRegime();
        if (regime.contains("bull")) {
            warnings.add("Profile was calibrated for bull markets");
        } else if (regime.contains("bear")) {
            warnings.add("Profile was calibrated for bear markets");
        }
        return warnings;
    }

    public List<String> availableProfiles() {
        return profileStore.listProfiles();
    }

    private static double totalReturn(List<SimulationCycleRecord> cycles, double startingCapital) {
        if (cycles.isEmpty() || startingCapital == 0) {
            return 0.0;
        }
        return (cycles.get(cycles.size() - 1).getTotalValue() / startingCapital - 1) * 100;
    }
}
