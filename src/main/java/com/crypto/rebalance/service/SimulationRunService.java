package com.crypto.rebalance.service;

import com.crypto.rebalance.calibration.CalibrationManager;
import com.crypto.rebalance.calibration.CalibrationProfileStore;
import com.crypto.rebalance.exception.SimulationException;
import com.crypto.rebalance.persistence.SimulationCycleEntity;
import com.crypto.rebalance.persistence.SimulationCycleRepository;
import com.crypto.rebalance.persistence.SimulationEntity;
import com.crypto.rebalance.persistence.SimulationRepository;
import com.crypto.rebalance.persistence.SimulationStatus;
import com.crypto.rebalance.simulation.DailyRebalanceSimulationEngine;
import com.crypto.rebalance.simulation.FinalSummary;
import com.crypto.rebalance.simulation.SimulationCycleRecord;
import com.crypto.rebalance.simulation.SimulationEngineFactory;
import com.crypto.rebalance.simulation.SimulationRequest;
import com.crypto.rebalance.simulation.SimulationResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Queues, runs and persists named simulations.
 *
 * Lifecycle: PENDING -> RUNNING -> COMPLETED | FAILED.
 * A failed run keeps the cycles completed before the failure.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SimulationRunService {

    private final SimulationEngineFactory engineFactory;
    private final SimulationRepository simulationRepository;
    private final SimulationCycleRepository cycleRepository;
    private final CalibrationProfileStore profileStore;
    private final ObjectMapper objectMapper;

    private final AtomicBoolean batchInProgress = new AtomicBoolean(false);

    /**
     * Queue a run. Unset fields take the configured defaults.
     */
    public SimulationEntity createSimulation(SimulationRequest request) {
        SimulationRequest resolved = engineFactory.withDefaults(request);

        String name = resolved.getRunName() != null
                ? resolved.getRunName()
                : "simulation_" + LocalDateTime.now().withNano(0);

        List<String> warnings = new CalibrationManager(profileStore).checkCompatibility(
                resolved.getCalibrationProfile(), resolved.getDurationDays(), resolved.getStartingCapital());
        warnings.forEach(warning -> log.warn("Simulation '{}': {}", name, warning));

        SimulationEntity entity = SimulationEntity.builder()
                .name(name)
                .status(SimulationStatus.PENDING)
                .startDate(resolved.getStartDate())
                .durationDays(resolved.getDurationDays())
                .cycleLengthMinutes(resolved.getCycleLengthMinutes())
                .startingCapital(resolved.getStartingCapital())
                .calibrationProfile(CalibrationManager.isDisabled(resolved.getCalibrationProfile())
                        ? CalibrationManager.NO_CALIBRATION
                        : resolved.getCalibrationProfile())
                .protectionEnabled(resolved.getProtectionEnabled())
                .realisticMode(resolved.getRealisticMode())
                .randomSeed(resolved.getRandomSeed())
                .createdAt(LocalDateTime.now())
                .build();

        SimulationEntity saved = simulationRepository.save(entity);
        log.info("Queued simulation '{}' (id={})", saved.getName(), saved.getId());
        return saved;
    }

    /**
     * Run a queued simulation and persist its cycles and outcome.
     */
    public SimulationResult runSimulation(Long simulationId) {
        SimulationEntity entity = simulationRepository.findById(simulationId)
                .orElseThrow(() -> new IllegalArgumentException("Simulation not found: " + simulationId));

        if (entity.getStatus() != SimulationStatus.PENDING) {
            throw new IllegalStateException("Simulation " + simulationId + " is " + entity.getStatus());
        }

        entity.setStatus(SimulationStatus.RUNNING);
        entity.setStartedAt(LocalDateTime.now());
        simulationRepository.save(entity);

        SimulationRequest request = engineFactory.withDefaults(toRequest(entity));
        SimulationResult result;
        try {
            DailyRebalanceSimulationEngine engine = engineFactory.create(request);
            result = engine.run(request);
        } catch (SimulationException e) {
            log.error("Simulation '{}' rejected [{}]: {}", entity.getName(), e.getErrorCode(), e.getMessage());
            markFailed(entity, e.getErrorCode() + ": " + e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            log.error("Simulation '{}' crashed: {}", entity.getName(), e.getMessage(), e);
            markFailed(entity, e.getMessage());
            throw e;
        }

        saveCycles(simulationId, result.getCycles());
        applyResult(entity, result);
        simulationRepository.save(entity);

        return result;
    }

    /**
     * Run up to {@code maxRuns} queued simulations, oldest first.
     *
     * @return number of runs that completed successfully
     */
    public int runPendingSimulations(int maxRuns) {
        if (!batchInProgress.compareAndSet(false, true)) {
            log.warn("Pending simulations already being processed, skipping...");
            return 0;
        }

        try {
            List<SimulationEntity> pending = simulationRepository.findNextByStatus(SimulationStatus.PENDING, maxRuns);
            if (pending.isEmpty()) {
                log.debug("No pending simulations");
                return 0;
            }

            log.info("Running {} pending simulations", pending.size());
            int completed = 0;
            for (SimulationEntity simulation : pending) {
                try {
                    SimulationResult result = runSimulation(simulation.getId());
                    if (result.isSuccess()) {
                        completed++;
                    }
                } catch (RuntimeException e) {
                    log.error("Pending simulation {} failed: {}", simulation.getId(), e.getMessage());
                }
            }
            log.info("Pending batch finished: {}/{} completed", completed, pending.size());
            return completed;

        } finally {
            batchInProgress.set(false);
        }
    }

    public List<SimulationCycleEntity> getCycles(Long simulationId) {
        return cycleRepository.findBySimulationIdOrderByCycleNumberAsc(simulationId);
    }

    public long countByStatus(SimulationStatus status) {
        return simulationRepository.countByStatus(status);
    }

    private void saveCycles(Long simulationId, List<SimulationCycleRecord> cycles) {
        List<SimulationCycleEntity> entities = new ArrayList<>(cycles.size());
        for (SimulationCycleRecord cycle : cycles) {
            entities.add(SimulationCycleEntity.builder()
                    .simulationId(simulationId)
                    .cycleNumber(cycle.getCycleNumber())
                    .cycleDate(cycle.getCycleDate())
                    .startingCapital(cycle.getStartingCapital())
                    .endingCapital(cycle.getEndingCapital())
                    .portfolioValue(cycle.getPortfolioValue())
                    .reserveValue(cycle.getReserveValue())
                    .totalValue(cycle.getTotalValue())
                    .cycleReturn(cycle.getCycleReturn())
                    .allocationBreakdown(toJson(cycle.getAllocationBreakdown()))
                    .tradingCosts(cycle.getTradingCosts())
                    .executionDelay(cycle.getExecutionDelay())
                    .failedOrders(cycle.getFailedOrders())
                    .marketRegime(cycle.getMarketRegime())
                    .protectionActive(cycle.isProtectionActive())
                    .actionsTaken(toJson(cycle.getActionsTaken()))
                    .calibrated(cycle.isCalibrated())
                    .calibrationProfile(cycle.getCalibrationProfile())
                    .build());
        }
        cycleRepository.saveAll(entities);
        log.debug("Saved {} cycles for simulation {}", entities.size(), simulationId);
    }

    private void applyResult(SimulationEntity entity, SimulationResult result) {
        FinalSummary summary = result.getFinalSummary();
        entity.setStatus(result.isSuccess() ? SimulationStatus.COMPLETED : SimulationStatus.FAILED);
        entity.setErrorMessage(truncate(result.getFailureReason()));
        entity.setFinalTotalValue(summary.getFinalCapital());
        entity.setFinalPortfolioValue(summary.getFinalPortfolioValue());
        entity.setFinalReserveValue(summary.getFinalReserveValue());
        entity.setRealizedPnl(summary.getRealizedPnl());
        entity.setTotalReturn(summary.getTotalReturn());
        entity.setTotalCycles(result.getTotalCycles());
        entity.setTotalTradingCosts(summary.getTotalTradingCosts());
        entity.setProtectionCycles(summary.getProtectionCycles());
        entity.setCalibrationInfo(toJson(result.getCalibrationInfo()));
        entity.setCompletedAt(LocalDateTime.now());
    }

    private void markFailed(SimulationEntity entity, String message) {
        entity.setStatus(SimulationStatus.FAILED);
        entity.setErrorMessage(truncate(message));
        entity.setCompletedAt(LocalDateTime.now());
        simulationRepository.save(entity);
    }

    private SimulationRequest toRequest(SimulationEntity entity) {
        return SimulationRequest.builder()
                .runName(entity.getName())
                .startDate(entity.getStartDate())
                .durationDays(entity.getDurationDays())
                .cycleLengthMinutes(entity.getCycleLengthMinutes())
                .startingCapital(entity.getStartingCapital())
                .calibrationProfile(entity.getCalibrationProfile())
                .protectionEnabled(entity.getProtectionEnabled())
                .realisticMode(entity.getRealisticMode())
                .randomSeed(entity.getRandomSeed())
                .build();
    }

    private String toJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Could not serialise {}: {}", value.getClass().getSimpleName(), e.getMessage());
            return null;
        }
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > 1000 ? message.substring(0, 1000) : message;
    }
}
