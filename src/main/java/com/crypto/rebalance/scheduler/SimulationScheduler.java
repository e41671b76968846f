package com.crypto.rebalance.scheduler;

import com.crypto.rebalance.service.SimulationRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Polls for queued simulations and runs them.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(name = "simulation.scheduler.enabled", havingValue = "true")
public class SimulationScheduler {

    private final SimulationRunService runService;

    @Value("${simulation.scheduler.batch-size:5}")
    private int batchSize;

    @Scheduled(initialDelayString = "${simulation.scheduler.initial-delay-ms:10000}",
            fixedDelayString = "${simulation.scheduler.fixed-delay-ms:60000}")
    public void runPending() {
        try {
            int completed = runService.runPendingSimulations(batchSize);
            if (completed > 0) {
                log.info("Scheduled run completed {} simulations", completed);
            }
        } catch (Exception e) {
            log.error("Error running pending simulations: {}", e.getMessage(), e);
        }
    }
}
