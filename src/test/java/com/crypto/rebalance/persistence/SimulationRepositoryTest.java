package com.crypto.rebalance.persistence;

import com.crypto.rebalance.BaseIntegrationTest;
import com.crypto.rebalance.strategy.MarketRegime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataIntegrityViolationException;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("Simulation Persistence Tests")
class SimulationRepositoryTest extends BaseIntegrationTest {

    private static final LocalDateTime BASE_TIME = LocalDateTime.of(2024, 1, 1, 12, 0);

    @Autowired
    private SimulationRepository simulationRepository;

    @Autowired
    private SimulationCycleRepository cycleRepository;

    @BeforeEach
    void setUp() {
        cycleRepository.deleteAll();
        simulationRepository.deleteAll();
    }

    private SimulationEntity simulation(String name, SimulationStatus status, LocalDateTime createdAt) {
        return simulationRepository.save(SimulationEntity.builder()
                .name(name)
                .status(status)
                .startDate(LocalDateTime.of(2024, 1, 1, 0, 0))
                .durationDays(30)
                .cycleLengthMinutes(1440)
                .startingCapital(1000.0)
                .calibrationProfile("none")
                .createdAt(createdAt)
                .build());
    }

    private SimulationCycleEntity cycle(Long simulationId, int number, double costs) {
        return SimulationCycleEntity.builder()
                .simulationId(simulationId)
                .cycleNumber(number)
                .cycleDate(LocalDateTime.of(2024, 1, number, 0, 0))
                .portfolioValue(950.0)
                .reserveValue(50.0)
                .totalValue(1000.0)
                .tradingCosts(costs)
                .marketRegime(MarketRegime.SIDEWAYS)
                .allocationBreakdown("{\"BTC\":1.0}")
                .actionsTaken("[\"CRYPTO_REBALANCE\"]")
                .build();
    }

    @Test
    @DisplayName("Pending runs are returned oldest first, up to the limit")
    void nextPendingOldestFirst() {
        simulation("third", SimulationStatus.PENDING, BASE_TIME.plusMinutes(2));
        simulation("first", SimulationStatus.PENDING, BASE_TIME);
        simulation("done", SimulationStatus.COMPLETED, BASE_TIME.minusDays(1));
        simulation("second", SimulationStatus.PENDING, BASE_TIME.plusMinutes(1));

        List<SimulationEntity> next = simulationRepository.findNextByStatus(SimulationStatus.PENDING, 2);

        assertThat(next).extracting(SimulationEntity::getName).containsExactly("first", "second");
        assertThat(simulationRepository.countByStatus(SimulationStatus.PENDING)).isEqualTo(3);
    }

    @Test
    @DisplayName("Latest run by name")
    void latestByName() {
        simulation("repeat", SimulationStatus.COMPLETED, BASE_TIME);
        simulation("repeat", SimulationStatus.PENDING, BASE_TIME.plusHours(1));

        assertThat(simulationRepository.findTopByNameOrderByCreatedAtDesc("repeat"))
                .map(SimulationEntity::getStatus)
                .contains(SimulationStatus.PENDING);
    }

    @Test
    @DisplayName("Status and creation time default on insert")
    void defaultsOnInsert() {
        SimulationEntity saved = simulation("defaults", null, null);

        assertThat(saved.getStatus()).isEqualTo(SimulationStatus.PENDING);
        assertThat(saved.getCreatedAt()).isNotNull();
    }

    @Test
    @DisplayName("Cycles are stored per run in cycle order")
    void cyclesPerRun() {
        Long id = simulation("cycles", SimulationStatus.COMPLETED, BASE_TIME).getId();
        Long otherId = simulation("other", SimulationStatus.COMPLETED, BASE_TIME).getId();
        cycleRepository.save(cycle(id, 2, 1.0));
        cycleRepository.save(cycle(id, 1, 0.5));
        cycleRepository.save(cycle(otherId, 1, 9.0));

        assertThat(cycleRepository.findBySimulationIdOrderByCycleNumberAsc(id))
                .extracting(SimulationCycleEntity::getCycleNumber)
                .containsExactly(1, 2);
        assertThat(cycleRepository.sumTradingCosts(id)).isEqualTo(1.5);
        assertThat(cycleRepository.sumTradingCosts(-1L)).isZero();

        assertThat(cycleRepository.deleteBySimulationId(id)).isEqualTo(2);
        assertThat(cycleRepository.countBySimulationId(id)).isZero();
        assertThat(cycleRepository.countBySimulationId(otherId)).isEqualTo(1);
    }

    @Test
    @DisplayName("A cycle number is unique within a run")
    void uniqueCycleNumber() {
        Long id = simulation("unique", SimulationStatus.COMPLETED, BASE_TIME).getId();
        cycleRepository.save(cycle(id, 1, 0.5));

        assertThrows(DataIntegrityViolationException.class, () -> cycleRepository.saveAndFlush(cycle(id, 1, 0.5)));
    }
}
