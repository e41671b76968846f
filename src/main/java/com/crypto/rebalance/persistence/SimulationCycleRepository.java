package com.crypto.rebalance.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Repository
public interface SimulationCycleRepository extends JpaRepository<SimulationCycleEntity, Long> {

    List<SimulationCycleEntity> findBySimulationIdOrderByCycleNumberAsc(Long simulationId);

    long countBySimulationId(Long simulationId);

    @Query("SELECT COALESCE(SUM(c.tradingCosts), 0.0) FROM SimulationCycleEntity c WHERE c.simulationId = :simulationId")
    Double sumTradingCosts(@Param("simulationId") Long simulationId);

    @Modifying
    @Transactional
    @Query("DELETE FROM SimulationCycleEntity c WHERE c.simulationId = :simulationId")
    int deleteBySimulationId(@Param("simulationId") Long simulationId);
}
