package com.crypto.rebalance.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SimulationRepository extends JpaRepository<SimulationEntity, Long> {

    /**
     * Oldest queued runs first.
     */
    List<SimulationEntity> findByStatusOrderByCreatedAtAsc(SimulationStatus status);

    Optional<SimulationEntity> findTopByNameOrderByCreatedAtDesc(String name);

    long countByStatus(SimulationStatus status);

    @Query("SELECT s FROM SimulationEntity s WHERE s.status = :status ORDER BY s.createdAt ASC LIMIT :limit")
    List<SimulationEntity> findNextByStatus(@Param("status") SimulationStatus status, @Param("limit") int limit);
}
