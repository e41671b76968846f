package com.crypto.rebalance.persistence;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * A named simulation run and its final figures.
 */
@Entity
@Table(name = "simulations", indexes = {
    @Index(name = "idx_simulation_status", columnList = "status"),
    @Index(name = "idx_simulation_created", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private SimulationStatus status;

    @Column(name = "start_date", nullable = false)
    private LocalDateTime startDate;

    @Column(name = "duration_days", nullable = false)
    private Integer durationDays;

    @Column(name = "cycle_length_minutes", nullable = false)
    private Integer cycleLengthMinutes;

    @Column(name = "starting_capital", nullable = false)
    private Double startingCapital;

    /**
     * Profile name, or "none".
     */
    @Column(name = "calibration_profile", length = 100)
    private String calibrationProfile;

    @Column(name = "protection_enabled")
    private Boolean protectionEnabled;

    @Column(name = "realistic_mode")
    private Boolean realisticMode;

    @Column(name = "random_seed")
    private Long randomSeed;

    @Column(name = "final_total_value")
    private Double finalTotalValue;

    @Column(name = "final_portfolio_value")
    private Double finalPortfolioValue;

    @Column(name = "final_reserve_value")
    private Double finalReserveValue;

    @Column(name = "realized_pnl")
    private Double realizedPnl;

    /**
     * Percent.
     */
    @Column(name = "total_return")
    private Double totalReturn;

    @Column(name = "total_cycles")
    private Integer totalCycles;

    @Column(name = "total_trading_costs")
    private Double totalTradingCosts;

    @Column(name = "protection_cycles")
    private Integer protectionCycles;

    /**
     * CalibrationInfo as JSON.
     */
    @Column(name = "calibration_info", columnDefinition = "TEXT")
    private String calibrationInfo;

    @Column(name = "error_message", length = 1000)
    private String errorMessage;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (status == null) {
            status = SimulationStatus.PENDING;
        }
    }
}
