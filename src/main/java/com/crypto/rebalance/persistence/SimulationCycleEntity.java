package com.crypto.rebalance.persistence;

import com.crypto.rebalance.strategy.MarketRegime;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One persisted simulation cycle. Allocation and actions are stored as JSON text.
 */
@Entity
@Table(name = "simulation_cycles", indexes = {
    @Index(name = "idx_cycle_simulation", columnList = "simulation_id, cycle_number", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimulationCycleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "simulation_id", nullable = false)
    private Long simulationId;

    @Column(name = "cycle_number", nullable = false)
    private Integer cycleNumber;

    @Column(name = "cycle_date", nullable = false)
    private LocalDateTime cycleDate;

    @Column(name = "starting_capital")
    private Double startingCapital;

    @Column(name = "ending_capital")
    private Double endingCapital;

    @Column(name = "portfolio_value", nullable = false)
    private Double portfolioValue;

    @Column(name = "reserve_value", nullable = false)
    private Double reserveValue;

    @Column(name = "total_value", nullable = false)
    private Double totalValue;

    @Column(name = "cycle_return")
    private Double cycleReturn;

    @Column(name = "allocation_breakdown", columnDefinition = "TEXT")
    private String allocationBreakdown;

    @Column(name = "trading_costs", nullable = false)
    private Double tradingCosts;

    @Column(name = "execution_delay")
    private Double executionDelay;

    @Column(name = "failed_orders")
    private Integer failedOrders;

    @Enumerated(EnumType.STRING)
    @Column(name = "market_regime", length = 20)
    private MarketRegime marketRegime;

    @Column(name = "protection_active")
    private Boolean protectionActive;

    @Column(name = "actions_taken", columnDefinition = "TEXT")
    private String actionsTaken;

    @Column(name = "calibrated")
    private Boolean calibrated;

    @Column(name = "calibration_profile", length = 100)
    private String calibrationProfile;
}
