package com.crypto.rebalance.strategy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MarketRegime Tests")
class MarketRegimeTest {

    @Test
    @DisplayName("Regime parameters")
    void regimeParameters() {
        assertEquals(0.8, MarketRegime.BULL.getMomentumWeight());
        assertEquals(1.08, MarketRegime.BULL.getRiskMultiplier());
        assertEquals(1.4, MarketRegime.BULL.getSyntheticReturnMultiplier());

        assertEquals(0.3, MarketRegime.BEAR.getMomentumWeight());
        assertEquals(0.92, MarketRegime.BEAR.getRiskMultiplier());
        assertEquals(0.6, MarketRegime.BEAR.getSyntheticReturnMultiplier());

        assertEquals(0.4, MarketRegime.VOLATILE.getMomentumWeight());
        assertEquals(0.95, MarketRegime.VOLATILE.getRiskMultiplier());
        assertEquals(1.1, MarketRegime.VOLATILE.getSyntheticReturnMultiplier());

        assertEquals(0.6, MarketRegime.SIDEWAYS.getMomentumWeight());
        assertEquals(1.0, MarketRegime.SIDEWAYS.getRiskMultiplier());
        assertEquals(1.0, MarketRegime.SIDEWAYS.getSyntheticReturnMultiplier());
    }

    @Test
    @DisplayName("Signal weights add up to 1 and labels are lower case")
    void weightsAndLabels() {
        for (MarketRegime regime : MarketRegime.values()) {
            assertEquals(1.0, regime.getMomentumWeight() + regime.getMeanReversionWeight(), 1e-12);
            assertEquals(regime.name().toLowerCase(), regime.getLabel());
            assertNotNull(regime.getDescription());
        }
    }
}
