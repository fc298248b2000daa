package com.tradingassistant.strategy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class RiskEstimatorTest {

    private final RiskEstimator estimator = new RiskEstimator();

    @Test
    void riskScore_shouldFloorLowVolatility() {
        assertEquals(20.0, estimator.riskScore(0.5, 100.0));
    }

    @Test
    void riskScore_shouldCapHighVolatility() {
        assertEquals(80.0, estimator.riskScore(6.0, 100.0));
    }

    @Test
    void riskScore_shouldInterpolateBetweenBands() {
        assertEquals(44.0, estimator.riskScore(0.4, 20.0), 1e-9);
        assertEquals(80.0, estimator.riskScore(5.0, 100.0), 1e-9);
        assertEquals(32.0, estimator.riskScore(1.0, 100.0), 1e-9);
    }

    @Test
    void riskScore_shouldTreatNonPositivePriceAsZeroVolatility() {
        assertEquals(20.0, estimator.riskScore(3.0, 0.0));
        assertEquals(20.0, estimator.riskScore(3.0, -5.0));
        assertEquals(0.0, estimator.atrPct(3.0, 0.0));
    }

    @Test
    void riskScore_shouldBeScaleInvariant() {
        assertEquals(estimator.riskScore(0.3, 10.0), estimator.riskScore(30.0, 1000.0), 1e-9);
    }
}
