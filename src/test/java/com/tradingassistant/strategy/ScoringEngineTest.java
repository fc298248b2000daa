package com.tradingassistant.strategy;

import com.tradingassistant.model.CatalystEvent;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ScoringEngineTest {

    private final ScoringEngine engine = new ScoringEngine();

    @Test
    void momentumScore_shouldRewardOversoldAndOverbought() {
        assertTrue(engine.momentumScore(20) > 40);
        assertTrue(engine.momentumScore(80) > 50);
        assertEquals(58.333, engine.momentumScore(25), 0.001);
        assertEquals(100.0, engine.momentumScore(0), 1e-9);
        assertEquals(100.0, engine.momentumScore(100), 1e-9);
    }

    @Test
    void momentumScore_shouldKeepOversoldBandAboveNeutralBand() {
        assertTrue(engine.momentumScore(29.9) > 50.0);
        assertTrue(engine.momentumScore(29.9) > engine.momentumScore(30));
        assertEquals(engine.momentumScore(20), engine.momentumScore(80), 1e-9);
    }

    @Test
    void momentumScore_shouldStayInNeutralBandBetween30And70() {
        assertEquals(25.0, engine.momentumScore(30), 1e-9);
        assertEquals(37.5, engine.momentumScore(50), 1e-9);
        assertEquals(50.0, engine.momentumScore(70), 1e-9);
    }

    @Test
    void momentumScore_shouldReturnZeroWhenRsiMissing() {
        assertEquals(0.0, engine.momentumScore(Double.NaN));
    }

    @Test
    void momentumScore_shouldStayWithinBoundsForValidRsi() {
        for (int rsi = 0; rsi <= 100; rsi++) {
            double score = engine.momentumScore(rsi);
            assertTrue(score >= 0.0 && score <= 100.0, "rsi=" + rsi + " score=" + score);
        }
    }

    @Test
    void volumeSurgeScore_shouldIgnoreNormalActivity() {
        assertEquals(0.0, engine.volumeSurgeScore(1_000_000, 1_000_000));
        assertEquals(0.0, engine.volumeSurgeScore(1_400_000, 1_000_000));
    }

    @Test
    void volumeSurgeScore_shouldGuardZeroAverage() {
        assertEquals(0.0, engine.volumeSurgeScore(0, 0));
        assertEquals(0.0, engine.volumeSurgeScore(5_000_000, 0));
    }

    @Test
    void volumeSurgeScore_shouldScaleAboveThresholdAndCap() {
        assertEquals(16.667, engine.volumeSurgeScore(2_000_000, 1_000_000), 0.001);
        assertEquals(50.0, engine.volumeSurgeScore(3_000_000, 1_000_000, 150), 1e-9);
        assertEquals(100.0, engine.volumeSurgeScore(10_000_000, 1_000_000), 1e-9);
        assertEquals(0.0, engine.volumeSurgeScore(1_500_000, 1_000_000), 1e-9);
    }

    @Test
    void relativeStrengthScore_shouldApplyBands() {
        assertEquals(0.0, engine.relativeStrengthScore(-7.0, 0.0, 5.0));
        assertEquals(25.0, engine.relativeStrengthScore(1.0, 0.0, 5.0));
        assertEquals(25.0, engine.relativeStrengthScore(-5.0, 0.0, 5.0));
        assertTrue(engine.relativeStrengthScore(5.0, -1.0, 5.0) > 25);
        assertEquals(55.0, engine.relativeStrengthScore(6.0, -1.0, 5.0), 1e-9);
        assertEquals(100.0, engine.relativeStrengthScore(30.0, 0.0, 5.0), 1e-9);
    }

    @Test
    void newsSentimentScore_shouldBeNeutralWithoutNews() {
        assertEquals(50.0, engine.newsSentimentScore(0, 0));
        assertEquals(100.0, engine.newsSentimentScore(1, 1));
        assertEquals(0.0, engine.newsSentimentScore(0, 4));
        assertEquals(75.0, engine.newsSentimentScore(3, 4));
    }

    @Test
    void catalystScore_shouldAverageByRecency() {
        assertEquals(0.0, engine.catalystScore(List.of()));
        assertEquals(0.0, engine.catalystScore(null));
        assertEquals(100.0, engine.catalystScore(List.of(CatalystEvent.recent("launch"))));
        assertEquals(50.0, engine.catalystScore(List.of(new CatalystEvent("beat", 20))));
        assertEquals(50.0, engine.catalystScore(List.of(
                new CatalystEvent("beat", 3),
                new CatalystEvent("expansion", 90)
        )), 1e-9);
    }

    @Test
    void compositeScore_shouldUseFixedWeights() {
        double composite = engine.compositeScore(100, 0, 0, 0, 0);
        assertEquals(25.0, composite, 1e-9);
        assertEquals(100.0, engine.compositeScore(100, 100, 100, 100, 100), 1e-9);
        assertEquals(0.0, engine.compositeScore(0, 0, 0, 0, 0), 1e-9);
    }

    @Test
    void compositeScore_shouldBeMonotonicInEachComponent() {
        double[] base = {40, 30, 25, 50, 0};
        for (int component = 0; component < 5; component++) {
            double previous = -1.0;
            for (int value = 0; value <= 100; value += 5) {
                double[] args = base.clone();
                args[component] = value;
                double score = engine.compositeScore(args[0], args[1], args[2], args[3], args[4]);
                assertTrue(score >= previous, "component " + component + " not monotonic at " + value);
                assertTrue(score >= 0.0 && score <= 100.0);
                previous = score;
            }
        }
    }

    @Test
    void compositeScore_shouldHonourConfiguredWeights() {
        ScoringEngine momentumOnly = new ScoringEngine(new ScoringWeights(1.0, 0.0, 0.0, 0.0, 0.0));
        assertEquals(42.0, momentumOnly.compositeScore(42, 100, 100, 100, 100), 1e-9);
    }
}
