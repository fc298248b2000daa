package com.tradingassistant.strategy;

import com.tradingassistant.model.CatalystEvent;

import java.util.List;

/**
 * Normalizes raw market signals onto a common 0-100 scale and combines them
 * into one composite score with a fixed set of weights.
 */
public final class ScoringEngine {
    public static final double DEFAULT_VOLUME_SURGE_THRESHOLD_PCT = 150.0;
    public static final double DEFAULT_RELATIVE_STRENGTH_THRESHOLD_PCT = 5.0;

    private static final double RSI_OVERSOLD = 30.0;
    private static final double RSI_OVERBOUGHT = 70.0;
    private static final double NEUTRAL_NEWS_SCORE = 50.0;
    private static final double FLAT_RELATIVE_STRENGTH_SCORE = 25.0;

    private final ScoringWeights weights;

    public ScoringEngine() {
        this(ScoringWeights.DEFAULT);
    }

    public ScoringEngine(ScoringWeights weights) {
        if (weights == null) {
            throw new IllegalArgumentException("scoring weights are required");
        }
        this.weights = weights;
    }

    /**
     * RSI extremes on either side score above the neutral band; a missing RSI scores 0.
     * <ul>
     *   <li>RSI &lt; 30: {@code 50 + (30 - rsi) / 30 * 50}, in (50, 100]</li>
     *   <li>RSI &gt; 70: {@code 50 + (rsi - 70) / 30 * 50}, in (50, 100]</li>
     *   <li>otherwise: {@code 25 + (rsi - 30) / 40 * 25}, in [25, 50]</li>
     * </ul>
     * The oversold branch is offset by 50 so it mirrors the overbought one.
     */
    public double momentumScore(double rsi) {
        if (!Double.isFinite(rsi)) {
            return 0.0;
        }
        double score;
        if (rsi < RSI_OVERSOLD) {
            score = 50.0 + (RSI_OVERSOLD - rsi) / 30.0 * 50.0;
        } else if (rsi > RSI_OVERBOUGHT) {
            score = (rsi - RSI_OVERBOUGHT) / 30.0 * 50.0 + 50.0;
        } else {
            score = 25.0 + (rsi - RSI_OVERSOLD) / 40.0 * 25.0;
        }
        return clamp(score, 0.0, 100.0);
    }

    public double volumeSurgeScore(double currentVolume, double averageVolume) {
        return volumeSurgeScore(currentVolume, averageVolume, DEFAULT_VOLUME_SURGE_THRESHOLD_PCT);
    }

    /**
     * Scores only volume above {@code thresholdPct} percent of the average.
     */
    public double volumeSurgeScore(double currentVolume, double averageVolume, double thresholdPct) {
        if (averageVolume == 0.0 || !Double.isFinite(averageVolume) || thresholdPct <= 0.0) {
            return 0.0;
        }
        double ratio = currentVolume / averageVolume * 100.0;
        if (ratio < thresholdPct) {
            return 0.0;
        }
        double score = (ratio - thresholdPct) / (thresholdPct * 2.0) * 100.0;
        return clamp(score, 0.0, 100.0);
    }

    public double relativeStrengthScore(double stockPctChange, double sectorPctChange) {
        return relativeStrengthScore(stockPctChange, sectorPctChange, DEFAULT_RELATIVE_STRENGTH_THRESHOLD_PCT);
    }

    public double relativeStrengthScore(double stockPctChange, double sectorPctChange, double minThreshold) {
        double diff = stockPctChange - sectorPctChange;
        if (diff < -minThreshold) {
            return 0.0;
        }
        if (diff < minThreshold) {
            return FLAT_RELATIVE_STRENGTH_SCORE;
        }
        if (minThreshold <= 0.0) {
            return 100.0;
        }
        double score = FLAT_RELATIVE_STRENGTH_SCORE + (diff - minThreshold) / minThreshold * 75.0;
        return clamp(score, 0.0, 100.0);
    }

    /**
     * Share of positive items; no news at all is neutral (50).
     */
    public double newsSentimentScore(int positiveCount, int totalCount) {
        if (totalCount <= 0) {
            return NEUTRAL_NEWS_SCORE;
        }
        double ratio = (double) Math.max(0, positiveCount) / totalCount;
        return clamp(ratio * 100.0, 0.0, 100.0);
    }

    public double catalystScore(List<CatalystEvent> events) {
        if (events == null || events.isEmpty()) {
            return 0.0;
        }
        double total = 0.0;
        for (CatalystEvent event : events) {
            if (event.daysAgo <= 7) {
                total += 100.0;
            } else if (event.daysAgo <= 30) {
                total += 50.0;
            }
        }
        return Math.min(100.0, total / events.size());
    }

    public double compositeScore(
            double momentum,
            double volumeSurge,
            double relativeStrength,
            double newsSentiment,
            double catalyst
    ) {
        double composite = momentum * weights.momentum
                + volumeSurge * weights.volumeSurge
                + relativeStrength * weights.relativeStrength
                + newsSentiment * weights.newsSentiment
                + catalyst * weights.catalyst;
        return clamp(composite, 0.0, 100.0);
    }

    static double clamp(double value, double min, double max) {
        if (value < min) {
            return min;
        }
        if (value > max) {
            return max;
        }
        return value;
    }
}
