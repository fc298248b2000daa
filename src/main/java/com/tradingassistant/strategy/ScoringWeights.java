package com.tradingassistant.strategy;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed composite weights. All five are non-negative and sum to 1.0.
 */
public final class ScoringWeights {
    private static final double SUM_TOLERANCE = 1e-6;

    public static final ScoringWeights DEFAULT = new ScoringWeights(0.25, 0.20, 0.20, 0.20, 0.15);

    public final double momentum;
    public final double volumeSurge;
    public final double relativeStrength;
    public final double newsSentiment;
    public final double catalyst;

    public ScoringWeights(
            double momentum,
            double volumeSurge,
            double relativeStrength,
            double newsSentiment,
            double catalyst
    ) {
        check("momentum", momentum);
        check("volumeSurge", volumeSurge);
        check("relativeStrength", relativeStrength);
        check("newsSentiment", newsSentiment);
        check("catalyst", catalyst);
        double sum = momentum + volumeSurge + relativeStrength + newsSentiment + catalyst;
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new IllegalArgumentException(String.format(
                    Locale.US,
                    "composite weights must sum to 1.0 but sum to %.6f",
                    sum
            ));
        }
        this.momentum = momentum;
        this.volumeSurge = volumeSurge;
        this.relativeStrength = relativeStrength;
        this.newsSentiment = newsSentiment;
        this.catalyst = catalyst;
    }

    public Map<String, Double> asMap() {
        Map<String, Double> out = new LinkedHashMap<>();
        out.put("momentum", momentum);
        out.put("volumeSurge", volumeSurge);
        out.put("relativeStrength", relativeStrength);
        out.put("newsSentiment", newsSentiment);
        out.put("catalyst", catalyst);
        return out;
    }

    private static void check(String name, double weight) {
        if (!Double.isFinite(weight) || weight < 0.0) {
            throw new IllegalArgumentException("composite weight " + name + " must be a non-negative number: " + weight);
        }
    }
}
