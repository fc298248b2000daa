package com.tradingassistant.config;

import com.tradingassistant.strategy.ScoringWeights;
import com.tradingassistant.strategy.SectorMap;
import lombok.Builder;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Every threshold and weight a pipeline run reads, resolved and validated once
 * before the run starts. Immutable.
 */
public final class PipelineSettings {
    public final double minPrice;
    public final double maxPrice;
    public final double minAvgVolume;
    public final double minMarketCapMillions;
    public final double maxFloatMillions;

    public final double minCompositeScore;
    public final double maxAcceptableRiskScore;
    public final int maxSignalsPerRun;

    public final double volumeSurgeThresholdPct;
    public final double relativeStrengthThresholdPct;
    public final List<String> catalystKeywords;

    public final ScoringWeights weights;
    public final String defaultSector;
    public final Map<String, String> sectorOverrides;
    public final int threads;

    @Builder(toBuilder = true)
    public PipelineSettings(
            double minPrice,
            double maxPrice,
            double minAvgVolume,
            double minMarketCapMillions,
            double maxFloatMillions,
            double minCompositeScore,
            double maxAcceptableRiskScore,
            int maxSignalsPerRun,
            double volumeSurgeThresholdPct,
            double relativeStrengthThresholdPct,
            List<String> catalystKeywords,
            ScoringWeights weights,
            String defaultSector,
            Map<String, String> sectorOverrides,
            int threads
    ) {
        if (minPrice > maxPrice) {
            throw new IllegalArgumentException("filters.minPrice (" + minPrice + ") exceeds filters.maxPrice (" + maxPrice + ")");
        }
        if (maxSignalsPerRun < 0) {
            throw new IllegalArgumentException("signals.maxSignalsPerRun must be >= 0: " + maxSignalsPerRun);
        }
        if (volumeSurgeThresholdPct <= 0.0) {
            throw new IllegalArgumentException("signals.volumeSurgeThresholdPct must be > 0: " + volumeSurgeThresholdPct);
        }
        if (relativeStrengthThresholdPct < 0.0) {
            throw new IllegalArgumentException("signals.relativeStrengthThresholdPct must be >= 0: " + relativeStrengthThresholdPct);
        }
        if (threads < 1) {
            throw new IllegalArgumentException("pipeline.threads must be >= 1: " + threads);
        }
        if (weights == null) {
            throw new IllegalArgumentException("composite weights are required");
        }
        this.minPrice = minPrice;
        this.maxPrice = maxPrice;
        this.minAvgVolume = minAvgVolume;
        this.minMarketCapMillions = minMarketCapMillions;
        this.maxFloatMillions = maxFloatMillions;
        this.minCompositeScore = minCompositeScore;
        this.maxAcceptableRiskScore = maxAcceptableRiskScore;
        this.maxSignalsPerRun = maxSignalsPerRun;
        this.volumeSurgeThresholdPct = volumeSurgeThresholdPct;
        this.relativeStrengthThresholdPct = relativeStrengthThresholdPct;
        this.catalystKeywords = catalystKeywords == null ? List.of() : List.copyOf(catalystKeywords);
        this.weights = weights;
        this.defaultSector = defaultSector == null || defaultSector.isBlank() ? SectorMap.DEFAULT_SECTOR : defaultSector.trim();
        this.sectorOverrides = sectorOverrides == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(sectorOverrides));
        this.threads = threads;
    }

    public static PipelineSettings from(Config config) {
        ScoringWeights weights = new ScoringWeights(
                config.requireDouble("weights.momentum"),
                config.requireDouble("weights.volumeSurge"),
                config.requireDouble("weights.relativeStrength"),
                config.requireDouble("weights.newsSentiment"),
                config.requireDouble("weights.catalyst")
        );
        return new PipelineSettings(
                config.requireDouble("filters.minPrice"),
                config.requireDouble("filters.maxPrice"),
                config.requireDouble("filters.minAvgVolume"),
                config.requireDouble("filters.minMarketCapMillions"),
                config.requireDouble("filters.maxFloatMillions"),
                config.requireDouble("signals.minCompositeScore"),
                config.requireDouble("signals.maxAcceptableRiskScore"),
                config.requireInt("signals.maxSignalsPerRun"),
                config.requireDouble("signals.volumeSurgeThresholdPct"),
                config.requireDouble("signals.relativeStrengthThresholdPct"),
                config.getList("signals.catalystKeywords"),
                weights,
                config.getString("sector.default", SectorMap.DEFAULT_SECTOR),
                SectorMap.parsePairs(config.getList("sector.overrides")),
                config.requireInt("pipeline.threads")
        );
    }

    public static PipelineSettings defaults() {
        return from(Config.fromConfigurationProperties(Path.of("."), Map.of()));
    }

    /**
     * Flattened view for reports, keyed by configuration name.
     */
    public Map<String, Object> describe() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("filters.minPrice", minPrice);
        out.put("filters.maxPrice", maxPrice);
        out.put("filters.minAvgVolume", minAvgVolume);
        out.put("filters.minMarketCapMillions", minMarketCapMillions);
        out.put("filters.maxFloatMillions", maxFloatMillions);
        out.put("signals.minCompositeScore", minCompositeScore);
        out.put("signals.maxAcceptableRiskScore", maxAcceptableRiskScore);
        out.put("signals.maxSignalsPerRun", maxSignalsPerRun);
        out.put("signals.volumeSurgeThresholdPct", volumeSurgeThresholdPct);
        out.put("signals.relativeStrengthThresholdPct", relativeStrengthThresholdPct);
        out.put("signals.catalystKeywords", String.join(",", catalystKeywords));
        for (Map.Entry<String, Double> e : weights.asMap().entrySet()) {
            out.put("weights." + e.getKey(), e.getValue());
        }
        out.put("sector.default", defaultSector);
        out.put("pipeline.threads", threads);
        return out;
    }
}
