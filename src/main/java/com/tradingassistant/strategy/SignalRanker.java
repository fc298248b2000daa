package com.tradingassistant.strategy;

import com.tradingassistant.config.PipelineSettings;
import com.tradingassistant.model.Signal;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Orders signals by composite score, then applies the score floor, the risk
 * ceiling and the per-run cap.
 */
public final class SignalRanker {
    private static final Comparator<Signal> BY_COMPOSITE_DESC =
            Comparator.comparingDouble((Signal s) -> s.compositeScore).reversed();

    private final PipelineSettings settings;

    public SignalRanker(PipelineSettings settings) {
        this.settings = settings;
    }

    public List<Signal> rank(List<Signal> signals) {
        if (signals == null || signals.isEmpty()) {
            return List.of();
        }
        // List.sort is stable: equal composites keep their input order.
        List<Signal> ranked = new ArrayList<>(signals);
        ranked.sort(BY_COMPOSITE_DESC);

        List<Signal> out = new ArrayList<>();
        for (Signal signal : ranked) {
            if (out.size() >= settings.maxSignalsPerRun) {
                break;
            }
            if (signal.compositeScore >= settings.minCompositeScore
                    && signal.riskScore <= settings.maxAcceptableRiskScore) {
                out.add(signal);
            }
        }
        return List.copyOf(out);
    }
}
