package com.tradingassistant.runner;

import com.tradingassistant.model.FilterDecision;
import com.tradingassistant.model.Signal;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything one pipeline run produced, stage by stage.
 */
public final class PipelineResult {
    public final List<FilterDecision> filterDecisions;
    public final List<String> eligibleTickers;
    public final List<Signal> scoredSignals;
    public final List<Signal> rankedSignals;

    public PipelineResult(
            List<FilterDecision> filterDecisions,
            List<String> eligibleTickers,
            List<Signal> scoredSignals,
            List<Signal> rankedSignals
    ) {
        this.filterDecisions = filterDecisions == null ? List.of() : List.copyOf(filterDecisions);
        this.eligibleTickers = eligibleTickers == null ? List.of() : List.copyOf(eligibleTickers);
        this.scoredSignals = scoredSignals == null ? List.of() : List.copyOf(scoredSignals);
        this.rankedSignals = rankedSignals == null ? List.of() : List.copyOf(rankedSignals);
    }

    public List<FilterDecision> rejected() {
        List<FilterDecision> out = new ArrayList<>();
        for (FilterDecision decision : filterDecisions) {
            if (!decision.passed) {
                out.add(decision);
            }
        }
        return out;
    }
}
