package com.tradingassistant.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Outcome of the screening stage for one ticker, with the names of every
 * predicate it failed and the values they were checked against.
 */
public final class FilterDecision {
    public final String ticker;
    public final boolean passed;
    public final List<String> reasons;
    public final Map<String, Object> metrics;

    public FilterDecision(String ticker, boolean passed, List<String> reasons, Map<String, Object> metrics) {
        this.ticker = ticker;
        this.passed = passed;
        this.reasons = reasons == null ? List.of() : Collections.unmodifiableList(reasons);
        this.metrics = metrics == null ? Map.of() : Collections.unmodifiableMap(metrics);
    }
}
