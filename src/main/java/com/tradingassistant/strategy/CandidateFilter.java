package com.tradingassistant.strategy;

import com.tradingassistant.config.PipelineSettings;
import com.tradingassistant.model.FilterDecision;
import com.tradingassistant.model.FundamentalRecord;
import com.tradingassistant.model.MarketObservation;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural screen on price, volume, market cap and float. Every rule is
 * evaluated so the decision lists all reasons a ticker was rejected.
 */
public final class CandidateFilter {
    private final PipelineSettings settings;

    public CandidateFilter(PipelineSettings settings) {
        this.settings = settings;
    }

    /**
     * @param fundamentals {@code null} when the ticker has no fundamentals; treated as zero cap and float
     */
    public FilterDecision evaluate(MarketObservation obs, FundamentalRecord fundamentals) {
        List<String> reasons = new ArrayList<>();
        Map<String, Object> metrics = new LinkedHashMap<>();

        FundamentalRecord fund = fundamentals == null ? FundamentalRecord.MISSING : fundamentals;
        boolean passed = true;

        // NaN fails the range.
        if (!(obs.price >= settings.minPrice && obs.price <= settings.maxPrice)) {
            passed = false;
            reasons.add("price_out_of_range");
        }
        if (obs.volume < settings.minAvgVolume) {
            passed = false;
            reasons.add("volume_too_low");
        }
        if (fundamentals == null) {
            reasons.add("fundamentals_missing");
        }
        if (fund.marketCapMillions < settings.minMarketCapMillions) {
            passed = false;
            reasons.add("market_cap_too_low");
        }
        if (fund.floatMillions > settings.maxFloatMillions) {
            passed = false;
            reasons.add("float_too_high");
        }

        metrics.put("price", obs.price);
        metrics.put("volume", obs.volume);
        metrics.put("market_cap_millions", fund.marketCapMillions);
        metrics.put("float_millions", fund.floatMillions);

        return new FilterDecision(obs.ticker, passed, reasons, metrics);
    }
}
