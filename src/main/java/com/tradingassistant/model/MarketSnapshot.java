package com.tradingassistant.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All inputs for one pipeline run. Iteration order of every map is the order
 * supplied by the caller.
 */
public final class MarketSnapshot {
    public final Instant asOf;
    public final Map<String, MarketObservation> prices;
    public final Map<String, List<NewsItem>> news;
    public final Map<String, FundamentalRecord> fundamentals;
    public final Map<String, SectorQuote> sectors;

    /**
     * Ticker and sector keys are trimmed, so every map is addressed by the same
     * identity as {@link MarketObservation#ticker}.
     *
     * @throws IllegalArgumentException when a mapping is missing, two keys trim to the same value,
     *                                  or a price key does not match its observation's ticker
     */
    public MarketSnapshot(
            Instant asOf,
            Map<String, MarketObservation> prices,
            Map<String, List<NewsItem>> news,
            Map<String, FundamentalRecord> fundamentals,
            Map<String, SectorQuote> sectors
    ) {
        this.asOf = asOf == null ? Instant.EPOCH : asOf;
        Map<String, MarketObservation> priceCopy = normalizeKeys(require(prices, "prices"), "prices");
        for (Map.Entry<String, MarketObservation> e : priceCopy.entrySet()) {
            if (!e.getKey().equals(e.getValue().ticker)) {
                throw new IllegalArgumentException(
                        "price key '" + e.getKey() + "' does not match observation ticker '" + e.getValue().ticker + "'");
            }
        }
        this.prices = Collections.unmodifiableMap(priceCopy);
        this.fundamentals = Collections.unmodifiableMap(normalizeKeys(require(fundamentals, "fundamentals"), "fundamentals"));
        this.sectors = Collections.unmodifiableMap(normalizeKeys(require(sectors, "sectors"), "sectors"));

        Map<String, List<NewsItem>> newsCopy = new LinkedHashMap<>();
        for (Map.Entry<String, List<NewsItem>> e : normalizeKeys(require(news, "news"), "news").entrySet()) {
            List<NewsItem> items = e.getValue() == null ? List.of() : e.getValue();
            newsCopy.put(e.getKey(), Collections.unmodifiableList(new ArrayList<>(items)));
        }
        this.news = Collections.unmodifiableMap(newsCopy);
    }

    public List<NewsItem> newsFor(String ticker) {
        return news.getOrDefault(ticker, List.of());
    }

    public FundamentalRecord fundamentalsFor(String ticker) {
        return fundamentals.getOrDefault(ticker, FundamentalRecord.MISSING);
    }

    public int newsItemCount() {
        int total = 0;
        for (List<NewsItem> items : news.values()) {
            total += items.size();
        }
        return total;
    }

    private static <V> Map<String, V> normalizeKeys(Map<String, V> map, String name) {
        Map<String, V> out = new LinkedHashMap<>();
        for (Map.Entry<String, V> e : map.entrySet()) {
            String key = e.getKey() == null ? "" : e.getKey().trim();
            if (key.isEmpty()) {
                throw new IllegalArgumentException("market snapshot has a blank key in mapping: " + name);
            }
            if (e.getValue() == null) {
                continue;
            }
            if (out.putIfAbsent(key, e.getValue()) != null) {
                throw new IllegalArgumentException("market snapshot has duplicate key '" + key + "' in mapping: " + name);
            }
        }
        return out;
    }

    private static <K, V> Map<K, V> require(Map<K, V> map, String name) {
        if (map == null) {
            throw new IllegalArgumentException("market snapshot is missing required mapping: " + name);
        }
        return map;
    }
}
