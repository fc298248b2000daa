package com.tradingassistant.strategy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Static lookup from ticker to the sector ETF it is benchmarked against.
 */
public final class SectorMap {
    public static final String DEFAULT_SECTOR = "XLK";

    private final Map<String, String> sectorByTicker;
    private final String defaultSector;

    public SectorMap() {
        this(Map.of(), DEFAULT_SECTOR);
    }

    /**
     * @param overrides entries layered over the built-in map; keys and values are normalized to upper case
     * @param defaultSector sector returned for unmapped tickers; blank means {@link #DEFAULT_SECTOR}
     */
    public SectorMap(Map<String, String> overrides, String defaultSector) {
        Map<String, String> map = new LinkedHashMap<>();
        seedDefaults(map);
        if (overrides != null) {
            for (Map.Entry<String, String> e : overrides.entrySet()) {
                String ticker = normalize(e.getKey());
                String sector = normalize(e.getValue());
                if (!ticker.isEmpty() && !sector.isEmpty()) {
                    map.put(ticker, sector);
                }
            }
        }
        this.sectorByTicker = Collections.unmodifiableMap(map);
        String fallback = normalize(defaultSector);
        this.defaultSector = fallback.isEmpty() ? DEFAULT_SECTOR : fallback;
    }

    public String sectorOf(String ticker) {
        String sector = sectorByTicker.get(normalize(ticker));
        return sector == null ? defaultSector : sector;
    }

    public boolean isMapped(String ticker) {
        return sectorByTicker.containsKey(normalize(ticker));
    }

    public String defaultSector() {
        return defaultSector;
    }

    /**
     * Parses {@code "AMD:XLK, KO:XLP"} style pairs. Malformed pairs are rejected.
     */
    public static Map<String, String> parsePairs(Iterable<String> pairs) {
        Map<String, String> out = new LinkedHashMap<>();
        if (pairs == null) {
            return out;
        }
        for (String pair : pairs) {
            if (pair == null || pair.trim().isEmpty()) {
                continue;
            }
            int idx = pair.indexOf(':');
            if (idx <= 0 || idx == pair.length() - 1) {
                throw new IllegalArgumentException("invalid sector override, expected TICKER:SECTOR but got: " + pair.trim());
            }
            out.put(normalize(pair.substring(0, idx)), normalize(pair.substring(idx + 1)));
        }
        return out;
    }

    private static void seedDefaults(Map<String, String> map) {
        map.put("AAPL", "XLK");
        map.put("MSFT", "XLK");
        map.put("GOOGL", "XLK");
        map.put("JPM", "XLF");
        map.put("BAC", "XLF");
        map.put("XOM", "XLE");
        map.put("CVX", "XLE");
        map.put("JNJ", "XLV");
        map.put("PFE", "XLV");
    }

    private static String normalize(String value) {
        if (value == null) {
            return "";
        }
        return value.trim().toUpperCase(Locale.ROOT);
    }
}
