package com.tradingassistant.data;

import com.tradingassistant.model.FundamentalRecord;
import com.tradingassistant.model.MarketObservation;
import com.tradingassistant.model.MarketSnapshot;
import com.tradingassistant.model.NewsItem;
import com.tradingassistant.model.SectorQuote;
import com.tradingassistant.model.Sentiment;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Reads a market snapshot document:
 * <pre>
 * {
 *   "asOf": "2026-01-02T21:00:00Z",
 *   "prices":       { "XYZ": { "price": 20, "volume": 2000000, "volume_20day_avg": 1000000,
 *                               "rsi": 25, "atr": 0.4, "pct_change": 6.0 } },
 *   "news":         { "XYZ": [ { "headline": "...", "sentiment": "Positive", "source": "...", "timestamp": "..." } ] },
 *   "fundamentals": { "XYZ": { "market_cap_millions": 500, "float_millions": 50, "pe_ratio": 18.5 } },
 *   "sectors":      { "XLK": { "pct_change": -1.0 } }
 * }
 * </pre>
 * Keys are visited in sorted order so repeated loads produce the same ticker order.
 */
public final class JsonSnapshotSource implements MarketDataSource {
    private static final Logger LOG = LogManager.getLogger(JsonSnapshotSource.class);

    private final Path file;

    public JsonSnapshotSource(Path file) {
        this.file = file;
    }

    @Override
    public MarketSnapshot fetch() throws IOException {
        if (!Files.exists(file)) {
            throw new IOException("market snapshot not found: " + file);
        }
        String body = Files.readString(file, StandardCharsets.UTF_8);
        try {
            MarketSnapshot snapshot = parse(body);
            LOG.info("Loaded snapshot {} prices={} news={} fundamentals={} sectors={}",
                    file.getFileName(),
                    snapshot.prices.size(),
                    snapshot.newsItemCount(),
                    snapshot.fundamentals.size(),
                    snapshot.sectors.size());
            return snapshot;
        } catch (JSONException e) {
            throw new IOException("malformed market snapshot " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "json:" + file;
    }

    public static MarketSnapshot parse(String body) {
        JSONObject root = new JSONObject(body);
        Instant asOf = parseInstant(root.optString("asOf", null));
        return new MarketSnapshot(
                asOf,
                parsePrices(root.optJSONObject("prices")),
                parseNews(root.optJSONObject("news")),
                parseFundamentals(root.optJSONObject("fundamentals")),
                parseSectors(root.optJSONObject("sectors"))
        );
    }

    private static Map<String, MarketObservation> parsePrices(JSONObject prices) {
        if (prices == null) {
            return null;
        }
        Map<String, MarketObservation> out = new LinkedHashMap<>();
        for (String ticker : new TreeSet<>(prices.keySet())) {
            JSONObject p = prices.optJSONObject(ticker);
            if (p == null) {
                LOG.warn("Skipping price entry ticker={}: not an object", ticker);
                continue;
            }
            out.put(ticker, new MarketObservation(
                    ticker,
                    p.optDouble("price", 0.0),
                    p.optLong("volume", 0L),
                    p.optLong("volume_20day_avg", 0L),
                    p.optDouble("rsi", Double.NaN),
                    p.optDouble("atr", 0.0),
                    p.optDouble("pct_change", 0.0)
            ));
        }
        return out;
    }

    private static Map<String, List<NewsItem>> parseNews(JSONObject news) {
        if (news == null) {
            return null;
        }
        Map<String, List<NewsItem>> out = new LinkedHashMap<>();
        for (String ticker : new TreeSet<>(news.keySet())) {
            JSONArray arr = news.optJSONArray(ticker);
            List<NewsItem> items = new ArrayList<>();
            if (arr != null) {
                for (int i = 0; i < arr.length(); i++) {
                    JSONObject n = arr.optJSONObject(i);
                    if (n == null) {
                        continue;
                    }
                    items.add(new NewsItem(
                            ticker,
                            n.optString("headline", ""),
                            Sentiment.parse(n.optString("sentiment", null)),
                            n.optString("source", ""),
                            parseInstant(n.optString("timestamp", null))
                    ));
                }
            }
            out.put(ticker, items);
        }
        return out;
    }

    private static Map<String, FundamentalRecord> parseFundamentals(JSONObject fundamentals) {
        if (fundamentals == null) {
            return null;
        }
        Map<String, FundamentalRecord> out = new LinkedHashMap<>();
        for (String ticker : new TreeSet<>(fundamentals.keySet())) {
            JSONObject f = fundamentals.optJSONObject(ticker);
            if (f == null) {
                continue;
            }
            out.put(ticker, new FundamentalRecord(
                    ticker,
                    f.optDouble("market_cap_millions", 0.0),
                    f.optDouble("float_millions", 0.0),
                    f.optDouble("pe_ratio", Double.NaN)
            ));
        }
        return out;
    }

    private static Map<String, SectorQuote> parseSectors(JSONObject sectors) {
        if (sectors == null) {
            return null;
        }
        Map<String, SectorQuote> out = new LinkedHashMap<>();
        for (String symbol : new TreeSet<>(sectors.keySet())) {
            JSONObject s = sectors.optJSONObject(symbol);
            if (s == null) {
                continue;
            }
            out.put(symbol, new SectorQuote(symbol, s.optDouble("pct_change", 0.0)));
        }
        return out;
    }

    private static Instant parseInstant(String raw) {
        if (raw == null || raw.trim().isEmpty()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim());
        } catch (DateTimeParseException e) {
            LOG.debug("Unparseable timestamp '{}'", raw);
            return null;
        }
    }
}
