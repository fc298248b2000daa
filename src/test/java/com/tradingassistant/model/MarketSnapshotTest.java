package com.tradingassistant.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MarketSnapshotTest {

    @Test
    void constructor_shouldRejectMissingMapping() {
        IllegalArgumentException e = assertThrows(
                IllegalArgumentException.class,
                () -> new MarketSnapshot(Instant.EPOCH, Map.of(), null, Map.of(), Map.of())
        );
        assertEquals("market snapshot is missing required mapping: news", e.getMessage());
    }

    @Test
    void constructor_shouldTrimKeysToObservationTicker() {
        MarketSnapshot snapshot = new MarketSnapshot(
                Instant.EPOCH,
                Map.of(" XYZ ", observation(" XYZ")),
                Map.of(),
                Map.of("XYZ ", new FundamentalRecord("XYZ", 500, 50, 20)),
                Map.of(" XLK", new SectorQuote("XLK", -1.0))
        );
        assertTrue(snapshot.prices.containsKey("XYZ"));
        assertEquals(500.0, snapshot.fundamentalsFor("XYZ").marketCapMillions);
        assertTrue(snapshot.sectors.containsKey("XLK"));
    }

    @Test
    void constructor_shouldRejectPriceKeyThatDiffersFromTicker() {
        assertThrows(IllegalArgumentException.class, () -> new MarketSnapshot(
                Instant.EPOCH, Map.of("ABC", observation("XYZ")), Map.of(), Map.of(), Map.of()));
    }

    @Test
    void constructor_shouldRejectKeysThatCollideAfterTrimming() {
        Map<String, FundamentalRecord> fundamentals = new LinkedHashMap<>();
        fundamentals.put("XYZ", new FundamentalRecord("XYZ", 500, 50, 20));
        fundamentals.put(" XYZ", new FundamentalRecord("XYZ", 900, 50, 20));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> new MarketSnapshot(
                Instant.EPOCH, Map.of(), Map.of(), fundamentals, Map.of()));
        assertTrue(e.getMessage().contains("duplicate key 'XYZ'"));
    }

    @Test
    void lookups_shouldDefaultForUnknownTicker() {
        MarketSnapshot snapshot = new MarketSnapshot(null, Map.of(), Map.of(), Map.of(), Map.of());
        assertTrue(snapshot.newsFor("XYZ").isEmpty());
        assertSame(FundamentalRecord.MISSING, snapshot.fundamentalsFor("XYZ"));
        assertEquals(Instant.EPOCH, snapshot.asOf);
    }

    @Test
    void observation_shouldRequireTicker() {
        assertThrows(IllegalArgumentException.class,
                () -> new MarketObservation(" ", 1.0, 1L, 1L, 50.0, 0.1, 0.0));
    }

    private static MarketObservation observation(String ticker) {
        return new MarketObservation(ticker, 20.0, 2_000_000L, 1_000_000L, 25.0, 0.4, 6.0);
    }

    @Test
    void sentimentParse_shouldBeLenient() {
        assertEquals(Sentiment.POSITIVE, Sentiment.parse("Positive"));
        assertEquals(Sentiment.POSITIVE, Sentiment.parse("bullish"));
        assertEquals(Sentiment.NEGATIVE, Sentiment.parse(" NEGATIVE "));
        assertEquals(Sentiment.NEUTRAL, Sentiment.parse("unknown"));
        assertEquals(Sentiment.NEUTRAL, Sentiment.parse(null));
    }
}
