package com.tradingassistant.model;

import java.util.Locale;

public enum Sentiment {
    POSITIVE,
    NEUTRAL,
    NEGATIVE;

    /**
     * Lenient parse; anything unrecognized is {@link #NEUTRAL}.
     */
    public static Sentiment parse(String raw) {
        if (raw == null) {
            return NEUTRAL;
        }
        switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "POSITIVE":
            case "BULLISH":
                return POSITIVE;
            case "NEGATIVE":
            case "BEARISH":
                return NEGATIVE;
            default:
                return NEUTRAL;
        }
    }
}
