package com.tradingassistant.model;

/**
 * One symbol's price/volume observation for the current session.
 */
public final class MarketObservation {
    public final String ticker;
    public final double price;
    public final long volume;
    public final long averageVolume20Day; // 0 = unknown
    public final double rsi;              // NaN = absent
    public final double atr;
    public final double percentChangeToday;

    public MarketObservation(
            String ticker,
            double price,
            long volume,
            long averageVolume20Day,
            double rsi,
            double atr,
            double percentChangeToday
    ) {
        if (ticker == null || ticker.trim().isEmpty()) {
            throw new IllegalArgumentException("observation ticker is required");
        }
        this.ticker = ticker.trim();
        this.price = price;
        this.volume = Math.max(0L, volume);
        this.averageVolume20Day = Math.max(0L, averageVolume20Day);
        this.rsi = rsi;
        this.atr = Double.isFinite(atr) ? Math.max(0.0, atr) : 0.0;
        this.percentChangeToday = Double.isFinite(percentChangeToday) ? percentChangeToday : 0.0;
    }

    public boolean hasRsi() {
        return Double.isFinite(rsi);
    }
}
