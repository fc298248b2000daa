package com.tradingassistant.model;

public final class FundamentalRecord {
    /** Stand-in for a ticker with no fundamentals; fails the market-cap floor. */
    public static final FundamentalRecord MISSING = new FundamentalRecord("", 0.0, 0.0, Double.NaN);

    public final String ticker;
    public final double marketCapMillions;
    public final double floatMillions;
    public final double peRatio;

    public FundamentalRecord(String ticker, double marketCapMillions, double floatMillions, double peRatio) {
        this.ticker = ticker == null ? "" : ticker.trim();
        this.marketCapMillions = nonNegative(marketCapMillions);
        this.floatMillions = nonNegative(floatMillions);
        this.peRatio = peRatio;
    }

    private static double nonNegative(double value) {
        return Double.isFinite(value) ? Math.max(0.0, value) : 0.0;
    }
}
