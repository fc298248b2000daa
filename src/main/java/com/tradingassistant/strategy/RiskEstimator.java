package com.tradingassistant.strategy;

/**
 * Maps volatility, as ATR relative to price, onto a 0-100 risk scale.
 */
public final class RiskEstimator {
    private static final double LOW_RISK = 20.0;
    private static final double HIGH_RISK = 80.0;
    private static final double LOW_ATR_PCT = 1.0;
    private static final double HIGH_ATR_PCT = 5.0;

    public double riskScore(double atr, double price) {
        double atrPct = atrPct(atr, price);
        double risk;
        if (atrPct < LOW_ATR_PCT) {
            risk = LOW_RISK;
        } else if (atrPct > HIGH_ATR_PCT) {
            risk = HIGH_RISK;
        } else {
            risk = LOW_RISK + (atrPct / HIGH_ATR_PCT) * (HIGH_RISK - LOW_RISK);
        }
        return ScoringEngine.clamp(risk, 0.0, 100.0);
    }

    /**
     * ATR as a percent of price; 0 when price is not positive.
     */
    public double atrPct(double atr, double price) {
        if (!(price > 0.0) || !Double.isFinite(atr)) {
            return 0.0;
        }
        return atr / price * 100.0;
    }
}
