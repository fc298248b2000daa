package com.tradingassistant.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * A scored trading candidate. Scores are on a 0-100 scale and rounded to two
 * decimals; price, ATR, RSI and percent change are echoed for reports.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Signal {
    public final String ticker;
    public final String sector;
    public final double momentumScore;
    public final double volumeSurgeScore;
    public final double relativeStrengthScore;
    public final double newsSentimentScore;
    public final double catalystScore;
    public final double compositeScore;
    public final double riskScore;
    public final double price;
    public final double atr;
    public final double rsi;
    public final double percentChangeToday;
}
