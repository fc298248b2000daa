package com.tradingassistant.model;

import java.time.Instant;

public final class NewsItem {
    public final String ticker;
    public final String headline;
    public final Sentiment sentiment;
    public final String source;
    public final Instant publishedAt;

    public NewsItem(String ticker, String headline, Sentiment sentiment, String source, Instant publishedAt) {
        this.ticker = ticker == null ? "" : ticker.trim();
        this.headline = headline == null ? "" : headline;
        this.sentiment = sentiment == null ? Sentiment.NEUTRAL : sentiment;
        this.source = source == null ? "" : source;
        this.publishedAt = publishedAt;
    }

    public boolean isPositive() {
        return sentiment == Sentiment.POSITIVE;
    }
}
