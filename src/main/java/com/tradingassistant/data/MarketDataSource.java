package com.tradingassistant.data;

import com.tradingassistant.model.MarketSnapshot;

import java.io.IOException;

/**
 * Supplies one run's worth of already-fetched market data.
 */
public interface MarketDataSource {

    MarketSnapshot fetch() throws IOException;

    String describe();
}
