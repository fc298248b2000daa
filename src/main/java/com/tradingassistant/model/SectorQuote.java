package com.tradingassistant.model;

public final class SectorQuote {
    public final String sectorSymbol;
    public final double percentChangeToday;

    public SectorQuote(String sectorSymbol, double percentChangeToday) {
        this.sectorSymbol = sectorSymbol == null ? "" : sectorSymbol.trim();
        this.percentChangeToday = Double.isFinite(percentChangeToday) ? percentChangeToday : 0.0;
    }
}
