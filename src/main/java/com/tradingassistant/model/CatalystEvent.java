package com.tradingassistant.model;

public final class CatalystEvent {
    public final String name;
    public final int daysAgo;

    public CatalystEvent(String name, int daysAgo) {
        this.name = name == null ? "" : name;
        this.daysAgo = Math.max(0, daysAgo);
    }

    public static CatalystEvent recent(String name) {
        return new CatalystEvent(name, 0);
    }
}
