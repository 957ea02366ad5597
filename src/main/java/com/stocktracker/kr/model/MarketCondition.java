package com.stocktracker.kr.model;

import java.util.Locale;

public enum MarketCondition {
    BULL,
    NEUTRAL,
    BEAR;

    public static MarketCondition fromText(String raw) {
        String value = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT);
        for (MarketCondition condition : values()) {
            if (condition.name().equals(value)) {
                return condition;
            }
        }
        return NEUTRAL;
    }
}
