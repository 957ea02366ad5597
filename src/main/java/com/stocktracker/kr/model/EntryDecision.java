package com.stocktracker.kr.model;

import java.util.Locale;

public enum EntryDecision {
    ENTER,
    SKIP;

    /**
     * Analyst wording ("진입", "enter", "buy") maps to ENTER; anything else ("관망", "watch", blank) to SKIP.
     */
    public static EntryDecision fromText(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        if (value.equals("enter") || value.equals("진입") || value.equals("buy")) {
            return ENTER;
        }
        return SKIP;
    }
}
