package com.stocktracker.kr.model;

import java.util.Locale;
import java.util.Optional;

public enum AdjustmentUrgency {
    LOW,
    MEDIUM,
    HIGH;

    public static Optional<AdjustmentUrgency> parse(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        switch (value) {
            case "low":
            case "낮음":
                return Optional.of(LOW);
            case "medium":
            case "중간":
                return Optional.of(MEDIUM);
            case "high":
            case "높음":
                return Optional.of(HIGH);
            default:
                return Optional.empty();
        }
    }
}
