package com.stocktracker.kr.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Close conditions a judgment can report. Declaration order is precedence order.
 */
public enum SellSignal {
    STOP_LOSS,
    TARGET_REACHED,
    SELL_TRIGGER;

    public static Optional<SellSignal> parse(String raw) {
        String value = raw == null ? "" : raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        switch (value) {
            case "STOP_LOSS":
            case "STOP":
                return Optional.of(STOP_LOSS);
            case "TARGET_REACHED":
            case "TARGET":
                return Optional.of(TARGET_REACHED);
            case "SELL_TRIGGER":
            case "TRIGGER":
                return Optional.of(SELL_TRIGGER);
            default:
                return Optional.empty();
        }
    }
}
