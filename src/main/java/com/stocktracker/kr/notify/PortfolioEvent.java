package com.stocktracker.kr.notify;

import java.time.Instant;

/**
 * Something a subscriber may want to hear about: a position opened, held, revised or closed, a
 * candidate skipped, or a transition rejected.
 */
public record PortfolioEvent(Type type, String ticker, String cycleId, String message, Instant at) {

    public enum Type {
        OPENED,
        SKIPPED,
        REVISED,
        HELD,
        CLOSED,
        REJECTED
    }

    public static PortfolioEvent of(Type type, String ticker, String cycleId, String message) {
        return new PortfolioEvent(type, ticker == null ? "" : ticker, cycleId == null ? "" : cycleId,
                message == null ? "" : message, Instant.now());
    }

    public String toLine() {
        return "[" + type + "] " + ticker + " @" + cycleId + " " + message;
    }
}
