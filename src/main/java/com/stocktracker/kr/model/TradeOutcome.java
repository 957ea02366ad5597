package com.stocktracker.kr.model;

public enum TradeOutcome {
    WIN,
    LOSS,
    BREAK_EVEN;

    public static TradeOutcome classify(double profitRatePercent) {
        if (profitRatePercent > 0.0) {
            return WIN;
        }
        if (profitRatePercent < 0.0) {
            return LOSS;
        }
        return BREAK_EVEN;
    }
}
