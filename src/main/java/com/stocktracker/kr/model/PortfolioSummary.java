package com.stocktracker.kr.model;

import java.util.Locale;

/**
 * Snapshot derived from the open positions at the time of the call.
 */
public record PortfolioSummary(
        int totalPositions,
        double totalEvaluation,
        double totalInvested,
        double totalUnrealizedProfit,
        int capacity
) {
    public double slotUsagePercent() {
        if (capacity <= 0) {
            return 0.0;
        }
        return totalPositions * 100.0 / capacity;
    }

    public String slotUsage() {
        return totalPositions + "/" + capacity;
    }

    public String toSummaryLine() {
        return String.format(Locale.US,
                "positions=%d, slots=%s, evaluation=%.0f, invested=%.0f, unrealized=%.0f",
                totalPositions, slotUsage(), totalEvaluation, totalInvested, totalUnrealizedProfit);
    }
}
