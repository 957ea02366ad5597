package com.stocktracker.kr.model;

import java.util.Locale;

public record HistoryStats(
        int count,
        int winCount,
        int lossCount,
        int breakEvenCount,
        double winRate,
        double avgProfitRate,
        double avgHoldingDays,
        double cumulativeProfitRate
) {
    public static HistoryStats empty() {
        return new HistoryStats(0, 0, 0, 0, 0.0, 0.0, 0.0, 0.0);
    }

    public String toSummaryLine() {
        return String.format(Locale.US,
                "trades=%d, win=%d, loss=%d, even=%d, win_rate=%.2f%%, avg_profit=%.2f%%, avg_days=%.1f, cumulative=%.2f%%",
                count, winCount, lossCount, breakEvenCount, winRate, avgProfitRate, avgHoldingDays, cumulativeProfitRate);
    }
}
