package com.stocktracker.kr.runner;

import com.stocktracker.core.diagnostics.Outcome;
import com.stocktracker.kr.decision.Transition;
import com.stocktracker.kr.model.HistoryStats;
import com.stocktracker.kr.model.PortfolioSummary;
import com.stocktracker.kr.model.WatchlistCandidate;

import java.util.List;

/**
 * Result of one cycle: an outcome per open position judged and per screened symbol, plus the
 * portfolio and history snapshots taken after the last transition.
 */
public record CycleReport(
        String cycleId,
        String status,
        List<Outcome<Transition>> decisions,
        List<Outcome<WatchlistCandidate>> entries,
        PortfolioSummary summary,
        HistoryStats stats,
        String telemetrySummary
) {
    public static final String STATUS_SUCCESS = "SUCCESS";
    public static final String STATUS_PARTIAL = "PARTIAL";
    public static final String STATUS_FAILED = "FAILED";
    public static final String STATUS_ABORTED = "ABORTED";

    public CycleReport {
        decisions = List.copyOf(decisions);
        entries = List.copyOf(entries);
    }

    public long failures() {
        return decisions.stream().filter(o -> !o.success).count()
                + entries.stream().filter(o -> !o.success).count();
    }

    public boolean aborted() {
        return STATUS_ABORTED.equals(status);
    }
}
