package com.stocktracker.kr.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * One cycle's judgment about one position. Append-only; (ticker, cycleId) is unique.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class DailyDecision {
    public final String ticker;
    public final String cycleId;
    public final Instant decidedAt;
    public final int confidence;
    public final String technicalTrend;
    public final String volumeAnalysis;
    public final String marketConditionImpact;
    public final String timeFactor;
    public final boolean portfolioAdjustmentNeeded;
    public final AdjustmentUrgency adjustmentUrgency;
    public final Double newTargetPrice;
    public final Double newStopLoss;
    public final Set<SellSignal> sellSignals;
    public final String sellReason;
    /** Free-text fields the engine does not interpret. */
    public final Map<String, String> extras;

    public boolean requestsRevision() {
        return portfolioAdjustmentNeeded && (newTargetPrice != null || newStopLoss != null);
    }

    public boolean signals(SellSignal signal) {
        return sellSignals != null && sellSignals.contains(signal);
    }
}
