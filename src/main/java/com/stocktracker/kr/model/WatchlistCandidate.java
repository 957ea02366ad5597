package com.stocktracker.kr.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Audit record of one screening verdict. Later screenings of the same ticker add new records.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class WatchlistCandidate {
    public final String ticker;
    public final String companyName;
    public final String sector;
    public final Instant analyzedAt;
    public final double buyScore;
    public final double minScoreThreshold;
    public final EntryDecision decision;
    public final String rationale;
    public final double quotedPrice;
    public final String cycleId;

    public boolean admitted() {
        return decision == EntryDecision.ENTER;
    }
}
