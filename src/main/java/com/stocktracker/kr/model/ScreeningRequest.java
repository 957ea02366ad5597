package com.stocktracker.kr.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One analysed symbol offered to the scoring gate, with the plan to open it under if admitted.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ScreeningRequest {
    public final String ticker;
    public final String companyName;
    public final String sector;
    public final Instant analyzedAt;
    public final double buyScore;
    public final EntryDecision analystDecision;
    public final String rationale;
    public final double quotedPrice;
    public final Scenario scenario;
}
