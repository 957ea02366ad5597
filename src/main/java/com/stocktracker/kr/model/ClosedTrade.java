package com.stocktracker.kr.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class ClosedTrade {
    public final String ticker;
    public final String companyName;
    public final String sector;
    public final double buyPrice;
    public final double sellPrice;
    public final LocalDate buyDate;
    public final LocalDate sellDate;
    public final int holdingDays;
    public final double profitRatePercent;
    public final TradeOutcome outcome;
    public final String sellReason;
    public final String cycleId;

    public static double profitRatePercent(double buyPrice, double sellPrice) {
        return (sellPrice - buyPrice) / buyPrice * 100.0;
    }
}
