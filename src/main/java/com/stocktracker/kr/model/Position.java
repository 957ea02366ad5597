package com.stocktracker.kr.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

/**
 * Open holding. Target, stop and horizon are read through the scenario so there is one source
 * for each level.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PUBLIC)
@Builder(toBuilder = true)
public final class Position {
    public final String ticker;
    public final String companyName;
    public final String sector;
    public final double buyPrice;
    public final LocalDate buyDate;
    public final double currentPrice;
    public final Scenario scenario;

    public double targetPrice() {
        return scenario.targetPrice;
    }

    public double stopLoss() {
        return scenario.stopLoss;
    }

    public InvestmentHorizon investmentHorizon() {
        return scenario.investmentHorizon;
    }

    public int holdingDays(LocalDate asOf) {
        if (asOf == null || buyDate == null || asOf.isBefore(buyDate)) {
            return 0;
        }
        return (int) ChronoUnit.DAYS.between(buyDate, asOf);
    }

    public double unrealizedProfit() {
        return currentPrice - buyPrice;
    }

    public double unrealizedProfitRatePercent() {
        if (buyPrice <= 0.0) {
            return 0.0;
        }
        return (currentPrice - buyPrice) / buyPrice * 100.0;
    }
}
