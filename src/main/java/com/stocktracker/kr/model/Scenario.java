package com.stocktracker.kr.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Trading plan attached to one position. Immutable; a revision produces a new instance that
 * replaces the old one wholesale.
 */
@Value
public final class Scenario {
    public final double targetPrice;
    public final double stopLoss;
    public final InvestmentHorizon investmentHorizon;
    public final String rationale;
    public final List<Double> supportLevels;
    public final List<Double> resistanceLevels;
    public final List<String> sellTriggers;
    public final List<String> holdConditions;
    /** 0 when the plan carries no capacity hint. */
    public final int maxPortfolioSize;

    @Builder(toBuilder = true)
    public Scenario(
            double targetPrice,
            double stopLoss,
            InvestmentHorizon investmentHorizon,
            String rationale,
            List<Double> supportLevels,
            List<Double> resistanceLevels,
            List<String> sellTriggers,
            List<String> holdConditions,
            int maxPortfolioSize
    ) {
        this.targetPrice = targetPrice;
        this.stopLoss = stopLoss;
        this.investmentHorizon = investmentHorizon == null ? InvestmentHorizon.MID : investmentHorizon;
        this.rationale = rationale == null ? "" : rationale;
        this.supportLevels = supportLevels == null ? List.of() : List.copyOf(supportLevels);
        this.resistanceLevels = resistanceLevels == null ? List.of() : List.copyOf(resistanceLevels);
        this.sellTriggers = sellTriggers == null ? List.of() : List.copyOf(sellTriggers);
        this.holdConditions = holdConditions == null ? List.of() : List.copyOf(holdConditions);
        this.maxPortfolioSize = Math.max(0, maxPortfolioSize);
    }

    /**
     * New scenario with the given levels; a null level keeps the current one.
     */
    public Scenario withLevels(Double newTargetPrice, Double newStopLoss, String newRationale) {
        return toBuilder()
                .targetPrice(newTargetPrice == null ? targetPrice : newTargetPrice)
                .stopLoss(newStopLoss == null ? stopLoss : newStopLoss)
                .rationale(newRationale == null || newRationale.trim().isEmpty() ? rationale : newRationale.trim())
                .build();
    }

    public boolean levelsPositive() {
        return Double.isFinite(targetPrice) && Double.isFinite(stopLoss) && targetPrice > 0.0 && stopLoss > 0.0;
    }

    public boolean levelsOrdered() {
        return stopLoss < targetPrice;
    }
}
