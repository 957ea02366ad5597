package com.stocktracker.kr.gate;

import com.stocktracker.kr.config.Config;
import com.stocktracker.kr.model.MarketCondition;

/**
 * Minimum buy score for the current market. Bear markets demand more, bull markets less, and a
 * crowded portfolio raises the bar by one point.
 */
public final class ThresholdPolicy {
    private final double baseMinScore;
    private final double bearMinScore;
    private final double bullMinScore;
    private final double crowdedSlotRatio;

    public ThresholdPolicy(double baseMinScore, double bearMinScore, double bullMinScore, double crowdedSlotRatio) {
        this.baseMinScore = baseMinScore;
        this.bearMinScore = bearMinScore;
        this.bullMinScore = bullMinScore;
        this.crowdedSlotRatio = crowdedSlotRatio;
    }

    public static ThresholdPolicy fromConfig(Config config) {
        return new ThresholdPolicy(
                config.getDouble("gate.base_min_score", 8.0),
                config.getDouble("gate.bear_min_score", 9.0),
                config.getDouble("gate.bull_min_score", 7.0),
                config.getDouble("gate.crowded_slot_ratio", 0.7)
        );
    }

    public double minScore(MarketCondition condition, int openCount, int capacity) {
        double score;
        if (condition == MarketCondition.BEAR) {
            score = bearMinScore;
        } else if (condition == MarketCondition.BULL) {
            score = bullMinScore;
        } else {
            score = baseMinScore;
        }
        if (capacity > 0 && crowdedSlotRatio > 0.0 && openCount >= capacity * crowdedSlotRatio) {
            score += 1.0;
        }
        return Math.min(10.0, score);
    }
}
