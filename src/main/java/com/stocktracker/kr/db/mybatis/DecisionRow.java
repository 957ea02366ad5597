package com.stocktracker.kr.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DecisionRow {
    private Long id;
    private String ticker;
    private String cycleId;
    private OffsetDateTime decidedAt;
    private Integer confidence;
    private String technicalTrend;
    private String volumeAnalysis;
    private String marketConditionImpact;
    private String timeFactor;
    private Boolean portfolioAdjustmentNeeded;
    private String adjustmentUrgency;
    private Double newTargetPrice;
    private Double newStopLoss;
    private String sellSignals;
    private String sellReason;
    private String extrasJson;
}
