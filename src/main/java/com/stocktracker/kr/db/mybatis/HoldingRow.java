package com.stocktracker.kr.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HoldingRow {
    private String ticker;
    private String companyName;
    private String sector;
    private Double buyPrice;
    private LocalDate buyDate;
    private Double currentPrice;
    private Double targetPrice;
    private Double stopLoss;
    private String investmentHorizon;
    private String scenarioJson;
    private OffsetDateTime updatedAt;
}
