package com.stocktracker.kr.db.mybatis;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClosedTradeRow {
    private Long id;
    private String ticker;
    private String companyName;
    private String sector;
    private Double buyPrice;
    private Double sellPrice;
    private LocalDate buyDate;
    private LocalDate sellDate;
    private Integer holdingDays;
    private Double profitRate;
    private String outcome;
    private String sellReason;
    private String cycleId;
}
