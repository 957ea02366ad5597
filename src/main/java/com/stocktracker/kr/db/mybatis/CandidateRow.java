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
public class CandidateRow {
    private Long id;
    private String ticker;
    private String companyName;
    private String sector;
    private OffsetDateTime analyzedAt;
    private Double buyScore;
    private Double minScoreThreshold;
    private String decision;
    private String rationale;
    private Double quotedPrice;
    private String cycleId;
}
