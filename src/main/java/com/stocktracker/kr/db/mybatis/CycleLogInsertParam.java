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
public class CycleLogInsertParam {
    private long runId;
    private String cycleId;
    private String step;
    private String status;
    private String message;
    private OffsetDateTime loggedAt;
}
