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
public class CycleRunInsertParam {
    private Long id;
    private String cycleId;
    private String trigger;
    private OffsetDateTime startedAt;
    private String status;
}
