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
public class CycleRunFinishParam {
    private long runId;
    private OffsetDateTime finishedAt;
    private String status;
    private String summary;
    private String error;
}
