package com.stocktracker.kr.db.mybatis;

import org.apache.ibatis.annotations.Insert;
import org.apache.ibatis.annotations.Options;
import org.apache.ibatis.annotations.Param;
import org.apache.ibatis.annotations.Select;
import org.apache.ibatis.annotations.Update;

import java.time.OffsetDateTime;

public interface CycleRunMapper {
    @Update("UPDATE cycle_runs SET status='ABORTED', finished_at=#{finishedAt}, " +
            "error=COALESCE(error, '') || 'recovered_on_startup' WHERE status='RUNNING'")
    int recoverDanglingRuns(@Param("finishedAt") OffsetDateTime finishedAt);

    @Insert("INSERT INTO cycle_runs(cycle_id, run_trigger, started_at, status) " +
            "VALUES(#{cycleId}, #{trigger}, #{startedAt}, #{status})")
    @Options(useGeneratedKeys = true, keyProperty = "id", keyColumn = "id")
    int insertRun(CycleRunInsertParam run);

    @Update("UPDATE cycle_runs SET finished_at=#{finishedAt}, status=#{status}, summary=#{summary}, error=#{error} " +
            "WHERE id=#{runId}")
    int updateRunFinish(CycleRunFinishParam row);

    @Select("SELECT cycle_id FROM cycle_runs WHERE id=#{runId}")
    String findCycleId(@Param("runId") long runId);

    @Insert("INSERT INTO cycle_logs(run_id, cycle_id, step, status, message, logged_at) " +
            "VALUES(#{runId}, #{cycleId}, #{step}, #{status}, #{message}, #{loggedAt})")
    int insertLog(CycleLogInsertParam row);
}
