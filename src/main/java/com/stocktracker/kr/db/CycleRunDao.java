package com.stocktracker.kr.db;

import com.stocktracker.kr.db.mybatis.CycleLogInsertParam;
import com.stocktracker.kr.db.mybatis.CycleRunFinishParam;
import com.stocktracker.kr.db.mybatis.CycleRunInsertParam;
import com.stocktracker.kr.db.mybatis.CycleRunMapper;
import com.stocktracker.kr.db.mybatis.MyBatisSupport;
import com.stocktracker.kr.runner.CycleRunLog;
import org.apache.ibatis.session.SqlSession;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * DAO for cycle run bookkeeping: one {@code cycle_runs} row per run plus START/FINISH log lines.
 */
public final class CycleRunDao implements CycleRunLog {
    private static final Logger LOG = LogManager.getLogger(CycleRunDao.class);

    private final Database database;

    public CycleRunDao(Database database) {
        this.database = database;
    }

    /**
     * Marks runs left RUNNING by a crashed process as ABORTED.
     */
    public int recoverDanglingRuns() throws SQLException {
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            int recovered = session.getMapper(CycleRunMapper.class).recoverDanglingRuns(OffsetDateTime.now(ZoneOffset.UTC));
            conn.commit();
            if (recovered > 0) {
                LOG.warn("marked {} dangling cycle run(s) ABORTED", recovered);
            }
            return recovered;
        }
    }

    @Override
    public long start(String cycleId, String trigger) throws SQLException {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            CycleRunMapper mapper = session.getMapper(CycleRunMapper.class);
            CycleRunInsertParam run = CycleRunInsertParam.builder()
                    .cycleId(cycleId)
                    .trigger(trigger == null ? "manual" : trigger)
                    .startedAt(now)
                    .status("RUNNING")
                    .build();
            mapper.insertRun(run);
            if (run.getId() == null) {
                throw new SQLException("failed to create cycle run");
            }
            mapper.insertLog(CycleLogInsertParam.builder()
                    .runId(run.getId())
                    .cycleId(cycleId)
                    .step("START")
                    .status("RUNNING")
                    .message(trigger)
                    .loggedAt(now)
                    .build());
            conn.commit();
            return run.getId();
        }
    }

    @Override
    public void finish(long runId, String status, String summary, String error) throws SQLException {
        OffsetDateTime now = OffsetDateTime.now(ZoneOffset.UTC);
        try (Connection conn = database.connect();
             SqlSession session = MyBatisSupport.openSession(conn)) {
            conn.setAutoCommit(false);
            CycleRunMapper mapper = session.getMapper(CycleRunMapper.class);
            mapper.updateRunFinish(CycleRunFinishParam.builder()
                    .runId(runId)
                    .finishedAt(now)
                    .status(status)
                    .summary(summary)
                    .error(error)
                    .build());
            String cycleId = mapper.findCycleId(runId);
            mapper.insertLog(CycleLogInsertParam.builder()
                    .runId(runId)
                    .cycleId(cycleId == null ? "UNKNOWN" : cycleId)
                    .step("FINISH")
                    .status(status)
                    .message(error == null || error.isEmpty() ? summary : error)
                    .loggedAt(now)
                    .build());
            conn.commit();
        }
    }
}
