package com.stocktracker.kr.runner;

import java.sql.SQLException;

/**
 * Start/finish bookkeeping for cycles, one row per run.
 */
public interface CycleRunLog {

    long start(String cycleId, String trigger) throws SQLException;

    void finish(long runId, String status, String summary, String error) throws SQLException;
}
