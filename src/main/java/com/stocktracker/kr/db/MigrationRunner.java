package com.stocktracker.kr.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * Idempotent PostgreSQL schema migration runner.
 */
public final class MigrationRunner {
    private static final Logger LOG = LogManager.getLogger(MigrationRunner.class);
    static final int TARGET_VERSION = 1;

    public void run(Database database) throws SQLException {
        String schema = database.schema();
        try (Connection conn = database.connect(); Statement st = conn.createStatement()) {
            st.execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            st.execute("SET search_path TO " + schema + ", public");
            st.execute("CREATE TABLE IF NOT EXISTS metadata (" +
                    "meta_key TEXT PRIMARY KEY," +
                    "meta_value TEXT NOT NULL," +
                    "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                    ")");

            int currentVersion = readSchemaVersion(conn);
            String lastSql = "";
            try {
                for (String sql : buildStatements()) {
                    lastSql = sql;
                    st.execute(sql);
                }
                writeSchemaVersion(conn, TARGET_VERSION);
            } catch (SQLException e) {
                String detail = "migration_failed: schema_version=" + currentVersion
                        + ", target_version=" + TARGET_VERSION
                        + ", failed_sql=" + summarizeSql(lastSql)
                        + ", cause=" + safe(e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            if (currentVersion != TARGET_VERSION) {
                LOG.info("schema {} migrated: version {} -> {}", schema, currentVersion, TARGET_VERSION);
            }
        }
    }

    static List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();

        sqls.add("CREATE TABLE IF NOT EXISTS holdings (" +
                "ticker TEXT PRIMARY KEY," +
                "company_name TEXT NULL," +
                "sector TEXT NULL," +
                "buy_price DOUBLE PRECISION NOT NULL," +
                "buy_date DATE NOT NULL," +
                "current_price DOUBLE PRECISION NOT NULL," +
                "target_price DOUBLE PRECISION NOT NULL," +
                "stop_loss DOUBLE PRECISION NOT NULL," +
                "investment_horizon TEXT NOT NULL," +
                "scenario_json TEXT NOT NULL," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS watchlist_candidates (" +
                "id BIGSERIAL PRIMARY KEY," +
                "ticker TEXT NOT NULL," +
                "company_name TEXT NULL," +
                "sector TEXT NULL," +
                "analyzed_at TIMESTAMPTZ NULL," +
                "buy_score DOUBLE PRECISION NOT NULL," +
                "min_score_threshold DOUBLE PRECISION NOT NULL," +
                "decision TEXT NOT NULL," +
                "rationale TEXT NULL," +
                "quoted_price DOUBLE PRECISION NOT NULL," +
                "cycle_id TEXT NOT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");
        sqls.add("CREATE INDEX IF NOT EXISTS idx_watchlist_candidates_cycle ON watchlist_candidates(cycle_id)");

        sqls.add("CREATE TABLE IF NOT EXISTS daily_decisions (" +
                "id BIGSERIAL PRIMARY KEY," +
                "ticker TEXT NOT NULL," +
                "cycle_id TEXT NOT NULL," +
                "decided_at TIMESTAMPTZ NOT NULL," +
                "confidence INT NOT NULL," +
                "technical_trend TEXT NULL," +
                "volume_analysis TEXT NULL," +
                "market_condition_impact TEXT NULL," +
                "time_factor TEXT NULL," +
                "portfolio_adjustment_needed BOOLEAN NOT NULL," +
                "adjustment_urgency TEXT NOT NULL," +
                "new_target_price DOUBLE PRECISION NULL," +
                "new_stop_loss DOUBLE PRECISION NULL," +
                "sell_signals TEXT NOT NULL DEFAULT ''," +
                "sell_reason TEXT NULL," +
                "extras_json TEXT NOT NULL DEFAULT '{}'," +
                "UNIQUE (ticker, cycle_id)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS closed_trades (" +
                "id BIGSERIAL PRIMARY KEY," +
                "ticker TEXT NOT NULL," +
                "company_name TEXT NULL," +
                "sector TEXT NULL," +
                "buy_price DOUBLE PRECISION NOT NULL," +
                "sell_price DOUBLE PRECISION NOT NULL," +
                "buy_date DATE NOT NULL," +
                "sell_date DATE NOT NULL," +
                "holding_days INT NOT NULL," +
                "profit_rate DOUBLE PRECISION NOT NULL," +
                "outcome TEXT NOT NULL," +
                "sell_reason TEXT NULL," +
                "cycle_id TEXT NOT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS cycle_runs (" +
                "id BIGSERIAL PRIMARY KEY," +
                "cycle_id TEXT NOT NULL," +
                "run_trigger TEXT NOT NULL," +
                "started_at TIMESTAMPTZ NOT NULL," +
                "finished_at TIMESTAMPTZ NULL," +
                "status TEXT NOT NULL," +
                "summary TEXT NULL," +
                "error TEXT NULL" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS cycle_logs (" +
                "id BIGSERIAL PRIMARY KEY," +
                "run_id BIGINT NOT NULL," +
                "cycle_id TEXT NOT NULL," +
                "step TEXT NOT NULL," +
                "status TEXT NOT NULL," +
                "message TEXT NULL," +
                "logged_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");
        return sqls;
    }

    private int readSchemaVersion(Connection conn) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("SELECT meta_value FROM metadata WHERE meta_key='schema_version'");
             ResultSet rs = ps.executeQuery()) {
            if (rs.next()) {
                String value = rs.getString(1);
                if (value != null && !value.trim().isEmpty()) {
                    try {
                        return Integer.parseInt(value.trim());
                    } catch (NumberFormatException e) {
                        LOG.warn("unreadable schema_version '{}', treating as 0", value);
                        return 0;
                    }
                }
            }
        }
        return 0;
    }

    private void writeSchemaVersion(Connection conn, int version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT INTO metadata(meta_key, meta_value, updated_at) VALUES('schema_version', ?, now()) " +
                        "ON CONFLICT(meta_key) DO UPDATE SET meta_value=excluded.meta_value, updated_at=excluded.updated_at"
        )) {
            ps.setString(1, Integer.toString(version));
            ps.executeUpdate();
        }
    }

    static String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replace('\n', ' ').replace('\r', ' ').replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
