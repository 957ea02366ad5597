package com.stocktracker.kr.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationRunnerTest {

    @Test
    void buildStatements_shouldCreateEveryTable() {
        String all = String.join("\n", MigrationRunner.buildStatements());

        for (String table : List.of("holdings", "watchlist_candidates", "daily_decisions", "closed_trades",
                "cycle_runs", "cycle_logs")) {
            assertTrue(all.contains("CREATE TABLE IF NOT EXISTS " + table + " ("), table);
        }
        assertTrue(all.contains("UNIQUE (ticker, cycle_id)"));
    }

    @Test
    void summarizeSql_shouldCollapseWhitespaceAndTruncate() {
        assertEquals("SELECT 1 FROM holdings", MigrationRunner.summarizeSql("SELECT 1\n   FROM holdings"));
        assertEquals(180, MigrationRunner.summarizeSql("x".repeat(400)).length());
        assertEquals("-", MigrationRunner.summarizeSql(" "));
    }

    @Test
    void database_shouldValidateSchemaAndMaskPassword() {
        Database database = new Database("jdbc:postgresql://db:5432/stocks?password=secret", "u", "p", " ");

        assertEquals("stocktracker", database.schema());
        assertEquals("jdbc:postgresql://db:5432/stocks?password=***", database.maskedJdbcUrl());
        assertThrows(IllegalArgumentException.class, () -> Database.normalizeSchema("bad-schema;"));
        assertThrows(IllegalArgumentException.class, () -> new Database("jdbc:mysql://db/x", "u", "p", "s"));
    }
}
