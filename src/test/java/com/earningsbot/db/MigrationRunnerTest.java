package com.earningsbot.db;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertTrue;

class MigrationRunnerTest {

    @Test
    void schemaShouldCarryTheDeduplicationConstraints() {
        String all = String.join("\n", MigrationRunner.buildStatements());

        assertTrue(all.contains("CONSTRAINT uq_positions_symbol_entry_date UNIQUE (symbol, entry_date)"));
        assertTrue(all.contains("CONSTRAINT uq_alerts_event_key UNIQUE (event_key)"));
        assertTrue(all.contains("symbol VARCHAR(20) PRIMARY KEY"));
    }

    @Test
    void everyStatementShouldBeRerunnable() {
        List<String> statements = MigrationRunner.buildStatements();

        for (String sql : statements) {
            assertTrue(sql.contains("IF NOT EXISTS"), sql);
        }
    }
}
