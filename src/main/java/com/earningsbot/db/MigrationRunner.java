package com.earningsbot.db;

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
 * The unique constraints on positions(symbol, entry_date) and alerts(event_key) are what
 * the scan relies on for deduplication; they must survive any schema change.
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
                        + ", cause=" + (e.getMessage() == null ? "" : e.getMessage());
                LOG.error(detail);
                throw new SQLException(detail, e.getSQLState(), e.getErrorCode(), e);
            }
            if (currentVersion != TARGET_VERSION) {
                LOG.info("Schema migrated: schema={} version {} -> {}", schema, currentVersion, TARGET_VERSION);
            }
        }
    }

    static List<String> buildStatements() {
        List<String> sqls = new ArrayList<>();

        sqls.add("CREATE TABLE IF NOT EXISTS positions (" +
                "id UUID PRIMARY KEY," +
                "symbol VARCHAR(20) NOT NULL," +
                "entry_date DATE NOT NULL," +
                "entry_price NUMERIC(18,6) NOT NULL," +
                "status VARCHAR(20) NOT NULL DEFAULT 'OPEN'," +
                "exit_date DATE NULL," +
                "exit_price NUMERIC(18,6) NULL," +
                "exit_reason VARCHAR(20) NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "CONSTRAINT uq_positions_symbol_entry_date UNIQUE (symbol, entry_date)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS alerts (" +
                "id UUID PRIMARY KEY," +
                "event_key TEXT NOT NULL," +
                "alert_type VARCHAR(20) NOT NULL," +
                "symbol VARCHAR(20) NOT NULL," +
                "as_of DATE NOT NULL," +
                "message TEXT NOT NULL," +
                "created_at TIMESTAMPTZ NOT NULL DEFAULT now()," +
                "sent_at TIMESTAMPTZ NULL," +
                "CONSTRAINT uq_alerts_event_key UNIQUE (event_key)" +
                ")");

        sqls.add("CREATE TABLE IF NOT EXISTS symbols_cache (" +
                "symbol VARCHAR(20) PRIMARY KEY," +
                "updated_at TIMESTAMPTZ NOT NULL DEFAULT now()" +
                ")");

        sqls.add("CREATE INDEX IF NOT EXISTS ix_positions_symbol ON positions(symbol)");
        sqls.add("CREATE INDEX IF NOT EXISTS ix_positions_status ON positions(status)");
        sqls.add("CREATE INDEX IF NOT EXISTS ix_alerts_symbol ON alerts(symbol)");
        sqls.add("CREATE INDEX IF NOT EXISTS ix_alerts_sent_at ON alerts(sent_at)");
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
                        LOG.warn("Unreadable schema_version '{}', treating as 0", value);
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

    private String summarizeSql(String sql) {
        if (sql == null || sql.trim().isEmpty()) {
            return "-";
        }
        String oneLine = sql.replace('\n', ' ').replace('\r', ' ').replaceAll("\\s+", " ").trim();
        if (oneLine.length() <= 180) {
            return oneLine;
        }
        return oneLine.substring(0, 177) + "...";
    }
}
