package com.earningsbot.db;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.regex.Pattern;

/**
 * Hands out PostgreSQL connections whose search path starts at the configured schema.
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);
    private static final Pattern SCHEMA_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern URL_PASSWORD = Pattern.compile("(?i)(password=)[^&]+");
    private static final Pattern URL_USERINFO = Pattern.compile("(://[^:/@]+:)[^@/]+(@)");

    private final PGSimpleDataSource dataSource = new PGSimpleDataSource();
    private final String jdbcUrl;
    private final String schema;

    public Database(String jdbcUrl, String user, String pass, String schema) {
        if (jdbcUrl == null || !jdbcUrl.trim().startsWith("jdbc:postgresql:")) {
            throw new IllegalArgumentException("db.url must be a jdbc:postgresql: URL");
        }
        this.jdbcUrl = jdbcUrl.trim();
        this.schema = normalizeSchema(schema);
        dataSource.setUrl(this.jdbcUrl);
        if (user != null && !user.isBlank()) {
            dataSource.setUser(user.trim());
            dataSource.setPassword(pass);
        }
        dataSource.setCurrentSchema(this.schema + ",public");
    }

    public Connection connect() throws SQLException {
        try {
            return dataSource.getConnection();
        } catch (SQLException e) {
            LOG.error("DB connect failed: url={}, schema={}, cause={}", maskedJdbcUrl(), schema, e.getMessage());
            throw e;
        }
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        String out = URL_PASSWORD.matcher(jdbcUrl).replaceAll("$1***");
        return URL_USERINFO.matcher(out).replaceAll("$1***$2");
    }

    static String normalizeSchema(String raw) {
        String value = raw == null || raw.isBlank() ? "earningsbot" : raw.trim();
        if (!SCHEMA_NAME.matcher(value).matches()) {
            throw new IllegalArgumentException("invalid db.schema: " + value);
        }
        return value;
    }
}
