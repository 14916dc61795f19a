package com.stocksync.db;

import com.microsoft.sqlserver.jdbc.SQLServerDataSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.postgresql.ds.PGSimpleDataSource;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;

/**
 * Database connection manager for the ERP store, PostgreSQL or SQL Server.
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);

    public enum Dialect {
        POSTGRES,
        SQLSERVER
    }

    private final DataSource dataSource;
    private final String jdbcUrl;
    private final String schema;
    private final Dialect dialect;

    public Database(String jdbcUrl, String user, String pass, String schema) {
        if (isBlank(jdbcUrl)) {
            throw new IllegalArgumentException("db.url must not be empty");
        }
        this.jdbcUrl = jdbcUrl.trim();
        this.dialect = dialectOf(this.jdbcUrl);
        this.schema = normalizeSchema(schema);

        if (dialect == Dialect.POSTGRES) {
            PGSimpleDataSource pg = new PGSimpleDataSource();
            pg.setUrl(this.jdbcUrl);
            if (!isBlank(user)) {
                pg.setUser(user.trim());
            }
            if (pass != null) {
                pg.setPassword(pass);
            }
            pg.setCurrentSchema(this.schema);
            pg.setApplicationName("stock-sync");
            this.dataSource = pg;
        } else {
            SQLServerDataSource ms = new SQLServerDataSource();
            ms.setURL(this.jdbcUrl);
            if (!isBlank(user)) {
                ms.setUser(user.trim());
            }
            if (pass != null) {
                ms.setPassword(pass);
            }
            ms.setApplicationName("stock-sync");
            this.dataSource = ms;
        }
    }

    public Connection connect() throws SQLException {
        LOG.info("Opening database connection {}...", maskedJdbcUrl());
        try {
            Connection raw = dataSource.getConnection();
            if (dialect == Dialect.POSTGRES) {
                try (Statement st = raw.createStatement()) {
                    st.execute("SET search_path TO " + schema + ", public");
                }
            }
            return raw;
        } catch (SQLException e) {
            String details = "DB connect failed: jdbc_url=" + maskedJdbcUrl()
                    + ", schema=" + schema
                    + ", hint=" + classifyConnectFailure(e)
                    + ", cause=" + safe(e.getMessage());
            LOG.error(details);
            throw new SQLException(details, e.getSQLState(), e.getErrorCode(), e);
        }
    }

    public Dialect dialect() {
        return dialect;
    }

    public String schema() {
        return schema;
    }

    public String maskedJdbcUrl() {
        String out = jdbcUrl;
        out = out.replaceAll("(?i)(password=)[^&;]+", "$1***");
        out = out.replaceAll("(://[^:/@]+:)[^@]+(@)", "$1***$2");
        return out;
    }

    static Dialect dialectOf(String url) {
        String lower = url.toLowerCase(Locale.ROOT);
        if (lower.startsWith("jdbc:postgresql:")) {
            return Dialect.POSTGRES;
        }
        if (lower.startsWith("jdbc:sqlserver:")) {
            return Dialect.SQLSERVER;
        }
        throw new IllegalArgumentException("db.url must be a PostgreSQL (jdbc:postgresql://...) or SQL Server (jdbc:sqlserver://...) JDBC URL");
    }

    private String normalizeSchema(String raw) {
        String value = isBlank(raw) ? (dialect == Dialect.POSTGRES ? "public" : "dbo") : raw.trim();
        if (!value.matches("[A-Za-z_][A-Za-z0-9_]*")) {
            throw new IllegalArgumentException("invalid db.schema, allowed pattern: [A-Za-z_][A-Za-z0-9_]*");
        }
        return value;
    }

    private boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private String classifyConnectFailure(SQLException e) {
        String msg = safe(e == null ? null : e.getMessage()).toLowerCase(Locale.ROOT);
        if (msg.contains("login failed") || msg.contains("password authentication failed")) {
            return "credentials";
        }
        if (msg.contains("permission denied") || msg.contains("access is denied")) {
            return "permission";
        }
        if (msg.contains("timed out") || msg.contains("connection refused")) {
            return "unreachable";
        }
        if (msg.contains("does not exist") || msg.contains("cannot open database")) {
            return "missing_database";
        }
        return "connection_error";
    }

    private String safe(String value) {
        return value == null ? "" : value;
    }
}
