package io.limitgraph.storage;

import io.limitgraph.config.LimitGraphConfig;
import io.limitgraph.error.StorageException;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final LimitGraphConfig config;
    private final String jdbcUrl;

    public Database(LimitGraphConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new StorageException("init_directories", e);
        }
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            // Per-connection settings: commits must be on disk when persist* returns.
            st.execute("PRAGMA synchronous=FULL");
            st.execute("PRAGMA busy_timeout=5000");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS traces (
                        trace_id TEXT PRIMARY KEY,
                        session_id TEXT NOT NULL,
                        payload TEXT NOT NULL,
                        created_at TEXT NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS rd_series (
                        session_id TEXT NOT NULL,
                        series_key TEXT NOT NULL,
                        data TEXT NOT NULL,
                        point_count INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(session_id, series_key)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS provenance (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        prov_id TEXT NOT NULL UNIQUE,
                        session_id TEXT NOT NULL,
                        trace_id TEXT NOT NULL,
                        kind TEXT NOT NULL,
                        hash TEXT NOT NULL,
                        data TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS checkpoints (
                        seq INTEGER PRIMARY KEY AUTOINCREMENT,
                        checkpoint_id TEXT NOT NULL UNIQUE,
                        session_id TEXT NOT NULL,
                        trace_id TEXT NOT NULL,
                        outcome TEXT NOT NULL,
                        data TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_traces_session ON traces(session_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_provenance_session_trace ON provenance(session_id, trace_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_checkpoints_session ON checkpoints(session_id)");
        } catch (SQLException e) {
            throw new StorageException("init_schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            validatePragma(st, "journal_mode", "wal");
        } catch (SQLException e) {
            throw new StorageException("apply_pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }
}
