package io.avscheduler.storage;

import io.avscheduler.exception.LogStoreException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * SQLite file holding the execution history. Connections are opened per operation;
 * WAL journaling lets readers proceed while a writer commits.
 */
public final class Database {
    private final Path dbFile;
    private final String jdbcUrl;

    public Database(Path dbFile) {
        this.dbFile = dbFile.toAbsolutePath().normalize();
        this.jdbcUrl = "jdbc:sqlite:" + this.dbFile;
    }

    public Path dbFile() {
        return dbFile;
    }

    /**
     * Creates the schema if missing and verifies the file. Throws
     * {@link LogStoreException} when the store is unreadable or corrupt.
     */
    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
        checkIntegrity();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
            st.execute("PRAGMA synchronous=FULL");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    private void initDirectories() {
        Path parent = dbFile.getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new LogStoreException("Failed to create database directory: " + parent, e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS job_execution_logs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        job_id TEXT NOT NULL,
                        exit_code INTEGER NOT NULL,
                        execution_time REAL NOT NULL,
                        timestamp_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_job_execution_logs_job_time ON job_execution_logs(job_id, timestamp_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_job_execution_logs_time ON job_execution_logs(timestamp_ms)");
        } catch (SQLException e) {
            throw new LogStoreException("Failed to initialize SQLite schema at " + dbFile, e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=FULL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "2");
        } catch (SQLException e) {
            throw new LogStoreException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new LogStoreException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new LogStoreException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    private void checkIntegrity() {
        try (Connection conn = openConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA quick_check")) {
            String result = rs.next() ? rs.getString(1) : null;
            if (!"ok".equalsIgnoreCase(result)) {
                throw new LogStoreException("Execution log store failed integrity check: " + result);
            }
        } catch (SQLException e) {
            throw new LogStoreException("Failed to verify execution log store " + dbFile, e);
        }
    }
}
