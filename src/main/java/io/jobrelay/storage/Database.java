package io.jobrelay.storage;

import io.jobrelay.config.JobRelayConfig;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * SQLite-backed store holding staged-job hashes, job records, status registries and
 * per-job log lists.
 */
public final class Database {
    private static final Logger LOG = LogManager.getLogger(Database.class);
    private static final int BUSY_TIMEOUT_MS = 5_000;
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final JobRelayConfig config;
    private final String jdbcUrl;

    public Database(JobRelayConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
        LOG.info("Store ready at {}", config.dbFile());
    }

    public Connection openConnection() throws SQLException {
        Properties props = new Properties();
        props.setProperty("busy_timeout", Integer.toString(BUSY_TIMEOUT_MS));
        props.setProperty("synchronous", "NORMAL");
        return DriverManager.getConnection(jdbcUrl, props);
    }

    static boolean isLockContention(SQLException e) {
        int code = e.getErrorCode();
        return code == SQLITE_BUSY || code == SQLITE_LOCKED;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new StorageUnavailableException("Failed to initialize data root: " + config.rootDir(), e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS staged_jobs (
                        staged_id TEXT PRIMARY KEY,
                        params TEXT NOT NULL,
                        staged_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS jobs (
                        job_id TEXT PRIMARY KEY,
                        status TEXT NOT NULL,
                        args TEXT NOT NULL,
                        meta TEXT NOT NULL,
                        enqueued_at_ms INTEGER,
                        started_at_ms INTEGER,
                        ended_at_ms INTEGER,
                        result TEXT,
                        error TEXT,
                        timeout_ms INTEGER NOT NULL,
                        result_ttl_s INTEGER NOT NULL,
                        failure_ttl_s INTEGER NOT NULL,
                        stop_requested INTEGER NOT NULL DEFAULT 0,
                        worker_id TEXT,
                        version INTEGER NOT NULL DEFAULT 0,
                        expires_at_ms INTEGER
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS job_registry (
                        entry_id INTEGER PRIMARY KEY AUTOINCREMENT,
                        registry TEXT NOT NULL,
                        job_id TEXT NOT NULL,
                        added_at_ms INTEGER NOT NULL,
                        UNIQUE(registry, job_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS log_records (
                        job_id TEXT NOT NULL,
                        seq INTEGER NOT NULL,
                        kind TEXT NOT NULL,
                        line TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(job_id, seq)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS log_retention (
                        job_id TEXT PRIMARY KEY,
                        expires_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_status ON jobs(status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_expires ON jobs(expires_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_registry_job ON job_registry(job_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_log_retention_expires ON log_retention(expires_at_ms)");
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
        } catch (SQLException e) {
            throw new StorageUnavailableException("Failed to apply SQLite pragmas", e);
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
