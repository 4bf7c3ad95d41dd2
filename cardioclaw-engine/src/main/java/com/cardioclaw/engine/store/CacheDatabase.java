package com.cardioclaw.engine.store;

import com.cardioclaw.common.errors.CacheWriteException;
import lombok.extern.slf4j.Slf4j;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * The SQLite file behind the job cache. Each caller opens its own connection;
 * nothing is pooled.
 */
@Slf4j
public final class CacheDatabase {

    private final Path file;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public CacheDatabase(Path file) {
        this.file = file;
        this.jdbcUrl = "jdbc:sqlite:" + file.toAbsolutePath();
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(5000);
        this.connectionProperties = config.toProperties();
    }

    /**
     * Open (creating directories and schema as needed) the database at
     * {@code file}.
     */
    public static CacheDatabase open(Path file) {
        CacheDatabase db = new CacheDatabase(file);
        db.init();
        return db;
    }

    public Path getFile() {
        return file;
    }

    public void init() {
        initDirectories();
        initSchema();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    private void initDirectories() {
        Path parent = file.toAbsolutePath().getParent();
        if (parent == null)
            return;
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new CacheWriteException("Failed to create directory " + parent, e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS jobs (
                        id TEXT PRIMARY KEY,
                        name TEXT NOT NULL,
                        schedule TEXT,
                        agent TEXT,
                        status TEXT DEFAULT 'active',
                        next_run_at INTEGER,
                        last_run_at INTEGER,
                        last_status TEXT,
                        last_error TEXT,
                        managed INTEGER DEFAULT 0,
                        created_at INTEGER,
                        updated_at INTEGER
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_name ON jobs(name)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_jobs_managed ON jobs(managed)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS runs (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        job_id TEXT NOT NULL,
                        job_name TEXT,
                        started_at INTEGER NOT NULL,
                        ended_at INTEGER,
                        status TEXT,
                        error TEXT,
                        FOREIGN KEY (job_id) REFERENCES jobs(id) ON DELETE CASCADE
                    )
                    """);
            ensureRunColumns(conn);
            st.execute("CREATE INDEX IF NOT EXISTS idx_runs_job_id ON runs(job_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_runs_started_at ON runs(started_at)");
        } catch (SQLException e) {
            throw new CacheWriteException("Failed to initialize cache schema in " + file, e);
        }
        log.debug("Cache database ready at {}", file);
    }

    // Columns added after the first release of the runs table.
    private void ensureRunColumns(Connection conn) throws SQLException {
        Set<String> columns = columnNames(conn, "runs");
        try (Statement st = conn.createStatement()) {
            if (!columns.contains("duration_ms")) {
                st.execute("ALTER TABLE runs ADD COLUMN duration_ms INTEGER");
            }
            if (!columns.contains("session_id")) {
                st.execute("ALTER TABLE runs ADD COLUMN session_id TEXT");
            }
        }
    }

    static Set<String> columnNames(Connection conn, String table) throws SQLException {
        Set<String> columns = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name").toLowerCase(Locale.ROOT));
            }
        }
        return columns;
    }
}
