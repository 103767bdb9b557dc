package io.swarmhive.storage;

import io.swarmhive.config.HiveConfig;
import io.swarmhive.config.HiveSettings;
import io.swarmhive.error.HiveException;
import io.swarmhive.error.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Owns the SQLite file shared by every agent process of a project: schema, pragmas and the
 * write-transaction helper. Write transactions start as {@code BEGIN IMMEDIATE} so that
 * check-then-write sequences never interleave across processes.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);
    private static final String MIGRATION_SCHEMA_VERSION = "swarmhive.schema.migration.v1";
    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;

    private final HiveConfig config;
    private final HiveSettings settings;
    private final String jdbcUrl;
    private final Properties connectionProperties;

    public Database(HiveConfig config) {
        this(config, HiveSettings.defaults());
    }

    public Database(HiveConfig config, HiveSettings settings) {
        this.config = config;
        this.settings = settings;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
        SQLiteConfig sqlite = new SQLiteConfig();
        sqlite.setJournalMode(SQLiteConfig.JournalMode.WAL);
        sqlite.setSynchronous(SQLiteConfig.SynchronousMode.NORMAL);
        sqlite.setBusyTimeout((int) Math.min(Integer.MAX_VALUE, settings.busyTimeoutMs()));
        sqlite.enforceForeignKeys(true);
        sqlite.setTransactionMode(SQLiteConfig.TransactionMode.IMMEDIATE);
        this.connectionProperties = sqlite.toProperties();
    }

    public HiveConfig config() {
        return config;
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl, connectionProperties);
    }

    /**
     * Runs {@code work} inside one immediate write transaction. Busy and locked errors are retried
     * with jittered exponential backoff; anything else rolls back and propagates.
     */
    public <T> T inTransaction(String action, Work<T> work) {
        SQLException last = null;
        int maxAttempts = Math.max(1, settings.storeMaxAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try (Connection c = openConnection()) {
                c.setAutoCommit(false);
                try {
                    T out = work.run(c);
                    c.commit();
                    return out;
                } catch (SQLException | RuntimeException e) {
                    rollback(c, e);
                    throw e;
                }
            } catch (SQLException e) {
                if (!isTransient(e)) {
                    throw new HiveException("Failed to " + action, e);
                }
                last = e;
                if (attempt < maxAttempts) {
                    long backoffMs = computeBackoffMs(attempt, settings.storeBaseBackoffMs(), settings.storeMaxBackoffMs());
                    log.debug("Store busy during {} (attempt {}/{}), retrying in {} ms", action, attempt, maxAttempts, backoffMs);
                    sleep(backoffMs, action, e);
                }
            }
        }
        log.warn("Store still busy after {} attempts: {}", maxAttempts, action);
        throw new StoreUnavailableException("Store unavailable after " + maxAttempts + " attempts: " + action, last);
    }

    /**
     * Runs a read in autocommit mode.
     */
    public <T> T query(String action, Work<T> work) {
        try (Connection c = openConnection()) {
            return work.run(c);
        } catch (SQLException e) {
            if (isTransient(e)) {
                throw new StoreUnavailableException("Store unavailable: " + action, e);
            }
            throw new HiveException("Failed to " + action, e);
        }
    }

    static boolean isTransient(SQLException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql) {
                int primary = sql.getErrorCode() & 0xFF;
                if (primary == SQLITE_BUSY || primary == SQLITE_LOCKED) {
                    return true;
                }
                String msg = sql.getMessage();
                if (msg != null && (msg.contains("SQLITE_BUSY") || msg.contains("SQLITE_LOCKED"))) {
                    return true;
                }
            }
        }
        return false;
    }

    static long computeBackoffMs(int attempt, long baseBackoffMs, long maxBackoffMs) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        long jitter = ThreadLocalRandom.current().nextLong(0L, Math.max(1L, backoff / 4L) + 1L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }

    private void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }

    private void sleep(long ms, String action, SQLException cause) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException("Interrupted while waiting for store: " + action, cause);
        }
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.hiveDir());
        } catch (IOException e) {
            throw new HiveException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS events (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        project_key TEXT NOT NULL,
                        sequence INTEGER NOT NULL,
                        type TEXT NOT NULL,
                        cell_id TEXT NOT NULL,
                        timestamp_ms INTEGER NOT NULL,
                        data TEXT NOT NULL,
                        recorded_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE UNIQUE INDEX IF NOT EXISTS idx_events_project_sequence ON events(project_key, sequence)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_events_project_cell ON events(project_key, cell_id, sequence)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS cells (
                        project_key TEXT NOT NULL,
                        id TEXT NOT NULL,
                        type TEXT NOT NULL,
                        status TEXT NOT NULL DEFAULT 'open',
                        title TEXT NOT NULL,
                        description TEXT,
                        priority INTEGER NOT NULL DEFAULT 2,
                        parent_id TEXT,
                        assignee TEXT,
                        created_by TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        closed_at_ms INTEGER,
                        closed_reason TEXT,
                        deleted_at_ms INTEGER,
                        deleted_by TEXT,
                        delete_reason TEXT,
                        CHECK (type IN ('epic','task','bug','chore','feature')),
                        CHECK (status IN ('open','in_progress','blocked','closed')),
                        CHECK (priority BETWEEN 0 AND 3),
                        CHECK ((status = 'closed') = (closed_at_ms IS NOT NULL)),
                        PRIMARY KEY(project_key, id)
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_cells_project_status ON cells(project_key, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_cells_parent ON cells(project_key, parent_id)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS cell_dependencies (
                        project_key TEXT NOT NULL,
                        cell_id TEXT NOT NULL,
                        depends_on_id TEXT NOT NULL,
                        relationship TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        created_by TEXT,
                        PRIMARY KEY(project_key, cell_id, depends_on_id, relationship)
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_cell_dependencies_target ON cell_dependencies(project_key, depends_on_id)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS cell_labels (
                        project_key TEXT NOT NULL,
                        cell_id TEXT NOT NULL,
                        label TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(project_key, cell_id, label)
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_cell_labels_label ON cell_labels(project_key, label)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS cell_comments (
                        project_key TEXT NOT NULL,
                        id TEXT NOT NULL,
                        cell_id TEXT NOT NULL,
                        author TEXT NOT NULL,
                        body TEXT NOT NULL,
                        parent_id TEXT,
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER,
                        PRIMARY KEY(project_key, id)
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_cell_comments_cell ON cell_comments(project_key, cell_id, created_at_ms)");

            st.execute("""
                    CREATE TABLE IF NOT EXISTS blocked_cells_cache (
                        project_key TEXT NOT NULL,
                        cell_id TEXT NOT NULL,
                        blocker_ids TEXT NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(project_key, cell_id)
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS dirty_cells (
                        project_key TEXT NOT NULL,
                        cell_id TEXT NOT NULL,
                        marked_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(project_key, cell_id)
                    )
                    """);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS reservations (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        project_key TEXT NOT NULL,
                        agent_name TEXT NOT NULL,
                        path_pattern TEXT NOT NULL,
                        exclusive INTEGER NOT NULL DEFAULT 1,
                        reason TEXT,
                        cell_id TEXT,
                        created_at_ms INTEGER NOT NULL,
                        expires_at_ms INTEGER NOT NULL,
                        released_at_ms INTEGER
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_reservations_active ON reservations(project_key, released_at_ms, expires_at_ms)");
            ensureReservationColumns(conn);

            st.execute("""
                    CREATE TABLE IF NOT EXISTS reservation_audit (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        project_key TEXT NOT NULL,
                        event_type TEXT NOT NULL,
                        agent_name TEXT NOT NULL,
                        path TEXT,
                        path_pattern TEXT,
                        reservation_id INTEGER,
                        holder_agent TEXT,
                        occurred_at_ms INTEGER NOT NULL
                    )
                    """);

            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);
        } catch (SQLException e) {
            throw new HiveException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureReservationColumns(Connection conn) throws SQLException {
        Set<String> cols = new HashSet<>();
        try (Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("PRAGMA table_info(reservations)")) {
            while (rs.next()) {
                cols.add(rs.getString("name"));
            }
        }
        try (Statement st = conn.createStatement()) {
            if (!cols.contains("cell_id")) {
                st.execute("ALTER TABLE reservations ADD COLUMN cell_id TEXT");
            }
            if (!cols.contains("reason")) {
                st.execute("ALTER TABLE reservations ADD COLUMN reason TEXT");
            }
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20260901_001_reservation_cell_index",
                "Index reservations by tagged cell for release-on-close",
                List.of("CREATE INDEX IF NOT EXISTS idx_reservations_cell ON reservations(project_key, cell_id)")
        ));
        steps.add(new MigrationStep(
                "20260901_002_reservation_audit_agent_index",
                "Index reservation audit rows by agent",
                List.of("CREATE INDEX IF NOT EXISTS idx_reservation_audit_agent ON reservation_audit(project_key, agent_name, occurred_at_ms)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum(step));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
        log.info("Applied schema migration {}", step.version());
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new HiveException("Failed to apply SQLite pragmas", e);
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

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        return query("list schema migrations", c -> {
            List<SchemaMigrationRow> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setInt(1, safeLimit);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new SchemaMigrationRow(
                                rs.getString("version"),
                                rs.getString("description"),
                                rs.getString("checksum"),
                                rs.getLong("applied_at_ms"),
                                rs.getInt("success") == 1
                        ));
                    }
                }
            }
            return out;
        });
    }

    @FunctionalInterface
    public interface Work<T> {
        T run(Connection c) throws SQLException;
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
