package io.swarmhive.reservation;

import io.swarmhive.storage.Database;
import io.swarmhive.storage.Sql;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;

/**
 * Advisory file leases for one project. Lease state lives outside the event log; every grant,
 * refresh, conflict and release is written to {@code reservation_audit} in the same transaction.
 * Expiry is passive: rows past {@code expires_at_ms} are simply ignored.
 */
public final class ReservationManager {
    private static final Logger log = LoggerFactory.getLogger(ReservationManager.class);
    private static final String COLUMNS = """
            SELECT id, project_key, agent_name, path_pattern, exclusive, reason, cell_id,
                   created_at_ms, expires_at_ms, released_at_ms
            FROM reservations
            """;

    private final Database db;
    private final String projectKey;
    private final Duration defaultTtl;
    private final Clock clock;

    public ReservationManager(Database db, String projectKey, Duration defaultTtl, Clock clock) {
        this.db = db;
        this.projectKey = projectKey;
        this.defaultTtl = defaultTtl;
        this.clock = clock;
    }

    /**
     * Grants every path that does not overlap a live lease of another agent where either side is
     * exclusive. Conflicting paths are reported, not retried. An agent asking again for a pattern
     * it already holds gets its lease refreshed.
     */
    public ReservationResult reserve(String agent, Collection<String> paths, ReserveOptions options) {
        requireAgent(agent);
        ReserveOptions opts = options == null ? ReserveOptions.defaults() : options;
        Duration ttl = opts.ttl() == null || opts.ttl().isNegative() || opts.ttl().isZero() ? defaultTtl : opts.ttl();
        Set<String> requested = new LinkedHashSet<>();
        for (String path : paths) {
            String normalized = PathPatterns.normalize(path);
            if (!normalized.isEmpty()) {
                requested.add(normalized);
            }
        }
        if (requested.isEmpty()) {
            throw new IllegalArgumentException("paths must not be empty");
        }
        ensureNotCancelled();
        ReservationResult result = db.inTransaction("reserve paths", c -> {
            long nowMs = clock.millis();
            long expiresAtMs = nowMs + ttl.toMillis();
            List<Reservation> live = readRows(c, COLUMNS + """
                    WHERE project_key=? AND released_at_ms IS NULL AND expires_at_ms>?
                    ORDER BY id
                    """, ps -> {
                ps.setString(1, projectKey);
                ps.setLong(2, nowMs);
            });
            List<Reservation> granted = new ArrayList<>();
            List<Conflict> conflicts = new ArrayList<>();
            for (String path : requested) {
                List<Reservation> blocking = new ArrayList<>();
                Reservation own = null;
                for (Reservation r : live) {
                    if (r.agentName().equals(agent)) {
                        if (own == null && r.pathPattern().equals(path)) {
                            own = r;
                        }
                        continue;
                    }
                    if ((r.exclusive() || opts.exclusive()) && PathPatterns.overlaps(r.pathPattern(), path)) {
                        blocking.add(r);
                    }
                }
                if (!blocking.isEmpty()) {
                    for (Reservation holder : blocking) {
                        conflicts.add(new Conflict(path, holder.agentName(), holder.pathPattern(), holder.exclusive(), holder.expiresAtMs()));
                        audit(c, "conflict", agent, path, holder.pathPattern(), holder.id(), holder.agentName(), nowMs);
                    }
                    continue;
                }
                if (own != null) {
                    granted.add(refresh(c, own, opts, expiresAtMs, nowMs));
                } else {
                    Reservation inserted = insert(c, agent, path, opts, nowMs, expiresAtMs);
                    live.add(inserted);
                    granted.add(inserted);
                }
            }
            ensureNotCancelled();
            return new ReservationResult(granted, conflicts);
        });
        if (result.hasConflicts()) {
            log.info("Agent {} was denied {} of {} paths", agent, result.conflicts().size(), requested.size());
        } else {
            log.debug("Agent {} reserved {} paths", agent, result.granted().size());
        }
        return result;
    }

    public int release(String agent, Collection<String> paths) {
        requireAgent(agent);
        List<String> patterns = new ArrayList<>();
        for (String path : paths) {
            patterns.add(PathPatterns.normalize(path));
        }
        if (patterns.isEmpty()) {
            return 0;
        }
        return releaseWhere("release paths", agent,
                "agent_name=? AND path_pattern IN (" + Sql.placeholders(patterns.size()) + ")",
                ps -> {
                    ps.setString(2, agent);
                    for (int i = 0; i < patterns.size(); i++) {
                        ps.setString(3 + i, patterns.get(i));
                    }
                });
    }

    public int releaseByIds(String agent, Collection<Long> ids) {
        requireAgent(agent);
        List<Long> list = new ArrayList<>(ids);
        if (list.isEmpty()) {
            return 0;
        }
        return releaseWhere("release reservations by id", agent,
                "agent_name=? AND id IN (" + Sql.placeholders(list.size()) + ")",
                ps -> {
                    ps.setString(2, agent);
                    for (int i = 0; i < list.size(); i++) {
                        ps.setLong(3 + i, list.get(i));
                    }
                });
    }

    public int releaseAll(String agent) {
        requireAgent(agent);
        return releaseWhere("release all reservations", agent, "agent_name=?", ps -> ps.setString(2, agent));
    }

    /**
     * Releases every live lease tagged with {@code cellId}, whoever holds it.
     */
    public int releaseForCell(String cellId) {
        return releaseWhere("release cell reservations", null, "cell_id=?", ps -> ps.setString(2, cellId));
    }

    public List<Reservation> active(String agent) {
        long nowMs = clock.millis();
        return db.query("list active reservations", c -> readRows(c, COLUMNS + """
                WHERE project_key=? AND released_at_ms IS NULL AND expires_at_ms>?
                  AND (? IS NULL OR agent_name=?)
                ORDER BY id
                """, ps -> {
            ps.setString(1, projectKey);
            ps.setLong(2, nowMs);
            Sql.setNullableString(ps, 3, agent);
            Sql.setNullableString(ps, 4, agent);
        }));
    }

    /**
     * Deletes rows released or expired before {@code now - olderThan}. Audit rows are kept.
     */
    public int pruneExpired(Duration olderThan) {
        long cutoff = clock.millis() - olderThan.toMillis();
        int removed = db.inTransaction("prune reservations", c -> Sql.exec(c, """
                DELETE FROM reservations
                WHERE project_key=? AND (released_at_ms<? OR (released_at_ms IS NULL AND expires_at_ms<?))
                """, ps -> {
            ps.setString(1, projectKey);
            ps.setLong(2, cutoff);
            ps.setLong(3, cutoff);
        }));
        if (removed > 0) {
            log.info("Pruned {} reservations older than {}", removed, olderThan);
        }
        return removed;
    }

    public List<ReservationAuditRow> auditTrail(int limit) {
        return db.query("read reservation audit", c -> {
            List<ReservationAuditRow> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT id, event_type, agent_name, path, path_pattern, reservation_id, holder_agent, occurred_at_ms
                    FROM reservation_audit WHERE project_key=? ORDER BY id LIMIT ?
                    """)) {
                ps.setString(1, projectKey);
                ps.setInt(2, Math.max(1, limit));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new ReservationAuditRow(
                                rs.getLong("id"),
                                rs.getString("event_type"),
                                rs.getString("agent_name"),
                                rs.getString("path"),
                                rs.getString("path_pattern"),
                                Sql.getNullableLong(rs, "reservation_id"),
                                rs.getString("holder_agent"),
                                rs.getLong("occurred_at_ms")
                        ));
                    }
                }
            }
            return out;
        });
    }

    private int releaseWhere(String action, String agent, String condition, Sql.Binder binder) {
        ensureNotCancelled();
        int released = db.inTransaction(action, c -> {
            long nowMs = clock.millis();
            List<Reservation> rows = readRows(c, COLUMNS + "WHERE project_key=? AND released_at_ms IS NULL AND " + condition,
                    ps -> {
                        ps.setString(1, projectKey);
                        binder.bind(ps);
                    });
            for (Reservation r : rows) {
                Sql.exec(c, "UPDATE reservations SET released_at_ms=? WHERE id=? AND released_at_ms IS NULL", ps -> {
                    ps.setLong(1, nowMs);
                    ps.setLong(2, r.id());
                });
                audit(c, "released", r.agentName(), r.pathPattern(), r.pathPattern(), r.id(), r.agentName(), nowMs);
            }
            ensureNotCancelled();
            return rows.size();
        });
        if (released > 0) {
            log.debug("Released {} reservations ({}) for {}", released, action, agent == null ? "any agent" : agent);
        }
        return released;
    }

    private Reservation insert(Connection c, String agent, String path, ReserveOptions opts, long nowMs, long expiresAtMs)
            throws SQLException {
        Sql.exec(c, """
                INSERT INTO reservations(project_key, agent_name, path_pattern, exclusive, reason, cell_id,
                                         created_at_ms, expires_at_ms)
                VALUES(?,?,?,?,?,?,?,?)
                """, ps -> {
            ps.setString(1, projectKey);
            ps.setString(2, agent);
            ps.setString(3, path);
            ps.setInt(4, opts.exclusive() ? 1 : 0);
            Sql.setNullableString(ps, 5, opts.reason());
            Sql.setNullableString(ps, 6, opts.cellId());
            ps.setLong(7, nowMs);
            ps.setLong(8, expiresAtMs);
        });
        long id;
        try (PreparedStatement ps = c.prepareStatement("SELECT last_insert_rowid()");
             ResultSet rs = ps.executeQuery()) {
            id = rs.next() ? rs.getLong(1) : 0L;
        }
        audit(c, "reserved", agent, path, path, id, agent, nowMs);
        return new Reservation(id, projectKey, agent, path, opts.exclusive(), opts.reason(), opts.cellId(),
                nowMs, expiresAtMs, null);
    }

    private Reservation refresh(Connection c, Reservation own, ReserveOptions opts, long expiresAtMs, long nowMs)
            throws SQLException {
        String reason = opts.reason() == null ? own.reason() : opts.reason();
        String cellId = opts.cellId() == null ? own.cellId() : opts.cellId();
        Sql.exec(c, "UPDATE reservations SET expires_at_ms=?, exclusive=?, reason=?, cell_id=? WHERE id=?", ps -> {
            ps.setLong(1, expiresAtMs);
            ps.setInt(2, opts.exclusive() ? 1 : 0);
            Sql.setNullableString(ps, 3, reason);
            Sql.setNullableString(ps, 4, cellId);
            ps.setLong(5, own.id());
        });
        audit(c, "refreshed", own.agentName(), own.pathPattern(), own.pathPattern(), own.id(), own.agentName(), nowMs);
        return new Reservation(own.id(), own.projectKey(), own.agentName(), own.pathPattern(), opts.exclusive(),
                reason, cellId, own.createdAtMs(), expiresAtMs, null);
    }

    private void audit(
            Connection c,
            String eventType,
            String agent,
            String path,
            String pattern,
            Long reservationId,
            String holder,
            long nowMs
    ) throws SQLException {
        Sql.exec(c, """
                INSERT INTO reservation_audit(project_key, event_type, agent_name, path, path_pattern,
                                              reservation_id, holder_agent, occurred_at_ms)
                VALUES(?,?,?,?,?,?,?,?)
                """, ps -> {
            ps.setString(1, projectKey);
            ps.setString(2, eventType);
            ps.setString(3, agent);
            Sql.setNullableString(ps, 4, path);
            Sql.setNullableString(ps, 5, pattern);
            Sql.setNullableLong(ps, 6, reservationId);
            Sql.setNullableString(ps, 7, holder);
            ps.setLong(8, nowMs);
        });
    }

    private List<Reservation> readRows(Connection c, String sql, Sql.Binder binder) throws SQLException {
        List<Reservation> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Reservation(
                            rs.getLong("id"),
                            rs.getString("project_key"),
                            rs.getString("agent_name"),
                            rs.getString("path_pattern"),
                            rs.getInt("exclusive") == 1,
                            rs.getString("reason"),
                            rs.getString("cell_id"),
                            rs.getLong("created_at_ms"),
                            rs.getLong("expires_at_ms"),
                            Sql.getNullableLong(rs, "released_at_ms")
                    ));
                }
            }
        }
        return out;
    }

    private static void ensureNotCancelled() {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Reservation request cancelled");
        }
    }

    private static void requireAgent(String agent) {
        if (agent == null || agent.isBlank()) {
            throw new IllegalArgumentException("agent must not be blank");
        }
    }
}
