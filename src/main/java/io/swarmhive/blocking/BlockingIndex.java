package io.swarmhive.blocking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.swarmhive.storage.Database;
import io.swarmhive.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Materialized blocked-cell cache. A cell is blocked while any of its dependency edges, whatever
 * the relationship, points at a cell that is neither closed nor deleted. Rows exist only for
 * blocked cells; the cache can always be rebuilt from edges and statuses.
 */
public final class BlockingIndex {
    private static final Logger log = LoggerFactory.getLogger(BlockingIndex.class);
    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };
    private static final String OPEN_BLOCKERS_SQL = """
            SELECT DISTINCT d.depends_on_id
            FROM cell_dependencies d
            JOIN cells t ON t.project_key = d.project_key AND t.id = d.depends_on_id
            WHERE d.project_key=? AND d.cell_id=? AND t.status<>'closed' AND t.deleted_at_ms IS NULL
            ORDER BY d.depends_on_id
            """;

    private final Database db;
    private final Clock clock;

    public BlockingIndex(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    public boolean isBlocked(String projectKey, String cellId) {
        return db.query("check blocked cell", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT 1 FROM blocked_cells_cache WHERE project_key=? AND cell_id=?")) {
                ps.setString(1, projectKey);
                ps.setString(2, cellId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    public List<String> getBlockers(String projectKey, String cellId) {
        return db.query("read blockers", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT blocker_ids FROM blocked_cells_cache WHERE project_key=? AND cell_id=?")) {
                ps.setString(1, projectKey);
                ps.setString(2, cellId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? parseBlockers(rs.getString(1)) : List.of();
                }
            }
        });
    }

    /**
     * Open blockers computed from the edges, ignoring the cache.
     */
    public List<String> verify(String projectKey, String cellId) {
        return db.query("verify blockers", c -> verify(c, projectKey, cellId));
    }

    public List<String> verify(Connection c, String projectKey, String cellId) throws SQLException {
        return openBlockers(c, projectKey, cellId);
    }

    /**
     * Recomputes the cache row of {@code cellId} and of every cell depending on it directly.
     */
    public void invalidate(Connection c, String projectKey, String cellId) throws SQLException {
        recompute(c, projectKey, cellId);
        for (String dependent : directDependents(c, projectKey, cellId)) {
            recompute(c, projectKey, dependent);
        }
    }

    public int rebuild(String projectKey) {
        return db.inTransaction("rebuild blocked cache", c -> rebuild(c, projectKey));
    }

    public int rebuild(Connection c, String projectKey) throws SQLException {
        try (PreparedStatement del = c.prepareStatement("DELETE FROM blocked_cells_cache WHERE project_key=?")) {
            del.setString(1, projectKey);
            del.executeUpdate();
        }
        List<String> withEdges = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT DISTINCT cell_id FROM cell_dependencies
                WHERE project_key=?
                ORDER BY cell_id
                """)) {
            ps.setString(1, projectKey);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    withEdges.add(rs.getString(1));
                }
            }
        }
        int blocked = 0;
        for (String cellId : withEdges) {
            if (recompute(c, projectKey, cellId)) {
                blocked++;
            }
        }
        log.debug("Rebuilt blocked cache for {}: {} blocked of {} with edges", projectKey, blocked, withEdges.size());
        return blocked;
    }

    /**
     * Path from {@code dependsOnId} back to {@code cellId} if the edge {@code cellId -> dependsOnId}
     * would close a cycle. A self-edge is reported as a one-step cycle.
     */
    public Optional<List<String>> findCycle(String projectKey, String cellId, String dependsOnId) {
        return db.query("check dependency cycle", c -> findCycle(c, projectKey, cellId, dependsOnId));
    }

    public Optional<List<String>> findCycle(Connection c, String projectKey, String cellId, String dependsOnId)
            throws SQLException {
        if (cellId.equals(dependsOnId)) {
            return Optional.of(List.of(cellId, cellId));
        }
        Map<String, String> cameFrom = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(dependsOnId);
        cameFrom.put(dependsOnId, null);
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT DISTINCT depends_on_id FROM cell_dependencies WHERE project_key=? AND cell_id=?")) {
            ps.setString(1, projectKey);
            while (!queue.isEmpty()) {
                String current = queue.poll();
                if (current.equals(cellId)) {
                    List<String> path = new ArrayList<>();
                    for (String at = current; at != null; at = cameFrom.get(at)) {
                        path.add(at);
                    }
                    Collections.reverse(path);
                    path.add(0, cellId);
                    return Optional.of(path);
                }
                ps.setString(2, current);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        String next = rs.getString(1);
                        if (!cameFrom.containsKey(next)) {
                            cameFrom.put(next, current);
                            queue.add(next);
                        }
                    }
                }
            }
        }
        return Optional.empty();
    }

    private boolean recompute(Connection c, String projectKey, String cellId) throws SQLException {
        List<String> blockers = openBlockers(c, projectKey, cellId);
        if (blockers.isEmpty()) {
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM blocked_cells_cache WHERE project_key=? AND cell_id=?")) {
                ps.setString(1, projectKey);
                ps.setString(2, cellId);
                ps.executeUpdate();
            }
            return false;
        }
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO blocked_cells_cache(project_key, cell_id, blocker_ids, updated_at_ms) VALUES(?,?,?,?)
                ON CONFLICT(project_key, cell_id) DO UPDATE SET
                    blocker_ids=excluded.blocker_ids,
                    updated_at_ms=excluded.updated_at_ms
                """)) {
            ps.setString(1, projectKey);
            ps.setString(2, cellId);
            ps.setString(3, Jsons.toCompactJson(blockers));
            ps.setLong(4, clock.millis());
            ps.executeUpdate();
        }
        return true;
    }

    private List<String> openBlockers(Connection c, String projectKey, String cellId) throws SQLException {
        List<String> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(OPEN_BLOCKERS_SQL)) {
            ps.setString(1, projectKey);
            ps.setString(2, cellId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
        }
        return out;
    }

    private List<String> directDependents(Connection c, String projectKey, String cellId) throws SQLException {
        List<String> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT DISTINCT cell_id FROM cell_dependencies WHERE project_key=? AND depends_on_id=?")) {
            ps.setString(1, projectKey);
            ps.setString(2, cellId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(rs.getString(1));
                }
            }
        }
        return out;
    }

    public static List<String> parseBlockers(String json) {
        if (json == null || json.isBlank()) {
            return List.of();
        }
        try {
            return Jsons.compact().readValue(json, STRING_LIST);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Corrupt blocker list in cache: " + json, e);
        }
    }
}
