package io.swarmhive.projection;

import io.swarmhive.blocking.BlockingIndex;
import io.swarmhive.model.BlockedCell;
import io.swarmhive.model.Cell;
import io.swarmhive.model.CellFilter;
import io.swarmhive.model.CellStats;
import io.swarmhive.model.CellStatus;
import io.swarmhive.model.CellType;
import io.swarmhive.model.Comment;
import io.swarmhive.model.Dependency;
import io.swarmhive.model.Relationship;
import io.swarmhive.storage.Database;
import io.swarmhive.storage.Sql;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read side of the projections. List queries order by priority (highest first), then creation
 * time, then id.
 */
public final class CellQueries {
    private static final String CELL_COLUMNS = """
            SELECT id, project_key, type, status, title, description, priority, parent_id, assignee,
                   created_by, created_at_ms, updated_at_ms, closed_at_ms, closed_reason,
                   deleted_at_ms, deleted_by, delete_reason
            FROM cells
            """;
    private static final String ORDER = " ORDER BY priority DESC, created_at_ms ASC, id ASC";

    private final Database db;
    private final BlockingIndex blocking;
    private final Clock clock;

    public CellQueries(Database db, BlockingIndex blocking, Clock clock) {
        this.db = db;
        this.blocking = blocking;
        this.clock = clock;
    }

    public Optional<Cell> getCell(String projectKey, String cellId) {
        return db.query("read cell", c -> getCell(c, projectKey, cellId));
    }

    public Optional<Cell> getCell(Connection c, String projectKey, String cellId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(CELL_COLUMNS + "WHERE project_key=? AND id=?")) {
            ps.setString(1, projectKey);
            ps.setString(2, cellId);
            List<Cell> rows = readCells(ps);
            return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
        }
    }

    public List<Cell> queryCells(String projectKey, CellFilter filter) {
        CellFilter f = filter == null ? CellFilter.all() : filter;
        StringBuilder sql = new StringBuilder(CELL_COLUMNS).append("WHERE project_key=?");
        List<Object> args = new ArrayList<>();
        args.add(projectKey);
        if (!f.statuses().isEmpty()) {
            sql.append(" AND status IN (").append(Sql.placeholders(f.statuses().size())).append(')');
            f.statuses().stream().map(CellStatus::wire).sorted().forEach(args::add);
        }
        if (!f.types().isEmpty()) {
            sql.append(" AND type IN (").append(Sql.placeholders(f.types().size())).append(')');
            f.types().stream().map(CellType::wire).sorted().forEach(args::add);
        }
        if (f.parentId() != null) {
            sql.append(" AND parent_id=?");
            args.add(f.parentId());
        }
        if (f.assignee() != null) {
            sql.append(" AND assignee=?");
            args.add(f.assignee());
        }
        if (!f.includeDeleted()) {
            sql.append(" AND deleted_at_ms IS NULL");
        }
        sql.append(ORDER).append(" LIMIT ? OFFSET ?");
        args.add(f.limit());
        args.add(f.offset());
        return db.query("query cells", c -> {
            try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
                for (int i = 0; i < args.size(); i++) {
                    ps.setObject(i + 1, args.get(i));
                }
                return readCells(ps);
            }
        });
    }

    /**
     * Highest-priority open cell with no open blockers. Blockers are checked against the edges
     * rather than the cache, since picking work is the one place a stale cache would hurt.
     */
    public Optional<Cell> nextReady(String projectKey) {
        return db.query("select next ready cell", c -> {
            List<Cell> candidates;
            try (PreparedStatement ps = c.prepareStatement(
                    CELL_COLUMNS + "WHERE project_key=? AND status='open' AND deleted_at_ms IS NULL" + ORDER)) {
                ps.setString(1, projectKey);
                candidates = readCells(ps);
            }
            for (Cell cell : candidates) {
                if (blocking.verify(c, projectKey, cell.id()).isEmpty()) {
                    return Optional.of(cell);
                }
            }
            return Optional.<Cell>empty();
        });
    }

    public List<BlockedCell> blockedCells(String projectKey) {
        return db.query("list blocked cells", c -> {
            List<BlockedCell> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT c.id, c.project_key, c.type, c.status, c.title, c.description, c.priority, c.parent_id,
                           c.assignee, c.created_by, c.created_at_ms, c.updated_at_ms, c.closed_at_ms, c.closed_reason,
                           c.deleted_at_ms, c.deleted_by, c.delete_reason, b.blocker_ids
                    FROM blocked_cells_cache b
                    JOIN cells c ON c.project_key = b.project_key AND c.id = b.cell_id
                    WHERE b.project_key=? AND c.status<>'closed' AND c.deleted_at_ms IS NULL
                    ORDER BY c.priority DESC, c.created_at_ms ASC, c.id ASC
                    """)) {
                ps.setString(1, projectKey);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new BlockedCell(mapCell(rs), BlockingIndex.parseBlockers(rs.getString("blocker_ids"))));
                    }
                }
            }
            return out;
        });
    }

    /**
     * Open or in-progress cells not updated for {@code days} days, oldest first.
     */
    public List<Cell> staleCells(String projectKey, int days) {
        long cutoff = clock.millis() - Duration.ofDays(Math.max(0, days)).toMillis();
        return db.query("list stale cells", c -> {
            try (PreparedStatement ps = c.prepareStatement(CELL_COLUMNS + """
                    WHERE project_key=? AND status IN ('open','in_progress') AND deleted_at_ms IS NULL
                      AND updated_at_ms<?
                    ORDER BY updated_at_ms ASC, id ASC
                    """)) {
                ps.setString(1, projectKey);
                ps.setLong(2, cutoff);
                return readCells(ps);
            }
        });
    }

    public List<Cell> inProgressCells(String projectKey) {
        return queryCells(projectKey, CellFilter.all().withStatuses(CellStatus.IN_PROGRESS).page(Integer.MAX_VALUE, 0));
    }

    public List<Cell> epicChildren(String projectKey, String epicId) {
        return queryCells(projectKey, CellFilter.all().withParent(epicId).page(Integer.MAX_VALUE, 0));
    }

    public List<Cell> cellsWithLabel(String projectKey, String label) {
        return db.query("list cells by label", c -> {
            try (PreparedStatement ps = c.prepareStatement(CELL_COLUMNS + """
                    WHERE project_key=? AND deleted_at_ms IS NULL
                      AND id IN (SELECT cell_id FROM cell_labels WHERE project_key=cells.project_key AND label=?)
                    """ + ORDER)) {
                ps.setString(1, projectKey);
                ps.setString(2, label);
                return readCells(ps);
            }
        });
    }

    /**
     * Outgoing edges of {@code cellId}: the cells it waits on.
     */
    public List<Dependency> dependencies(String projectKey, String cellId) {
        return db.query("list dependencies", c -> dependencies(c, projectKey, cellId));
    }

    public List<Dependency> dependencies(Connection c, String projectKey, String cellId) throws SQLException {
        return readDependencies(c, "cell_id", projectKey, cellId);
    }

    /**
     * Incoming edges of {@code cellId}: the cells waiting on it.
     */
    public List<Dependency> dependents(String projectKey, String cellId) {
        return db.query("list dependents", c -> readDependencies(c, "depends_on_id", projectKey, cellId));
    }

    public List<String> labels(String projectKey, String cellId) {
        return db.query("list labels", c -> labels(c, projectKey, cellId));
    }

    public List<String> labels(Connection c, String projectKey, String cellId) throws SQLException {
        List<String> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT label FROM cell_labels WHERE project_key=? AND cell_id=? ORDER BY created_at_ms, label")) {
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

    public List<Comment> comments(String projectKey, String cellId) {
        return db.query("list comments", c -> comments(c, projectKey, cellId));
    }

    public List<Comment> comments(Connection c, String projectKey, String cellId) throws SQLException {
        List<Comment> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement("""
                SELECT id, cell_id, author, body, parent_id, created_at_ms, updated_at_ms
                FROM cell_comments WHERE project_key=? AND cell_id=? ORDER BY created_at_ms, rowid
                """)) {
            ps.setString(1, projectKey);
            ps.setString(2, cellId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Comment(
                            rs.getString("id"),
                            rs.getString("cell_id"),
                            rs.getString("author"),
                            rs.getString("body"),
                            rs.getString("parent_id"),
                            rs.getLong("created_at_ms"),
                            Sql.getNullableLong(rs, "updated_at_ms")
                    ));
                }
            }
        }
        return out;
    }

    public CellStats stats(String projectKey) {
        return db.query("compute cell stats", c -> {
            int total = 0;
            int open = 0;
            int inProgress = 0;
            int blockedStatus = 0;
            int closed = 0;
            int deleted = 0;
            Map<String, Integer> byType = new LinkedHashMap<>();
            try (PreparedStatement ps = c.prepareStatement("""
                    SELECT type, status, deleted_at_ms IS NOT NULL AS is_deleted, COUNT(*) AS n
                    FROM cells WHERE project_key=?
                    GROUP BY type, status, is_deleted
                    ORDER BY type
                    """)) {
                ps.setString(1, projectKey);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        int n = rs.getInt("n");
                        if (rs.getInt("is_deleted") == 1) {
                            deleted += n;
                            continue;
                        }
                        total += n;
                        byType.merge(rs.getString("type"), n, Integer::sum);
                        switch (CellStatus.fromString(rs.getString("status"))) {
                            case OPEN -> open += n;
                            case IN_PROGRESS -> inProgress += n;
                            case BLOCKED -> blockedStatus += n;
                            case CLOSED -> closed += n;
                        }
                    }
                }
            }
            return new CellStats(total, open, inProgress, blockedStatus, closed, deleted, byType);
        });
    }

    private List<Dependency> readDependencies(Connection c, String column, String projectKey, String id)
            throws SQLException {
        List<Dependency> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT cell_id, depends_on_id, relationship, created_at_ms, created_by FROM cell_dependencies"
                        + " WHERE project_key=? AND " + column + "=? ORDER BY created_at_ms, cell_id, depends_on_id")) {
            ps.setString(1, projectKey);
            ps.setString(2, id);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Dependency(
                            rs.getString("cell_id"),
                            rs.getString("depends_on_id"),
                            Relationship.fromString(rs.getString("relationship")),
                            rs.getLong("created_at_ms"),
                            rs.getString("created_by")
                    ));
                }
            }
        }
        return out;
    }

    private List<Cell> readCells(PreparedStatement ps) throws SQLException {
        List<Cell> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapCell(rs));
            }
        }
        return out;
    }

    private Cell mapCell(ResultSet rs) throws SQLException {
        return new Cell(
                rs.getString("id"),
                rs.getString("project_key"),
                CellType.fromString(rs.getString("type")),
                CellStatus.fromString(rs.getString("status")),
                rs.getString("title"),
                rs.getString("description"),
                rs.getInt("priority"),
                rs.getString("parent_id"),
                rs.getString("assignee"),
                rs.getString("created_by"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                Sql.getNullableLong(rs, "closed_at_ms"),
                rs.getString("closed_reason"),
                Sql.getNullableLong(rs, "deleted_at_ms"),
                rs.getString("deleted_by"),
                rs.getString("delete_reason")
        );
    }
}
