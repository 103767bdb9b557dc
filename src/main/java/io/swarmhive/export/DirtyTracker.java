package io.swarmhive.export;

import io.swarmhive.storage.Database;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Tracks cells whose projected state is newer than the export file. Re-marking a dirty cell always
 * moves its marker forward, even within the same millisecond, so a flush can tell a marker it
 * exported from one refreshed while it was writing.
 */
public final class DirtyTracker {
    private final Database db;
    private final Clock clock;

    public DirtyTracker(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    public void markDirty(Connection c, String projectKey, String cellId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO dirty_cells(project_key, cell_id, marked_at_ms) VALUES(?,?,?)
                ON CONFLICT(project_key, cell_id) DO UPDATE SET
                    marked_at_ms=MAX(excluded.marked_at_ms, dirty_cells.marked_at_ms + 1)
                """)) {
            ps.setString(1, projectKey);
            ps.setString(2, cellId);
            ps.setLong(3, clock.millis());
            ps.executeUpdate();
        }
    }

    public void markDirty(String projectKey, String cellId) {
        db.inTransaction("mark cell dirty", c -> {
            markDirty(c, projectKey, cellId);
            return null;
        });
    }

    public List<DirtyCell> getDirty(String projectKey) {
        return db.query("list dirty cells", c -> {
            List<DirtyCell> out = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT cell_id, marked_at_ms FROM dirty_cells WHERE project_key=? ORDER BY cell_id")) {
                ps.setString(1, projectKey);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(new DirtyCell(rs.getString("cell_id"), rs.getLong("marked_at_ms")));
                    }
                }
            }
            return out;
        });
    }

    public boolean isDirty(String projectKey, String cellId) {
        return db.query("check dirty cell", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT 1 FROM dirty_cells WHERE project_key=? AND cell_id=?")) {
                ps.setString(1, projectKey);
                ps.setString(2, cellId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next();
                }
            }
        });
    }

    /**
     * Removes the marker only if it was not refreshed after {@code markedAtUpToMs}.
     */
    public boolean clear(String projectKey, String cellId, long markedAtUpToMs) {
        return db.inTransaction("clear dirty cell", c -> clear(c, projectKey, cellId, markedAtUpToMs));
    }

    boolean clear(Connection c, String projectKey, String cellId, long markedAtUpToMs) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "DELETE FROM dirty_cells WHERE project_key=? AND cell_id=? AND marked_at_ms<=?")) {
            ps.setString(1, projectKey);
            ps.setString(2, cellId);
            ps.setLong(3, markedAtUpToMs);
            return ps.executeUpdate() > 0;
        }
    }

    public record DirtyCell(String cellId, long markedAtMs) {
    }
}
