package io.swarmhive.projection;

import io.swarmhive.blocking.BlockingIndex;
import io.swarmhive.event.CellEvent;
import io.swarmhive.event.CellEventPayload;
import io.swarmhive.event.StoredEvent;
import io.swarmhive.export.DirtyTracker;
import io.swarmhive.model.CellStatus;
import io.swarmhive.storage.Sql;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Folds events into the read tables. Runs inside the append transaction, so an event and its
 * projection commit or roll back together.
 */
public final class ProjectionEngine {
    private static final Logger log = LoggerFactory.getLogger(ProjectionEngine.class);

    private final BlockingIndex blocking;
    private final DirtyTracker dirty;

    public ProjectionEngine(BlockingIndex blocking, DirtyTracker dirty) {
        this.blocking = blocking;
        this.dirty = dirty;
    }

    /**
     * @return false when the event type is unrecognized and was skipped
     */
    public boolean apply(Connection c, StoredEvent stored) throws SQLException {
        CellEvent event = stored.event();
        boolean applied = event.payload().accept(new Handler(c, event));
        if (applied) {
            dirty.markDirty(c, event.projectKey(), event.cellId());
        }
        return applied;
    }

    /**
     * Removes every projected row of a project ahead of a replay. Events are left untouched.
     */
    public void clearProject(Connection c, String projectKey) throws SQLException {
        String[] statements = {
                "DELETE FROM cell_dependencies WHERE project_key=?",
                "DELETE FROM cell_labels WHERE project_key=?",
                "DELETE FROM cell_comments WHERE project_key=?",
                "DELETE FROM blocked_cells_cache WHERE project_key=?",
                "DELETE FROM cells WHERE project_key=?"
        };
        for (String sql : statements) {
            Sql.exec(c, sql, ps -> ps.setString(1, projectKey));
        }
    }

    private final class Handler implements CellEventPayload.Visitor<Boolean, SQLException> {
        private final Connection c;
        private final CellEvent event;

        private Handler(Connection c, CellEvent event) {
            this.c = c;
            this.event = event;
        }

        @Override
        public Boolean created(CellEventPayload.Created p) throws SQLException {
            Sql.exec(c, """
                    INSERT INTO cells(project_key, id, type, status, title, description, priority,
                                      parent_id, created_by, created_at_ms, updated_at_ms)
                    VALUES(?,?,?,?,?,?,?,?,?,?,?)
                    ON CONFLICT(project_key, id) DO NOTHING
                    """, ps -> {
                ps.setString(1, event.projectKey());
                ps.setString(2, event.cellId());
                ps.setString(3, p.issueType().wire());
                ps.setString(4, CellStatus.OPEN.wire());
                ps.setString(5, p.title());
                Sql.setNullableString(ps, 6, p.description());
                ps.setInt(7, p.priority());
                Sql.setNullableString(ps, 8, blankToNull(p.parentId()));
                Sql.setNullableString(ps, 9, p.createdBy());
                ps.setLong(10, event.timestampMs());
                ps.setLong(11, event.timestampMs());
            });
            // edges may already point at this id, e.g. during import
            blocking.invalidate(c, event.projectKey(), event.cellId());
            return true;
        }

        @Override
        public Boolean updated(CellEventPayload.Updated p) throws SQLException {
            CellEventPayload.Changes changes = p.changes();
            if (changes.title() != null) {
                setColumn("title", changes.title().to());
            }
            if (changes.description() != null) {
                setColumn("description", changes.description().to());
            }
            if (changes.priority() != null) {
                Sql.exec(c, "UPDATE cells SET priority=? WHERE project_key=? AND id=?", ps -> {
                    ps.setInt(1, changes.priority().to());
                    ps.setString(2, event.projectKey());
                    ps.setString(3, event.cellId());
                });
            }
            if (changes.assignee() != null) {
                setColumn("assignee", blankToNull(changes.assignee().to()));
            }
            touch();
            return true;
        }

        @Override
        public Boolean statusChanged(CellEventPayload.StatusChanged p) throws SQLException {
            // leaving closed through a plain status change clears the close fields too
            Sql.exec(c, """
                    UPDATE cells SET status=?, closed_at_ms=NULL, closed_reason=NULL, updated_at_ms=?
                    WHERE project_key=? AND id=?
                    """, ps -> {
                ps.setString(1, p.toStatus().wire());
                ps.setLong(2, event.timestampMs());
                ps.setString(3, event.projectKey());
                ps.setString(4, event.cellId());
            });
            blocking.invalidate(c, event.projectKey(), event.cellId());
            return true;
        }

        @Override
        public Boolean closed(CellEventPayload.Closed p) throws SQLException {
            Sql.exec(c, """
                    UPDATE cells SET status='closed', closed_at_ms=?, closed_reason=?, updated_at_ms=?
                    WHERE project_key=? AND id=?
                    """, ps -> {
                ps.setLong(1, event.timestampMs());
                ps.setString(2, p.reason());
                ps.setLong(3, event.timestampMs());
                ps.setString(4, event.projectKey());
                ps.setString(5, event.cellId());
            });
            blocking.invalidate(c, event.projectKey(), event.cellId());
            return true;
        }

        @Override
        public Boolean reopened(CellEventPayload.Reopened p) throws SQLException {
            Sql.exec(c, """
                    UPDATE cells SET status='open', closed_at_ms=NULL, closed_reason=NULL, updated_at_ms=?
                    WHERE project_key=? AND id=?
                    """, ps -> {
                ps.setLong(1, event.timestampMs());
                ps.setString(2, event.projectKey());
                ps.setString(3, event.cellId());
            });
            blocking.invalidate(c, event.projectKey(), event.cellId());
            return true;
        }

        @Override
        public Boolean deleted(CellEventPayload.Deleted p) throws SQLException {
            Sql.exec(c, """
                    UPDATE cells SET deleted_at_ms=?, deleted_by=?, delete_reason=?, updated_at_ms=?
                    WHERE project_key=? AND id=?
                    """, ps -> {
                ps.setLong(1, event.timestampMs());
                Sql.setNullableString(ps, 2, p.deletedBy());
                Sql.setNullableString(ps, 3, p.reason());
                ps.setLong(4, event.timestampMs());
                ps.setString(5, event.projectKey());
                ps.setString(6, event.cellId());
            });
            blocking.invalidate(c, event.projectKey(), event.cellId());
            return true;
        }

        @Override
        public Boolean dependencyAdded(CellEventPayload.DependencyAdded p) throws SQLException {
            Sql.exec(c, """
                    INSERT OR IGNORE INTO cell_dependencies(project_key, cell_id, depends_on_id, relationship,
                                                            created_at_ms, created_by)
                    VALUES(?,?,?,?,?,?)
                    """, ps -> {
                ps.setString(1, event.projectKey());
                ps.setString(2, event.cellId());
                ps.setString(3, p.dependsOnId());
                ps.setString(4, p.relationship().wire());
                ps.setLong(5, event.timestampMs());
                Sql.setNullableString(ps, 6, p.addedBy());
            });
            touch();
            blocking.invalidate(c, event.projectKey(), event.cellId());
            return true;
        }

        @Override
        public Boolean dependencyRemoved(CellEventPayload.DependencyRemoved p) throws SQLException {
            Sql.exec(c, """
                    DELETE FROM cell_dependencies
                    WHERE project_key=? AND cell_id=? AND depends_on_id=? AND relationship=?
                    """, ps -> {
                ps.setString(1, event.projectKey());
                ps.setString(2, event.cellId());
                ps.setString(3, p.dependsOnId());
                ps.setString(4, p.relationship().wire());
            });
            touch();
            blocking.invalidate(c, event.projectKey(), event.cellId());
            return true;
        }

        @Override
        public Boolean labelAdded(CellEventPayload.LabelAdded p) throws SQLException {
            Sql.exec(c, """
                    INSERT OR IGNORE INTO cell_labels(project_key, cell_id, label, created_at_ms) VALUES(?,?,?,?)
                    """, ps -> {
                ps.setString(1, event.projectKey());
                ps.setString(2, event.cellId());
                ps.setString(3, p.label());
                ps.setLong(4, event.timestampMs());
            });
            touch();
            return true;
        }

        @Override
        public Boolean labelRemoved(CellEventPayload.LabelRemoved p) throws SQLException {
            Sql.exec(c, "DELETE FROM cell_labels WHERE project_key=? AND cell_id=? AND label=?", ps -> {
                ps.setString(1, event.projectKey());
                ps.setString(2, event.cellId());
                ps.setString(3, p.label());
            });
            touch();
            return true;
        }

        @Override
        public Boolean commentAdded(CellEventPayload.CommentAdded p) throws SQLException {
            Sql.exec(c, """
                    INSERT INTO cell_comments(project_key, id, cell_id, author, body, parent_id, created_at_ms)
                    VALUES(?,?,?,?,?,?,?)
                    ON CONFLICT(project_key, id) DO NOTHING
                    """, ps -> {
                ps.setString(1, event.projectKey());
                ps.setString(2, p.commentId());
                ps.setString(3, event.cellId());
                ps.setString(4, p.author());
                ps.setString(5, p.body());
                Sql.setNullableString(ps, 6, blankToNull(p.parentCommentId()));
                ps.setLong(7, event.timestampMs());
            });
            touch();
            return true;
        }

        @Override
        public Boolean commentUpdated(CellEventPayload.CommentUpdated p) throws SQLException {
            Sql.exec(c, """
                    UPDATE cell_comments SET body=?, updated_at_ms=?
                    WHERE project_key=? AND id=? AND cell_id=?
                    """, ps -> {
                ps.setString(1, p.newBody());
                ps.setLong(2, event.timestampMs());
                ps.setString(3, event.projectKey());
                ps.setString(4, p.commentId());
                ps.setString(5, event.cellId());
            });
            touch();
            return true;
        }

        @Override
        public Boolean commentDeleted(CellEventPayload.CommentDeleted p) throws SQLException {
            Sql.exec(c, "DELETE FROM cell_comments WHERE project_key=? AND id=? AND cell_id=?", ps -> {
                ps.setString(1, event.projectKey());
                ps.setString(2, p.commentId());
                ps.setString(3, event.cellId());
            });
            touch();
            return true;
        }

        @Override
        public Boolean epicChildAdded(CellEventPayload.EpicChildAdded p) throws SQLException {
            Sql.exec(c, "UPDATE cells SET parent_id=?, updated_at_ms=? WHERE project_key=? AND id=?", ps -> {
                ps.setString(1, event.cellId());
                ps.setLong(2, event.timestampMs());
                ps.setString(3, event.projectKey());
                ps.setString(4, p.childId());
            });
            touch();
            dirty.markDirty(c, event.projectKey(), p.childId());
            return true;
        }

        @Override
        public Boolean epicChildRemoved(CellEventPayload.EpicChildRemoved p) throws SQLException {
            Sql.exec(c, """
                    UPDATE cells SET parent_id=NULL, updated_at_ms=?
                    WHERE project_key=? AND id=? AND parent_id=?
                    """, ps -> {
                ps.setLong(1, event.timestampMs());
                ps.setString(2, event.projectKey());
                ps.setString(3, p.childId());
                ps.setString(4, event.cellId());
            });
            touch();
            dirty.markDirty(c, event.projectKey(), p.childId());
            return true;
        }

        @Override
        public Boolean assigned(CellEventPayload.Assigned p) throws SQLException {
            setColumn("assignee", p.assignee());
            touch();
            return true;
        }

        @Override
        public Boolean workStarted(CellEventPayload.WorkStarted p) throws SQLException {
            Sql.exec(c, """
                    UPDATE cells SET status='in_progress', assignee=COALESCE(?, assignee), updated_at_ms=?
                    WHERE project_key=? AND id=? AND status<>'closed'
                    """, ps -> {
                Sql.setNullableString(ps, 1, blankToNull(p.agent()));
                ps.setLong(2, event.timestampMs());
                ps.setString(3, event.projectKey());
                ps.setString(4, event.cellId());
            });
            return true;
        }

        @Override
        public Boolean unrecognized(CellEventPayload.Unrecognized p) {
            log.warn("Skipping unrecognized event type {} for cell {}", p.typeName(), event.cellId());
            return false;
        }

        private void setColumn(String column, String value) throws SQLException {
            Sql.exec(c, "UPDATE cells SET " + column + "=? WHERE project_key=? AND id=?", ps -> {
                Sql.setNullableString(ps, 1, value);
                ps.setString(2, event.projectKey());
                ps.setString(3, event.cellId());
            });
        }

        private void touch() throws SQLException {
            Sql.exec(c, "UPDATE cells SET updated_at_ms=MAX(updated_at_ms, ?) WHERE project_key=? AND id=?", ps -> {
                ps.setLong(1, event.timestampMs());
                ps.setString(2, event.projectKey());
                ps.setString(3, event.cellId());
            });
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
