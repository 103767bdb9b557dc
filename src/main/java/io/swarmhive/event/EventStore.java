package io.swarmhive.event;

import io.swarmhive.blocking.BlockingIndex;
import io.swarmhive.error.CellNotFoundException;
import io.swarmhive.error.DependencyCycleException;
import io.swarmhive.error.EventValidationException;
import io.swarmhive.projection.ProjectionEngine;
import io.swarmhive.storage.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Append-only event log. Each append assigns the next per-project sequence and applies the
 * projection in the same immediate transaction.
 */
public final class EventStore {
    private static final Logger log = LoggerFactory.getLogger(EventStore.class);
    private static final String SELECT_COLUMNS =
            "SELECT id, project_key, sequence, type, cell_id, timestamp_ms, data, recorded_at_ms FROM events ";

    private final Database db;
    private final ProjectionEngine projections;
    private final BlockingIndex blocking;
    private final Clock clock;

    public EventStore(Database db, ProjectionEngine projections, BlockingIndex blocking, Clock clock) {
        this.db = db;
        this.projections = projections;
        this.blocking = blocking;
        this.clock = clock;
    }

    public long append(CellEvent event) {
        EventValidator.validate(event);
        return db.inTransaction("append " + event.typeName() + " event", c -> append(c, event).sequence());
    }

    /**
     * Appends all events atomically, in order. Every event is validated before anything is written.
     */
    public List<Long> appendAll(List<CellEvent> events) {
        if (events == null || events.isEmpty()) {
            return List.of();
        }
        for (CellEvent event : events) {
            EventValidator.validate(event);
        }
        return db.inTransaction("append event batch", c -> {
            List<Long> sequences = new ArrayList<>(events.size());
            for (CellEvent event : events) {
                sequences.add(append(c, event).sequence());
            }
            return sequences;
        });
    }

    /**
     * Appends inside a caller-owned transaction. The caller is responsible for validation.
     * A {@code cell_created} for a cell the project already has, an event for a cell it does not
     * have, and a dependency edge that would close a cycle are all rejected before anything is
     * written, so the caller may catch the exception and keep using the transaction.
     */
    public StoredEvent append(Connection c, CellEvent event) throws SQLException {
        checkTarget(c, event);
        long sequence = nextSequence(c, event.projectKey());
        long recordedAt = clock.millis();
        long id;
        try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO events(project_key, sequence, type, cell_id, timestamp_ms, data, recorded_at_ms)
                VALUES(?,?,?,?,?,?,?)
                """)) {
            ps.setString(1, event.projectKey());
            ps.setLong(2, sequence);
            ps.setString(3, event.typeName());
            ps.setString(4, event.cellId());
            ps.setLong(5, event.timestampMs());
            ps.setString(6, EventCodec.encode(event.payload()));
            ps.setLong(7, recordedAt);
            ps.executeUpdate();
        }
        try (PreparedStatement ps = c.prepareStatement("SELECT last_insert_rowid()");
             ResultSet rs = ps.executeQuery()) {
            id = rs.next() ? rs.getLong(1) : 0L;
        }
        StoredEvent stored = new StoredEvent(id, sequence, recordedAt, event);
        projections.apply(c, stored);
        log.debug("Appended {} #{} for {}", event.typeName(), sequence, event.cellId());
        return stored;
    }

    /**
     * Events of a project in sequence order, strictly after {@code sinceSequence} when given.
     */
    public List<StoredEvent> read(String projectKey, Long sinceSequence) {
        return db.query("read events", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    SELECT_COLUMNS + "WHERE project_key=? AND sequence>? ORDER BY sequence")) {
                ps.setString(1, projectKey);
                ps.setLong(2, sinceSequence == null ? 0L : sinceSequence);
                return readRows(ps);
            }
        });
    }

    public List<StoredEvent> readCell(String projectKey, String cellId) {
        return db.query("read cell events", c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    SELECT_COLUMNS + "WHERE project_key=? AND cell_id=? ORDER BY sequence")) {
                ps.setString(1, projectKey);
                ps.setString(2, cellId);
                return readRows(ps);
            }
        });
    }

    public long latestSequence(String projectKey) {
        return db.query("read latest sequence", c -> latestSequence(c, projectKey));
    }

    /**
     * Rebuilds the projections of one project from its log. With {@code clearViews} the projected
     * rows are dropped first, so the result equals applying every event from empty.
     *
     * @return number of events applied
     */
    public int replay(String projectKey, boolean clearViews) {
        return db.inTransaction("replay events", c -> {
            if (clearViews) {
                projections.clearProject(c, projectKey);
            }
            int applied = 0;
            try (PreparedStatement ps = c.prepareStatement(
                    SELECT_COLUMNS + "WHERE project_key=? ORDER BY sequence")) {
                ps.setString(1, projectKey);
                for (StoredEvent stored : readRows(ps)) {
                    if (projections.apply(c, stored)) {
                        applied++;
                    }
                }
            }
            blocking.rebuild(c, projectKey);
            log.info("Replayed {} events for {}", applied, projectKey);
            return applied;
        });
    }

    private void checkTarget(Connection c, CellEvent event) throws SQLException {
        CellEventPayload payload = event.payload();
        if (payload instanceof CellEventPayload.Unrecognized) {
            return;
        }
        boolean exists = cellExists(c, event.projectKey(), event.cellId());
        if (payload instanceof CellEventPayload.Created) {
            if (exists) {
                throw new EventValidationException(event.typeName(), List.of(
                        "cell " + event.cellId() + " already exists in project " + event.projectKey()));
            }
            return;
        }
        if (!exists) {
            throw new CellNotFoundException(event.cellId());
        }
        if (payload instanceof CellEventPayload.DependencyAdded added) {
            Optional<List<String>> cycle = blocking.findCycle(c, event.projectKey(), event.cellId(), added.dependsOnId());
            if (cycle.isPresent()) {
                throw new DependencyCycleException(
                        "Dependency " + event.cellId() + " -> " + added.dependsOnId() + " would create a cycle: "
                                + String.join(" -> ", cycle.get()),
                        cycle.get());
            }
        }
    }

    private static boolean cellExists(Connection c, String projectKey, String cellId) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM cells WHERE project_key=? AND id=?")) {
            ps.setString(1, projectKey);
            ps.setString(2, cellId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private long nextSequence(Connection c, String projectKey) throws SQLException {
        return latestSequence(c, projectKey) + 1L;
    }

    private long latestSequence(Connection c, String projectKey) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT COALESCE(MAX(sequence), 0) FROM events WHERE project_key=?")) {
            ps.setString(1, projectKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        }
    }

    private List<StoredEvent> readRows(PreparedStatement ps) throws SQLException {
        List<StoredEvent> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                String type = rs.getString("type");
                CellEvent event = new CellEvent(
                        rs.getString("project_key"),
                        rs.getString("cell_id"),
                        rs.getLong("timestamp_ms"),
                        EventCodec.decode(type, rs.getString("data"))
                );
                out.add(new StoredEvent(
                        rs.getLong("id"),
                        rs.getLong("sequence"),
                        rs.getLong("recorded_at_ms"),
                        event
                ));
            }
        }
        return out;
    }
}
