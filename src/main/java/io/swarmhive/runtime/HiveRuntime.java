package io.swarmhive.runtime;

import io.swarmhive.blocking.BlockingIndex;
import io.swarmhive.config.HiveConfig;
import io.swarmhive.config.HiveSettings;
import io.swarmhive.error.CellNotFoundException;
import io.swarmhive.error.DependencyCycleException;
import io.swarmhive.event.CellEvent;
import io.swarmhive.event.CellEventPayload;
import io.swarmhive.event.EventStore;
import io.swarmhive.event.EventValidator;
import io.swarmhive.export.DirtyTracker;
import io.swarmhive.export.FlushManager;
import io.swarmhive.export.FlushResult;
import io.swarmhive.export.ImportOptions;
import io.swarmhive.export.ImportResult;
import io.swarmhive.export.JsonlImporter;
import io.swarmhive.model.Cell;
import io.swarmhive.model.CellStatus;
import io.swarmhive.model.CellType;
import io.swarmhive.model.Comment;
import io.swarmhive.model.Relationship;
import io.swarmhive.projection.CellQueries;
import io.swarmhive.projection.ProjectionEngine;
import io.swarmhive.reservation.ReservationManager;
import io.swarmhive.storage.Database;
import io.swarmhive.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Context object for one project: owns the store and every component built on it. Nothing is held
 * in process globals; state shared between agents lives in the SQLite file.
 */
public final class HiveRuntime {
    private static final Logger log = LoggerFactory.getLogger(HiveRuntime.class);

    private final HiveConfig config;
    private final HiveSettings settings;
    private final Clock clock;
    private final Database db;
    private final DirtyTracker dirty;
    private final BlockingIndex blocking;
    private final EventStore events;
    private final CellQueries queries;
    private final FlushManager flushManager;
    private final JsonlImporter importer;
    private final ReservationManager reservations;

    public HiveRuntime(HiveConfig config, HiveSettings settings, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.clock = clock;
        this.db = new Database(config, settings);
        this.dirty = new DirtyTracker(db, clock);
        this.blocking = new BlockingIndex(db, clock);
        this.events = new EventStore(db, new ProjectionEngine(blocking, dirty), blocking, clock);
        this.queries = new CellQueries(db, blocking, clock);
        this.flushManager = new FlushManager(db, queries, dirty, config.exportFile());
        this.importer = new JsonlImporter(db, events, queries, clock);
        this.reservations = new ReservationManager(
                db, config.projectKey(), Duration.ofSeconds(settings.reservationTtlSeconds()), clock);
    }

    public static HiveRuntime open(String root, String projectKey) {
        HiveConfig config = HiveConfig.fromRoot(root, projectKey);
        HiveRuntime runtime = new HiveRuntime(config, HiveSettings.load(config.settingsFile()), Clock.systemUTC());
        runtime.init();
        return runtime;
    }

    public void init() {
        db.init();
        log.debug("Hive store ready at {} for project {}", config.dbFile(), config.projectKey());
    }

    public Cell createCell(CreateCellRequest request) {
        long now = clock.millis();
        String cellId = Ids.newCellId(config.idPrefix(), config.projectKey(), now);
        List<CellEventPayload> payloads = new ArrayList<>();
        payloads.add(new CellEventPayload.Created(
                request.title(),
                request.description(),
                request.type() == null ? CellType.TASK : request.type(),
                request.priority() == null ? CreateCellRequest.DEFAULT_PRIORITY : request.priority(),
                request.parentId(),
                request.createdBy()
        ));
        if (request.assignee() != null && !request.assignee().isBlank()) {
            payloads.add(new CellEventPayload.Assigned(request.assignee(), request.createdBy()));
        }
        List<CellEvent> batch = toEvents(cellId, now, payloads);
        batch.forEach(EventValidator::validate);
        db.inTransaction("create cell", c -> {
            if (request.parentId() != null && !request.parentId().isBlank()
                    && queries.getCell(c, config.projectKey(), request.parentId()).isEmpty()) {
                throw new CellNotFoundException(request.parentId());
            }
            for (CellEvent event : batch) {
                events.append(c, event);
            }
            return null;
        });
        log.debug("Created cell {}", cellId);
        return requireCell(cellId);
    }

    /**
     * Records only the fields that actually differ; with nothing to change no event is written.
     */
    public Cell updateCell(String cellId, UpdateCellRequest request) {
        Cell current = requireCell(cellId);
        CellEventPayload.Changes changes = new CellEventPayload.Changes(
                change(current.title(), request.title(), false),
                change(current.description(), request.description(), true),
                request.priority() == null || request.priority() == current.priority()
                        ? null : new CellEventPayload.Change<>(current.priority(), request.priority()),
                change(current.assignee(), request.assignee(), true)
        );
        if (changes.isEmpty()) {
            return current;
        }
        return emit(cellId, new CellEventPayload.Updated(changes, request.updatedBy()));
    }

    public Cell changeStatus(String cellId, CellStatus to, String reason, String actor) {
        Cell current = requireCell(cellId);
        if (current.status() == to) {
            return current;
        }
        return emit(cellId, new CellEventPayload.StatusChanged(current.status(), to, reason, actor));
    }

    public Cell startWork(String cellId, String agent) {
        requireCell(cellId);
        return emit(cellId, new CellEventPayload.WorkStarted(agent));
    }

    public Cell assign(String cellId, String assignee, String actor) {
        requireCell(cellId);
        return emit(cellId, new CellEventPayload.Assigned(assignee, actor));
    }

    /**
     * Closes the cell and releases every reservation tagged with it.
     */
    public Cell closeCell(String cellId, String reason, String closedBy, List<String> filesTouched, Long durationMs) {
        requireCell(cellId);
        Cell closed = emit(cellId, new CellEventPayload.Closed(reason, closedBy, filesTouched, durationMs));
        int released = reservations.releaseForCell(cellId);
        if (released > 0) {
            log.info("Released {} reservations held for closed cell {}", released, cellId);
        }
        return closed;
    }

    public Cell closeCell(String cellId, String reason) {
        return closeCell(cellId, reason, null, null, null);
    }

    public Cell reopenCell(String cellId, String reason, String actor) {
        Cell current = requireCell(cellId);
        if (!current.isClosed()) {
            return current;
        }
        return emit(cellId, new CellEventPayload.Reopened(reason, actor));
    }

    public Cell deleteCell(String cellId, String reason, String actor) {
        Cell current = requireCell(cellId);
        if (current.isDeleted()) {
            return current;
        }
        return emit(cellId, new CellEventPayload.Deleted(reason, actor));
    }

    /**
     * Adds {@code cellId -> dependsOnId}. Existence and cycle checks run in the same transaction as
     * the append, so two agents cannot race a cycle into the graph. The event store rejects the
     * cycle with {@link DependencyCycleException}.
     */
    public void addDependency(String cellId, String dependsOnId, Relationship relationship, String reason, String actor) {
        CellEvent event = new CellEvent(config.projectKey(), cellId, clock.millis(), new CellEventPayload.DependencyAdded(
                dependsOnId, relationship == null ? Relationship.BLOCKS : relationship, reason, actor));
        EventValidator.validate(event);
        db.inTransaction("add dependency", c -> {
            if (queries.getCell(c, config.projectKey(), cellId).isEmpty()) {
                throw new CellNotFoundException(cellId);
            }
            if (queries.getCell(c, config.projectKey(), dependsOnId).isEmpty()) {
                throw new CellNotFoundException(dependsOnId);
            }
            events.append(c, event);
            return null;
        });
    }

    public void removeDependency(String cellId, String dependsOnId, Relationship relationship, String reason, String actor) {
        requireCell(cellId);
        emit(cellId, new CellEventPayload.DependencyRemoved(
                dependsOnId, relationship == null ? Relationship.BLOCKS : relationship, reason, actor));
    }

    public void addLabel(String cellId, String label) {
        requireCell(cellId);
        emit(cellId, new CellEventPayload.LabelAdded(label));
    }

    public void removeLabel(String cellId, String label) {
        requireCell(cellId);
        emit(cellId, new CellEventPayload.LabelRemoved(label));
    }

    /**
     * @return the new comment's id, generated here so replays reproduce it
     */
    public String addComment(String cellId, String author, String body, String parentCommentId) {
        requireCell(cellId);
        String commentId = Ids.newCommentId(clock.millis());
        emit(cellId, new CellEventPayload.CommentAdded(commentId, author, body, parentCommentId));
        return commentId;
    }

    public void updateComment(String cellId, String commentId, String newBody, String actor) {
        requireComment(cellId, commentId);
        emit(cellId, new CellEventPayload.CommentUpdated(commentId, newBody, actor));
    }

    public void deleteComment(String cellId, String commentId, String actor) {
        requireComment(cellId, commentId);
        emit(cellId, new CellEventPayload.CommentDeleted(commentId, actor));
    }

    public void addChildToEpic(String epicId, String childId, String actor) {
        Cell epic = requireCell(epicId);
        if (epic.type() != CellType.EPIC) {
            throw new IllegalArgumentException("Cell " + epicId + " is a " + epic.type().wire() + ", not an epic");
        }
        requireCell(childId);
        int index = queries.epicChildren(config.projectKey(), epicId).size();
        emit(epicId, new CellEventPayload.EpicChildAdded(childId, index, actor));
    }

    public void removeChildFromEpic(String epicId, String childId, String reason, String actor) {
        requireCell(epicId);
        Cell child = requireCell(childId);
        if (!epicId.equals(child.parentId())) {
            return;
        }
        emit(epicId, new CellEventPayload.EpicChildRemoved(childId, reason, actor));
    }

    /**
     * True when the epic has at least one live child and every live child is closed.
     */
    public boolean isEpicClosureEligible(String epicId) {
        requireCell(epicId);
        List<Cell> children = queries.epicChildren(config.projectKey(), epicId);
        return !children.isEmpty() && children.stream().allMatch(Cell::isClosed);
    }

    public Optional<Cell> nextReady() {
        return queries.nextReady(config.projectKey());
    }

    public FlushResult flush() {
        return flushManager.flush(config.projectKey());
    }

    public String exportAll(boolean includeDeleted) {
        return flushManager.exportAll(config.projectKey(), includeDeleted);
    }

    public ImportResult importJsonl(String jsonl, ImportOptions options) {
        return importer.importJsonl(config.projectKey(), jsonl, options);
    }

    public int replay(boolean clearViews) {
        return events.replay(config.projectKey(), clearViews);
    }

    public HiveSession openSession(String agentName) {
        return new HiveSession(this, agentName);
    }

    public Cell requireCell(String cellId) {
        return queries.getCell(config.projectKey(), cellId).orElseThrow(() -> new CellNotFoundException(cellId));
    }

    public HiveConfig config() {
        return config;
    }

    public HiveSettings settings() {
        return settings;
    }

    public String projectKey() {
        return config.projectKey();
    }

    public Database database() {
        return db;
    }

    public EventStore events() {
        return events;
    }

    public CellQueries queries() {
        return queries;
    }

    public BlockingIndex blocking() {
        return blocking;
    }

    public DirtyTracker dirty() {
        return dirty;
    }

    public FlushManager flushManager() {
        return flushManager;
    }

    public ReservationManager reservations() {
        return reservations;
    }

    private Cell emit(String cellId, CellEventPayload payload) {
        events.append(new CellEvent(config.projectKey(), cellId, clock.millis(), payload));
        return requireCell(cellId);
    }

    private List<CellEvent> toEvents(String cellId, long now, List<CellEventPayload> payloads) {
        List<CellEvent> out = new ArrayList<>(payloads.size());
        for (CellEventPayload payload : payloads) {
            out.add(new CellEvent(config.projectKey(), cellId, now, payload));
        }
        return out;
    }

    private void requireComment(String cellId, String commentId) {
        boolean found = false;
        for (Comment comment : queries.comments(config.projectKey(), cellId)) {
            if (comment.id().equals(commentId)) {
                found = true;
                break;
            }
        }
        if (!found) {
            throw new IllegalArgumentException("Comment " + commentId + " not found on cell " + cellId);
        }
    }

    private static CellEventPayload.Change<String> change(String current, String requested, boolean clearable) {
        if (requested == null) {
            return null;
        }
        String target = clearable && requested.isBlank() ? null : requested;
        String normalizedCurrent = current == null || current.isBlank() ? null : current;
        if (Objects.equals(normalizedCurrent, target)) {
            return null;
        }
        return new CellEventPayload.Change<>(current, target);
    }
}
