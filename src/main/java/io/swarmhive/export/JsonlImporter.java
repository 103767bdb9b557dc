package io.swarmhive.export;

import io.swarmhive.error.DependencyCycleException;
import io.swarmhive.event.CellEvent;
import io.swarmhive.event.CellEventPayload;
import io.swarmhive.event.EventStore;
import io.swarmhive.event.EventValidator;
import io.swarmhive.model.Cell;
import io.swarmhive.model.CellStatus;
import io.swarmhive.model.CellType;
import io.swarmhive.model.Comment;
import io.swarmhive.model.Dependency;
import io.swarmhive.model.Relationship;
import io.swarmhive.projection.CellQueries;
import io.swarmhive.storage.Database;
import io.swarmhive.util.Ids;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Loads an export file back into a project. Every change goes through the event log, so an
 * imported project replays to the same state. Cells whose content hash already matches are skipped.
 */
public final class JsonlImporter {
    private static final Logger log = LoggerFactory.getLogger(JsonlImporter.class);
    private static final String IMPORT_ACTOR = "import";
    private static final String IMPORT_REASON = "imported";

    private final Database db;
    private final EventStore events;
    private final CellQueries queries;
    private final Clock clock;

    public JsonlImporter(Database db, EventStore events, CellQueries queries, Clock clock) {
        this.db = db;
        this.events = events;
        this.queries = queries;
        this.clock = clock;
    }

    public ImportResult importJsonl(String projectKey, String jsonl, ImportOptions options) {
        ImportOptions opts = options == null ? ImportOptions.defaults() : options;
        int created = 0;
        int updated = 0;
        int skipped = 0;
        List<String> errors = new ArrayList<>();
        String[] lines = jsonl == null ? new String[0] : jsonl.split("\r?\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i];
            if (line.isBlank()) {
                continue;
            }
            CellExport export;
            try {
                export = JsonlCodec.parseLine(line);
            } catch (Exception e) {
                errors.add("line " + (i + 1) + ": " + e.getMessage());
                continue;
            }
            try {
                switch (importOne(projectKey, export, opts, errors)) {
                    case CREATED -> created++;
                    case UPDATED -> updated++;
                    case SKIPPED -> skipped++;
                }
            } catch (RuntimeException e) {
                log.warn("Failed to import cell {}", export.id(), e);
                errors.add(export.id() + ": " + e.getMessage());
            }
        }
        log.info("Imported into {}: created={} updated={} skipped={} errors={}",
                projectKey, created, updated, skipped, errors.size());
        return new ImportResult(created, updated, skipped, errors);
    }

    private Outcome importOne(String projectKey, CellExport incoming, ImportOptions opts, List<String> errors) {
        Optional<Cell> existing = queries.getCell(projectKey, incoming.id());
        if (existing.isPresent()) {
            if (opts.skipExisting()) {
                return Outcome.SKIPPED;
            }
            CellExport current = JsonlCodec.toExport(
                    existing.get(),
                    queries.dependencies(projectKey, incoming.id()),
                    queries.labels(projectKey, incoming.id()),
                    queries.comments(projectKey, incoming.id())
            );
            if (JsonlCodec.contentHash(current).equals(JsonlCodec.contentHash(incoming))) {
                return Outcome.SKIPPED;
            }
            List<CellEvent> batch = updateEvents(projectKey, existing.get(), incoming);
            if (batch.isEmpty()) {
                return Outcome.SKIPPED;
            }
            if (!opts.dryRun()) {
                apply(incoming.id(), batch, errors);
            }
            return Outcome.UPDATED;
        }
        List<CellEvent> batch = createEvents(projectKey, incoming);
        if (!opts.dryRun()) {
            apply(incoming.id(), batch, errors);
        }
        return Outcome.CREATED;
    }

    /**
     * Appends one cell's events in a single transaction. A dependency edge that would close a cycle
     * is left out and reported; any other rejection rolls the whole cell back.
     */
    private void apply(String cellId, List<CellEvent> batch, List<String> errors) {
        for (CellEvent event : batch) {
            EventValidator.validate(event);
        }
        List<String> rejected = db.inTransaction("import cell " + cellId, c -> {
            List<String> cycles = new ArrayList<>();
            for (CellEvent event : batch) {
                try {
                    events.append(c, event);
                } catch (DependencyCycleException e) {
                    cycles.add(cellId + ": " + e.getMessage());
                }
            }
            return cycles;
        });
        for (String error : rejected) {
            log.warn("Skipped imported dependency: {}", error);
        }
        errors.addAll(rejected);
    }

    private List<CellEvent> createEvents(String projectKey, CellExport in) {
        long now = clock.millis();
        long createdAt = JsonlCodec.parseTimestamp(in.createdAt(), now);
        long updatedAt = Math.max(createdAt, JsonlCodec.parseTimestamp(in.updatedAt(), createdAt));
        Batch batch = new Batch(projectKey, in.id());
        batch.add(createdAt, new CellEventPayload.Created(
                in.title(),
                in.description(),
                CellType.fromString(in.issueType()),
                in.priority(),
                in.parentId(),
                IMPORT_ACTOR
        ));
        if (in.assignee() != null) {
            batch.add(updatedAt, new CellEventPayload.Assigned(in.assignee(), IMPORT_ACTOR));
        }
        for (CellExport.DependencyExport dep : in.dependencies()) {
            if (!in.id().equals(dep.dependsOnId())) {
                batch.add(updatedAt, new CellEventPayload.DependencyAdded(
                        dep.dependsOnId(), Relationship.fromString(dep.type()), IMPORT_REASON, IMPORT_ACTOR));
            }
        }
        for (String label : new LinkedHashSet<>(in.labels())) {
            batch.add(updatedAt, new CellEventPayload.LabelAdded(label));
        }
        for (CellExport.CommentExport comment : in.comments()) {
            batch.add(updatedAt, new CellEventPayload.CommentAdded(
                    Ids.newCommentId(now), comment.author(), comment.text(), null));
        }
        String status = in.status() == null ? CellStatus.OPEN.wire() : in.status();
        if (in.isTombstone()) {
            if (in.closedAt() != null) {
                batch.add(JsonlCodec.parseTimestamp(in.closedAt(), updatedAt), new CellEventPayload.Closed(IMPORT_REASON, IMPORT_ACTOR, null, null));
            }
            batch.add(updatedAt, new CellEventPayload.Deleted(IMPORT_REASON, IMPORT_ACTOR));
        } else {
            CellStatus target = CellStatus.fromString(status);
            if (target == CellStatus.CLOSED) {
                batch.add(JsonlCodec.parseTimestamp(in.closedAt(), updatedAt),
                        new CellEventPayload.Closed(IMPORT_REASON, IMPORT_ACTOR, null, null));
            } else if (target != CellStatus.OPEN) {
                batch.add(updatedAt, new CellEventPayload.StatusChanged(CellStatus.OPEN, target, IMPORT_REASON, IMPORT_ACTOR));
            }
        }
        return batch.events;
    }

    private List<CellEvent> updateEvents(String projectKey, Cell current, CellExport in) {
        long now = clock.millis();
        Batch batch = new Batch(projectKey, in.id());

        CellEventPayload.Change<String> title = Objects.equals(current.title(), in.title())
                ? null : new CellEventPayload.Change<>(current.title(), in.title());
        CellEventPayload.Change<String> description = Objects.equals(blankToNull(current.description()), in.description())
                ? null : new CellEventPayload.Change<>(current.description(), in.description());
        CellEventPayload.Change<Integer> priority = current.priority() == in.priority()
                ? null : new CellEventPayload.Change<>(current.priority(), in.priority());
        CellEventPayload.Change<String> assignee = Objects.equals(blankToNull(current.assignee()), in.assignee())
                ? null : new CellEventPayload.Change<>(current.assignee(), in.assignee());
        CellEventPayload.Changes changes = new CellEventPayload.Changes(title, description, priority, assignee);
        if (!changes.isEmpty()) {
            batch.add(now, new CellEventPayload.Updated(changes, IMPORT_ACTOR));
        }

        Set<String> wantedDeps = new LinkedHashSet<>();
        for (CellExport.DependencyExport dep : in.dependencies()) {
            if (!in.id().equals(dep.dependsOnId())) {
                wantedDeps.add(dep.dependsOnId() + "\n" + Relationship.fromString(dep.type()).wire());
            }
        }
        Set<String> haveDeps = new HashSet<>();
        for (Dependency dep : queries.dependencies(projectKey, in.id())) {
            String key = dep.dependsOnId() + "\n" + dep.relationship().wire();
            haveDeps.add(key);
            if (!wantedDeps.contains(key)) {
                batch.add(now, new CellEventPayload.DependencyRemoved(
                        dep.dependsOnId(), dep.relationship(), IMPORT_REASON, IMPORT_ACTOR));
            }
        }
        for (String key : wantedDeps) {
            if (!haveDeps.contains(key)) {
                String[] parts = key.split("\n", 2);
                batch.add(now, new CellEventPayload.DependencyAdded(
                        parts[0], Relationship.fromString(parts[1]), IMPORT_REASON, IMPORT_ACTOR));
            }
        }

        List<String> haveLabels = queries.labels(projectKey, in.id());
        for (String label : haveLabels) {
            if (!in.labels().contains(label)) {
                batch.add(now, new CellEventPayload.LabelRemoved(label));
            }
        }
        for (String label : new LinkedHashSet<>(in.labels())) {
            if (!haveLabels.contains(label)) {
                batch.add(now, new CellEventPayload.LabelAdded(label));
            }
        }

        Set<String> haveComments = new HashSet<>();
        for (Comment comment : queries.comments(projectKey, in.id())) {
            haveComments.add(comment.author() + "\n" + comment.body());
        }
        for (CellExport.CommentExport comment : in.comments()) {
            if (haveComments.add(comment.author() + "\n" + comment.text())) {
                batch.add(now, new CellEventPayload.CommentAdded(
                        Ids.newCommentId(now), comment.author(), comment.text(), null));
            }
        }

        addStatusEvents(batch, current, in, now);
        return batch.events;
    }

    private void addStatusEvents(Batch batch, Cell current, CellExport in, long now) {
        if (in.isTombstone()) {
            if (!current.isDeleted()) {
                batch.add(now, new CellEventPayload.Deleted(IMPORT_REASON, IMPORT_ACTOR));
            }
            return;
        }
        CellStatus target = CellStatus.fromString(in.status());
        if (target == current.status()) {
            return;
        }
        if (target == CellStatus.CLOSED) {
            batch.add(now, new CellEventPayload.Closed(IMPORT_REASON, IMPORT_ACTOR, null, null));
            return;
        }
        if (current.status() == CellStatus.CLOSED) {
            batch.add(now, new CellEventPayload.Reopened(IMPORT_REASON, IMPORT_ACTOR));
            if (target == CellStatus.OPEN) {
                return;
            }
        }
        batch.add(now, new CellEventPayload.StatusChanged(current.status(), target, IMPORT_REASON, IMPORT_ACTOR));
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private enum Outcome {
        CREATED,
        UPDATED,
        SKIPPED
    }

    private static final class Batch {
        private final String projectKey;
        private final String cellId;
        private final List<CellEvent> events = new ArrayList<>();

        private Batch(String projectKey, String cellId) {
            this.projectKey = projectKey;
            this.cellId = cellId;
        }

        private void add(long timestampMs, CellEventPayload payload) {
            events.add(new CellEvent(projectKey, cellId, timestampMs, payload));
        }
    }
}
