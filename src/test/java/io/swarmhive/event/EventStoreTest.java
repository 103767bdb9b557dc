package io.swarmhive.event;

import io.swarmhive.MutableClock;
import io.swarmhive.TestHives;
import io.swarmhive.error.EventValidationException;
import io.swarmhive.model.Cell;
import io.swarmhive.model.CellFilter;
import io.swarmhive.model.CellType;
import io.swarmhive.model.Relationship;
import io.swarmhive.runtime.CreateCellRequest;
import io.swarmhive.runtime.HiveRuntime;
import io.swarmhive.storage.Sql;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.swarmhive.TestHives.deleteRecursively;

final class EventStoreTest {

    @Test
    void sequencesArePerProjectAndGapless() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-events-seq-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            HiveRuntime runtime = TestHives.runtime(root, clock);
            EventStore events = runtime.events();

            Assertions.assertEquals(1L, events.append(created("proj-a", "a-1", clock.millis(), "first")));
            Assertions.assertEquals(2L, events.append(created("proj-a", "a-2", clock.millis(), "second")));
            Assertions.assertEquals(1L, events.append(created("proj-b", "b-1", clock.millis(), "other project")));
            List<Long> batch = events.appendAll(List.of(
                    new CellEvent("proj-a", "a-1", clock.millis(), new CellEventPayload.LabelAdded("backend")),
                    new CellEvent("proj-a", "a-1", clock.millis(), new CellEventPayload.WorkStarted("agent-1"))
            ));
            Assertions.assertEquals(List.of(3L, 4L), batch);

            Assertions.assertEquals(4L, events.latestSequence("proj-a"));
            Assertions.assertEquals(1L, events.latestSequence("proj-b"));
            Assertions.assertEquals(0L, events.latestSequence("proj-c"));

            List<StoredEvent> after = events.read("proj-a", 2L);
            Assertions.assertEquals(List.of(3L, 4L), after.stream().map(StoredEvent::sequence).toList());
            Assertions.assertEquals("cell_label_added", after.get(0).typeName());
            Assertions.assertInstanceOf(CellEventPayload.WorkStarted.class, after.get(1).event().payload());
            Assertions.assertEquals(4, events.read("proj-a", null).size());
            Assertions.assertEquals(3, events.readCell("proj-a", "a-1").size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void invalidEventLeavesNoTrace() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-events-invalid-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            HiveRuntime runtime = TestHives.runtime(root, clock);
            EventStore events = runtime.events();

            EventValidationException e = Assertions.assertThrows(EventValidationException.class, () -> events.append(
                    new CellEvent("proj", "c-1", clock.millis(),
                            new CellEventPayload.Created(" ", null, CellType.TASK, 7, null, null))));
            Assertions.assertEquals(2, e.problems().size());
            Assertions.assertTrue(e.problems().contains("title is required"));

            Assertions.assertThrows(EventValidationException.class, () -> events.appendAll(List.of(
                    created("proj", "c-2", clock.millis(), "valid"),
                    new CellEvent("proj", "c-2", 0L, new CellEventPayload.LabelAdded("x"))
            )));

            Assertions.assertEquals(0L, events.latestSequence("proj"));
            Assertions.assertTrue(runtime.queries().getCell("proj", "c-1").isEmpty());
            Assertions.assertTrue(runtime.queries().getCell("proj", "c-2").isEmpty());
            Assertions.assertTrue(runtime.dirty().getDirty("proj").isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void payloadSurvivesStorageWithSnakeCaseFields() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-events-codec-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            HiveRuntime runtime = TestHives.runtime(root, clock);
            runtime.events().append(created("proj", "c-1", clock.millis(), "codec"));
            CellEventPayload.Updated update = new CellEventPayload.Updated(new CellEventPayload.Changes(
                    new CellEventPayload.Change<>("codec", "codec v2"), null,
                    new CellEventPayload.Change<>(2, 3), null), "agent-7");
            runtime.events().append(new CellEvent("proj", "c-1", clock.millis(), update));

            String raw = runtime.database().query("read raw payload", c -> {
                try (var ps = c.prepareStatement("SELECT data FROM events WHERE sequence=2 AND project_key='proj'");
                     var rs = ps.executeQuery()) {
                    return rs.next() ? rs.getString(1) : null;
                }
            });
            Assertions.assertTrue(raw.contains("\"updated_by\":\"agent-7\""), raw);
            Assertions.assertTrue(raw.contains("\"old\":\"codec\""), raw);

            CellEventPayload back = runtime.events().read("proj", 1L).get(0).event().payload();
            Assertions.assertEquals(update, back);
            Cell cell = runtime.queries().getCell("proj", "c-1").orElseThrow();
            Assertions.assertEquals("codec v2", cell.title());
            Assertions.assertEquals(3, cell.priority());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void replayFromEmptyReproducesProjections() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-events-replay-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            HiveRuntime runtime = TestHives.runtime(root, clock);
            Cell epic = runtime.createCell(CreateCellRequest.of("Epic", CellType.EPIC).withPriority(1));
            clock.advanceMillis(10);
            Cell a = runtime.createCell(CreateCellRequest.of("A", CellType.TASK).withParent(epic.id()));
            clock.advanceMillis(10);
            Cell b = runtime.createCell(CreateCellRequest.of("B", CellType.BUG).withAssignee("agent-2"));
            clock.advanceMillis(10);
            runtime.addDependency(b.id(), a.id(), Relationship.BLOCKS, "needs A", "agent-1");
            runtime.addLabel(a.id(), "backend");
            runtime.addComment(a.id(), "agent-1", "looking into it", null);
            clock.advanceMillis(10);
            runtime.startWork(a.id(), "agent-1");
            clock.advanceMillis(10);
            runtime.closeCell(a.id(), "done");

            String project = runtime.projectKey();
            List<Cell> before = runtime.queries().queryCells(project, CellFilter.all().includingDeleted());
            List<String> labelsBefore = runtime.queries().labels(runtime.projectKey(), a.id());
            int commentsBefore = runtime.queries().comments(runtime.projectKey(), a.id()).size();
            boolean blockedBefore = runtime.blocking().isBlocked(project, b.id());

            long total = runtime.events().latestSequence(project);
            int applied = runtime.replay(true);
            Assertions.assertEquals(total, applied);

            Assertions.assertEquals(before, runtime.queries().queryCells(project, CellFilter.all().includingDeleted()));
            Assertions.assertEquals(labelsBefore, runtime.queries().labels(runtime.projectKey(), a.id()));
            Assertions.assertEquals(commentsBefore, runtime.queries().comments(runtime.projectKey(), a.id()).size());
            Assertions.assertEquals(blockedBefore, runtime.blocking().isBlocked(project, b.id()));
            Assertions.assertFalse(runtime.blocking().isBlocked(project, b.id()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownEventTypesAreSkippedOnReadAndReplay() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-events-unknown-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            HiveRuntime runtime = TestHives.runtime(root, clock);
            Cell cell = runtime.createCell(CreateCellRequest.of("Keep", CellType.TASK));
            String project = runtime.projectKey();

            runtime.database().inTransaction("insert future event", c -> Sql.exec(c, """
                    INSERT INTO events(project_key, sequence, type, cell_id, timestamp_ms, data, recorded_at_ms)
                    VALUES(?, 2, 'cell_archived', ?, ?, '{"archived_by":"future"}', ?)
                    """, ps -> {
                ps.setString(1, project);
                ps.setString(2, cell.id());
                ps.setLong(3, clock.millis());
                ps.setLong(4, clock.millis());
            }));
            clock.advanceMillis(5);
            runtime.addLabel(cell.id(), "after-unknown");

            List<StoredEvent> all = runtime.events().read(project, null);
            Assertions.assertEquals(3, all.size());
            CellEventPayload.Unrecognized unknown =
                    Assertions.assertInstanceOf(CellEventPayload.Unrecognized.class, all.get(1).event().payload());
            Assertions.assertEquals("cell_archived", unknown.typeName());
            Assertions.assertEquals("future", unknown.data().get("archived_by").asText());
            Assertions.assertEquals(3L, all.get(2).sequence());

            Assertions.assertEquals(2, runtime.replay(true));
            Assertions.assertEquals(List.of("after-unknown"), runtime.queries().labels(runtime.projectKey(), cell.id()));
        } finally {
            deleteRecursively(root);
        }
    }

    private static CellEvent created(String project, String cellId, long ts, String title) {
        return new CellEvent(project, cellId, ts, new CellEventPayload.Created(title, null, CellType.TASK, 2, null, null));
    }
}
