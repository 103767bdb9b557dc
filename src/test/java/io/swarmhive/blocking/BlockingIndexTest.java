package io.swarmhive.blocking;

import io.swarmhive.MutableClock;
import io.swarmhive.TestHives;
import io.swarmhive.error.CellNotFoundException;
import io.swarmhive.error.DependencyCycleException;
import io.swarmhive.model.BlockedCell;
import io.swarmhive.model.Cell;
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

final class BlockingIndexTest {

    @Test
    void blockersFollowTheStatusOfWhatTheyWaitOn() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-blocking-epic-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            HiveRuntime runtime = TestHives.runtime(root, clock);
            String project = runtime.projectKey();
            BlockingIndex blocking = runtime.blocking();

            Cell epic = runtime.createCell(CreateCellRequest.of("Auth rework", CellType.EPIC).withPriority(1));
            clock.advanceMillis(10);
            Cell schema = runtime.createCell(CreateCellRequest.of("Schema", CellType.TASK).withParent(epic.id()));
            clock.advanceMillis(10);
            Cell api = runtime.createCell(CreateCellRequest.of("API", CellType.TASK).withParent(epic.id()));
            clock.advanceMillis(10);

            runtime.addDependency(api.id(), schema.id(), Relationship.BLOCKS, null, "agent");
            Assertions.assertTrue(blocking.isBlocked(project, api.id()));
            Assertions.assertEquals(List.of(schema.id()), blocking.getBlockers(project, api.id()));
            Assertions.assertFalse(blocking.isBlocked(project, schema.id()));
            List<BlockedCell> blocked = runtime.queries().blockedCells(project);
            Assertions.assertEquals(1, blocked.size());
            Assertions.assertEquals(api.id(), blocked.get(0).cell().id());
            Assertions.assertEquals(schema.id(), runtime.nextReady().orElseThrow().id());

            runtime.closeCell(schema.id(), "migrated");
            Assertions.assertFalse(blocking.isBlocked(project, api.id()));
            Assertions.assertTrue(runtime.queries().blockedCells(project).isEmpty());
            Assertions.assertEquals(api.id(), runtime.nextReady().orElseThrow().id());

            runtime.reopenCell(schema.id(), "missing index", "agent");
            Assertions.assertEquals(List.of(schema.id()), blocking.getBlockers(project, api.id()));

            runtime.deleteCell(schema.id(), "folded into API", "agent");
            Assertions.assertFalse(blocking.isBlocked(project, api.id()));
            Assertions.assertEquals(api.id(), runtime.nextReady().orElseThrow().id());

            runtime.closeCell(api.id(), "done");
            Assertions.assertEquals(epic.id(), runtime.nextReady().orElseThrow().id());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void everyRelationshipTypeBlocks() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-blocking-kinds-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            HiveRuntime runtime = TestHives.runtime(root, clock);
            Cell target = runtime.createCell(CreateCellRequest.of("target", CellType.TASK));
            for (Relationship relationship : Relationship.values()) {
                clock.advanceMillis(1);
                Cell cell = runtime.createCell(CreateCellRequest.of("via " + relationship.wire(), CellType.TASK));
                runtime.addDependency(cell.id(), target.id(), relationship, null, null);
                Assertions.assertTrue(runtime.blocking().isBlocked(runtime.projectKey(), cell.id()), relationship.wire());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cyclesAndSelfEdgesAreRejected() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-blocking-cycle-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            HiveRuntime runtime = TestHives.runtime(root, clock);
            Cell a = runtime.createCell(CreateCellRequest.of("A", CellType.TASK));
            Cell b = runtime.createCell(CreateCellRequest.of("B", CellType.TASK));
            Cell c = runtime.createCell(CreateCellRequest.of("C", CellType.TASK));
            runtime.addDependency(b.id(), a.id(), Relationship.BLOCKS, null, null);
            runtime.addDependency(c.id(), b.id(), Relationship.BLOCKS, null, null);
            long sequence = runtime.events().latestSequence(runtime.projectKey());

            DependencyCycleException cycle = Assertions.assertThrows(DependencyCycleException.class,
                    () -> runtime.addDependency(a.id(), c.id(), Relationship.BLOCKS, null, null));
            Assertions.assertEquals(List.of(a.id(), c.id(), b.id(), a.id()), cycle.path());

            DependencyCycleException self = Assertions.assertThrows(DependencyCycleException.class,
                    () -> runtime.addDependency(a.id(), a.id(), Relationship.RELATED, null, null));
            Assertions.assertEquals(List.of(a.id(), a.id()), self.path());

            Assertions.assertThrows(CellNotFoundException.class,
                    () -> runtime.addDependency(a.id(), "missing-cell", Relationship.BLOCKS, null, null));
            Assertions.assertEquals(sequence, runtime.events().latestSequence(runtime.projectKey()));
            Assertions.assertTrue(runtime.blocking().findCycle(runtime.projectKey(), c.id(), a.id()).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void rebuildRestoresCacheFromEdges() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-blocking-rebuild-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            HiveRuntime runtime = TestHives.runtime(root, clock);
            String project = runtime.projectKey();
            Cell a = runtime.createCell(CreateCellRequest.of("A", CellType.TASK));
            Cell b = runtime.createCell(CreateCellRequest.of("B", CellType.TASK));
            Cell c = runtime.createCell(CreateCellRequest.of("C", CellType.TASK));
            runtime.addDependency(b.id(), a.id(), Relationship.BLOCKS, null, null);
            runtime.addDependency(c.id(), a.id(), Relationship.BLOCKS, null, null);
            runtime.addDependency(c.id(), b.id(), Relationship.BLOCKS, null, null);

            runtime.database().inTransaction("wipe cache", conn ->
                    Sql.exec(conn, "DELETE FROM blocked_cells_cache", ps -> {
                    }));
            Assertions.assertFalse(runtime.blocking().isBlocked(project, c.id()));
            Assertions.assertEquals(List.of(a.id(), b.id()).stream().sorted().toList(),
                    runtime.blocking().verify(project, c.id()));

            Assertions.assertEquals(2, runtime.blocking().rebuild(project));
            Assertions.assertTrue(runtime.blocking().isBlocked(project, b.id()));
            Assertions.assertEquals(List.of(a.id(), b.id()).stream().sorted().toList(),
                    runtime.blocking().getBlockers(project, c.id()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nextReadySkipsCellsWithOpenBlockersEvenIfCacheIsStale() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-blocking-ready-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            HiveRuntime runtime = TestHives.runtime(root, clock);
            Cell urgent = runtime.createCell(CreateCellRequest.of("urgent", CellType.BUG).withPriority(3));
            clock.advanceMillis(1);
            Cell prerequisite = runtime.createCell(CreateCellRequest.of("prerequisite", CellType.TASK).withPriority(0));
            runtime.addDependency(urgent.id(), prerequisite.id(), Relationship.BLOCKS, null, null);
            runtime.database().inTransaction("wipe cache", conn ->
                    Sql.exec(conn, "DELETE FROM blocked_cells_cache", ps -> {
                    }));

            Assertions.assertEquals(prerequisite.id(), runtime.nextReady().orElseThrow().id());
            runtime.startWork(prerequisite.id(), "agent");
            Assertions.assertTrue(runtime.nextReady().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void parseBlockersHandlesEmptyValues() {
        Assertions.assertEquals(List.of(), BlockingIndex.parseBlockers(null));
        Assertions.assertEquals(List.of(), BlockingIndex.parseBlockers(" "));
        Assertions.assertEquals(List.of("x-1", "x-2"), BlockingIndex.parseBlockers("[\"x-1\",\"x-2\"]"));
        Assertions.assertThrows(IllegalStateException.class, () -> BlockingIndex.parseBlockers("[oops"));
    }
}
