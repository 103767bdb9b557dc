package io.swarmhive.export;

import io.swarmhive.MutableClock;
import io.swarmhive.TestHives;
import io.swarmhive.model.Cell;
import io.swarmhive.model.CellType;
import io.swarmhive.model.Relationship;
import io.swarmhive.runtime.CreateCellRequest;
import io.swarmhive.runtime.HiveRuntime;
import io.swarmhive.runtime.UpdateCellRequest;
import io.swarmhive.storage.Sql;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static io.swarmhive.TestHives.deleteRecursively;

final class FlushManagerTest {

    @Test
    void flushMergesIntoExistingFileWithoutClobbering() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-flush-merge-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            HiveRuntime runtime = TestHives.runtime(root, clock);
            Path file = runtime.config().exportFile();
            Files.createDirectories(file.getParent());
            String foreign = "{\"id\":\"zz-foreign-1\",\"title\":\"written by another clone\",\"status\":\"open\"}";
            Files.writeString(file, foreign + "\n", StandardCharsets.UTF_8);

            Cell cell = runtime.createCell(CreateCellRequest.of("local work", CellType.TASK));
            FlushResult first = runtime.flush();
            Assertions.assertEquals(1, first.exportedCount());
            Assertions.assertTrue(first.failedCellIds().isEmpty());
            Assertions.assertTrue(runtime.dirty().getDirty(runtime.projectKey()).isEmpty());

            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Assertions.assertEquals(2, lines.size());
            Assertions.assertEquals(foreign, lines.get(0));
            Assertions.assertEquals(cell.id(), JsonlCodec.idOf(lines.get(1)));

            byte[] before = Files.readAllBytes(file);
            Assertions.assertEquals(0, runtime.flush().exportedCount());
            Assertions.assertArrayEquals(before, Files.readAllBytes(file));

            clock.advanceMillis(100);
            runtime.updateCell(cell.id(), new UpdateCellRequest("local work, renamed", null, null, null, "agent"));
            Assertions.assertEquals(1, runtime.flush().exportedCount());
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            Assertions.assertEquals(2, lines.size());
            Assertions.assertEquals(foreign, lines.get(0));
            Assertions.assertEquals("local work, renamed", JsonlCodec.parseLine(lines.get(1)).title());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nothingDirtyWritesNothing() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-flush-empty-");
        try {
            HiveRuntime runtime = TestHives.runtime(root, new MutableClock(1_700_000_000_000L));
            FlushResult result = runtime.flush();
            Assertions.assertEquals(FlushResult.empty(), result);
            Assertions.assertFalse(Files.exists(runtime.config().exportFile()));

            runtime.dirty().markDirty(runtime.projectKey(), "ghost-cell");
            Assertions.assertEquals(0, runtime.flush().exportedCount());
            Assertions.assertFalse(runtime.dirty().isDirty(runtime.projectKey(), "ghost-cell"));
            Assertions.assertFalse(Files.exists(runtime.config().exportFile()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void deletedCellsAreWrittenAsTombstones() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-flush-tombstone-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            HiveRuntime runtime = TestHives.runtime(root, clock);
            Cell cell = runtime.createCell(CreateCellRequest.of("short lived", CellType.CHORE));
            runtime.flush();
            clock.advanceMillis(10);
            runtime.deleteCell(cell.id(), "duplicate", "agent");
            runtime.flush();

            List<String> lines = Files.readAllLines(runtime.config().exportFile(), StandardCharsets.UTF_8);
            Assertions.assertEquals(1, lines.size());
            CellExport export = JsonlCodec.parseLine(lines.get(0));
            Assertions.assertTrue(export.isTombstone());
            Assertions.assertEquals("tombstone", export.status());

            Assertions.assertEquals("", runtime.exportAll(false));
            Assertions.assertEquals(lines.get(0) + "\n", runtime.exportAll(true));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void exportImportRoundTripIsByteIdentical() throws Exception {
        Path rootA = Files.createTempDirectory("swarmhive-test-flush-roundtrip-a-");
        Path rootB = Files.createTempDirectory("swarmhive-test-flush-roundtrip-b-");
        try {
            MutableClock clock = new MutableClock(1_700_000_001_000L);
            HiveRuntime source = TestHives.runtime(rootA, clock);
            Cell a = source.createCell(CreateCellRequest.of("Design schema", CellType.FEATURE)
                    .withDescription("tables and indexes").withPriority(3));
            clock.advanceMillis(1_000);
            Cell b = source.createCell(CreateCellRequest.of("Write API", CellType.TASK));
            clock.advanceMillis(1_000);
            source.addDependency(b.id(), a.id(), Relationship.BLOCKS, null, "agent-1");
            clock.advanceMillis(1_000);
            source.addLabel(a.id(), "alpha");
            clock.advanceMillis(1_000);
            source.addLabel(a.id(), "beta");
            clock.advanceMillis(1_000);
            source.addComment(a.id(), "agent-1", "first pass done", null);
            clock.advanceMillis(1_000);
            source.closeCell(a.id(), "merged");
            clock.advanceMillis(1_000);
            source.assign(b.id(), "agent-2", "agent-1");

            Assertions.assertEquals(2, source.flush().exportedCount());
            String exported = Files.readString(source.config().exportFile(), StandardCharsets.UTF_8);

            MutableClock laterClock = new MutableClock(1_800_000_000_000L);
            HiveRuntime target = TestHives.runtime(rootB, "/elsewhere/clone", laterClock);
            ImportResult imported = target.importJsonl(exported, ImportOptions.defaults());
            Assertions.assertEquals(new ImportResult(2, 0, 0, List.of()), imported);
            Assertions.assertEquals(exported, target.exportAll(false));
            Assertions.assertFalse(target.blocking().isBlocked(target.projectKey(), b.id()));

            ImportResult again = target.importJsonl(exported, ImportOptions.defaults());
            Assertions.assertEquals(new ImportResult(0, 0, 2, List.of()), again);

            String edited = exported.replace("\"title\":\"Write API\"", "\"title\":\"Write public API\"");
            ImportResult changed = target.importJsonl(edited, ImportOptions.defaults());
            Assertions.assertEquals(new ImportResult(0, 1, 1, List.of()), changed);
            Assertions.assertEquals("Write public API", target.requireCell(b.id()).title());
        } finally {
            deleteRecursively(rootA);
            deleteRecursively(rootB);
        }
    }

    @Test
    void cellThatFailsToExportStaysDirtyWhileTheRestFlush() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-flush-partial-");
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            HiveRuntime runtime = TestHives.runtime(root, clock);
            String project = runtime.projectKey();
            Cell good = runtime.createCell(CreateCellRequest.of("exports fine", CellType.TASK));
            Cell bad = runtime.createCell(CreateCellRequest.of("has a broken edge", CellType.TASK));
            runtime.database().inTransaction("insert broken dependency", c -> Sql.exec(c, """
                    INSERT INTO cell_dependencies(project_key, cell_id, depends_on_id, relationship, created_at_ms, created_by)
                    VALUES(?, ?, ?, 'weird', ?, NULL)
                    """, ps -> {
                ps.setString(1, project);
                ps.setString(2, bad.id());
                ps.setString(3, good.id());
                ps.setLong(4, clock.millis());
            }));

            FlushResult result = runtime.flush();
            Assertions.assertEquals(1, result.exportedCount());
            Assertions.assertEquals(List.of(bad.id()), result.failedCellIds());
            Assertions.assertTrue(runtime.dirty().isDirty(project, bad.id()));
            Assertions.assertFalse(runtime.dirty().isDirty(project, good.id()));

            List<String> lines = Files.readAllLines(runtime.config().exportFile(), StandardCharsets.UTF_8);
            Assertions.assertEquals(1, lines.size());
            Assertions.assertEquals(good.id(), JsonlCodec.idOf(lines.get(0)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runtimesSharingAnExportFileFlushWithoutLosingLines() throws Exception {
        Path root = Files.createTempDirectory("swarmhive-test-flush-shared-");
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            MutableClock clock = new MutableClock(1_700_000_000_000L);
            HiveRuntime one = TestHives.runtime(root, "/work/flush-one", clock);
            HiveRuntime two = TestHives.runtime(root, "/work/flush-two", clock);
            Assertions.assertEquals(one.config().exportFile(), two.config().exportFile());
            List<String> ids = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                ids.add(one.createCell(CreateCellRequest.of("one-" + i, CellType.TASK)).id());
                ids.add(two.createCell(CreateCellRequest.of("two-" + i, CellType.TASK)).id());
            }

            CountDownLatch start = new CountDownLatch(1);
            Future<FlushResult> first = pool.submit(() -> {
                start.await();
                return one.flush();
            });
            Future<FlushResult> second = pool.submit(() -> {
                start.await();
                return two.flush();
            });
            start.countDown();
            Assertions.assertEquals(5, first.get(30, TimeUnit.SECONDS).exportedCount());
            Assertions.assertEquals(5, second.get(30, TimeUnit.SECONDS).exportedCount());

            List<String> written = new ArrayList<>();
            for (String line : Files.readAllLines(one.config().exportFile(), StandardCharsets.UTF_8)) {
                written.add(JsonlCodec.idOf(line));
            }
            Assertions.assertEquals(10, written.size());
            Assertions.assertTrue(written.containsAll(ids), written.toString());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }
}
