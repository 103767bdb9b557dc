package io.swarmhive.export;

import io.swarmhive.error.HiveException;
import io.swarmhive.model.Cell;
import io.swarmhive.model.CellFilter;
import io.swarmhive.projection.CellQueries;
import io.swarmhive.storage.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Merges dirty cells into the export file. Lines of clean cells are left where they are, changed
 * cells are replaced in place and new cells are appended in id order. The file is written through
 * a temporary sibling and an atomic move while holding {@code <file>.lock}.
 */
public final class FlushManager {
    private static final Logger log = LoggerFactory.getLogger(FlushManager.class);
    private static final long LOCK_RETRY_MS = 10L;

    private final Database db;
    private final CellQueries queries;
    private final DirtyTracker dirty;
    private final Path exportFile;
    private final ReentrantLock localLock = new ReentrantLock();

    public FlushManager(Database db, CellQueries queries, DirtyTracker dirty, Path exportFile) {
        this.db = db;
        this.queries = queries;
        this.dirty = dirty;
        this.exportFile = exportFile.toAbsolutePath().normalize();
    }

    public Path exportFile() {
        return exportFile;
    }

    public FlushResult flush(String projectKey) {
        localLock.lock();
        try {
            Files.createDirectories(exportFile.getParent());
            Path lockFile = exportFile.resolveSibling(exportFile.getFileName() + ".lock");
            try (FileChannel channel = FileChannel.open(lockFile, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
                 FileLock ignored = acquire(channel)) {
                return flushLocked(projectKey);
            }
        } catch (IOException e) {
            throw new HiveException("Failed to flush " + exportFile, e);
        } finally {
            localLock.unlock();
        }
    }

    /**
     * Blocks on the file lock. Another runtime of this JVM holding it shows up as
     * {@link OverlappingFileLockException} instead of blocking, so that case is polled.
     */
    private FileLock acquire(FileChannel channel) throws IOException {
        while (true) {
            try {
                return channel.lock();
            } catch (OverlappingFileLockException e) {
                try {
                    Thread.sleep(LOCK_RETRY_MS);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new HiveException("Interrupted while waiting for " + exportFile + ".lock", ie);
                }
            }
        }
    }

    private FlushResult flushLocked(String projectKey) throws IOException {
        List<DirtyTracker.DirtyCell> pending = dirty.getDirty(projectKey);
        if (pending.isEmpty()) {
            return FlushResult.empty();
        }
        LinkedHashMap<String, String> lines = readExisting();
        List<DirtyTracker.DirtyCell> exported = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> appended = new ArrayList<>();
        for (DirtyTracker.DirtyCell marker : pending) {
            Optional<CellExport> export;
            try {
                export = db.query("export cell " + marker.cellId(), c -> buildExport(c, projectKey, marker.cellId()));
            } catch (RuntimeException e) {
                log.warn("Failed to export cell {}, leaving it dirty", marker.cellId(), e);
                failed.add(marker.cellId());
                continue;
            }
            if (export.isEmpty()) {
                log.debug("Dirty marker for unknown cell {} dropped", marker.cellId());
                dirty.clear(projectKey, marker.cellId(), marker.markedAtMs());
                continue;
            }
            String line = JsonlCodec.toLine(export.get());
            if (!lines.containsKey(marker.cellId())) {
                appended.add(marker.cellId());
            }
            lines.put(marker.cellId(), line);
            exported.add(marker);
        }
        if (!exported.isEmpty()) {
            writeAtomically(render(lines));
        }
        for (DirtyTracker.DirtyCell marker : exported) {
            dirty.clear(projectKey, marker.cellId(), marker.markedAtMs());
        }
        log.info("Flushed {} cells to {} ({} new, {} failed)", exported.size(), exportFile, appended.size(), failed.size());
        return new FlushResult(exported.size(), failed);
    }

    /**
     * Every cell of the project as JSONL, ordered by id. Does not touch dirty markers.
     */
    public String exportAll(String projectKey, boolean includeDeleted) {
        CellFilter filter = CellFilter.all().page(Integer.MAX_VALUE, 0);
        if (includeDeleted) {
            filter = filter.includingDeleted();
        }
        List<String> ids = new ArrayList<>();
        for (Cell cell : queries.queryCells(projectKey, filter)) {
            ids.add(cell.id());
        }
        ids.sort(String::compareTo);
        StringBuilder sb = new StringBuilder();
        db.query("export cells", c -> {
            for (String id : ids) {
                Optional<CellExport> export = buildExport(c, projectKey, id);
                if (export.isPresent()) {
                    sb.append(JsonlCodec.toLine(export.get())).append('\n');
                }
            }
            return null;
        });
        return sb.toString();
    }

    Optional<CellExport> buildExport(Connection c, String projectKey, String cellId) throws SQLException {
        Optional<Cell> cell = queries.getCell(c, projectKey, cellId);
        if (cell.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(JsonlCodec.toExport(
                cell.get(),
                queries.dependencies(c, projectKey, cellId),
                queries.labels(c, projectKey, cellId),
                queries.comments(c, projectKey, cellId)
        ));
    }

    private LinkedHashMap<String, String> readExisting() throws IOException {
        LinkedHashMap<String, String> out = new LinkedHashMap<>();
        if (!Files.exists(exportFile)) {
            return out;
        }
        int unkeyed = 0;
        for (String line : Files.readAllLines(exportFile, StandardCharsets.UTF_8)) {
            if (line.isBlank()) {
                continue;
            }
            String id = JsonlCodec.idOf(line);
            if (id == null) {
                // keep lines we cannot key, in place
                out.put("\u0000unkeyed-" + unkeyed++, line);
                continue;
            }
            out.put(id, line);
        }
        return out;
    }

    private static String render(Map<String, String> lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines.values()) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    private void writeAtomically(String content) throws IOException {
        Path tmp = Files.createTempFile(exportFile.getParent(), exportFile.getFileName().toString(), ".tmp");
        try {
            Files.writeString(tmp, content, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, exportFile, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("Atomic move not supported for {}, falling back to replace", exportFile);
                Files.move(tmp, exportFile, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }
}
