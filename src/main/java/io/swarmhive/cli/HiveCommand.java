package io.swarmhive.cli;

import io.swarmhive.event.StoredEvent;
import io.swarmhive.export.ImportOptions;
import io.swarmhive.model.Cell;
import io.swarmhive.model.CellType;
import io.swarmhive.model.Relationship;
import io.swarmhive.reservation.ReserveOptions;
import io.swarmhive.runtime.CreateCellRequest;
import io.swarmhive.runtime.HiveRuntime;
import io.swarmhive.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;

@Command(
        name = "swarmhive",
        mixinStandardHelpOptions = true,
        version = "swarmhive 0.1.0",
        description = "Event-sourced work tracker for cooperating agents",
        subcommands = {
                HiveCommand.InitCommand.class,
                HiveCommand.CreateCommand.class,
                HiveCommand.CloseCommand.class,
                HiveCommand.DepCommand.class,
                HiveCommand.ReadyCommand.class,
                HiveCommand.BlockedCommand.class,
                HiveCommand.FlushCommand.class,
                HiveCommand.ImportCommand.class,
                HiveCommand.ReserveCommand.class,
                HiveCommand.ReleaseCommand.class,
                HiveCommand.EventsCommand.class,
                HiveCommand.ReplayCommand.class
        }
)
public final class HiveCommand implements Runnable {
    @Option(names = {"--root"}, description = "Project root directory", defaultValue = ".")
    String root;

    @Option(names = {"--project"}, description = "Project key (defaults to the absolute root path)")
    String project;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | create | close | dep | ready | blocked | flush | import | reserve | release | events | replay");
    }

    HiveRuntime runtime() {
        return HiveRuntime.open(root, project);
    }

    @Command(name = "init", description = "Create the .hive directory and SQLite schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        HiveCommand parent;

        @Override
        public Integer call() {
            HiveRuntime runtime = parent.runtime();
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("project_key", runtime.projectKey());
            out.put("db_file", runtime.config().dbFile().toString());
            out.put("migrations", runtime.database().listSchemaMigrations(20));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "create", description = "Create a cell")
    static final class CreateCommand implements Callable<Integer> {
        @ParentCommand
        HiveCommand parent;

        @Option(names = {"--title"}, required = true, description = "Cell title")
        String title;

        @Option(names = {"--type"}, defaultValue = "task", description = "epic|task|bug|chore|feature")
        String type;

        @Option(names = {"--priority"}, defaultValue = "2", description = "0 (lowest) to 3 (highest)")
        int priority;

        @Option(names = {"--description"}, description = "Longer description")
        String description;

        @Option(names = {"--parent"}, description = "Parent epic id")
        String parentId;

        @Option(names = {"--assignee"}, description = "Initial assignee")
        String assignee;

        @Option(names = {"--by"}, description = "Creating agent")
        String createdBy;

        @Override
        public Integer call() {
            HiveRuntime runtime = parent.runtime();
            Cell cell = runtime.createCell(new CreateCellRequest(
                    title, description, CellType.fromString(type), priority, parentId, assignee, createdBy));
            System.out.println(Jsons.toJson(cell));
            return 0;
        }
    }

    @Command(name = "close", description = "Close a cell and release its reservations")
    static final class CloseCommand implements Callable<Integer> {
        @ParentCommand
        HiveCommand parent;

        @Parameters(index = "0", description = "Cell id")
        String cellId;

        @Option(names = {"--reason"}, required = true, description = "Why the cell is done")
        String reason;

        @Option(names = {"--by"}, description = "Closing agent")
        String closedBy;

        @Override
        public Integer call() {
            HiveRuntime runtime = parent.runtime();
            Cell cell = runtime.closeCell(cellId, reason, closedBy, null, null);
            System.out.println(Jsons.toJson(cell));
            return 0;
        }
    }

    @Command(name = "dep", description = "Add or remove a dependency edge")
    static final class DepCommand implements Callable<Integer> {
        @ParentCommand
        HiveCommand parent;

        @Parameters(index = "0", description = "Dependent cell id")
        String cellId;

        @Parameters(index = "1", description = "Cell it depends on")
        String dependsOnId;

        @Option(names = {"--type"}, defaultValue = "blocks", description = "blocks|related|parent_child|discovered_from")
        String relationship;

        @Option(names = {"--remove"}, description = "Remove the edge instead of adding it")
        boolean remove;

        @Override
        public Integer call() {
            HiveRuntime runtime = parent.runtime();
            Relationship rel = Relationship.fromString(relationship);
            if (remove) {
                runtime.removeDependency(cellId, dependsOnId, rel, null, null);
            } else {
                runtime.addDependency(cellId, dependsOnId, rel, null, null);
            }
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("cell_id", cellId);
            out.put("blocked", runtime.blocking().isBlocked(runtime.projectKey(), cellId));
            out.put("blockers", runtime.blocking().getBlockers(runtime.projectKey(), cellId));
            System.out.println(Jsons.toJson(out));
            return 0;
        }
    }

    @Command(name = "ready", description = "Show the next unblocked cell")
    static final class ReadyCommand implements Callable<Integer> {
        @ParentCommand
        HiveCommand parent;

        @Override
        public Integer call() {
            Optional<Cell> next = parent.runtime().nextReady();
            if (next.isEmpty()) {
                System.out.println("{}");
                return 1;
            }
            System.out.println(Jsons.toJson(next.get()));
            return 0;
        }
    }

    @Command(name = "blocked", description = "List blocked cells with their blockers")
    static final class BlockedCommand implements Callable<Integer> {
        @ParentCommand
        HiveCommand parent;

        @Override
        public Integer call() {
            HiveRuntime runtime = parent.runtime();
            System.out.println(Jsons.toJson(runtime.queries().blockedCells(runtime.projectKey())));
            return 0;
        }
    }

    @Command(name = "flush", description = "Merge dirty cells into the export file")
    static final class FlushCommand implements Callable<Integer> {
        @ParentCommand
        HiveCommand parent;

        @Override
        public Integer call() {
            System.out.println(Jsons.toJson(parent.runtime().flush()));
            return 0;
        }
    }

    @Command(name = "import", description = "Import cells from a JSONL export")
    static final class ImportCommand implements Callable<Integer> {
        @ParentCommand
        HiveCommand parent;

        @Option(names = {"--file"}, description = "JSONL file (defaults to the export file)")
        String file;

        @Option(names = {"--dry-run"}, description = "Only count what would change")
        boolean dryRun;

        @Option(names = {"--skip-existing"}, description = "Leave existing cells untouched")
        boolean skipExisting;

        @Override
        public Integer call() throws Exception {
            HiveRuntime runtime = parent.runtime();
            Path source = file == null ? runtime.config().exportFile() : Path.of(file);
            String text = Files.readString(source, StandardCharsets.UTF_8);
            System.out.println(Jsons.toJson(runtime.importJsonl(text, new ImportOptions(dryRun, skipExisting))));
            return 0;
        }
    }

    @Command(name = "reserve", description = "Reserve file paths for an agent")
    static final class ReserveCommand implements Callable<Integer> {
        @ParentCommand
        HiveCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent name")
        String agent;

        @Parameters(arity = "1..*", description = "Paths or glob patterns")
        List<String> paths;

        @Option(names = {"--ttl-seconds"}, description = "Lease length in seconds")
        Long ttlSeconds;

        @Option(names = {"--shared"}, description = "Take a shared instead of an exclusive lease")
        boolean shared;

        @Option(names = {"--reason"}, description = "Why the paths are reserved")
        String reason;

        @Option(names = {"--cell"}, description = "Cell the reservation belongs to")
        String cellId;

        @Override
        public Integer call() {
            HiveRuntime runtime = parent.runtime();
            ReserveOptions options = new ReserveOptions(
                    ttlSeconds == null ? null : Duration.ofSeconds(ttlSeconds), !shared, reason, cellId);
            var result = runtime.reservations().reserve(agent, paths, options);
            System.out.println(Jsons.toJson(result));
            return result.hasConflicts() ? 2 : 0;
        }
    }

    @Command(name = "release", description = "Release reservations of an agent")
    static final class ReleaseCommand implements Callable<Integer> {
        @ParentCommand
        HiveCommand parent;

        @Option(names = {"--agent"}, required = true, description = "Agent name")
        String agent;

        @Parameters(arity = "0..*", description = "Patterns to release; all when omitted")
        List<String> paths;

        @Override
        public Integer call() {
            HiveRuntime runtime = parent.runtime();
            int released = paths == null || paths.isEmpty()
                    ? runtime.reservations().releaseAll(agent)
                    : runtime.reservations().release(agent, paths);
            System.out.println(Jsons.toJson(Map.of("released", released)));
            return 0;
        }
    }

    @Command(name = "events", description = "Print the event log")
    static final class EventsCommand implements Callable<Integer> {
        @ParentCommand
        HiveCommand parent;

        @Option(names = {"--since"}, description = "Only events after this sequence")
        Long since;

        @Option(names = {"--cell"}, description = "Only events of this cell")
        String cellId;

        @Override
        public Integer call() {
            HiveRuntime runtime = parent.runtime();
            List<StoredEvent> events = cellId == null
                    ? runtime.events().read(runtime.projectKey(), since)
                    : runtime.events().readCell(runtime.projectKey(), cellId);
            for (StoredEvent event : events) {
                Map<String, Object> row = new LinkedHashMap<>();
                row.put("sequence", event.sequence());
                row.put("type", event.typeName());
                row.put("cell_id", event.cellId());
                row.put("timestamp", event.event().timestampMs());
                row.put("payload", event.event().payload());
                System.out.println(Jsons.toCompactJson(row));
            }
            return 0;
        }
    }

    @Command(name = "replay", description = "Rebuild projections from the event log")
    static final class ReplayCommand implements Callable<Integer> {
        @ParentCommand
        HiveCommand parent;

        @Option(names = {"--keep-views"}, description = "Apply on top of existing projections")
        boolean keepViews;

        @Override
        public Integer call() {
            int applied = parent.runtime().replay(!keepViews);
            System.out.println(Jsons.toJson(Map.of("applied", applied)));
            return 0;
        }
    }
}
