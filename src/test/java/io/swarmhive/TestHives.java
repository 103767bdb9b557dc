package io.swarmhive;

import io.swarmhive.config.HiveConfig;
import io.swarmhive.config.HiveSettings;
import io.swarmhive.runtime.HiveRuntime;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.stream.Stream;

public final class TestHives {
    public static final String PROJECT = "/work/hive-test";

    private TestHives() {
    }

    public static HiveRuntime runtime(Path root, Clock clock) {
        return runtime(root, PROJECT, clock);
    }

    public static HiveRuntime runtime(Path root, String projectKey, Clock clock) {
        HiveRuntime runtime = new HiveRuntime(HiveConfig.fromRoot(root.toString(), projectKey), HiveSettings.defaults(), clock);
        runtime.init();
        return runtime;
    }

    public static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
