package io.swarmhive.client;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

final class ProcessRestarterTest {

    @Test
    void missingExecutableFailsWithoutPolling() {
        AtomicInteger probes = new AtomicInteger();
        ProcessRestarter restarter = new ProcessRestarter(
                List.of("/nonexistent/swarmhive-relay-" + System.nanoTime()),
                () -> probes.incrementAndGet() > 0,
                2_000L,
                millis -> { }
        );
        Assertions.assertFalse(restarter.restart());
        Assertions.assertEquals(0, probes.get());
    }

    @Test
    void pollsUntilHealthy() {
        AtomicInteger probes = new AtomicInteger();
        List<Long> sleeps = new ArrayList<>();
        ProcessRestarter restarter = new ProcessRestarter(
                javaVersion(),
                () -> probes.incrementAndGet() >= 3,
                5_000L,
                sleeps::add
        );
        Assertions.assertTrue(restarter.restart());
        Assertions.assertEquals(List.of(500L, 500L, 500L), sleeps);
    }

    @Test
    void givesUpAfterWaitWindow() {
        List<Long> sleeps = new ArrayList<>();
        ProcessRestarter restarter = new ProcessRestarter(javaVersion(), () -> false, 1_500L, sleeps::add);
        Assertions.assertFalse(restarter.restart());
        Assertions.assertEquals(3, sleeps.size());
    }

    private static List<String> javaVersion() {
        return List.of(Paths.get(System.getProperty("java.home"), "bin", "java").toString(), "-version");
    }

    @Test
    void emptyCommandIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new ProcessRestarter(List.of(), () -> true, 1_000L, Sleeper.SYSTEM));
    }
}
