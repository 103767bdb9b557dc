package io.swarmhive.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Starts the relay with a configured command and polls its health endpoint until it answers.
 */
public final class ProcessRestarter implements CollaboratorRestarter {
    private static final Logger log = LoggerFactory.getLogger(ProcessRestarter.class);
    private static final long POLL_INTERVAL_MS = 500L;

    private final List<String> command;
    private final HealthProbe probe;
    private final long waitForHealthyMs;
    private final Sleeper sleeper;

    public ProcessRestarter(List<String> command, HealthProbe probe, long waitForHealthyMs, Sleeper sleeper) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("restart command cannot be empty");
        }
        this.command = List.copyOf(command);
        this.probe = probe;
        this.waitForHealthyMs = Math.max(POLL_INTERVAL_MS, waitForHealthyMs);
        this.sleeper = sleeper;
    }

    @Override
    public boolean restart() {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        try {
            Process process = pb.start();
            log.info("Started relay process pid={} with {}", process.pid(), command);
        } catch (IOException e) {
            log.warn("Failed to start relay with {}: {}", command, e.getMessage());
            return false;
        }
        long waited = 0L;
        while (waited < waitForHealthyMs) {
            try {
                sleeper.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            waited += POLL_INTERVAL_MS;
            if (probe.isHealthy()) {
                return true;
            }
        }
        log.warn("Relay not healthy {} ms after restart", waitForHealthyMs);
        return false;
    }
}
