package io.swarmhive.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swarmhive.config.HiveSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;

/**
 * Retries transient relay failures with exponential backoff. After {@code failureThreshold}
 * consecutive failures the relay is probed and, if unhealthy, restarted at most once per cooldown.
 * A call that succeeds right after a restart does not count against the retry budget.
 */
public final class ResilientRelayClient {
    private static final Logger log = LoggerFactory.getLogger(ResilientRelayClient.class);

    private final RelayTransport transport;
    private final HealthProbe probe;
    private final CollaboratorRestarter restarter;
    private final RelayPolicy policy;
    private final BackoffPolicy backoff;
    private final Sleeper sleeper;
    private final Clock clock;

    private RecoveryState state = RecoveryState.HEALTHY;
    private int consecutiveFailures;
    private long lastRestartAttemptMs = Long.MIN_VALUE;

    public ResilientRelayClient(
            RelayTransport transport,
            HealthProbe probe,
            CollaboratorRestarter restarter,
            RelayPolicy policy,
            BackoffPolicy backoff,
            Sleeper sleeper,
            Clock clock
    ) {
        this.transport = transport;
        this.probe = probe;
        this.restarter = restarter;
        this.policy = policy;
        this.backoff = backoff;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    /**
     * HTTP transport against {@code relayUrl}; restarts are only possible when a restart command is configured.
     */
    public static ResilientRelayClient fromSettings(HiveSettings settings) {
        HttpRelayTransport http = new HttpRelayTransport(settings.relayUrl(), Duration.ofMillis(settings.relayTimeoutMs()));
        CollaboratorRestarter restarter = settings.relayRestartCommand().isEmpty()
                ? () -> false
                : new ProcessRestarter(settings.relayRestartCommand(), http, settings.relayTimeoutMs(), Sleeper.SYSTEM);
        RelayPolicy policy = RelayPolicy.fromSettings(settings);
        return new ResilientRelayClient(
                http,
                http,
                restarter,
                policy,
                new BackoffPolicy(policy.baseDelayMs(), policy.maxDelayMs()),
                Sleeper.SYSTEM,
                Clock.systemUTC()
        );
    }

    public JsonNode call(String operation, ObjectNode args) {
        RelayException last = null;
        for (int attempt = 0; attempt <= policy.maxRetries(); attempt++) {
            if (attempt > 0) {
                long delay = backoff.delayMs(attempt);
                log.warn("Retry {}/{} for {} after {} ms", attempt, policy.maxRetries(), operation, delay);
                pause(operation, delay, last);
            }
            try {
                JsonNode result = transport.call(operation, args);
                recordSuccess();
                return result;
            } catch (RelayException e) {
                last = e;
                boolean retryable = ErrorClassifier.isRetryable(e);
                if (recordFailure() && recover() && retryable) {
                    attempt--;
                    continue;
                }
                if (!retryable) {
                    log.warn("Non-retryable relay error for {}: {}", operation, e.getMessage());
                    throw e;
                }
            }
        }
        log.error("All {} retries exhausted for {}", policy.maxRetries(), operation);
        throw new RetryExhaustedException(operation, policy.maxRetries() + 1, last);
    }

    public synchronized RecoveryState recoveryState() {
        return state;
    }

    public synchronized int consecutiveFailures() {
        return consecutiveFailures;
    }

    private synchronized void recordSuccess() {
        if (state != RecoveryState.HEALTHY) {
            log.info("Relay recovered after {} consecutive failures", consecutiveFailures);
        }
        consecutiveFailures = 0;
        state = RecoveryState.HEALTHY;
    }

    /**
     * @return true when the failure threshold has been reached
     */
    private synchronized boolean recordFailure() {
        consecutiveFailures++;
        if (consecutiveFailures >= policy.failureThreshold() && state == RecoveryState.HEALTHY) {
            state = RecoveryState.DEGRADED;
            log.warn("{} consecutive relay failures, marking relay degraded", consecutiveFailures);
        }
        return consecutiveFailures >= policy.failureThreshold();
    }

    /**
     * Probes the relay and restarts it when unhealthy.
     *
     * @return true only if a restart happened and the relay is healthy again
     */
    private boolean recover() {
        if (!policy.autoRestart()) {
            return false;
        }
        if (probe.isHealthy()) {
            return false;
        }
        synchronized (this) {
            if (state == RecoveryState.RESTARTING) {
                log.warn("Relay restart already in progress");
                return false;
            }
            long nowMs = clock.millis();
            if (lastRestartAttemptMs != Long.MIN_VALUE && nowMs - lastRestartAttemptMs < policy.restartCooldownMs()) {
                log.warn("Relay restart cooldown active for another {} ms",
                        policy.restartCooldownMs() - (nowMs - lastRestartAttemptMs));
                return false;
            }
            lastRestartAttemptMs = nowMs;
            state = RecoveryState.RESTARTING;
        }
        log.warn("Relay unhealthy, attempting restart");
        boolean restarted = false;
        try {
            restarted = restarter.restart();
            return restarted;
        } finally {
            synchronized (this) {
                if (restarted) {
                    state = RecoveryState.HEALTHY;
                    consecutiveFailures = 0;
                } else {
                    state = RecoveryState.DEGRADED;
                }
            }
            log.info("Relay restart {}", restarted ? "succeeded" : "failed");
        }
    }

    private void pause(String operation, long delayMs, RelayException last) {
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RelayException(operation, RelayException.Kind.INTERRUPTED, 0,
                    "Interrupted while backing off " + operation, last);
        }
    }
}
