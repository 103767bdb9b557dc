package io.swarmhive.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.swarmhive.MutableClock;
import io.swarmhive.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

final class ResilientRelayClientTest {

    @Test
    void transientFailuresAreRetriedWithBackoff() {
        ScriptedTransport transport = new ScriptedTransport()
                .fail(io())
                .fail(new RelayException("fetch_inbox", RelayException.Kind.HTTP, 503, "unavailable"))
                .succeed("{\"messages\":[]}");
        List<Long> sleeps = new ArrayList<>();
        ResilientRelayClient client = client(transport, () -> true, () -> true, policy(3, 3, true), sleeps, new MutableClock(0L));

        JsonNode result = client.call("fetch_inbox", args());
        Assertions.assertTrue(result.get("messages").isArray());
        Assertions.assertEquals(3, transport.calls);
        Assertions.assertEquals(List.of(100L, 200L), sleeps);
        Assertions.assertEquals(RecoveryState.HEALTHY, client.recoveryState());
        Assertions.assertEquals(0, client.consecutiveFailures());
    }

    @Test
    void fatalErrorsSurfaceImmediately() {
        RelayException invalid = new RelayException("send_message", RelayException.Kind.RPC, -32602, "Invalid params");
        ScriptedTransport transport = new ScriptedTransport().fail(invalid);
        List<Long> sleeps = new ArrayList<>();
        ResilientRelayClient client = client(transport, () -> true, () -> true, policy(3, 3, true), sleeps, new MutableClock(0L));

        RelayException thrown = Assertions.assertThrows(RelayException.class, () -> client.call("send_message", args()));
        Assertions.assertSame(invalid, thrown);
        Assertions.assertEquals(1, transport.calls);
        Assertions.assertTrue(sleeps.isEmpty());
    }

    @Test
    void exhaustedRetriesCarryTheLastFailure() {
        ScriptedTransport transport = new ScriptedTransport().fail(io()).fail(io()).fail(io());
        ResilientRelayClient client = client(transport, () -> true, () -> true, policy(2, 5, true), new ArrayList<>(), new MutableClock(0L));

        RetryExhaustedException e = Assertions.assertThrows(RetryExhaustedException.class,
                () -> client.call("register_agent", args()));
        Assertions.assertEquals(3, e.attempts());
        Assertions.assertEquals("register_agent", e.operation());
        RelayException cause = Assertions.assertInstanceOf(RelayException.class, e.getCause());
        Assertions.assertEquals(RelayException.Kind.IO, cause.kind());
        Assertions.assertEquals(3, transport.calls);
        Assertions.assertEquals(RecoveryState.HEALTHY, client.recoveryState());
        Assertions.assertEquals(3, client.consecutiveFailures());
    }

    @Test
    void thresholdMarksRelayDegraded() {
        ScriptedTransport transport = new ScriptedTransport().fail(io()).fail(io());
        ResilientRelayClient client = client(transport, () -> true, () -> true, policy(1, 2, true), new ArrayList<>(), new MutableClock(0L));

        Assertions.assertThrows(RetryExhaustedException.class, () -> client.call("fetch_inbox", args()));
        Assertions.assertEquals(RecoveryState.DEGRADED, client.recoveryState());
    }

    @Test
    void successfulRestartDoesNotConsumeRetryBudget() {
        ScriptedTransport transport = new ScriptedTransport().fail(io()).succeed("{\"ok\":true}");
        AtomicBoolean healthy = new AtomicBoolean(false);
        AtomicInteger restarts = new AtomicInteger();
        CollaboratorRestarter restarter = () -> {
            restarts.incrementAndGet();
            healthy.set(true);
            return true;
        };
        List<Long> sleeps = new ArrayList<>();
        ResilientRelayClient client = client(transport, healthy::get, restarter, policy(0, 1, true), sleeps, new MutableClock(0L));

        Assertions.assertTrue(client.call("send_message", args()).get("ok").asBoolean());
        Assertions.assertEquals(1, restarts.get());
        Assertions.assertEquals(2, transport.calls);
        Assertions.assertTrue(sleeps.isEmpty());
        Assertions.assertEquals(RecoveryState.HEALTHY, client.recoveryState());
    }

    @Test
    void restartsAreRateLimitedByCooldown() {
        ScriptedTransport transport = new ScriptedTransport();
        for (int i = 0; i < 10; i++) {
            transport.fail(io());
        }
        AtomicInteger restarts = new AtomicInteger();
        CollaboratorRestarter restarter = () -> {
            restarts.incrementAndGet();
            return true;
        };
        MutableClock clock = new MutableClock(1_000_000L);
        ResilientRelayClient client = client(transport, () -> false, restarter, policy(0, 1, true), new ArrayList<>(), clock);

        Assertions.assertThrows(RetryExhaustedException.class, () -> client.call("fetch_inbox", args()));
        Assertions.assertEquals(1, restarts.get());
        Assertions.assertEquals(2, transport.calls);
        Assertions.assertEquals(RecoveryState.DEGRADED, client.recoveryState());

        clock.advance(Duration.ofSeconds(5));
        Assertions.assertThrows(RetryExhaustedException.class, () -> client.call("fetch_inbox", args()));
        Assertions.assertEquals(1, restarts.get());

        clock.advance(Duration.ofSeconds(6));
        Assertions.assertThrows(RetryExhaustedException.class, () -> client.call("fetch_inbox", args()));
        Assertions.assertEquals(2, restarts.get());
    }

    @Test
    void failedRestartLeavesRelayDegraded() {
        ScriptedTransport transport = new ScriptedTransport().fail(io()).fail(io());
        AtomicInteger restarts = new AtomicInteger();
        CollaboratorRestarter restarter = () -> {
            restarts.incrementAndGet();
            return false;
        };
        ResilientRelayClient client = client(transport, () -> false, restarter, policy(1, 1, true), new ArrayList<>(), new MutableClock(0L));

        Assertions.assertThrows(RetryExhaustedException.class, () -> client.call("fetch_inbox", args()));
        Assertions.assertEquals(1, restarts.get());
        Assertions.assertEquals(2, transport.calls);
        Assertions.assertEquals(RecoveryState.DEGRADED, client.recoveryState());
    }

    @Test
    void autoRestartOffNeverProbes() {
        ScriptedTransport transport = new ScriptedTransport().fail(io()).succeed("{}");
        AtomicInteger probes = new AtomicInteger();
        HealthProbe probe = () -> {
            probes.incrementAndGet();
            return false;
        };
        ResilientRelayClient client = client(transport, probe, () -> true, policy(1, 1, false), new ArrayList<>(), new MutableClock(0L));

        client.call("fetch_inbox", args());
        Assertions.assertEquals(0, probes.get());
    }

    @Test
    void interruptedBackoffStopsTheCall() {
        ScriptedTransport transport = new ScriptedTransport().fail(io()).succeed("{}");
        ResilientRelayClient client = new ResilientRelayClient(
                transport, () -> true, () -> true, policy(3, 5, true),
                new BackoffPolicy(100L, 1_000L, () -> 0.5d),
                millis -> {
                    throw new InterruptedException("stop");
                },
                new MutableClock(0L));
        try {
            RelayException e = Assertions.assertThrows(RelayException.class, () -> client.call("fetch_inbox", args()));
            Assertions.assertEquals(RelayException.Kind.INTERRUPTED, e.kind());
            Assertions.assertTrue(Thread.currentThread().isInterrupted());
            Assertions.assertEquals(1, transport.calls);
        } finally {
            Thread.interrupted();
        }
    }

    private static ResilientRelayClient client(
            RelayTransport transport,
            HealthProbe probe,
            CollaboratorRestarter restarter,
            RelayPolicy policy,
            List<Long> sleeps,
            MutableClock clock
    ) {
        return new ResilientRelayClient(transport, probe, restarter, policy,
                new BackoffPolicy(policy.baseDelayMs(), policy.maxDelayMs(), () -> 0.5d), sleeps::add, clock);
    }

    private static RelayPolicy policy(int maxRetries, int failureThreshold, boolean autoRestart) {
        return new RelayPolicy(maxRetries, 100L, 1_000L, failureThreshold, 10_000L, autoRestart);
    }

    private static RelayException io() {
        return new RelayException("fetch_inbox", RelayException.Kind.IO, 0, "connection refused");
    }

    private static ObjectNode args() {
        return Jsons.compact().createObjectNode().put("project_key", "/work/hive-test");
    }

    private static final class ScriptedTransport implements RelayTransport {
        private final Deque<Object> script = new ArrayDeque<>();
        private int calls;

        ScriptedTransport fail(RelayException e) {
            script.add(e);
            return this;
        }

        ScriptedTransport succeed(String json) {
            try {
                script.add(Jsons.compact().readTree(json));
            } catch (Exception e) {
                throw new IllegalArgumentException(json, e);
            }
            return this;
        }

        @Override
        public JsonNode call(String operation, ObjectNode args) {
            calls++;
            Object next = script.poll();
            if (next == null) {
                throw new IllegalStateException("no scripted response left for " + operation);
            }
            if (next instanceof RelayException e) {
                throw e;
            }
            return (JsonNode) next;
        }
    }
}
