package io.swarmhive.runtime;

import io.swarmhive.model.Cell;
import io.swarmhive.reservation.ReservationResult;
import io.swarmhive.reservation.ReserveOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;

/**
 * One agent's working session. Closing it releases every reservation the agent still holds.
 */
public final class HiveSession implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(HiveSession.class);

    private final HiveRuntime runtime;
    private final String agentName;
    private boolean closed;

    HiveSession(HiveRuntime runtime, String agentName) {
        if (agentName == null || agentName.isBlank()) {
            throw new IllegalArgumentException("agent name must not be blank");
        }
        this.runtime = runtime;
        this.agentName = agentName;
    }

    public String agentName() {
        return agentName;
    }

    public ReservationResult reserve(Collection<String> paths, ReserveOptions options) {
        ensureOpen();
        return runtime.reservations().reserve(agentName, paths, options);
    }

    public int release(Collection<String> paths) {
        ensureOpen();
        return runtime.reservations().release(agentName, paths);
    }

    public Cell startWork(String cellId) {
        ensureOpen();
        return runtime.startWork(cellId, agentName);
    }

    public Cell closeCell(String cellId, String reason) {
        ensureOpen();
        return runtime.closeCell(cellId, reason, agentName, null, null);
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        int released = runtime.reservations().releaseAll(agentName);
        log.debug("Session of {} closed, released {} reservations", agentName, released);
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("session of " + agentName + " is closed");
        }
    }
}
