package io.swarmhive.reservation;

public record Reservation(
        long id,
        String projectKey,
        String agentName,
        String pathPattern,
        boolean exclusive,
        String reason,
        String cellId,
        long createdAtMs,
        long expiresAtMs,
        Long releasedAtMs
) {
    public boolean isActiveAt(long nowMs) {
        return releasedAtMs == null && expiresAtMs > nowMs;
    }
}
