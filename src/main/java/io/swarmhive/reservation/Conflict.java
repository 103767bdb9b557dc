package io.swarmhive.reservation;

/**
 * A requested path that overlaps a live lease held by another agent.
 */
public record Conflict(String path, String holder, String pattern, boolean exclusive, long expiresAtMs) {
}
