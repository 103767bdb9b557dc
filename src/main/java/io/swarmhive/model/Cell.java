package io.swarmhive.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Denormalized projection of every event recorded for one cell id. Timestamps are epoch millis
 * taken from the events, not from the wall clock at projection time.
 */
public record Cell(
        String id,
        String projectKey,
        CellType type,
        CellStatus status,
        String title,
        String description,
        int priority,
        String parentId,
        String assignee,
        String createdBy,
        long createdAtMs,
        long updatedAtMs,
        Long closedAtMs,
        String closedReason,
        Long deletedAtMs,
        String deletedBy,
        String deleteReason
) {
    @JsonIgnore
    public boolean isClosed() {
        return status == CellStatus.CLOSED;
    }

    @JsonIgnore
    public boolean isDeleted() {
        return deletedAtMs != null;
    }
}
