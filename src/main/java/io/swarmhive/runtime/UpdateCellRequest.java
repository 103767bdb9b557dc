package io.swarmhive.runtime;

/**
 * Fields left null are not changed. An empty string clears description or assignee.
 */
public record UpdateCellRequest(
        String title,
        String description,
        Integer priority,
        String assignee,
        String updatedBy
) {
}
