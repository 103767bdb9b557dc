package io.swarmhive.model;

public record Dependency(
        String cellId,
        String dependsOnId,
        Relationship relationship,
        long createdAtMs,
        String createdBy
) {
}
