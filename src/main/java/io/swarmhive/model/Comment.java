package io.swarmhive.model;

public record Comment(
        String id,
        String cellId,
        String author,
        String body,
        String parentId,
        long createdAtMs,
        Long updatedAtMs
) {
}
