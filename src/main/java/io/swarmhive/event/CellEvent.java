package io.swarmhive.event;

/**
 * An event as offered for append. The sequence is assigned by the store.
 */
public record CellEvent(
        String projectKey,
        String cellId,
        long timestampMs,
        CellEventPayload payload
) {
    public String typeName() {
        return payload == null ? null : payload.typeName();
    }
}
