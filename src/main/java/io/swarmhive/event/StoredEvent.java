package io.swarmhive.event;

public record StoredEvent(
        long id,
        long sequence,
        long recordedAtMs,
        CellEvent event
) {
    public String typeName() {
        return event.typeName();
    }

    public String cellId() {
        return event.cellId();
    }
}
