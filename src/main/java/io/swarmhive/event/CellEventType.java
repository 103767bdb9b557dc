package io.swarmhive.event;

import java.util.Optional;

public enum CellEventType {
    CREATED("cell_created", CellEventPayload.Created.class),
    UPDATED("cell_updated", CellEventPayload.Updated.class),
    STATUS_CHANGED("cell_status_changed", CellEventPayload.StatusChanged.class),
    CLOSED("cell_closed", CellEventPayload.Closed.class),
    REOPENED("cell_reopened", CellEventPayload.Reopened.class),
    DELETED("cell_deleted", CellEventPayload.Deleted.class),
    DEPENDENCY_ADDED("cell_dependency_added", CellEventPayload.DependencyAdded.class),
    DEPENDENCY_REMOVED("cell_dependency_removed", CellEventPayload.DependencyRemoved.class),
    LABEL_ADDED("cell_label_added", CellEventPayload.LabelAdded.class),
    LABEL_REMOVED("cell_label_removed", CellEventPayload.LabelRemoved.class),
    COMMENT_ADDED("cell_comment_added", CellEventPayload.CommentAdded.class),
    COMMENT_UPDATED("cell_comment_updated", CellEventPayload.CommentUpdated.class),
    COMMENT_DELETED("cell_comment_deleted", CellEventPayload.CommentDeleted.class),
    EPIC_CHILD_ADDED("cell_epic_child_added", CellEventPayload.EpicChildAdded.class),
    EPIC_CHILD_REMOVED("cell_epic_child_removed", CellEventPayload.EpicChildRemoved.class),
    ASSIGNED("cell_assigned", CellEventPayload.Assigned.class),
    WORK_STARTED("cell_work_started", CellEventPayload.WorkStarted.class);

    private final String wire;
    private final Class<? extends CellEventPayload> payloadClass;

    CellEventType(String wire, Class<? extends CellEventPayload> payloadClass) {
        this.wire = wire;
        this.payloadClass = payloadClass;
    }

    public String wire() {
        return wire;
    }

    public Class<? extends CellEventPayload> payloadClass() {
        return payloadClass;
    }

    /**
     * Empty for types written by a newer version of the hive.
     */
    public static Optional<CellEventType> fromWire(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        for (CellEventType value : values()) {
            if (value.wire.equals(raw)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
