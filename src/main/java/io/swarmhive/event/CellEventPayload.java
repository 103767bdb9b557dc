package io.swarmhive.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import io.swarmhive.model.CellStatus;
import io.swarmhive.model.CellType;
import io.swarmhive.model.Relationship;

import java.util.ArrayList;
import java.util.List;

/**
 * Typed body of a cell event. One record per event type; {@link Unrecognized} carries types this
 * build does not know. Handlers implement {@link Visitor}, so a new variant without a handler does
 * not compile.
 */
public sealed interface CellEventPayload {

    /**
     * Wire type name; for {@link Unrecognized} the raw stored name.
     */
    String typeName();

    /**
     * Structural problems with this payload, empty when valid.
     */
    List<String> problems();

    <R, X extends Exception> R accept(Visitor<R, X> visitor) throws X;

    interface Visitor<R, X extends Exception> {
        R created(Created p) throws X;

        R updated(Updated p) throws X;

        R statusChanged(StatusChanged p) throws X;

        R closed(Closed p) throws X;

        R reopened(Reopened p) throws X;

        R deleted(Deleted p) throws X;

        R dependencyAdded(DependencyAdded p) throws X;

        R dependencyRemoved(DependencyRemoved p) throws X;

        R labelAdded(LabelAdded p) throws X;

        R labelRemoved(LabelRemoved p) throws X;

        R commentAdded(CommentAdded p) throws X;

        R commentUpdated(CommentUpdated p) throws X;

        R commentDeleted(CommentDeleted p) throws X;

        R epicChildAdded(EpicChildAdded p) throws X;

        R epicChildRemoved(EpicChildRemoved p) throws X;

        R assigned(Assigned p) throws X;

        R workStarted(WorkStarted p) throws X;

        R unrecognized(Unrecognized p) throws X;
    }

    record Created(
            String title,
            String description,
            CellType issueType,
            Integer priority,
            String parentId,
            String createdBy
    ) implements CellEventPayload {
        public String typeName() {
            return CellEventType.CREATED.wire();
        }

        public List<String> problems() {
            List<String> out = new ArrayList<>();
            requireText(out, "title", title);
            if (issueType == null) {
                out.add("issue_type is required");
            }
            checkPriority(out, priority, true);
            return out;
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.created(this);
        }
    }

    /**
     * A before/after pair; {@code to == null} clears the field.
     */
    record Change<T>(@JsonProperty("old") T from, @JsonProperty("new") T to) {
    }

    record Changes(
            Change<String> title,
            Change<String> description,
            Change<Integer> priority,
            Change<String> assignee
    ) {
        @JsonIgnore
        public boolean isEmpty() {
            return title == null && description == null && priority == null && assignee == null;
        }
    }

    record Updated(Changes changes, String updatedBy) implements CellEventPayload {
        public String typeName() {
            return CellEventType.UPDATED.wire();
        }

        public List<String> problems() {
            List<String> out = new ArrayList<>();
            if (changes == null || changes.isEmpty()) {
                out.add("changes must contain at least one field");
                return out;
            }
            if (changes.title() != null) {
                requireText(out, "changes.title.new", changes.title().to());
            }
            if (changes.priority() != null) {
                checkPriority(out, changes.priority().to(), true);
            }
            return out;
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.updated(this);
        }
    }

    record StatusChanged(
            CellStatus fromStatus,
            CellStatus toStatus,
            String reason,
            String changedBy
    ) implements CellEventPayload {
        public String typeName() {
            return CellEventType.STATUS_CHANGED.wire();
        }

        public List<String> problems() {
            List<String> out = new ArrayList<>();
            if (toStatus == null) {
                out.add("to_status is required");
            } else if (toStatus == CellStatus.CLOSED) {
                out.add("to_status must not be closed; use cell_closed");
            }
            return out;
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.statusChanged(this);
        }
    }

    record Closed(
            String reason,
            String closedBy,
            List<String> filesTouched,
            Long durationMs
    ) implements CellEventPayload {
        public String typeName() {
            return CellEventType.CLOSED.wire();
        }

        public List<String> problems() {
            List<String> out = new ArrayList<>();
            requireText(out, "reason", reason);
            return out;
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.closed(this);
        }
    }

    record Reopened(String reason, String reopenedBy) implements CellEventPayload {
        public String typeName() {
            return CellEventType.REOPENED.wire();
        }

        public List<String> problems() {
            return List.of();
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.reopened(this);
        }
    }

    record Deleted(String reason, String deletedBy) implements CellEventPayload {
        public String typeName() {
            return CellEventType.DELETED.wire();
        }

        public List<String> problems() {
            return List.of();
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.deleted(this);
        }
    }

    record DependencyAdded(
            String dependsOnId,
            Relationship relationship,
            String reason,
            String addedBy
    ) implements CellEventPayload {
        public String typeName() {
            return CellEventType.DEPENDENCY_ADDED.wire();
        }

        public List<String> problems() {
            List<String> out = new ArrayList<>();
            requireText(out, "depends_on_id", dependsOnId);
            if (relationship == null) {
                out.add("relationship is required");
            }
            return out;
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.dependencyAdded(this);
        }
    }

    record DependencyRemoved(
            String dependsOnId,
            Relationship relationship,
            String reason,
            String removedBy
    ) implements CellEventPayload {
        public String typeName() {
            return CellEventType.DEPENDENCY_REMOVED.wire();
        }

        public List<String> problems() {
            List<String> out = new ArrayList<>();
            requireText(out, "depends_on_id", dependsOnId);
            if (relationship == null) {
                out.add("relationship is required");
            }
            return out;
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.dependencyRemoved(this);
        }
    }

    record LabelAdded(String label) implements CellEventPayload {
        public String typeName() {
            return CellEventType.LABEL_ADDED.wire();
        }

        public List<String> problems() {
            List<String> out = new ArrayList<>();
            requireText(out, "label", label);
            return out;
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.labelAdded(this);
        }
    }

    record LabelRemoved(String label) implements CellEventPayload {
        public String typeName() {
            return CellEventType.LABEL_REMOVED.wire();
        }

        public List<String> problems() {
            List<String> out = new ArrayList<>();
            requireText(out, "label", label);
            return out;
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.labelRemoved(this);
        }
    }

    record CommentAdded(
            String commentId,
            String author,
            String body,
            String parentCommentId
    ) implements CellEventPayload {
        public String typeName() {
            return CellEventType.COMMENT_ADDED.wire();
        }

        public List<String> problems() {
            List<String> out = new ArrayList<>();
            requireText(out, "comment_id", commentId);
            requireText(out, "author", author);
            requireText(out, "body", body);
            return out;
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.commentAdded(this);
        }
    }

    record CommentUpdated(String commentId, String newBody, String updatedBy) implements CellEventPayload {
        public String typeName() {
            return CellEventType.COMMENT_UPDATED.wire();
        }

        public List<String> problems() {
            List<String> out = new ArrayList<>();
            requireText(out, "comment_id", commentId);
            requireText(out, "new_body", newBody);
            return out;
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.commentUpdated(this);
        }
    }

    record CommentDeleted(String commentId, String deletedBy) implements CellEventPayload {
        public String typeName() {
            return CellEventType.COMMENT_DELETED.wire();
        }

        public List<String> problems() {
            List<String> out = new ArrayList<>();
            requireText(out, "comment_id", commentId);
            return out;
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.commentDeleted(this);
        }
    }

    record EpicChildAdded(String childId, Integer childIndex, String addedBy) implements CellEventPayload {
        public String typeName() {
            return CellEventType.EPIC_CHILD_ADDED.wire();
        }

        public List<String> problems() {
            List<String> out = new ArrayList<>();
            requireText(out, "child_id", childId);
            return out;
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.epicChildAdded(this);
        }
    }

    record EpicChildRemoved(String childId, String reason, String removedBy) implements CellEventPayload {
        public String typeName() {
            return CellEventType.EPIC_CHILD_REMOVED.wire();
        }

        public List<String> problems() {
            List<String> out = new ArrayList<>();
            requireText(out, "child_id", childId);
            return out;
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.epicChildRemoved(this);
        }
    }

    record Assigned(String assignee, String assignedBy) implements CellEventPayload {
        public String typeName() {
            return CellEventType.ASSIGNED.wire();
        }

        public List<String> problems() {
            List<String> out = new ArrayList<>();
            requireText(out, "assignee", assignee);
            return out;
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.assigned(this);
        }
    }

    record WorkStarted(String agent) implements CellEventPayload {
        public String typeName() {
            return CellEventType.WORK_STARTED.wire();
        }

        public List<String> problems() {
            return List.of();
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.workStarted(this);
        }
    }

    /**
     * An event whose type this build does not recognize. Never appended, only read back.
     */
    record Unrecognized(String typeName, JsonNode data) implements CellEventPayload {
        public List<String> problems() {
            return List.of("unrecognized event type: " + typeName);
        }

        public <R, X extends Exception> R accept(Visitor<R, X> v) throws X {
            return v.unrecognized(this);
        }
    }

    private static void requireText(List<String> out, String field, String value) {
        if (value == null || value.isBlank()) {
            out.add(field + " is required");
        }
    }

    private static void checkPriority(List<String> out, Integer priority, boolean required) {
        if (priority == null) {
            if (required) {
                out.add("priority is required");
            }
            return;
        }
        if (priority < 0 || priority > 3) {
            out.add("priority must be between 0 and 3, got " + priority);
        }
    }
}
