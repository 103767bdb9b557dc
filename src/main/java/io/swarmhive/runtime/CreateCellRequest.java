package io.swarmhive.runtime;

import io.swarmhive.model.CellType;

/**
 * @param priority 0 (lowest) to 3 (highest); null means 2
 * @param assignee optional; when set the assignment is recorded in the same transaction as the creation
 */
public record CreateCellRequest(
        String title,
        String description,
        CellType type,
        Integer priority,
        String parentId,
        String assignee,
        String createdBy
) {
    public static final int DEFAULT_PRIORITY = 2;

    public static CreateCellRequest of(String title, CellType type) {
        return new CreateCellRequest(title, null, type, null, null, null, null);
    }

    public CreateCellRequest withDescription(String value) {
        return new CreateCellRequest(title, value, type, priority, parentId, assignee, createdBy);
    }

    public CreateCellRequest withPriority(int value) {
        return new CreateCellRequest(title, description, type, value, parentId, assignee, createdBy);
    }

    public CreateCellRequest withParent(String value) {
        return new CreateCellRequest(title, description, type, priority, value, assignee, createdBy);
    }

    public CreateCellRequest withAssignee(String value) {
        return new CreateCellRequest(title, description, type, priority, parentId, value, createdBy);
    }

    public CreateCellRequest createdBy(String value) {
        return new CreateCellRequest(title, description, type, priority, parentId, assignee, value);
    }
}
