package io.swarmhive.model;

import java.util.List;
import java.util.Set;

/**
 * Query filter for {@code CellQueries.queryCells}. Empty sets and null fields match everything.
 */
public record CellFilter(
        Set<CellStatus> statuses,
        Set<CellType> types,
        String parentId,
        String assignee,
        boolean includeDeleted,
        int limit,
        int offset
) {
    public static final int DEFAULT_LIMIT = 100;

    public CellFilter {
        statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
        types = types == null ? Set.of() : Set.copyOf(types);
        limit = limit <= 0 ? DEFAULT_LIMIT : limit;
        offset = Math.max(0, offset);
    }

    public static CellFilter all() {
        return new CellFilter(Set.of(), Set.of(), null, null, false, DEFAULT_LIMIT, 0);
    }

    public CellFilter withStatuses(CellStatus... values) {
        return new CellFilter(Set.copyOf(List.of(values)), types, parentId, assignee, includeDeleted, limit, offset);
    }

    public CellFilter withTypes(CellType... values) {
        return new CellFilter(statuses, Set.copyOf(List.of(values)), parentId, assignee, includeDeleted, limit, offset);
    }

    public CellFilter withParent(String value) {
        return new CellFilter(statuses, types, value, assignee, includeDeleted, limit, offset);
    }

    public CellFilter withAssignee(String value) {
        return new CellFilter(statuses, types, parentId, value, includeDeleted, limit, offset);
    }

    public CellFilter includingDeleted() {
        return new CellFilter(statuses, types, parentId, assignee, true, limit, offset);
    }

    public CellFilter page(int newLimit, int newOffset) {
        return new CellFilter(statuses, types, parentId, assignee, includeDeleted, newLimit, newOffset);
    }
}
