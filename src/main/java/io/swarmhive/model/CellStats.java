package io.swarmhive.model;

import java.util.Map;

public record CellStats(
        int total,
        int open,
        int inProgress,
        int blocked,
        int closed,
        int deleted,
        Map<String, Integer> byType
) {
    public CellStats {
        byType = Map.copyOf(byType);
    }
}
