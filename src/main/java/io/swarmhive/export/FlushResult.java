package io.swarmhive.export;

import java.util.List;

public record FlushResult(int exportedCount, List<String> failedCellIds) {
    public FlushResult {
        failedCellIds = List.copyOf(failedCellIds);
    }

    public static FlushResult empty() {
        return new FlushResult(0, List.of());
    }
}
