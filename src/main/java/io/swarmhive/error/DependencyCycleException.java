package io.swarmhive.error;

import java.util.List;

public final class DependencyCycleException extends HiveException {
    private final List<String> path;

    public DependencyCycleException(String message, List<String> path) {
        super(message);
        this.path = List.copyOf(path);
    }

    /**
     * Cells forming the cycle, starting and ending with the cell the edge would have left.
     */
    public List<String> path() {
        return path;
    }
}
