package io.swarmhive.model;

import java.util.List;

public record BlockedCell(Cell cell, List<String> blockerIds) {
    public BlockedCell {
        blockerIds = List.copyOf(blockerIds);
    }
}
