package io.swarmhive.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CellType {
    EPIC("epic"),
    TASK("task"),
    BUG("bug"),
    CHORE("chore"),
    FEATURE("feature");

    private final String wire;

    CellType(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static CellType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return TASK;
        }
        for (CellType value : values()) {
            if (value.wire.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown cell type: " + raw);
    }
}
