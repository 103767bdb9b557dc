package io.swarmhive.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CellStatus {
    OPEN("open"),
    IN_PROGRESS("in_progress"),
    BLOCKED("blocked"),
    CLOSED("closed");

    private final String wire;

    CellStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static CellStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return OPEN;
        }
        for (CellStatus value : values()) {
            if (value.wire.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown cell status: " + raw);
    }
}
