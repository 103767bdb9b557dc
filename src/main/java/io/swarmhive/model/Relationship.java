package io.swarmhive.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Relationship {
    BLOCKS("blocks"),
    RELATED("related"),
    PARENT_CHILD("parent_child"),
    DISCOVERED_FROM("discovered_from");

    private final String wire;

    Relationship(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    @JsonCreator
    public static Relationship fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return BLOCKS;
        }
        for (Relationship value : values()) {
            if (value.wire.equalsIgnoreCase(raw.trim()) || value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown relationship: " + raw);
    }
}
