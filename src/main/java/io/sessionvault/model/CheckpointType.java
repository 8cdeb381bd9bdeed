package io.sessionvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CheckpointType {
    MANUAL("manual"),
    AUTOMATIC("automatic"),
    CRASH_RECOVERY("crash_recovery");

    private final String wireName;

    CheckpointType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static CheckpointType fromWireName(String raw) {
        if (raw == null) {
            return null;
        }
        for (CheckpointType value : values()) {
            if (value.wireName.equals(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown checkpoint type: " + raw);
    }

    public static CheckpointType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MANUAL;
        }
        for (CheckpointType value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown checkpoint type: " + raw);
    }
}
