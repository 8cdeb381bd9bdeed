package io.sessionvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SessionState {
    ACTIVE("active"),
    INACTIVE("inactive"),
    CRASHED("crashed"),
    TERMINATING("terminating"),
    TERMINATED("terminated");

    private final String wireName;

    SessionState(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static SessionState fromWireName(String raw) {
        if (raw == null) {
            return null;
        }
        for (SessionState value : values()) {
            if (value.wireName.equals(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown session state: " + raw);
    }

    public static SessionState fromString(String raw) {
        for (SessionState value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown session state: " + raw);
    }
}
