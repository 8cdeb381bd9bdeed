package io.sessionvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Task lifecycle status. Declaration order is the progression order used when two
 * concurrent copies of a task are merged: a later constant counts as more advanced.
 */
public enum TaskStatus {
    PENDING("pending"),
    READY("ready"),
    IN_PROGRESS("in_progress"),
    COMPLETED("completed"),
    FAILED("failed"),
    CANCELLED("cancelled"),
    BLOCKED("blocked");

    private final String wireName;

    TaskStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isMoreAdvancedThan(TaskStatus other) {
        return other == null || ordinal() > other.ordinal();
    }

    @JsonCreator
    public static TaskStatus fromWireName(String raw) {
        if (raw == null) {
            return null;
        }
        for (TaskStatus value : values()) {
            if (value.wireName.equals(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }

    public static TaskStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return PENDING;
        }
        for (TaskStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown task status: " + raw);
    }
}
