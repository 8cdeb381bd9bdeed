package io.sessionvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TaskPriority {
    CRITICAL("critical", 1000),
    HIGH("high", 800),
    MEDIUM("medium", 500),
    LOW("low", 200),
    BACKGROUND("background", 50);

    private final String wireName;
    private final int weight;

    TaskPriority(String wireName, int weight) {
        this.wireName = wireName;
        this.weight = weight;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int weight() {
        return weight;
    }

    @JsonCreator
    public static TaskPriority fromWireName(String raw) {
        if (raw == null) {
            return null;
        }
        for (TaskPriority value : values()) {
            if (value.wireName.equals(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }

    public static TaskPriority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        for (TaskPriority value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
