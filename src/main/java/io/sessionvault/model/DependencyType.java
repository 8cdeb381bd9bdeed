package io.sessionvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DependencyType {
    PREREQUISITE("prerequisite"),
    SOFT_DEPENDENCY("soft_dependency"),
    RESOURCE_DEPENDENCY("resource_dependency");

    private final String wireName;

    DependencyType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public static boolean isKnown(String raw) {
        for (DependencyType value : values()) {
            if (value.wireName.equals(raw)) {
                return true;
            }
        }
        return false;
    }

    @JsonCreator
    public static DependencyType fromWireName(String raw) {
        if (raw == null) {
            return null;
        }
        for (DependencyType value : values()) {
            if (value.wireName.equals(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown dependency type: " + raw);
    }

    public static DependencyType fromString(String raw) {
        for (DependencyType value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown dependency type: " + raw);
    }
}
