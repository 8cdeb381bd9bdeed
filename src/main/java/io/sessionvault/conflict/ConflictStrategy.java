package io.sessionvault.conflict;

import io.sessionvault.error.ConflictResolutionException;

public enum ConflictStrategy {
    TIMESTAMP("timestamp"),
    MERGE("merge"),
    // no interactive resolution; behaves like TIMESTAMP
    MANUAL("manual");

    private final String wireName;

    ConflictStrategy(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ConflictStrategy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return TIMESTAMP;
        }
        for (ConflictStrategy value : values()) {
            if (value.wireName.equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new ConflictResolutionException("Unknown conflict resolution strategy: " + raw);
    }
}
