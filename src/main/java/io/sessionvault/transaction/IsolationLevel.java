package io.sessionvault.transaction;

public enum IsolationLevel {
    READ_UNCOMMITTED,
    READ_COMMITTED,
    REPEATABLE_READ,
    SERIALIZABLE;

    public static IsolationLevel fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return READ_COMMITTED;
        }
        return IsolationLevel.valueOf(raw.trim().toUpperCase().replace('-', '_'));
    }
}
