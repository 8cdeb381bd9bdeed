package io.sessionvault.error;

public enum ValidationCategory {
    STRUCTURAL,
    CONTENT,
    BUSINESS,
    TEMPORAL
}
