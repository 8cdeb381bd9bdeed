package io.sessionvault.integrity;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
