package io.sessionvault.migration;

public enum DataKind {
    TASK,
    STORAGE,
    CHECKPOINT
}
