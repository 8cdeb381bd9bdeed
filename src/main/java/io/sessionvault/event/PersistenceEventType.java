package io.sessionvault.event;

public enum PersistenceEventType {
    CROSS_SESSION_INITIALIZED("cross-session-initialized"),
    TASK_SAVED("task-saved-cross-session"),
    TASK_LOADED("task-loaded-cross-session"),
    QUEUE_SAVED("queue-saved-cross-session"),
    QUEUE_DELETED("queue-deleted-cross-session"),
    CONFLICT_RESOLVED("task-conflict-resolved"),
    WRITE_BUFFER_FLUSHED("write-buffer-flushed"),
    CHECKPOINT_CREATED("checkpoint-created"),
    CHECKPOINT_RESTORED("checkpoint-restored"),
    CRASH_RECOVERY_STARTED("crash-recovery-started"),
    CRASH_RECOVERY_COMPLETED("crash-recovery-completed"),
    CRASH_RECOVERY_FAILED("crash-recovery-failed"),
    CRASH_RECOVERY_NO_CHECKPOINT("crash-recovery-no-checkpoint"),
    EMERGENCY_CHECKPOINT("emergency-checkpoint"),
    CROSS_SESSION_SHUTDOWN("cross-session-shutdown"),
    INITIALIZATION_ERROR("initialization-error"),
    SAVE_ERROR("save-error"),
    LOAD_ERROR("load-error"),
    DELETE_QUEUE_ERROR("delete-queue-error"),
    CHECKPOINT_ERROR("checkpoint-error"),
    RESTORE_ERROR("restore-error"),
    CRASH_RECOVERY_ERROR("crash-recovery-error"),
    HEARTBEAT_ERROR("heartbeat-error"),
    FLUSH_ERROR("flush-error"),
    SHUTDOWN_ERROR("shutdown-error");

    private final String wireName;

    PersistenceEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isError() {
        return wireName.endsWith("-error") || this == CRASH_RECOVERY_FAILED;
    }
}
