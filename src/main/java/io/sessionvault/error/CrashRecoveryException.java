package io.sessionvault.error;

public class CrashRecoveryException extends PersistenceException {
    private final String crashedSessionId;

    public CrashRecoveryException(String crashedSessionId, Throwable cause) {
        super("Crash recovery failed for session " + crashedSessionId, cause);
        this.crashedSessionId = crashedSessionId;
    }

    public String crashedSessionId() {
        return crashedSessionId;
    }
}
