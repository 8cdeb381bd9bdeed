package io.sessionvault.error;

public class IntegrityException extends PersistenceException {
    public IntegrityException(String message) {
        super(message);
    }

    public IntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
