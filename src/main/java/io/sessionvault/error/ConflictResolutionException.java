package io.sessionvault.error;

public class ConflictResolutionException extends PersistenceException {
    public ConflictResolutionException(String message) {
        super(message);
    }
}
