package io.sessionvault.error;

import java.nio.file.Path;

public class StorageException extends PersistenceException {
    private final Path path;

    public StorageException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
