package io.sessionvault.error;

public class CheckpointNotFoundException extends PersistenceException {
    private final String checkpointId;

    public CheckpointNotFoundException(String checkpointId) {
        super("Checkpoint not found: " + checkpointId);
        this.checkpointId = checkpointId;
    }

    public String checkpointId() {
        return checkpointId;
    }
}
