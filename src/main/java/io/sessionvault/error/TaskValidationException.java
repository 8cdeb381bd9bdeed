package io.sessionvault.error;

public class TaskValidationException extends PersistenceException {
    private final ValidationCategory category;
    private final String taskId;

    public TaskValidationException(ValidationCategory category, String taskId, String message) {
        super("Task validation failed: " + message);
        this.category = category;
        this.taskId = taskId;
    }

    public ValidationCategory category() {
        return category;
    }

    public String taskId() {
        return taskId;
    }
}
