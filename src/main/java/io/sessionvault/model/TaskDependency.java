package io.sessionvault.model;

public record TaskDependency(String taskId, DependencyType type) {
    public static TaskDependency prerequisite(String taskId) {
        return new TaskDependency(taskId, DependencyType.PREREQUISITE);
    }
}
