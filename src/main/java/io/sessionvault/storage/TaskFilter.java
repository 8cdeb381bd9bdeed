package io.sessionvault.storage;

import io.sessionvault.model.Task;
import io.sessionvault.model.TaskPriority;
import io.sessionvault.model.TaskStatus;

import java.util.Set;

public record TaskFilter(
        Set<TaskStatus> statuses,
        String type,
        String tag,
        TaskPriority priority,
        String parentTaskId
) {
    public static TaskFilter all() {
        return new TaskFilter(null, null, null, null, null);
    }

    public static TaskFilter byStatus(TaskStatus... statuses) {
        return new TaskFilter(Set.of(statuses), null, null, null, null);
    }

    public static TaskFilter byTag(String tag) {
        return new TaskFilter(null, null, tag, null, null);
    }

    public boolean matches(Task task) {
        if (statuses != null && !statuses.isEmpty() && !statuses.contains(task.status())) {
            return false;
        }
        if (type != null && !type.equals(task.type())) {
            return false;
        }
        if (tag != null && (task.tags() == null || !task.tags().contains(tag))) {
            return false;
        }
        if (priority != null && priority != task.priority()) {
            return false;
        }
        return parentTaskId == null || parentTaskId.equals(task.parentTaskId());
    }
}
