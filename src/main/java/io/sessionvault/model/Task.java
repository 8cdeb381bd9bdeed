package io.sessionvault.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionvault.util.Jsons;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Unit of work persisted by the engine. Updates go through the {@code with*} copies, which
 * never touch {@code createdAt}. Absent context and parameters become empty objects.
 * Lists are held read-only and the JSON members are copied on the way in and out, so a
 * task handed to a caller cannot change the one held by the engine.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Task(
        String id,
        String name,
        String description,
        String type,
        TaskPriority priority,
        TaskStatus status,
        Instant createdAt,
        Instant updatedAt,
        List<TaskDependency> dependencies,
        List<String> tags,
        List<String> subtasks,
        String parentTaskId,
        Instant scheduledAt,
        ObjectNode context,
        ObjectNode parameters,
        JsonNode result
) {
    public Task {
        dependencies = readOnly(dependencies);
        tags = readOnly(tags);
        subtasks = readOnly(subtasks);
        context = context == null ? Jsons.mapper().createObjectNode() : context.deepCopy();
        parameters = parameters == null ? Jsons.mapper().createObjectNode() : parameters.deepCopy();
        result = result == null ? null : result.deepCopy();
    }

    @Override
    public ObjectNode context() {
        return context.deepCopy();
    }

    @Override
    public ObjectNode parameters() {
        return parameters.deepCopy();
    }

    @Override
    public JsonNode result() {
        return result == null ? null : result.deepCopy();
    }

    // null stays null so validation can still report a missing array
    private static <T> List<T> readOnly(List<T> values) {
        return values == null ? null : Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static Task create(String id, String name, String description, String type, Instant now) {
        return new Task(
                id,
                name,
                description,
                type,
                TaskPriority.MEDIUM,
                TaskStatus.PENDING,
                now,
                now,
                List.of(),
                List.of(),
                List.of(),
                null,
                null,
                Jsons.mapper().createObjectNode(),
                Jsons.mapper().createObjectNode(),
                null
        );
    }

    public Task withStatus(TaskStatus newStatus, Instant at) {
        return new Task(id, name, description, type, priority, newStatus, createdAt, at,
                dependencies, tags, subtasks, parentTaskId, scheduledAt, context, parameters, result);
    }

    public Task withPriority(TaskPriority newPriority) {
        return new Task(id, name, description, type, newPriority, status, createdAt, updatedAt,
                dependencies, tags, subtasks, parentTaskId, scheduledAt, context, parameters, result);
    }

    public Task withUpdatedAt(Instant at) {
        return new Task(id, name, description, type, priority, status, createdAt, at,
                dependencies, tags, subtasks, parentTaskId, scheduledAt, context, parameters, result);
    }

    public Task withTags(List<String> newTags) {
        return new Task(id, name, description, type, priority, status, createdAt, updatedAt,
                dependencies, newTags, subtasks, parentTaskId, scheduledAt, context, parameters, result);
    }

    public Task withSubtasks(List<String> newSubtasks) {
        return new Task(id, name, description, type, priority, status, createdAt, updatedAt,
                dependencies, tags, newSubtasks, parentTaskId, scheduledAt, context, parameters, result);
    }

    public Task withDependencies(List<TaskDependency> newDependencies) {
        return new Task(id, name, description, type, priority, status, createdAt, updatedAt,
                newDependencies, tags, subtasks, parentTaskId, scheduledAt, context, parameters, result);
    }

    public Task withParentTaskId(String newParentTaskId) {
        return new Task(id, name, description, type, priority, status, createdAt, updatedAt,
                dependencies, tags, subtasks, newParentTaskId, scheduledAt, context, parameters, result);
    }

    public Task withScheduledAt(Instant newScheduledAt) {
        return new Task(id, name, description, type, priority, status, createdAt, updatedAt,
                dependencies, tags, subtasks, parentTaskId, newScheduledAt, context, parameters, result);
    }

    public Task withParameters(ObjectNode newParameters) {
        return new Task(id, name, description, type, priority, status, createdAt, updatedAt,
                dependencies, tags, subtasks, parentTaskId, scheduledAt, context, newParameters, result);
    }

    public Task withResult(JsonNode newResult) {
        return new Task(id, name, description, type, priority, status, createdAt, updatedAt,
                dependencies, tags, subtasks, parentTaskId, scheduledAt, context, parameters, newResult);
    }
}
