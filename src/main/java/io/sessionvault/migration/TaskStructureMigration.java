package io.sessionvault.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

final class TaskStructureMigration implements SchemaMigration {
    static final String ID = "task_structure_1_0_0_to_1_1_0";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Add execution context, parameters and collection fields to tasks";
    }

    @Override
    public DataKind kind() {
        return DataKind.TASK;
    }

    @Override
    public String fromVersion() {
        return "1.0.0";
    }

    @Override
    public String toVersion() {
        return "1.1.0";
    }

    @Override
    public boolean reversible() {
        return true;
    }

    @Override
    public ObjectNode migrate(ObjectNode data) {
        if (!data.path("context").isObject()) {
            ObjectNode context = data.putObject("context");
            context.put("sessionId", "");
            context.put("workingDirectory", "");
            context.putObject("environment");
            context.putObject("config");
            context.put("timeout", 30_000);
            context.put("maxRetries", 3);
            context.putObject("userPreferences");
        }
        if (!data.path("parameters").isObject()) {
            data.putObject("parameters");
        }
        for (String field : new String[]{"dependencies", "tags", "subtasks"}) {
            if (!data.path(field).isArray()) {
                data.putArray(field);
            }
        }
        return data;
    }

    @Override
    public ObjectNode rollback(ObjectNode data) {
        data.remove("context");
        data.remove("parameters");
        return data;
    }

    @Override
    public boolean validate(ObjectNode data) {
        JsonNode id = data.get("id");
        JsonNode name = data.get("name");
        return id != null && id.isTextual() && name != null && name.isTextual();
    }

    @Override
    public boolean validateAfter(ObjectNode data) {
        return data.path("context").isObject();
    }
}
