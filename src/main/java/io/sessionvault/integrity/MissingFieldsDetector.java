package io.sessionvault.integrity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionvault.model.TaskPriority;
import io.sessionvault.model.TaskStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

final class MissingFieldsDetector implements CorruptionDetector {
    static final String TYPE = "missing_fields";
    private static final List<String> REQUIRED = List.of("id", "name", "description", "type", "priority", "status");

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Severity severity() {
        return Severity.HIGH;
    }

    @Override
    public boolean autoRepair() {
        return true;
    }

    @Override
    public Optional<CorruptionIssue> detect(ObjectNode data) {
        List<String> missing = new ArrayList<>();
        for (String field : REQUIRED) {
            JsonNode value = data.get(field);
            if (value == null || value.isNull() || (value.isTextual() && value.asText().isBlank() && !"description".equals(field))) {
                missing.add(field);
            }
        }
        if (missing.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CorruptionIssue(TYPE, severity(), "Missing required fields: " + missing, missing));
    }

    @Override
    public String repair(ObjectNode data, CorruptionIssue issue, RepairContext context) {
        for (String field : issue.fields()) {
            switch (field) {
                case "id" -> data.put("id", context.expectedId() == null || context.expectedId().isBlank()
                        ? UUID.randomUUID().toString()
                        : context.expectedId());
                case "name" -> data.put("name", "Recovered Task");
                case "description" -> data.put("description", "Task recovered from corruption");
                case "type" -> data.put("type", "implementation");
                case "priority" -> data.put("priority", TaskPriority.MEDIUM.wireName());
                case "status" -> data.put("status", TaskStatus.PENDING.wireName());
                default -> throw new IllegalStateException("No default for field " + field);
            }
        }
        return "default_value_insertion";
    }
}
