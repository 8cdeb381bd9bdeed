package io.sessionvault.integrity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

final class MalformedCollectionsDetector implements CorruptionDetector {
    static final String TYPE = "malformed_collections";
    private static final List<String> FIELDS = List.of("dependencies", "tags", "subtasks");

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Severity severity() {
        return Severity.LOW;
    }

    @Override
    public boolean autoRepair() {
        return true;
    }

    @Override
    public Optional<CorruptionIssue> detect(ObjectNode data) {
        List<String> malformed = new ArrayList<>();
        for (String field : FIELDS) {
            JsonNode value = data.get(field);
            if (value == null || !value.isArray()) {
                malformed.add(field);
            }
        }
        if (malformed.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CorruptionIssue(TYPE, severity(), "Expected arrays: " + malformed, malformed));
    }

    @Override
    public String repair(ObjectNode data, CorruptionIssue issue, RepairContext context) {
        for (String field : issue.fields()) {
            data.putArray(field);
        }
        return "collection_reset";
    }
}
