package io.sessionvault.integrity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

final class InvalidTimestampsDetector implements CorruptionDetector {
    static final String TYPE = "invalid_timestamps";
    private static final List<String> FIELDS = List.of("createdAt", "updatedAt");

    private final Clock clock;

    InvalidTimestampsDetector(Clock clock) {
        this.clock = clock;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public Severity severity() {
        return Severity.MEDIUM;
    }

    @Override
    public boolean autoRepair() {
        return true;
    }

    @Override
    public Optional<CorruptionIssue> detect(ObjectNode data) {
        List<String> invalid = new ArrayList<>();
        for (String field : FIELDS) {
            if (parse(data.get(field)) == null) {
                invalid.add(field);
            }
        }
        if (invalid.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new CorruptionIssue(TYPE, severity(), "Invalid timestamps: " + invalid, invalid));
    }

    @Override
    public String repair(ObjectNode data, CorruptionIssue issue, RepairContext context) {
        Instant now = clock.instant();
        for (String field : issue.fields()) {
            data.put(field, now.toString());
        }
        Instant created = parse(data.get("createdAt"));
        Instant updated = parse(data.get("updatedAt"));
        if (created != null && updated != null && updated.isBefore(created)) {
            data.put("updatedAt", created.toString());
        }
        return "timestamp_reset";
    }

    static Instant parse(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return Instant.ofEpochMilli(value.asLong());
        }
        if (!value.isTextual()) {
            return null;
        }
        try {
            return Instant.parse(value.asText());
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
