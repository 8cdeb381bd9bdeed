package io.sessionvault.model;

import com.fasterxml.jackson.databind.JsonNode;

public record TaskQueue(String id, JsonNode payload) {
}
