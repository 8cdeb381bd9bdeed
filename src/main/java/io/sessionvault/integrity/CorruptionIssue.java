package io.sessionvault.integrity;

import java.util.List;

public record CorruptionIssue(String type, Severity severity, String description, List<String> fields) {
}
