package io.sessionvault.integrity;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

public record CorruptionReport(
        List<CorruptionIssue> issues,
        List<RepairResult> repairs,
        ObjectNode repairedData,
        boolean success,
        long durationMs
) {
    public boolean corrupted() {
        return !issues.isEmpty();
    }
}
