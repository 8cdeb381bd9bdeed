package io.sessionvault.integrity;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

public interface CorruptionDetector {
    String type();

    Severity severity();

    boolean autoRepair();

    Optional<CorruptionIssue> detect(ObjectNode data);

    String repair(ObjectNode data, CorruptionIssue issue, RepairContext context);
}
