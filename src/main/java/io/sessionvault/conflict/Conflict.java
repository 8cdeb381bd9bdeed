package io.sessionvault.conflict;

import io.sessionvault.model.Task;

import java.util.List;

public record Conflict(String type, String id, Task currentData, Task conflictingData, List<String> sessions) {
    public String conflictId() {
        return type + "-" + id;
    }
}
