package io.sessionvault.integrity;

public record RepairResult(String type, boolean success, String method, String error) {
    public static RepairResult repaired(String type, String method) {
        return new RepairResult(type, true, method, null);
    }

    public static RepairResult failed(String type, String error) {
        return new RepairResult(type, false, null, error);
    }
}
