package io.sessionvault.integrity;

public record RepairContext(boolean allowAutoRepair, String expectedId) {
    public static RepairContext autoRepair(String expectedId) {
        return new RepairContext(true, expectedId);
    }

    public static RepairContext detectOnly() {
        return new RepairContext(false, null);
    }
}
