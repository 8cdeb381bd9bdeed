package io.sessionvault.migration;

public record SchemaVersion(int major, int minor, int patch) implements Comparable<SchemaVersion> {

    public static SchemaVersion parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Version must not be blank");
        }
        String[] parts = raw.trim().split("\\.");
        if (parts.length > 3) {
            throw new IllegalArgumentException("Invalid version: " + raw);
        }
        int[] values = new int[3];
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid version: " + raw, e);
            }
            if (values[i] < 0) {
                throw new IllegalArgumentException("Invalid version: " + raw);
            }
        }
        return new SchemaVersion(values[0], values[1], values[2]);
    }

    public static int compare(String left, String right) {
        return parse(left).compareTo(parse(right));
    }

    @Override
    public int compareTo(SchemaVersion other) {
        if (major != other.major) {
            return Integer.compare(major, other.major);
        }
        if (minor != other.minor) {
            return Integer.compare(minor, other.minor);
        }
        return Integer.compare(patch, other.patch);
    }

    @Override
    public String toString() {
        return major + "." + minor + "." + patch;
    }
}
