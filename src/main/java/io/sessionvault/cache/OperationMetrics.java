package io.sessionvault.cache;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

public final class OperationMetrics {
    private final Map<String, long[]> byOperation = new TreeMap<>();

    public synchronized void record(String operation, long durationNanos) {
        long[] slot = byOperation.computeIfAbsent(operation, k -> new long[2]);
        slot[0]++;
        slot[1] += durationNanos;
    }

    public synchronized long count(String operation) {
        long[] slot = byOperation.get(operation);
        return slot == null ? 0L : slot[0];
    }

    public synchronized long totalCount() {
        long total = 0L;
        for (long[] slot : byOperation.values()) {
            total += slot[0];
        }
        return total;
    }

    public synchronized double totalTimeMs() {
        long nanos = 0L;
        for (long[] slot : byOperation.values()) {
            nanos += slot[1];
        }
        return nanos / 1_000_000.0;
    }

    public synchronized Map<String, OperationMetric> snapshot() {
        Map<String, OperationMetric> out = new LinkedHashMap<>();
        for (Map.Entry<String, long[]> e : byOperation.entrySet()) {
            long count = e.getValue()[0];
            double totalMs = e.getValue()[1] / 1_000_000.0;
            out.put(e.getKey(), new OperationMetric(count, totalMs, count == 0 ? 0.0 : totalMs / count));
        }
        return out;
    }

    public record OperationMetric(long count, double totalTimeMs, double avgTimeMs) {
    }
}
