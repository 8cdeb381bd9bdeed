package io.sessionvault.observability;

import io.sessionvault.cache.OperationMetrics;
import io.sessionvault.runtime.CrossSessionPersistenceEngine;

import java.util.LinkedHashMap;
import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(CrossSessionPersistenceEngine.SessionStatistics stats) {
        StringBuilder sb = new StringBuilder();
        var performance = stats.performanceStats();
        var integrity = stats.integrityStats();
        var conflicts = stats.conflictStats();
        var migrations = stats.migrationStats();
        var transactions = stats.transactionStats();

        appendGauge(sb, "sessionvault_active_sessions", "Sessions currently live on this storage directory", null, null, stats.activeSessions().size());
        appendGauge(sb, "sessionvault_tasks_processed_total", "Tasks saved by this session", null, null, stats.currentSession().statistics().tasksProcessed());
        appendGauge(sb, "sessionvault_operations_total", "Persistence operations performed by this session", null, null, stats.currentSession().statistics().totalOperations());
        appendGauge(sb, "sessionvault_errors_total", "Errors encountered by this session", null, null, stats.currentSession().statistics().errorsEncountered());

        Map<String, Long> counts = new LinkedHashMap<>();
        Map<String, Double> averages = new LinkedHashMap<>();
        for (Map.Entry<String, OperationMetrics.OperationMetric> e : stats.operationMetrics().entrySet()) {
            counts.put(e.getKey(), e.getValue().count());
            averages.put(e.getKey(), e.getValue().avgTimeMs());
        }
        appendMapGauge(sb, "sessionvault_operation_count", "Timed operations grouped by operation", "operation", counts);
        appendMapGauge(sb, "sessionvault_operation_avg_ms", "Average operation time in milliseconds", "operation", averages);

        appendGauge(sb, "sessionvault_checkpoints_total", "Checkpoints currently retained", null, null, stats.checkpointStats().total());
        appendMapGauge(sb, "sessionvault_checkpoints_by_type", "Retained checkpoints grouped by type", "type", stats.checkpointStats().byType());

        appendGauge(sb, "sessionvault_avg_operation_ms", "Average time over all timed operations", null, null, performance.avgOperationTimeMs());
        appendGauge(sb, "sessionvault_operations_per_second", "Operations per second since initialization", null, null, performance.operationsPerSecond());
        appendGauge(sb, "sessionvault_cache_hit_rate", "Prefetch cache hits per 100 loads", null, null, performance.cacheHitRate());
        appendGauge(sb, "sessionvault_write_buffer_size", "Tasks waiting in the write buffer", null, null, performance.writeBufferSize());
        appendGauge(sb, "sessionvault_prefetch_cache_size", "Tasks held in the prefetch cache", null, null, performance.prefetchCacheSize());

        appendGauge(sb, "sessionvault_validations_passed_total", "Task validations passed", null, null, integrity.validationsPassed());
        appendGauge(sb, "sessionvault_corruptions_total", "Corruptions and validation failures grouped by outcome", "outcome", "detected", integrity.corruptionsDetected());
        appendGauge(sb, "sessionvault_corruptions_total", "Corruptions and validation failures grouped by outcome", "outcome", "fixed", integrity.corruptionsFixed());

        appendGauge(sb, "sessionvault_conflicts_total", "Cross-session conflicts resolved", null, null, conflicts.totalConflicts());
        appendMapGauge(sb, "sessionvault_conflicts_by_strategy", "Resolved conflicts grouped by strategy", "strategy", conflicts.byStrategy());

        appendGauge(sb, "sessionvault_migration_steps_total", "Migration steps grouped by outcome", "outcome", "success", migrations.successfulSteps());
        appendGauge(sb, "sessionvault_migration_steps_total", "Migration steps grouped by outcome", "outcome", "failed", migrations.failedSteps());

        appendGauge(sb, "sessionvault_transactions", "Transactions grouped by state", "state", "active", transactions.active());
        appendGauge(sb, "sessionvault_transactions", "Transactions grouped by state", "state", "committed", transactions.committed());
        appendGauge(sb, "sessionvault_transactions", "Transactions grouped by state", "state", "rolled_back", transactions.rolledBack());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, ? extends Number> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, ? extends Number> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, Number value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
