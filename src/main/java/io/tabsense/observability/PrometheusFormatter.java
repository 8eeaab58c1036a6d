package io.tabsense.observability;

import io.tabsense.runtime.IntelligenceHub;

import java.util.Locale;
import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(IntelligenceHub.StatsOutcome stats) {
        StringBuilder sb = new StringBuilder();
        appendMapGauge(sb, "tabsense_tasks_total", "Stored tasks grouped by status", "status", stats.taskStatus());
        appendGauge(sb, "tabsense_registered_tabs", "Registered tabs", null, null, stats.registeredTabs());
        appendGauge(sb, "tabsense_running_tasks", "Tasks currently running", null, null, stats.runningTasks());
        appendGauge(sb, "tabsense_pending_tasks", "Tasks waiting for a slot or their start delay", null, null, stats.pendingTasks());
        appendGauge(sb, "tabsense_max_concurrent_tasks", "Configured concurrency cap", null, null, stats.maxConcurrentTasks());
        appendGauge(sb, "tabsense_slots_in_use", "Concurrency slots held by running tasks and the waiting dispatcher", null, null, stats.slotsInUse());
        appendCounter(sb, "tabsense_tasks_completed_total", "Tasks completed since start", stats.completedTasks());
        appendCounter(sb, "tabsense_tasks_failed_total", "Tasks failed since start", stats.failedTasks());
        appendCounter(sb, "tabsense_tasks_timed_out_total", "Running tasks cancelled by the stuck-task reaper", stats.timedOutTasks());
        appendCounter(sb, "tabsense_execution_ms_total", "Summed execution time of completed tasks in milliseconds", stats.totalExecutionMs());
        appendGauge(sb, "tabsense_execution_ms_avg", "Average execution time of completed tasks in milliseconds", null, null, stats.averageExecutionMs());
        appendRatio(sb, "tabsense_success_rate", "Completed share of finished tasks", stats.successRate());
        appendMapGauge(sb, "tabsense_capability_usage_total", "Completed tasks grouped by capability", "capability", stats.capabilityUsage());
        appendGauge(sb, "tabsense_insights", "Retained insights", null, null, stats.insights());
        return sb.toString();
    }

    private static void appendMapGauge(
            StringBuilder sb,
            String metric,
            String help,
            String label,
            Map<String, ? extends Number> values
    ) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, ? extends Number> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue().longValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
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

    private static void appendCounter(StringBuilder sb, String metric, String help, long value) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" counter").append('\n');
        sb.append(metric).append(' ').append(value).append('\n');
    }

    private static void appendRatio(StringBuilder sb, String metric, String help, double value) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        sb.append(metric).append(' ').append(String.format(Locale.ROOT, "%.4f", value)).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
