package io.tabsense.runtime;

import io.tabsense.model.Capability;

import java.util.Map;

/**
 * Point-in-time copy of the execution counters.
 */
public record ExecutionStats(
        long completed,
        long failed,
        long timeouts,
        long totalExecutionMs,
        Map<Capability, Long> capabilityUsage
) {
    public ExecutionStats {
        capabilityUsage = capabilityUsage == null ? Map.of() : Map.copyOf(capabilityUsage);
    }

    /**
     * Share of completed tasks among finished ones; 1.0 before anything has finished.
     */
    public double successRate() {
        long finished = completed + failed;
        if (finished == 0L) {
            return 1.0;
        }
        return (double) completed / (double) finished;
    }

    public long averageExecutionMs() {
        return completed == 0L ? 0L : totalExecutionMs / completed;
    }
}
