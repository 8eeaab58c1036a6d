package io.tabsense.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * One unit of schedulable work against a tab. Instances are immutable snapshots; the task store
 * derives new snapshots through the transition methods below.
 */
public record IntelligenceTask(
        String id,
        String tabId,
        String name,
        String description,
        Capability capability,
        TaskPriority priority,
        TaskStatus status,
        Map<String, Object> parameters,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        Duration estimatedDuration,
        double progress,
        String error,
        Map<String, Object> result
) {
    public IntelligenceTask {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(tabId, "tabId");
        Objects.requireNonNull(capability, "capability");
        Objects.requireNonNull(createdAt, "createdAt");
        name = name == null ? "" : name;
        description = description == null ? "" : description;
        priority = priority == null ? TaskPriority.MEDIUM : priority;
        status = status == null ? TaskStatus.PENDING : status;
        parameters = frozen(parameters);
        result = frozen(result);
        progress = clampProgress(progress);
    }

    public static Builder builder(String tabId, Capability capability) {
        return new Builder(tabId, capability);
    }

    /**
     * Same task re-based to a fresh Pending state, discarding any lifecycle fields a caller set.
     */
    public IntelligenceTask asPending() {
        return new IntelligenceTask(id, tabId, name, description, capability, priority, TaskStatus.PENDING,
                parameters, createdAt, null, null, estimatedDuration, 0.0, null, Map.of());
    }

    public IntelligenceTask started(Instant at) {
        return new IntelligenceTask(id, tabId, name, description, capability, priority, TaskStatus.RUNNING,
                parameters, createdAt, at, null, estimatedDuration, progress, null, result);
    }

    public IntelligenceTask completed(Instant at, Map<String, Object> output) {
        Map<String, Object> merged = new LinkedHashMap<>(result);
        if (output != null) {
            merged.putAll(output);
        }
        return new IntelligenceTask(id, tabId, name, description, capability, priority, TaskStatus.COMPLETED,
                parameters, createdAt, startedAt, at, estimatedDuration, 1.0, null, merged);
    }

    public IntelligenceTask failed(Instant at, String reason) {
        return new IntelligenceTask(id, tabId, name, description, capability, priority, TaskStatus.FAILED,
                parameters, createdAt, startedAt, at, estimatedDuration, progress, reason, result);
    }

    public IntelligenceTask cancelled(Instant at, String reason) {
        Instant start = startedAt == null ? at : startedAt;
        return new IntelligenceTask(id, tabId, name, description, capability, priority, TaskStatus.CANCELLED,
                parameters, createdAt, start, at, estimatedDuration, progress, reason, result);
    }

    public IntelligenceTask withProgress(double value) {
        double next = Math.max(progress, clampProgress(value));
        return new IntelligenceTask(id, tabId, name, description, capability, priority, status,
                parameters, createdAt, startedAt, completedAt, estimatedDuration, next, error, result);
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private static Map<String, Object> frozen(Map<String, Object> raw) {
        if (raw == null || raw.isEmpty()) {
            return Map.of();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(raw));
    }

    private static double clampProgress(double value) {
        if (Double.isNaN(value) || value < 0.0) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }

    public static final class Builder {
        private final String tabId;
        private final Capability capability;
        private String id;
        private String name;
        private String description;
        private TaskPriority priority = TaskPriority.MEDIUM;
        private Map<String, Object> parameters = Map.of();
        private Duration estimatedDuration;
        private Instant createdAt;

        private Builder(String tabId, Capability capability) {
            if (tabId == null || tabId.isBlank()) {
                throw new IllegalArgumentException("tabId cannot be empty");
            }
            this.tabId = tabId;
            this.capability = Objects.requireNonNull(capability, "capability");
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        /**
         * Id of the form {@code <tabId>_<suffix>}.
         */
        public Builder idSuffix(String suffix) {
            this.id = tabId + "_" + suffix;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder priority(TaskPriority priority) {
            this.priority = priority;
            return this;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder estimatedDuration(Duration estimatedDuration) {
            this.estimatedDuration = estimatedDuration;
            return this;
        }

        /**
         * Creation time of the task. When unset, {@link #build()} stamps the system clock.
         */
        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public IntelligenceTask build() {
            String resolvedId = id == null || id.isBlank()
                    ? tabId + "_task_" + UUID.randomUUID().toString().substring(0, 8)
                    : id;
            String resolvedName = name == null || name.isBlank() ? capability.wireName() : name;
            return new IntelligenceTask(
                    resolvedId,
                    tabId,
                    resolvedName,
                    description,
                    capability,
                    priority,
                    TaskStatus.PENDING,
                    parameters,
                    createdAt == null ? Instant.now() : createdAt,
                    null,
                    null,
                    estimatedDuration,
                    0.0,
                    null,
                    Map.of()
            );
        }
    }
}
