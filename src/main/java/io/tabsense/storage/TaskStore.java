package io.tabsense.storage;

import io.tabsense.model.IntelligenceTask;
import io.tabsense.model.TaskStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.UnaryOperator;

/**
 * Authoritative table of tasks. Every mutation is a named transition that checks the source
 * status under the store monitor and returns the new snapshot, or empty when the transition does
 * not apply.
 */
public final class TaskStore {
    private final Map<String, IntelligenceTask> tasks = new LinkedHashMap<>();
    private final Map<String, CompletableFuture<IntelligenceTask>> terminals = new HashMap<>();

    /**
     * Stores the task as Pending with clean lifecycle fields.
     *
     * @throws IllegalArgumentException if a task with the same id is still stored
     */
    public synchronized IntelligenceTask insertPending(IntelligenceTask task) {
        Objects.requireNonNull(task, "task");
        if (tasks.containsKey(task.id())) {
            throw new IllegalArgumentException("task already exists: " + task.id());
        }
        IntelligenceTask pending = task.asPending();
        tasks.put(pending.id(), pending);
        terminals.put(pending.id(), new CompletableFuture<>());
        return pending;
    }

    public synchronized boolean contains(String taskId) {
        return tasks.containsKey(taskId);
    }

    public synchronized Optional<IntelligenceTask> markRunning(String taskId, Instant at) {
        return transition(taskId, TaskStatus.PENDING, task -> task.started(at));
    }

    public synchronized Optional<IntelligenceTask> complete(String taskId, Instant at, Map<String, Object> output) {
        return transition(taskId, TaskStatus.RUNNING, task -> task.completed(at, output));
    }

    public synchronized Optional<IntelligenceTask> fail(String taskId, Instant at, String reason) {
        return transition(taskId, TaskStatus.RUNNING, task -> task.failed(at, reason));
    }

    public synchronized Optional<IntelligenceTask> cancelPending(String taskId, Instant at, String reason) {
        return transition(taskId, TaskStatus.PENDING, task -> task.cancelled(at, reason));
    }

    public synchronized Optional<IntelligenceTask> forceCancel(String taskId, Instant at, String reason) {
        return transition(taskId, TaskStatus.RUNNING, task -> task.cancelled(at, reason));
    }

    /**
     * Raises the progress of a Running task. Returns empty if the task is not Running or the value
     * would not move progress forward.
     */
    public synchronized Optional<IntelligenceTask> updateProgress(String taskId, double progress) {
        IntelligenceTask current = tasks.get(taskId);
        if (current == null || current.status() != TaskStatus.RUNNING) {
            return Optional.empty();
        }
        IntelligenceTask next = current.withProgress(progress);
        if (Double.compare(next.progress(), current.progress()) == 0) {
            return Optional.empty();
        }
        tasks.put(taskId, next);
        return Optional.of(next);
    }

    public synchronized Optional<IntelligenceTask> find(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    public synchronized List<IntelligenceTask> list() {
        return List.copyOf(tasks.values());
    }

    public synchronized List<IntelligenceTask> list(String tabId) {
        List<IntelligenceTask> out = new ArrayList<>();
        for (IntelligenceTask task : tasks.values()) {
            if (task.tabId().equals(tabId)) {
                out.add(task);
            }
        }
        return List.copyOf(out);
    }

    public synchronized List<IntelligenceTask> listByStatus(TaskStatus status) {
        List<IntelligenceTask> out = new ArrayList<>();
        for (IntelligenceTask task : tasks.values()) {
            if (task.status() == status) {
                out.add(task);
            }
        }
        return List.copyOf(out);
    }

    public synchronized Map<TaskStatus, Integer> countByStatus() {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0);
        }
        for (IntelligenceTask task : tasks.values()) {
            counts.merge(task.status(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Future completed with the task's terminal snapshot. Already-terminal tasks yield a completed
     * future; unknown ids yield empty.
     */
    public synchronized Optional<CompletableFuture<IntelligenceTask>> awaitTerminal(String taskId) {
        IntelligenceTask current = tasks.get(taskId);
        if (current == null) {
            return Optional.empty();
        }
        CompletableFuture<IntelligenceTask> future = terminals.get(taskId);
        if (future == null) {
            return Optional.of(CompletableFuture.completedFuture(current));
        }
        return Optional.of(future);
    }

    /**
     * Removes a terminal task. Live tasks are never purged.
     */
    public synchronized boolean purge(String taskId) {
        IntelligenceTask current = tasks.get(taskId);
        if (current == null || !current.isTerminal()) {
            return false;
        }
        tasks.remove(taskId);
        terminals.remove(taskId);
        return true;
    }

    public synchronized int size() {
        return tasks.size();
    }

    public synchronized void clear() {
        for (CompletableFuture<IntelligenceTask> future : terminals.values()) {
            future.cancel(false);
        }
        terminals.clear();
        tasks.clear();
    }

    private Optional<IntelligenceTask> transition(
            String taskId,
            TaskStatus expected,
            UnaryOperator<IntelligenceTask> change
    ) {
        IntelligenceTask current = tasks.get(taskId);
        if (current == null || current.status() != expected) {
            return Optional.empty();
        }
        IntelligenceTask next = change.apply(current);
        tasks.put(taskId, next);
        if (next.isTerminal()) {
            CompletableFuture<IntelligenceTask> future = terminals.remove(taskId);
            if (future != null) {
                future.complete(next);
            }
        }
        return Optional.of(next);
    }
}
