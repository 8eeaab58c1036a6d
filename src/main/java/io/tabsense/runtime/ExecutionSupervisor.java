package io.tabsense.runtime;

import io.tabsense.capability.CancellationToken;
import io.tabsense.capability.CapabilityContext;
import io.tabsense.capability.CapabilityHandler;
import io.tabsense.capability.CapabilityRegistry;
import io.tabsense.capability.RenderTarget;
import io.tabsense.model.Capability;
import io.tabsense.model.IntelligenceTask;
import io.tabsense.security.SensitiveDataMasker;
import io.tabsense.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs dispatched tasks on the worker pool and owns every Running to terminal transition. Each
 * dispatched task holds one limiter permit, returned exactly once by whichever terminal
 * transition wins.
 */
final class ExecutionSupervisor {
    private static final Logger log = LoggerFactory.getLogger(ExecutionSupervisor.class);

    private final TaskStore tasks;
    private final CapabilityRegistry registry;
    private final ConcurrencyLimiter limiter;
    private final NotificationHub notifications;
    private final InsightGenerator insights;
    private final ExecutorService workers;
    private final Function<String, RenderTarget> targets;
    private final Consumer<String> purgeScheduler;
    private final Clock clock;
    private final Map<String, Execution> executions = new ConcurrentHashMap<>();

    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong timeouts = new AtomicLong();
    private final AtomicLong totalExecutionMs = new AtomicLong();
    private final Map<Capability, Long> usage = new EnumMap<>(Capability.class);

    ExecutionSupervisor(
            TaskStore tasks,
            CapabilityRegistry registry,
            ConcurrencyLimiter limiter,
            NotificationHub notifications,
            InsightGenerator insights,
            ExecutorService workers,
            Function<String, RenderTarget> targets,
            Consumer<String> purgeScheduler,
            Clock clock
    ) {
        this.tasks = tasks;
        this.registry = registry;
        this.limiter = limiter;
        this.notifications = notifications;
        this.insights = insights;
        this.workers = workers;
        this.targets = targets;
        this.purgeScheduler = purgeScheduler;
        this.clock = clock;
    }

    /**
     * Starts a task whose limiter permit the caller already holds. The permit is returned here if
     * the task is no longer Pending.
     */
    void dispatch(IntelligenceTask queued) {
        Execution execution = new Execution(queued.id());
        executions.put(queued.id(), execution);
        Optional<IntelligenceTask> running = tasks.markRunning(queued.id(), clock.instant());
        if (running.isEmpty()) {
            executions.remove(queued.id(), execution);
            execution.releaseSlot();
            log.debug("Skipped dispatch of {}: no longer pending", queued.id());
            return;
        }
        IntelligenceTask task = running.get();
        log.debug("Task {} running ({}, {})", task.id(), task.capability().wireName(), task.priority());
        notifications.publishTask(task);
        try {
            execution.future = workers.submit(() -> run(task, execution));
        } catch (RejectedExecutionException e) {
            fail(task, execution, "worker pool unavailable");
        }
    }

    /**
     * Forces a Running task to Cancelled, signals its token and interrupts its worker.
     */
    Optional<IntelligenceTask> forceCancel(String taskId, String reason, boolean timeout) {
        Optional<IntelligenceTask> cancelled = tasks.forceCancel(taskId, clock.instant(), reason);
        if (cancelled.isEmpty()) {
            return Optional.empty();
        }
        if (timeout) {
            timeouts.incrementAndGet();
        }
        Execution execution = executions.remove(taskId);
        if (execution != null) {
            execution.token.cancel(reason);
            Future<?> future = execution.future;
            if (future != null) {
                future.cancel(true);
            }
            execution.releaseSlot();
        }
        notifications.publishTask(cancelled.get());
        purgeScheduler.accept(taskId);
        return cancelled;
    }

    ExecutionStats snapshot() {
        Map<Capability, Long> usageCopy;
        synchronized (usage) {
            usageCopy = new EnumMap<>(usage);
        }
        return new ExecutionStats(
                completed.get(),
                failed.get(),
                timeouts.get(),
                totalExecutionMs.get(),
                usageCopy
        );
    }

    private void run(IntelligenceTask task, Execution execution) {
        try {
            execution.token.throwIfCancelled();
            CapabilityHandler handler = registry.find(task.capability())
                    .orElseThrow(() -> new IllegalStateException(
                            "No handler registered for capability " + task.capability().wireName()));
            CapabilityContext context = new CapabilityContext(
                    task.id(),
                    task.tabId(),
                    task.parameters(),
                    targets.apply(task.tabId()),
                    execution.token,
                    value -> progress(task.id(), value)
            );
            Map<String, Object> output = handler.execute(context);
            succeed(task, execution, output);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(task, execution, describe(e));
        } catch (Exception e) {
            fail(task, execution, describe(e));
        } catch (Error e) {
            // The task must leave Running before its slot is returned in finally.
            fail(task, execution, describe(e));
            throw e;
        } finally {
            executions.remove(task.id(), execution);
            execution.releaseSlot();
        }
    }

    private void succeed(IntelligenceTask task, Execution execution, Map<String, Object> output) {
        Instant now = clock.instant();
        Optional<IntelligenceTask> done = tasks.complete(task.id(), now, output);
        if (done.isEmpty()) {
            log.debug("Discarded late result of {}", task.id());
            return;
        }
        completed.incrementAndGet();
        synchronized (usage) {
            usage.merge(task.capability(), 1L, Long::sum);
        }
        long elapsedMs = Math.max(0L, Duration.between(task.startedAt(), now).toMillis());
        totalExecutionMs.addAndGet(elapsedMs);
        execution.releaseSlot();
        log.debug("Task {} completed in {} ms", task.id(), elapsedMs);

        IntelligenceTask finished = done.get();
        notifications.publishTask(finished);
        try {
            insights.onTaskCompleted(finished);
        } catch (RuntimeException e) {
            log.warn("Insight generation failed for {}: {}", task.id(), e.toString());
        }
        purgeScheduler.accept(task.id());
    }

    private void fail(IntelligenceTask task, Execution execution, String error) {
        Optional<IntelligenceTask> done = tasks.fail(task.id(), clock.instant(), error);
        if (done.isEmpty()) {
            log.debug("Discarded late failure of {}: {}", task.id(), error);
            return;
        }
        failed.incrementAndGet();
        execution.releaseSlot();
        log.warn(
                "Task {} ({}) failed: {} parameters={}",
                task.id(),
                task.capability().wireName(),
                error,
                SensitiveDataMasker.masked(task.parameters())
        );
        notifications.publishTask(done.get());
        purgeScheduler.accept(task.id());
    }

    private void progress(String taskId, double value) {
        tasks.updateProgress(taskId, value).ifPresent(notifications::publishTask);
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        if (message == null || message.isBlank()) {
            return error.getClass().getSimpleName();
        }
        return error.getClass().getSimpleName() + ": " + message;
    }

    private final class Execution {
        private final String taskId;
        private final CancellationToken token = new CancellationToken();
        private final AtomicBoolean released = new AtomicBoolean(false);
        private volatile Future<?> future;

        private Execution(String taskId) {
            this.taskId = taskId;
        }

        private void releaseSlot() {
            if (released.compareAndSet(false, true)) {
                limiter.release();
                log.trace("Released slot of {}", taskId);
            }
        }
    }
}
