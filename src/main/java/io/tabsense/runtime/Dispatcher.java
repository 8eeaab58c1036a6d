package io.tabsense.runtime;

import io.tabsense.model.IntelligenceTask;
import io.tabsense.model.TaskStatus;
import io.tabsense.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Moves Pending tasks into the ready queue after their priority stagger and starts them, highest
 * priority first and in admission order within a priority, whenever a limiter permit is free.
 */
final class Dispatcher {
    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private static final long ACQUIRE_POLL_MS = 250L;

    private static final Comparator<ReadyEntry> READY_ORDER = Comparator
            .comparingInt((ReadyEntry entry) -> entry.task().priority().ordinal())
            .thenComparingLong(ReadyEntry::sequence);

    private final TaskStore tasks;
    private final ConcurrencyLimiter limiter;
    private final ExecutionSupervisor supervisor;
    private final ScheduledExecutorService scheduler;
    private final PriorityBlockingQueue<ReadyEntry> ready = new PriorityBlockingQueue<>(16, READY_ORDER);
    private final Map<String, ScheduledFuture<?>> stagger = new ConcurrentHashMap<>();
    private final AtomicLong admissions = new AtomicLong();
    private volatile Thread thread;
    private volatile boolean running;

    Dispatcher(TaskStore tasks, ConcurrencyLimiter limiter, ExecutionSupervisor supervisor, ScheduledExecutorService scheduler) {
        this.tasks = tasks;
        this.limiter = limiter;
        this.supervisor = supervisor;
        this.scheduler = scheduler;
    }

    synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        Thread loop = new Thread(this::loop, "tabsense-dispatch");
        loop.setDaemon(true);
        thread = loop;
        loop.start();
    }

    /**
     * Schedules a stored Pending task to enter the ready queue after its priority delay.
     */
    void admit(IntelligenceTask task) {
        long sequence = admissions.incrementAndGet();
        long delayMs = task.priority().startDelay().toMillis();
        if (delayMs <= 0L) {
            ready.offer(new ReadyEntry(task, sequence));
            return;
        }
        ScheduledFuture<?> timer = scheduler.schedule(() -> {
            stagger.remove(task.id());
            ready.offer(new ReadyEntry(task, sequence));
        }, delayMs, TimeUnit.MILLISECONDS);
        stagger.put(task.id(), timer);
        if (timer.isDone()) {
            stagger.remove(task.id(), timer);
        }
    }

    /**
     * Drops the stagger timer and ready-queue entry of a task that left Pending.
     */
    void discard(String taskId) {
        ScheduledFuture<?> timer = stagger.remove(taskId);
        if (timer != null) {
            timer.cancel(false);
        }
        ready.removeIf(entry -> entry.task().id().equals(taskId));
    }

    void stop() {
        running = false;
        for (ScheduledFuture<?> timer : stagger.values()) {
            timer.cancel(false);
        }
        stagger.clear();
        ready.clear();
        Thread loop = thread;
        if (loop != null) {
            loop.interrupt();
            try {
                loop.join(2_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void loop() {
        while (running) {
            boolean holding = false;
            try {
                if (!limiter.tryAcquire(ACQUIRE_POLL_MS, TimeUnit.MILLISECONDS)) {
                    continue;
                }
                holding = true;
                ReadyEntry entry = ready.take();
                Optional<IntelligenceTask> current = tasks.find(entry.task().id());
                if (current.isEmpty() || current.get().status() != TaskStatus.PENDING) {
                    limiter.release();
                    holding = false;
                    continue;
                }
                holding = false;
                supervisor.dispatch(current.get());
            } catch (InterruptedException e) {
                if (holding) {
                    limiter.release();
                }
                if (running) {
                    log.warn("Dispatcher interrupted while running");
                }
                break;
            } catch (RuntimeException e) {
                if (holding) {
                    limiter.release();
                }
                log.error("Dispatcher iteration failed", e);
            }
        }
        log.debug("Dispatcher stopped");
    }

    private record ReadyEntry(IntelligenceTask task, long sequence) {
    }
}
