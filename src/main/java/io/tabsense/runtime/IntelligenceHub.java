package io.tabsense.runtime;

import io.tabsense.capability.CapabilityHandler;
import io.tabsense.capability.CapabilityRegistry;
import io.tabsense.capability.RenderTarget;
import io.tabsense.command.CommandInterpreter;
import io.tabsense.config.HubConfig;
import io.tabsense.config.HubSettings;
import io.tabsense.config.SettingsUpdate;
import io.tabsense.model.Capability;
import io.tabsense.model.Insight;
import io.tabsense.model.IntelligenceTask;
import io.tabsense.model.TaskPriority;
import io.tabsense.model.TaskStatus;
import io.tabsense.observability.PrometheusFormatter;
import io.tabsense.storage.InsightStore;
import io.tabsense.storage.SettingsStore;
import io.tabsense.storage.TaskStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Coordinates intelligence tasks for a set of tabs: admission, priority scheduling under a
 * concurrency cap, timeouts, insight derivation and update fan-out.
 *
 * <p>One instance per host. Call {@link #start()} to load settings and launch the background
 * threads, and {@link #close()} to cancel everything and release them.
 */
public final class IntelligenceHub implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IntelligenceHub.class);

    public static final String TAB_CLOSED_ERROR = "Tab closed";
    public static final String HUB_CLOSED_ERROR = "Hub closed";
    public static final String TIMEOUT_ERROR = StuckTaskReaper.TIMEOUT_ERROR;
    public static final Duration COMMAND_ESTIMATE = Duration.ofSeconds(10);

    private final HubConfig config;
    private final SettingsStore settingsStore;
    private final CapabilityRegistry registry;
    private final Clock clock;
    private final TaskStore tasks = new TaskStore();
    private final InsightStore insights;
    private final NotificationHub notifications = new NotificationHub();
    private final ConcurrencyLimiter limiter;
    private final ScheduledExecutorService scheduler;
    private final ExecutorService workers;
    private final InsightGenerator insightGenerator;
    private final ExecutionSupervisor supervisor;
    private final Dispatcher dispatcher;
    private final StuckTaskReaper reaper;
    private final Map<String, RenderTarget> tabs = new ConcurrentHashMap<>();
    private final List<ScheduledFuture<?>> periodicJobs = new ArrayList<>();
    private final Object settingsLock = new Object();
    private volatile HubSettings settings;
    private volatile boolean started;
    private volatile boolean closed;

    public IntelligenceHub(HubConfig config, SettingsStore settingsStore, CapabilityRegistry registry) {
        this(config, settingsStore, registry, Clock.systemUTC());
    }

    public IntelligenceHub(HubConfig config, SettingsStore settingsStore, CapabilityRegistry registry, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.settingsStore = Objects.requireNonNull(settingsStore, "settingsStore");
        this.registry = registry == null ? new CapabilityRegistry() : registry;
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.settings = HubSettings.defaults();
        this.insights = new InsightStore(config.insightCapacity());
        this.limiter = new ConcurrencyLimiter(settings.maxConcurrentTasks());
        this.scheduler = Executors.newSingleThreadScheduledExecutor(namedThreads("tabsense-scheduler"));
        this.workers = Executors.newCachedThreadPool(namedThreads("tabsense-worker"));
        this.insightGenerator = new InsightGenerator(insights, notifications, this.clock);
        this.supervisor = new ExecutionSupervisor(
                tasks,
                this.registry,
                limiter,
                notifications,
                insightGenerator,
                workers,
                tabs::get,
                this::schedulePurge,
                this.clock
        );
        this.dispatcher = new Dispatcher(tasks, limiter, supervisor, scheduler);
        this.reaper = new StuckTaskReaper(tasks, supervisor, config.defaultEstimate(), this.clock);
    }

    public synchronized void start() {
        requireOpen();
        if (started) {
            return;
        }
        HubSettings loaded = loadSettings();
        synchronized (settingsLock) {
            settings = loaded;
            limiter.setCap(loaded.maxConcurrentTasks());
        }
        dispatcher.start();
        schedulePeriodic("reaper", config.reaperInterval(), this::reapStuckTasks);
        schedulePeriodic("insight sweep", config.insightInterval(), this::generatePeriodicInsights);
        schedulePeriodic("auto optimization", config.autoOptimizationInterval(), this::runAutoOptimization);
        started = true;
        log.info(
                "Intelligence hub started root={} maxConcurrentTasks={} enabled={}",
                config.rootDir(),
                loaded.maxConcurrentTasks(),
                loaded.toFile().enabledCapabilities()
        );
    }

    public void registerTab(String tabId, RenderTarget target) {
        requireOpen();
        requireTabId(tabId);
        tabs.put(tabId, target == null ? RenderTarget.of(tabId, null) : target);
        log.info("Registered tab {}", tabId);

        queueInitial(IntelligenceTask.builder(tabId, Capability.WEB_ANALYSIS)
                .idSuffix("initial_analysis")
                .name("Initial Page Analysis")
                .description("Analyze page structure, content, and capabilities")
                .priority(TaskPriority.HIGH)
                .estimatedDuration(Duration.ofSeconds(5))
                .createdAt(clock.instant())
                .build());
        queueInitial(IntelligenceTask.builder(tabId, Capability.SECURITY)
                .idSuffix("security_scan")
                .name("Security Scan")
                .description("Scan page for security threats and vulnerabilities")
                .priority(TaskPriority.HIGH)
                .estimatedDuration(Duration.ofSeconds(3))
                .createdAt(clock.instant())
                .build());
        queueInitial(IntelligenceTask.builder(tabId, Capability.PERFORMANCE)
                .idSuffix("performance_analysis")
                .name("Performance Analysis")
                .description("Analyze page performance and optimization opportunities")
                .priority(TaskPriority.MEDIUM)
                .estimatedDuration(Duration.ofSeconds(2))
                .createdAt(clock.instant())
                .build());
    }

    /**
     * Drops the tab, cancels its Pending tasks, force-cancels its Running ones and closes its
     * subscriptions.
     */
    public void unregisterTab(String tabId) {
        requireTabId(tabId);
        tabs.remove(tabId);
        int cancelled = 0;
        for (IntelligenceTask task : tasks.list(tabId)) {
            if (task.isTerminal()) {
                continue;
            }
            if (cancelPending(task.id(), TAB_CLOSED_ERROR)
                    || supervisor.forceCancel(task.id(), TAB_CLOSED_ERROR, false).isPresent()) {
                cancelled++;
            }
        }
        notifications.closeTab(tabId);
        log.info("Unregistered tab {} cancelledTasks={}", tabId, cancelled);
    }

    public List<String> registeredTabs() {
        return List.copyOf(new TreeSet<>(tabs.keySet()));
    }

    /**
     * Stores the task as Pending and schedules it. Returns without waiting for a free slot.
     *
     * @throws CapabilityDisabledException if the task's capability is not enabled
     * @throws IllegalArgumentException    if a task with the same id is still stored
     */
    public String queueTask(IntelligenceTask task) {
        requireOpen();
        if (task == null) {
            throw new IllegalArgumentException("task must not be null");
        }
        if (!settings.isEnabled(task.capability())) {
            throw new CapabilityDisabledException(task.capability());
        }
        IntelligenceTask pending = tasks.insertPending(task);
        log.debug("Queued task {} ({}, {})", pending.id(), pending.capability().wireName(), pending.priority());
        notifications.publishTask(pending);
        dispatcher.admit(pending);
        return pending.id();
    }

    /**
     * Cancels a Pending task. Returns {@code false} for unknown, Running or finished tasks.
     */
    public boolean cancelTask(String taskId) {
        return cancelPending(taskId, null);
    }

    /**
     * Runs a free-text command against a tab and completes with a human-readable outcome. The
     * future never completes exceptionally.
     */
    public CompletableFuture<String> processCommand(String tabId, String command) {
        try {
            requireTabId(tabId);
            CommandInterpreter.CommandPlan plan = CommandInterpreter.interpret(command);
            IntelligenceTask task = IntelligenceTask.builder(tabId, plan.capability())
                    .id(uniqueTaskId(tabId + "_command_" + clock.millis()))
                    .name("User Command")
                    .description(plan.instruction())
                    .priority(TaskPriority.HIGH)
                    .parameters(plan.parameters())
                    .estimatedDuration(COMMAND_ESTIMATE)
                    .createdAt(clock.instant())
                    .build();
            String taskId = queueTask(task);
            log.debug("Command on tab {} mapped to {} as {}", tabId, plan.capability().wireName(), taskId);
            CompletableFuture<IntelligenceTask> terminal = tasks.awaitTerminal(taskId)
                    .orElseGet(() -> CompletableFuture.failedFuture(
                            new IllegalStateException("task disappeared: " + taskId)));
            return terminal.handle((done, error) -> {
                if (error != null) {
                    return "Error processing command: " + ExecutionSupervisor.describe(error);
                }
                if (done.status() == TaskStatus.COMPLETED) {
                    Object message = done.result().get("message");
                    return "Command executed successfully: " + (message == null ? "Done" : message);
                }
                return "Command failed: " + (done.error() == null ? "Unknown error" : done.error());
            });
        } catch (RuntimeException e) {
            return CompletableFuture.completedFuture("Error processing command: " + e.getMessage());
        }
    }

    public List<IntelligenceTask> getActiveTasks() {
        return tasks.list();
    }

    public List<IntelligenceTask> getActiveTasks(String tabId) {
        return tasks.list(tabId);
    }

    public Optional<IntelligenceTask> getTask(String taskId) {
        return tasks.find(taskId);
    }

    public List<Insight> getInsights() {
        return insights.list();
    }

    public List<Insight> getInsights(Capability category) {
        return insights.list(category);
    }

    public Subscription subscribeTaskUpdates(String tabId, Consumer<IntelligenceTask> subscriber) {
        requireTabId(tabId);
        return notifications.subscribeTasks(tabId, subscriber);
    }

    public Subscription subscribeInsights(Consumer<Insight> subscriber) {
        return notifications.subscribeInsights(subscriber);
    }

    public void registerHandler(Capability capability, CapabilityHandler handler) {
        registry.register(capability, handler);
    }

    public CapabilityRegistry capabilityRegistry() {
        return registry;
    }

    public HubSettings setCapabilityEnabled(Capability capability, boolean enabled) {
        Objects.requireNonNull(capability, "capability");
        return updateSettings(current -> current.withCapability(capability, enabled));
    }

    public HubSettings configure(SettingsUpdate update) {
        return updateSettings(current -> current.apply(update));
    }

    public HubSettings currentSettings() {
        return settings;
    }

    public StatsOutcome stats() {
        ExecutionStats execution = supervisor.snapshot();
        Map<TaskStatus, Integer> byStatus = tasks.countByStatus();
        Map<String, Integer> taskStatus = new LinkedHashMap<>();
        for (Map.Entry<TaskStatus, Integer> entry : byStatus.entrySet()) {
            taskStatus.put(entry.getKey().name(), entry.getValue());
        }
        Map<String, Long> usage = new LinkedHashMap<>();
        for (Capability capability : Capability.values()) {
            Long count = execution.capabilityUsage().get(capability);
            if (count != null) {
                usage.put(capability.wireName(), count);
            }
        }
        HubSettings current = settings;
        return new StatsOutcome(
                tabs.size(),
                tasks.size(),
                taskStatus,
                byStatus.getOrDefault(TaskStatus.RUNNING, 0),
                byStatus.getOrDefault(TaskStatus.PENDING, 0),
                limiter.cap(),
                limiter.inUse(),
                execution.completed(),
                execution.failed(),
                execution.timeouts(),
                execution.totalExecutionMs(),
                execution.averageExecutionMs(),
                execution.successRate(),
                usage,
                insights.size(),
                current.toFile()
        );
    }

    public String metricsText() {
        return PrometheusFormatter.format(stats());
    }

    public List<Insight> generatePeriodicInsights() {
        return insightGenerator.periodic(supervisor.snapshot());
    }

    public List<String> reapStuckTasks() {
        return reaper.sweep();
    }

    /**
     * Queues a low-priority performance pass for every registered tab when auto-optimization is
     * on. Returns the queued task ids.
     */
    public List<String> runAutoOptimization() {
        if (closed || !settings.autoOptimization()) {
            return List.of();
        }
        List<String> queued = new ArrayList<>();
        for (String tabId : registeredTabs()) {
            IntelligenceTask task = IntelligenceTask.builder(tabId, Capability.PERFORMANCE)
                    .id(uniqueTaskId(tabId + "_auto_optimization_" + clock.millis()))
                    .name("Auto Optimization")
                    .description("Automatic performance and security optimization")
                    .priority(TaskPriority.LOW)
                    .estimatedDuration(Duration.ofSeconds(3))
                    .createdAt(clock.instant())
                    .build();
            try {
                queued.add(queueTask(task));
            } catch (CapabilityDisabledException e) {
                log.debug("Auto optimization skipped for tab {}: {}", tabId, e.getMessage());
            }
        }
        return queued;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        for (ScheduledFuture<?> job : periodicJobs) {
            job.cancel(false);
        }
        periodicJobs.clear();
        dispatcher.stop();
        for (IntelligenceTask task : tasks.list()) {
            if (!task.isTerminal() && !cancelPending(task.id(), HUB_CLOSED_ERROR)) {
                supervisor.forceCancel(task.id(), HUB_CLOSED_ERROR, false);
            }
        }
        workers.shutdownNow();
        scheduler.shutdownNow();
        notifications.close();
        tabs.clear();
        tasks.clear();
        insights.clear();
        log.info("Intelligence hub closed");
    }

    private boolean cancelPending(String taskId, String reason) {
        Optional<IntelligenceTask> cancelled = tasks.cancelPending(taskId, clock.instant(), reason);
        if (cancelled.isEmpty()) {
            return false;
        }
        dispatcher.discard(taskId);
        log.debug("Cancelled pending task {}", taskId);
        notifications.publishTask(cancelled.get());
        schedulePurge(taskId);
        return true;
    }

    private void queueInitial(IntelligenceTask task) {
        try {
            queueTask(task);
        } catch (CapabilityDisabledException | IllegalArgumentException e) {
            log.info("Skipped {} for tab {}: {}", task.name(), task.tabId(), e.getMessage());
        }
    }

    private HubSettings updateSettings(UnaryOperator<HubSettings> change) {
        synchronized (settingsLock) {
            HubSettings previous = settings;
            HubSettings next = change.apply(previous);
            settingsStore.saveSettings(next);
            settings = next;
            limiter.setCap(next.maxConcurrentTasks());
            List<String> changed = previous.diffFields(next);
            if (!changed.isEmpty()) {
                log.info("Settings updated fields={}", changed);
            }
            return next;
        }
    }

    private HubSettings loadSettings() {
        try {
            return settingsStore.loadSettings().orElseGet(HubSettings::defaults);
        } catch (RuntimeException e) {
            log.warn("Failed to load settings, using defaults: {}", e.getMessage());
            return HubSettings.defaults();
        }
    }

    private void schedulePeriodic(String name, Duration period, Runnable job) {
        long periodMs = period.toMillis();
        periodicJobs.add(scheduler.scheduleWithFixedDelay(() -> {
            try {
                job.run();
            } catch (RuntimeException e) {
                log.warn("Periodic {} failed: {}", name, e.toString());
            }
        }, periodMs, periodMs, TimeUnit.MILLISECONDS));
    }

    private void schedulePurge(String taskId) {
        if (closed) {
            return;
        }
        try {
            scheduler.schedule(() -> {
                if (tasks.purge(taskId)) {
                    log.debug("Purged task {}", taskId);
                }
            }, config.taskRetention().toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Purge of {} skipped after shutdown", taskId);
        }
    }

    private String uniqueTaskId(String base) {
        String candidate = base;
        int attempt = 1;
        while (tasks.contains(candidate)) {
            attempt++;
            candidate = base + "_" + attempt;
        }
        return candidate;
    }

    private void requireOpen() {
        if (closed) {
            throw new IllegalStateException("Intelligence hub is closed");
        }
    }

    private static void requireTabId(String tabId) {
        if (tabId == null || tabId.isBlank()) {
            throw new IllegalArgumentException("tabId must not be blank");
        }
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public record StatsOutcome(
            int registeredTabs,
            int activeTasks,
            Map<String, Integer> taskStatus,
            int runningTasks,
            int pendingTasks,
            int maxConcurrentTasks,
            int slotsInUse,
            long completedTasks,
            long failedTasks,
            long timedOutTasks,
            long totalExecutionMs,
            long averageExecutionMs,
            double successRate,
            Map<String, Long> capabilityUsage,
            int insights,
            HubSettings.SettingsFile settings
    ) {
    }
}
