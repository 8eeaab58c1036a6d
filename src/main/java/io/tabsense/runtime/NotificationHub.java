package io.tabsense.runtime;

import io.tabsense.model.Insight;
import io.tabsense.model.IntelligenceTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Fans task updates out to per-tab subscribers and insights to global subscribers. Deliveries run
 * on a single thread in publish order.
 */
final class NotificationHub implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NotificationHub.class);

    private final Map<String, List<Consumer<IntelligenceTask>>> taskSubscribers = new ConcurrentHashMap<>();
    private final List<Consumer<Insight>> insightSubscribers = new CopyOnWriteArrayList<>();
    private final ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
        Thread thread = new Thread(runnable, "tabsense-notify");
        thread.setDaemon(true);
        return thread;
    });

    Subscription subscribeTasks(String tabId, Consumer<IntelligenceTask> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        List<Consumer<IntelligenceTask>> subscribers =
                taskSubscribers.computeIfAbsent(tabId, ignored -> new CopyOnWriteArrayList<>());
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    Subscription subscribeInsights(Consumer<Insight> subscriber) {
        Objects.requireNonNull(subscriber, "subscriber");
        insightSubscribers.add(subscriber);
        return () -> insightSubscribers.remove(subscriber);
    }

    void publishTask(IntelligenceTask task) {
        List<Consumer<IntelligenceTask>> registered = taskSubscribers.get(task.tabId());
        if (registered == null || registered.isEmpty()) {
            return;
        }
        List<Consumer<IntelligenceTask>> subscribers = List.copyOf(registered);
        submit(() -> {
            for (Consumer<IntelligenceTask> subscriber : subscribers) {
                deliver("task", task.id(), subscriber, task);
            }
        });
    }

    void publishInsight(Insight insight) {
        if (insightSubscribers.isEmpty()) {
            return;
        }
        List<Consumer<Insight>> subscribers = List.copyOf(insightSubscribers);
        submit(() -> {
            for (Consumer<Insight> subscriber : subscribers) {
                deliver("insight", insight.id(), subscriber, insight);
            }
        });
    }

    void closeTab(String tabId) {
        List<Consumer<IntelligenceTask>> removed = taskSubscribers.remove(tabId);
        if (removed != null) {
            removed.clear();
        }
    }

    @Override
    public void close() {
        taskSubscribers.clear();
        insightSubscribers.clear();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void submit(Runnable delivery) {
        try {
            executor.execute(delivery);
        } catch (RejectedExecutionException e) {
            log.debug("Notification dropped after shutdown");
        }
    }

    private static <T> void deliver(String kind, String id, Consumer<T> subscriber, T payload) {
        try {
            subscriber.accept(payload);
        } catch (RuntimeException e) {
            log.warn("Subscriber failed on {} {}: {}", kind, id, e.toString());
        }
    }
}
