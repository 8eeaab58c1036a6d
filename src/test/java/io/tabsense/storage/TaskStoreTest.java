package io.tabsense.storage;

import io.tabsense.model.Capability;
import io.tabsense.model.IntelligenceTask;
import io.tabsense.model.TaskPriority;
import io.tabsense.model.TaskStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

final class TaskStoreTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void insertNormalizesToPending() {
        TaskStore store = new TaskStore();
        IntelligenceTask dirty = task("tab1_a").started(T0).completed(T0.plusSeconds(1), Map.of("x", 1));

        IntelligenceTask stored = store.insertPending(dirty);

        Assertions.assertEquals(TaskStatus.PENDING, stored.status());
        Assertions.assertNull(stored.startedAt());
        Assertions.assertNull(stored.completedAt());
        Assertions.assertTrue(stored.result().isEmpty());
        Assertions.assertEquals(0.0, stored.progress());
    }

    @Test
    void duplicateIdIsRejectedUntilPurged() {
        TaskStore store = new TaskStore();
        store.insertPending(task("tab1_a"));

        Assertions.assertThrows(IllegalArgumentException.class, () -> store.insertPending(task("tab1_a")));

        store.cancelPending("tab1_a", T0, null);
        Assertions.assertThrows(IllegalArgumentException.class, () -> store.insertPending(task("tab1_a")));
        Assertions.assertTrue(store.purge("tab1_a"));
        Assertions.assertDoesNotThrow(() -> store.insertPending(task("tab1_a")));
    }

    @Test
    void transitionsRequireExpectedSourceStatus() {
        TaskStore store = new TaskStore();
        store.insertPending(task("tab1_a"));

        Assertions.assertTrue(store.complete("tab1_a", T0, Map.of()).isEmpty());
        Assertions.assertTrue(store.forceCancel("tab1_a", T0, "Task timeout").isEmpty());
        Assertions.assertTrue(store.markRunning("tab1_a", T0).isPresent());
        Assertions.assertTrue(store.markRunning("tab1_a", T0).isEmpty());
        Assertions.assertTrue(store.cancelPending("tab1_a", T0, null).isEmpty());

        IntelligenceTask cancelled = store.forceCancel("tab1_a", T0.plusSeconds(5), "Task timeout").orElseThrow();
        Assertions.assertEquals(TaskStatus.CANCELLED, cancelled.status());
        Assertions.assertEquals("Task timeout", cancelled.error());
        Assertions.assertTrue(store.complete("tab1_a", T0.plusSeconds(6), Map.of("late", true)).isEmpty());
        Assertions.assertFalse(store.find("tab1_a").orElseThrow().result().containsKey("late"));
    }

    @Test
    void liveTasksAreNeverPurged() {
        TaskStore store = new TaskStore();
        store.insertPending(task("tab1_a"));
        store.markRunning("tab1_a", T0);

        Assertions.assertFalse(store.purge("tab1_a"));
        Assertions.assertEquals(1, store.countByStatus().get(TaskStatus.RUNNING));
    }

    @Test
    void progressOnlyMovesForwardWhileRunning() {
        TaskStore store = new TaskStore();
        store.insertPending(task("tab1_a"));
        Assertions.assertTrue(store.updateProgress("tab1_a", 0.5).isEmpty());

        store.markRunning("tab1_a", T0);
        Assertions.assertEquals(0.5, store.updateProgress("tab1_a", 0.5).orElseThrow().progress());
        Assertions.assertTrue(store.updateProgress("tab1_a", 0.3).isEmpty());
        Assertions.assertEquals(0.5, store.find("tab1_a").orElseThrow().progress());
    }

    @Test
    void terminalFutureCompletesWithFinalSnapshot() throws Exception {
        TaskStore store = new TaskStore();
        store.insertPending(task("tab1_a"));
        CompletableFuture<IntelligenceTask> terminal = store.awaitTerminal("tab1_a").orElseThrow();
        Assertions.assertFalse(terminal.isDone());

        store.markRunning("tab1_a", T0);
        store.fail("tab1_a", T0.plusSeconds(1), "IllegalStateException: boom");

        IntelligenceTask done = terminal.get(1, TimeUnit.SECONDS);
        Assertions.assertEquals(TaskStatus.FAILED, done.status());
        Assertions.assertEquals("IllegalStateException: boom", done.error());
        Assertions.assertTrue(store.awaitTerminal("tab1_a").orElseThrow().isDone());
        Assertions.assertTrue(store.awaitTerminal("missing").isEmpty());
    }

    @Test
    void listsAreFilteredAndStable() {
        TaskStore store = new TaskStore();
        store.insertPending(task("tab1_a"));
        store.insertPending(IntelligenceTask.builder("tab2", Capability.SECURITY).id("tab2_b").build());

        Assertions.assertEquals(1, store.list("tab1").size());
        Assertions.assertEquals(2, store.list().size());
        Assertions.assertEquals(store.list(), store.list());
        Assertions.assertEquals(2, store.countByStatus().get(TaskStatus.PENDING));
        Assertions.assertEquals(0, store.countByStatus().get(TaskStatus.RUNNING));
    }

    private static IntelligenceTask task(String id) {
        return IntelligenceTask.builder("tab1", Capability.PERFORMANCE)
                .id(id)
                .priority(TaskPriority.HIGH)
                .createdAt(T0)
                .build();
    }
}
