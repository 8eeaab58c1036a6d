package io.tabsense.model;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

final class IntelligenceTaskTest {

    @Test
    void builderFillsTabScopedDefaults() {
        IntelligenceTask task = IntelligenceTask.builder("tab1", Capability.SECURITY).build();

        Assertions.assertTrue(task.id().startsWith("tab1_task_"));
        Assertions.assertEquals("security", task.name());
        Assertions.assertEquals(TaskPriority.MEDIUM, task.priority());
        Assertions.assertEquals(TaskStatus.PENDING, task.status());
        Assertions.assertNull(task.startedAt());
        Assertions.assertNull(task.completedAt());
        Assertions.assertTrue(task.parameters().isEmpty());
        Assertions.assertTrue(task.result().isEmpty());
    }

    @Test
    void idSuffixPrefixesTabId() {
        IntelligenceTask task = IntelligenceTask.builder("tab7", Capability.WEB_ANALYSIS)
                .idSuffix("initial_analysis")
                .build();
        Assertions.assertEquals("tab7_initial_analysis", task.id());
    }

    @Test
    void blankTabIdIsRejected() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> IntelligenceTask.builder(" ", Capability.SECURITY));
    }

    @Test
    void lifecycleStampsTimestampsConsistently() {
        Instant t0 = Instant.parse("2026-01-01T00:00:00Z");
        IntelligenceTask pending = IntelligenceTask.builder("tab1", Capability.PERFORMANCE)
                .createdAt(t0)
                .estimatedDuration(Duration.ofSeconds(2))
                .build();
        IntelligenceTask running = pending.started(t0.plusSeconds(1));
        IntelligenceTask done = running.completed(t0.plusSeconds(2), Map.of("message", "ok"));

        Assertions.assertEquals(TaskStatus.RUNNING, running.status());
        Assertions.assertNotNull(running.startedAt());
        Assertions.assertNull(running.completedAt());
        Assertions.assertEquals(TaskStatus.COMPLETED, done.status());
        Assertions.assertEquals(1.0, done.progress());
        Assertions.assertEquals("ok", done.result().get("message"));
        Assertions.assertEquals(t0.plusSeconds(2), done.completedAt());
    }

    @Test
    void cancellingPendingTaskStampsZeroLengthLifetime() {
        Instant at = Instant.parse("2026-01-01T00:00:05Z");
        IntelligenceTask cancelled = IntelligenceTask.builder("tab1", Capability.SECURITY).build().cancelled(at, null);

        Assertions.assertEquals(TaskStatus.CANCELLED, cancelled.status());
        Assertions.assertEquals(at, cancelled.startedAt());
        Assertions.assertEquals(at, cancelled.completedAt());
    }

    @Test
    void progressIsClampedAndMonotonic() {
        IntelligenceTask running = IntelligenceTask.builder("tab1", Capability.LEARNING).build().started(Instant.now());

        IntelligenceTask half = running.withProgress(0.5);
        Assertions.assertEquals(0.5, half.withProgress(0.2).progress());
        Assertions.assertEquals(1.0, half.withProgress(7.0).progress());
        Assertions.assertEquals(0.0, running.withProgress(Double.NaN).progress());
    }

    @Test
    void parametersAreCopiedAndAllowNullValues() {
        Map<String, Object> params = new HashMap<>();
        params.put("instruction", "click login");
        params.put("selector", null);
        IntelligenceTask task = IntelligenceTask.builder("tab1", Capability.AUTOMATION).parameters(params).build();
        params.put("instruction", "changed");

        Assertions.assertEquals("click login", task.parameters().get("instruction"));
        Assertions.assertTrue(task.parameters().containsKey("selector"));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> task.parameters().put("x", 1));
    }

    @Test
    void capabilityAcceptsWireAndEnumNames() {
        Assertions.assertEquals(Capability.WEB_ANALYSIS, Capability.fromString("webAnalysis"));
        Assertions.assertEquals(Capability.WEB_ANALYSIS, Capability.fromString("WEB_ANALYSIS"));
        Assertions.assertEquals(Capability.AI_INTERACTION, Capability.fromString("ai-interaction"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> Capability.fromString("telepathy"));
    }

    @Test
    void priorityDelaysFollowDeclarationOrder() {
        Assertions.assertEquals(Duration.ZERO, TaskPriority.CRITICAL.startDelay());
        Assertions.assertEquals(Duration.ofMillis(100), TaskPriority.HIGH.startDelay());
        Assertions.assertEquals(Duration.ofSeconds(10), TaskPriority.IDLE.startDelay());
        Assertions.assertEquals(TaskPriority.MEDIUM, TaskPriority.fromString(""));
        Assertions.assertEquals(TaskPriority.LOW, TaskPriority.fromString("low"));
    }
}
