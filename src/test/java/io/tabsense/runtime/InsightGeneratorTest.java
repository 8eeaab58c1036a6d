package io.tabsense.runtime;

import io.tabsense.model.Capability;
import io.tabsense.model.Insight;
import io.tabsense.model.IntelligenceTask;
import io.tabsense.storage.InsightStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

final class InsightGeneratorTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    private InsightStore store;
    private NotificationHub notifications;
    private InsightGenerator generator;

    @BeforeEach
    void setUp() {
        store = new InsightStore(50);
        notifications = new NotificationHub();
        generator = new InsightGenerator(store, notifications, Clock.fixed(T0, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        notifications.close();
    }

    @Test
    void slowPageYieldsOnePerformanceInsight() {
        List<Insight> emitted = generator.onTaskCompleted(completed(Capability.PERFORMANCE, Map.of(
                "performanceMetrics", Map.of("lcp", 4200),
                "coreWebVitalsScore", 0.5
        )));

        Assertions.assertEquals(1, emitted.size());
        Insight insight = emitted.get(0);
        Assertions.assertEquals(Capability.PERFORMANCE, insight.category());
        Assertions.assertEquals("Performance Optimization Needed", insight.title());
        Assertions.assertEquals("Page performance is below optimal levels (50%)", insight.description());
        Assertions.assertEquals(0.9, insight.confidence());
        Assertions.assertEquals(4, insight.recommendations().size());
        Assertions.assertTrue(insight.id().startsWith("perf_" + T0.toEpochMilli() + "_"));
        Assertions.assertEquals(1, store.size());
    }

    @Test
    void scoreAloneIsEnoughForPerformanceInsight() {
        List<Insight> emitted = generator.onTaskCompleted(completed(Capability.PERFORMANCE, Map.of("coreWebVitalsScore", 0.5)));

        Assertions.assertEquals(1, emitted.size());
        Assertions.assertEquals(Capability.PERFORMANCE, emitted.get(0).category());
        Assertions.assertEquals(0.9, emitted.get(0).confidence());
        Assertions.assertEquals(Map.of("score", 0.5), emitted.get(0).data());
    }

    @Test
    void healthyPageYieldsNothing() {
        List<Insight> emitted = generator.onTaskCompleted(completed(Capability.PERFORMANCE, Map.of(
                "performanceMetrics", Map.of("lcp", 900),
                "coreWebVitalsScore", "0.92"
        )));

        Assertions.assertTrue(emitted.isEmpty());
        Assertions.assertTrue(generator.onTaskCompleted(completed(Capability.PERFORMANCE, Map.of("performanceMetrics", Map.of("lcp", 9000)))).isEmpty());
        Assertions.assertTrue(generator.onTaskCompleted(completed(Capability.PERFORMANCE, Map.of("coreWebVitalsScore", "n/a"))).isEmpty());
        Assertions.assertTrue(generator.onTaskCompleted(completed(Capability.SECURITY, Map.of())).isEmpty());
    }

    @Test
    void highThreatScoreYieldsSecurityInsight() {
        List<Insight> emitted = generator.onTaskCompleted(completed(Capability.SECURITY, Map.of(
                "threatLevel", "high",
                "threatScore", 75
        )));

        Assertions.assertEquals(1, emitted.size());
        Assertions.assertEquals("Multiple security threats detected (threat score: 75)", emitted.get(0).description());
        Assertions.assertEquals(0.95, emitted.get(0).confidence());
        Assertions.assertTrue(generator.onTaskCompleted(completed(Capability.SECURITY, Map.of("threatScore", 50))).isEmpty());
    }

    @Test
    void pageAnalysisReportsFormsAndAccessibility() {
        List<Insight> emitted = generator.onTaskCompleted(completed(Capability.WEB_ANALYSIS, Map.of(
                "pageIntelligence", Map.of(
                        "forms", List.of(Map.of("id", "login"), Map.of("id", "search")),
                        "accessibility", Map.of("score", 0.6)
                )
        )));

        Assertions.assertEquals(2, emitted.size());
        Assertions.assertEquals(Capability.AUTOMATION, emitted.get(0).category());
        Assertions.assertEquals("Found 2 form(s) that can be automated", emitted.get(0).description());
        Assertions.assertEquals(Capability.ACCESSIBILITY, emitted.get(1).category());
        Assertions.assertEquals("Page has accessibility issues (score: 60%)", emitted.get(1).description());
    }

    @Test
    void pageAnalysisWithoutFindingsYieldsNothing() {
        Assertions.assertTrue(generator.onTaskCompleted(completed(Capability.WEB_ANALYSIS, Map.of(
                "forms", List.of(),
                "accessibility", Map.of("score", 0.95)
        ))).isEmpty());
    }

    @Test
    void periodicSweepReportsHeavyUsage() {
        Map<Capability, Long> usage = new EnumMap<>(Capability.class);
        usage.put(Capability.SECURITY, 11L);
        usage.put(Capability.PERFORMANCE, 3L);

        List<Insight> emitted = generator.periodic(new ExecutionStats(14, 0, 0, 1_400, usage));

        Assertions.assertEquals(1, emitted.size());
        Assertions.assertEquals(Capability.SECURITY, emitted.get(0).category());
        Assertions.assertEquals("You frequently use security features (11 times)", emitted.get(0).description());
    }

    @Test
    void periodicSweepReportsLowSuccessRate() {
        List<Insight> emitted = generator.periodic(new ExecutionStats(21, 9, 0, 0, Map.of()));

        Assertions.assertEquals(1, emitted.size());
        Assertions.assertEquals(Capability.LEARNING, emitted.get(0).category());
        Assertions.assertEquals("Task success rate is 70% (9 failures)", emitted.get(0).description());

        Assertions.assertTrue(generator.periodic(new ExecutionStats(20, 15, 0, 0, Map.of())).isEmpty());
        Assertions.assertTrue(generator.periodic(new ExecutionStats(0, 0, 0, 0, Map.of())).isEmpty());
    }

    @Test
    void numbersAreReadLeniently() {
        Assertions.assertEquals(0.5, InsightGenerator.number("0.5", 1.0));
        Assertions.assertEquals(1.0, InsightGenerator.number("n/a", 1.0));
        Assertions.assertEquals(3.0, InsightGenerator.number(3, 1.0));
        Assertions.assertEquals(1.0, InsightGenerator.number(null, 1.0));
    }

    private static IntelligenceTask completed(Capability capability, Map<String, Object> result) {
        return IntelligenceTask.builder("tab1", capability)
                .createdAt(T0)
                .build()
                .started(T0)
                .completed(T0.plusSeconds(1), result);
    }
}
