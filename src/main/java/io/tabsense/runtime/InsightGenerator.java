package io.tabsense.runtime;

import io.tabsense.model.Capability;
import io.tabsense.model.Insight;
import io.tabsense.model.IntelligenceTask;
import io.tabsense.storage.InsightStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Derives insights from completed task results and from aggregate execution counters.
 */
final class InsightGenerator {
    private static final Logger log = LoggerFactory.getLogger(InsightGenerator.class);

    static final double PERFORMANCE_SCORE_THRESHOLD = 0.7;
    static final double THREAT_SCORE_THRESHOLD = 50.0;
    static final double ACCESSIBILITY_SCORE_THRESHOLD = 0.8;
    static final long HIGH_USAGE_THRESHOLD = 10L;
    static final long SUCCESS_RATE_MIN_COMPLETED = 20L;
    static final double SUCCESS_RATE_THRESHOLD = 0.8;

    private final InsightStore store;
    private final NotificationHub notifications;
    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong();

    InsightGenerator(InsightStore store, NotificationHub notifications, Clock clock) {
        this.store = store;
        this.notifications = notifications;
        this.clock = clock;
    }

    List<Insight> onTaskCompleted(IntelligenceTask task) {
        Map<String, Object> result = task.result();
        if (result.isEmpty()) {
            return List.of();
        }
        List<Insight> emitted = new ArrayList<>();
        switch (task.capability()) {
            case PERFORMANCE -> performance(result, emitted);
            case SECURITY -> security(result, emitted);
            case WEB_ANALYSIS -> webAnalysis(result, emitted);
            default -> {
            }
        }
        emitAll(emitted);
        return emitted;
    }

    List<Insight> periodic(ExecutionStats stats) {
        List<Insight> emitted = new ArrayList<>();
        usage(stats, emitted);
        successRate(stats, emitted);
        emitAll(emitted);
        return emitted;
    }

    private void performance(Map<String, Object> result, List<Insight> out) {
        double score = number(result.get("coreWebVitalsScore"), Double.NaN);
        if (Double.isNaN(score) || score >= PERFORMANCE_SCORE_THRESHOLD) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        Object metrics = result.get("performanceMetrics");
        if (metrics != null) {
            data.put("metrics", metrics);
        }
        data.put("score", score);
        out.add(new Insight(
                nextId("perf"),
                "Performance Optimization Needed",
                "Page performance is below optimal levels (" + percent(score) + "%)",
                Capability.PERFORMANCE,
                0.9,
                data,
                List.of(
                        "Enable performance mode",
                        "Optimize images and resources",
                        "Reduce JavaScript execution time",
                        "Improve server response time"
                ),
                clock.instant()
        ));
    }

    private void security(Map<String, Object> result, List<Insight> out) {
        double threatScore = number(result.get("threatScore"), 0.0);
        if (threatScore <= THREAT_SCORE_THRESHOLD) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("threatLevel", result.get("threatLevel"));
        data.put("threatScore", result.get("threatScore"));
        out.add(new Insight(
                nextId("sec"),
                "Security Threats Detected",
                "Multiple security threats detected (threat score: " + formatNumber(threatScore) + ")",
                Capability.SECURITY,
                0.95,
                data,
                List.of(
                        "Enable strict security mode",
                        "Block suspicious scripts",
                        "Use HTTPS-only mode",
                        "Enable tracking protection"
                ),
                clock.instant()
        ));
    }

    private void webAnalysis(Map<String, Object> result, List<Insight> out) {
        Object nested = result.get("pageIntelligence");
        Map<?, ?> intelligence = nested instanceof Map<?, ?> ? (Map<?, ?>) nested : result;

        Object forms = intelligence.get("forms");
        int formCount = forms instanceof Collection<?> ? ((Collection<?>) forms).size() : 0;
        if (formCount > 0) {
            out.add(new Insight(
                    nextId("form"),
                    "Forms Detected",
                    "Found " + formCount + " form(s) that can be automated",
                    Capability.AUTOMATION,
                    0.8,
                    Map.of("forms", forms),
                    List.of(
                            "Enable smart autofill",
                            "Create automation shortcuts",
                            "Save form templates"
                    ),
                    clock.instant()
            ));
        }

        Object a11y = intelligence.get("accessibility");
        Map<?, ?> accessibility = a11y instanceof Map<?, ?> ? (Map<?, ?>) a11y : Map.of();
        double score = number(accessibility.get("score"), 1.0);
        if (score < ACCESSIBILITY_SCORE_THRESHOLD) {
            out.add(new Insight(
                    nextId("a11y"),
                    "Accessibility Issues Found",
                    "Page has accessibility issues (score: " + percent(score) + "%)",
                    Capability.ACCESSIBILITY,
                    0.85,
                    Map.of("accessibility", accessibility),
                    List.of(
                            "Enable accessibility mode",
                            "Add missing alt text",
                            "Improve keyboard navigation",
                            "Increase color contrast"
                    ),
                    clock.instant()
            ));
        }
    }

    private void usage(ExecutionStats stats, List<Insight> out) {
        Capability mostUsed = null;
        long mostUsedCount = 0L;
        for (Capability capability : Capability.values()) {
            long count = stats.capabilityUsage().getOrDefault(capability, 0L);
            if (count > mostUsedCount) {
                mostUsed = capability;
                mostUsedCount = count;
            }
        }
        if (mostUsed == null || mostUsedCount <= HIGH_USAGE_THRESHOLD) {
            return;
        }
        Map<String, Object> usage = new LinkedHashMap<>();
        for (Capability capability : Capability.values()) {
            Long count = stats.capabilityUsage().get(capability);
            if (count != null) {
                usage.put(capability.wireName(), count);
            }
        }
        out.add(new Insight(
                nextId("usage"),
                "High Usage Pattern Detected",
                "You frequently use " + mostUsed.wireName() + " features (" + mostUsedCount + " times)",
                mostUsed,
                0.8,
                Map.of("usage", usage),
                List.of(
                        "Create shortcuts for common tasks",
                        "Enable auto-optimization for this feature",
                        "Consider upgrading to premium features"
                ),
                clock.instant()
        ));
    }

    private void successRate(ExecutionStats stats, List<Insight> out) {
        double rate = stats.successRate();
        if (stats.completed() <= SUCCESS_RATE_MIN_COMPLETED || rate >= SUCCESS_RATE_THRESHOLD) {
            return;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("successRate", rate);
        data.put("completed", stats.completed());
        data.put("failed", stats.failed());
        out.add(new Insight(
                nextId("trend"),
                "Task Success Rate Below Optimal",
                "Task success rate is " + percent(rate) + "% (" + stats.failed() + " failures)",
                Capability.LEARNING,
                0.7,
                data,
                List.of(
                        "Check network connectivity",
                        "Update browser engine",
                        "Reset AI models",
                        "Contact support if issues persist"
                ),
                clock.instant()
        ));
    }

    private void emitAll(List<Insight> emitted) {
        for (Insight insight : emitted) {
            store.add(insight).ifPresent(evicted -> log.debug("Evicted insight {}", evicted.id()));
            log.debug("Insight {} [{}] {}", insight.id(), insight.category().wireName(), insight.title());
            notifications.publishInsight(insight);
        }
    }

    private String nextId(String prefix) {
        Instant now = clock.instant();
        return prefix + "_" + now.toEpochMilli() + "_" + sequence.incrementAndGet();
    }

    static double number(Object raw, double fallback) {
        if (raw instanceof Number) {
            double value = ((Number) raw).doubleValue();
            return Double.isNaN(value) ? fallback : value;
        }
        if (raw instanceof String && !((String) raw).isBlank()) {
            try {
                return Double.parseDouble(((String) raw).trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }

    private static int percent(double ratio) {
        return (int) (ratio * 100.0);
    }

    private static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value)) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
