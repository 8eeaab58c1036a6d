package io.tabsense.config;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Static engine parameters fixed for the lifetime of a hub. The user-tunable block lives in
 * {@link HubSettings}.
 */
public record HubConfig(
        Path rootDir,
        Duration reaperInterval,
        Duration insightInterval,
        Duration autoOptimizationInterval,
        Duration taskRetention,
        Duration defaultEstimate,
        int insightCapacity
) {
    public static final String DEFAULT_ROOT = "data";
    public static final Duration DEFAULT_REAPER_INTERVAL = Duration.ofSeconds(10);
    public static final Duration DEFAULT_INSIGHT_INTERVAL = Duration.ofMinutes(2);
    public static final Duration DEFAULT_AUTO_OPTIMIZATION_INTERVAL = Duration.ofMinutes(5);
    public static final Duration DEFAULT_TASK_RETENTION = Duration.ofMinutes(5);
    public static final Duration DEFAULT_ESTIMATE = Duration.ofMinutes(5);
    public static final int DEFAULT_INSIGHT_CAPACITY = 50;

    public HubConfig {
        rootDir = rootDir == null ? Paths.get(DEFAULT_ROOT).toAbsolutePath().normalize() : rootDir;
        reaperInterval = positive(reaperInterval, DEFAULT_REAPER_INTERVAL);
        insightInterval = positive(insightInterval, DEFAULT_INSIGHT_INTERVAL);
        autoOptimizationInterval = positive(autoOptimizationInterval, DEFAULT_AUTO_OPTIMIZATION_INTERVAL);
        taskRetention = taskRetention == null || taskRetention.isNegative() ? DEFAULT_TASK_RETENTION : taskRetention;
        defaultEstimate = positive(defaultEstimate, DEFAULT_ESTIMATE);
        insightCapacity = insightCapacity <= 0 ? DEFAULT_INSIGHT_CAPACITY : insightCapacity;
    }

    public static HubConfig defaults() {
        return fromRoot(null);
    }

    public static HubConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank() ? Paths.get(DEFAULT_ROOT) : Paths.get(root);
        return new HubConfig(
                resolved.toAbsolutePath().normalize(),
                DEFAULT_REAPER_INTERVAL,
                DEFAULT_INSIGHT_INTERVAL,
                DEFAULT_AUTO_OPTIMIZATION_INTERVAL,
                DEFAULT_TASK_RETENTION,
                DEFAULT_ESTIMATE,
                DEFAULT_INSIGHT_CAPACITY
        );
    }

    public Path dbFile() {
        return rootDir.resolve("tabsense.db");
    }

    public Path handlersFile() {
        return rootDir.resolve("handlers").resolve("scripts.json");
    }

    public HubConfig withReaperInterval(Duration value) {
        return new HubConfig(rootDir, value, insightInterval, autoOptimizationInterval, taskRetention, defaultEstimate, insightCapacity);
    }

    public HubConfig withAutoOptimizationInterval(Duration value) {
        return new HubConfig(rootDir, reaperInterval, insightInterval, value, taskRetention, defaultEstimate, insightCapacity);
    }

    public HubConfig withTaskRetention(Duration value) {
        return new HubConfig(rootDir, reaperInterval, insightInterval, autoOptimizationInterval, value, defaultEstimate, insightCapacity);
    }

    private static Duration positive(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}
