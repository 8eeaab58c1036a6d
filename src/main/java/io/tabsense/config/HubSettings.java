package io.tabsense.config;

import io.tabsense.model.Capability;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Mutable-by-replacement settings block of the hub. Persisted as {@link SettingsFile} JSON.
 */
public record HubSettings(
        Set<Capability> enabledCapabilities,
        boolean autoOptimization,
        boolean predictiveBrowsing,
        boolean learningMode,
        double confidenceThreshold,
        int maxConcurrentTasks
) {
    public static final String STORE_KEY = "intelligence_config";
    public static final int MIN_CONCURRENT_TASKS = 1;
    public static final int MAX_CONCURRENT_TASKS = 20;
    public static final int DEFAULT_MAX_CONCURRENT_TASKS = 5;
    public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.7;

    public HubSettings {
        enabledCapabilities = enabledCapabilities == null || enabledCapabilities.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(Capability.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(enabledCapabilities));
        confidenceThreshold = clamp(confidenceThreshold, 0.0, 1.0);
        maxConcurrentTasks = Math.max(MIN_CONCURRENT_TASKS, Math.min(MAX_CONCURRENT_TASKS, maxConcurrentTasks));
    }

    public static HubSettings defaults() {
        return new HubSettings(
                EnumSet.of(
                        Capability.WEB_ANALYSIS,
                        Capability.AUTOMATION,
                        Capability.AI_INTERACTION,
                        Capability.PERFORMANCE,
                        Capability.SECURITY,
                        Capability.ACCESSIBILITY
                ),
                true,
                true,
                true,
                DEFAULT_CONFIDENCE_THRESHOLD,
                DEFAULT_MAX_CONCURRENT_TASKS
        );
    }

    public static HubSettings fromFile(SettingsFile file, HubSettings defaults) {
        if (file == null) {
            return defaults;
        }
        Set<Capability> enabled = defaults.enabledCapabilities();
        if (file.enabledCapabilities() != null) {
            EnumSet<Capability> parsed = EnumSet.noneOf(Capability.class);
            for (String raw : file.enabledCapabilities()) {
                try {
                    parsed.add(Capability.fromString(raw));
                } catch (IllegalArgumentException ignored) {
                    // Names from a newer or older build are dropped rather than failing the load.
                }
            }
            enabled = parsed;
        }
        return new HubSettings(
                enabled,
                sanitizeBoolean(file.autoOptimization(), defaults.autoOptimization()),
                sanitizeBoolean(file.predictiveBrowsing(), defaults.predictiveBrowsing()),
                sanitizeBoolean(file.learningMode(), defaults.learningMode()),
                file.confidenceThreshold() == null || file.confidenceThreshold().isNaN()
                        ? defaults.confidenceThreshold()
                        : file.confidenceThreshold(),
                file.maxConcurrentTasks() == null ? defaults.maxConcurrentTasks() : file.maxConcurrentTasks()
        );
    }

    public SettingsFile toFile() {
        List<String> names = new ArrayList<>();
        for (Capability capability : enabledCapabilities) {
            names.add(capability.wireName());
        }
        return new SettingsFile(
                autoOptimization,
                predictiveBrowsing,
                learningMode,
                confidenceThreshold,
                maxConcurrentTasks,
                names
        );
    }

    public boolean isEnabled(Capability capability) {
        return enabledCapabilities.contains(capability);
    }

    public HubSettings withCapability(Capability capability, boolean enabled) {
        EnumSet<Capability> next = enabledCapabilities.isEmpty()
                ? EnumSet.noneOf(Capability.class)
                : EnumSet.copyOf(enabledCapabilities);
        if (enabled) {
            next.add(capability);
        } else {
            next.remove(capability);
        }
        return new HubSettings(next, autoOptimization, predictiveBrowsing, learningMode, confidenceThreshold, maxConcurrentTasks);
    }

    public HubSettings apply(SettingsUpdate update) {
        if (update == null) {
            return this;
        }
        return new HubSettings(
                enabledCapabilities,
                sanitizeBoolean(update.autoOptimization(), autoOptimization),
                sanitizeBoolean(update.predictiveBrowsing(), predictiveBrowsing),
                sanitizeBoolean(update.learningMode(), learningMode),
                update.confidenceThreshold() == null ? confidenceThreshold : update.confidenceThreshold(),
                update.maxConcurrentTasks() == null ? maxConcurrentTasks : update.maxConcurrentTasks()
        );
    }

    public List<String> diffFields(HubSettings other) {
        List<String> changed = new ArrayList<>();
        if (other == null) {
            return changed;
        }
        if (!Objects.equals(enabledCapabilities, other.enabledCapabilities)) {
            changed.add("enabledCapabilities");
        }
        if (autoOptimization != other.autoOptimization) {
            changed.add("autoOptimization");
        }
        if (predictiveBrowsing != other.predictiveBrowsing) {
            changed.add("predictiveBrowsing");
        }
        if (learningMode != other.learningMode) {
            changed.add("learningMode");
        }
        if (Double.compare(confidenceThreshold, other.confidenceThreshold) != 0) {
            changed.add("confidenceThreshold");
        }
        if (maxConcurrentTasks != other.maxConcurrentTasks) {
            changed.add("maxConcurrentTasks");
        }
        return changed;
    }

    private static boolean sanitizeBoolean(Boolean value, boolean fallback) {
        return value == null ? fallback : value;
    }

    private static double clamp(double value, double min, double max) {
        if (Double.isNaN(value)) {
            return DEFAULT_CONFIDENCE_THRESHOLD;
        }
        return Math.max(min, Math.min(max, value));
    }

    /**
     * JSON shape of the persisted block. Every field is optional.
     */
    public record SettingsFile(
            Boolean autoOptimization,
            Boolean predictiveBrowsing,
            Boolean learningMode,
            Double confidenceThreshold,
            Integer maxConcurrentTasks,
            List<String> enabledCapabilities
    ) {
    }
}
