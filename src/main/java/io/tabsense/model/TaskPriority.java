package io.tabsense.model;

import java.time.Duration;

/**
 * Task priority. Declaration order is dispatch order; {@link #startDelay()} staggers admission
 * so that lower priorities yield to work queued just after them.
 */
public enum TaskPriority {
    CRITICAL(Duration.ZERO),
    HIGH(Duration.ofMillis(100)),
    MEDIUM(Duration.ofMillis(500)),
    LOW(Duration.ofSeconds(2)),
    IDLE(Duration.ofSeconds(10));

    private final Duration startDelay;

    TaskPriority(Duration startDelay) {
        this.startDelay = startDelay;
    }

    public Duration startDelay() {
        return startDelay;
    }

    public static TaskPriority fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return MEDIUM;
        }
        for (TaskPriority value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + raw);
    }
}
