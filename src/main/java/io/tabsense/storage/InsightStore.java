package io.tabsense.storage;

import io.tabsense.model.Capability;
import io.tabsense.model.Insight;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded, append-only insight list. Past capacity the oldest entry by {@code generatedAt} is
 * evicted.
 */
public final class InsightStore {
    private final int capacity;
    private final List<Insight> insights = new ArrayList<>();

    public InsightStore(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Appends the insight and returns the entry evicted to make room, if any.
     */
    public synchronized Optional<Insight> add(Insight insight) {
        Objects.requireNonNull(insight, "insight");
        insights.add(insight);
        if (insights.size() <= capacity) {
            return Optional.empty();
        }
        Insight oldest = insights.stream()
                .min(Comparator.comparing(Insight::generatedAt))
                .orElseThrow();
        insights.remove(oldest);
        return Optional.of(oldest);
    }

    public synchronized List<Insight> list() {
        return List.copyOf(insights);
    }

    public synchronized List<Insight> list(Capability category) {
        List<Insight> out = new ArrayList<>();
        for (Insight insight : insights) {
            if (insight.category() == category) {
                out.add(insight);
            }
        }
        return List.copyOf(out);
    }

    public synchronized int size() {
        return insights.size();
    }

    public synchronized void clear() {
        insights.clear();
    }
}
