package io.tabsense.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record Insight(
        String id,
        String title,
        String description,
        Capability category,
        double confidence,
        Map<String, Object> data,
        List<String> recommendations,
        Instant generatedAt,
        boolean actionable
) {
    public Insight {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(generatedAt, "generatedAt");
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        data = data == null || data.isEmpty() ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
    }

    public Insight(
            String id,
            String title,
            String description,
            Capability category,
            double confidence,
            Map<String, Object> data,
            List<String> recommendations,
            Instant generatedAt
    ) {
        this(id, title, description, category, confidence, data, recommendations, generatedAt, true);
    }
}
