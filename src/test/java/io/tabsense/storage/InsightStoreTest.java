package io.tabsense.storage;

import io.tabsense.model.Capability;
import io.tabsense.model.Insight;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

final class InsightStoreTest {
    private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void evictsSingleOldestPastCapacity() {
        InsightStore store = new InsightStore(50);
        for (int i = 0; i < 50; i++) {
            Assertions.assertTrue(store.add(insight("i" + i, T0.plusSeconds(i + 1), Capability.PERFORMANCE)).isEmpty());
        }
        // Older timestamp than everything stored, so it is the one evicted.
        Optional<Insight> evicted = store.add(insight("early", T0, Capability.SECURITY));

        Assertions.assertEquals("early", evicted.orElseThrow().id());
        Assertions.assertEquals(50, store.size());

        Optional<Insight> next = store.add(insight("late", T0.plusSeconds(100), Capability.SECURITY));
        Assertions.assertEquals("i0", next.orElseThrow().id());
        Assertions.assertEquals(50, store.size());
    }

    @Test
    void filtersByCategory() {
        InsightStore store = new InsightStore(5);
        store.add(insight("a", T0, Capability.PERFORMANCE));
        store.add(insight("b", T0.plusSeconds(1), Capability.SECURITY));

        List<Insight> security = store.list(Capability.SECURITY);
        Assertions.assertEquals(1, security.size());
        Assertions.assertEquals("b", security.get(0).id());
        Assertions.assertEquals(store.list(), store.list());
    }

    @Test
    void rejectsNonPositiveCapacity() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new InsightStore(0));
    }

    private static Insight insight(String id, Instant at, Capability category) {
        return new Insight(id, "title", "description", category, 0.5, Map.of(), List.of(), at);
    }
}
