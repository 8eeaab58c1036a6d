package io.tabsense.observability;

import io.tabsense.config.HubSettings;
import io.tabsense.runtime.IntelligenceHub;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

final class PrometheusFormatterTest {

    @Test
    void rendersCountersGaugesAndLabels() {
        Map<String, Integer> byStatus = new LinkedHashMap<>();
        byStatus.put("PENDING", 2);
        byStatus.put("RUNNING", 1);
        byStatus.put("COMPLETED", 7);
        Map<String, Long> usage = new LinkedHashMap<>();
        usage.put("performance", 4L);
        usage.put("security", 3L);
        IntelligenceHub.StatsOutcome stats = new IntelligenceHub.StatsOutcome(
                2, 10, byStatus, 1, 2, 5, 2,
                7L, 1L, 1L, 1_400L, 200L, 0.875, usage, 3,
                HubSettings.defaults().toFile()
        );

        String text = PrometheusFormatter.format(stats);

        Assertions.assertTrue(text.contains("# TYPE tabsense_tasks_total gauge\n"));
        Assertions.assertTrue(text.contains("tabsense_tasks_total{status=\"COMPLETED\"} 7\n"));
        Assertions.assertTrue(text.contains("tabsense_registered_tabs 2\n"));
        Assertions.assertTrue(text.contains("tabsense_slots_in_use 2\n"));
        Assertions.assertTrue(text.contains("# TYPE tabsense_tasks_completed_total counter\n"));
        Assertions.assertTrue(text.contains("tabsense_tasks_timed_out_total 1\n"));
        Assertions.assertTrue(text.contains("tabsense_execution_ms_avg 200\n"));
        Assertions.assertTrue(text.contains("tabsense_success_rate 0.8750\n"));
        Assertions.assertTrue(text.contains("tabsense_capability_usage_total{capability=\"security\"} 3\n"));
        Assertions.assertTrue(text.contains("tabsense_insights 3\n"));
    }
}
