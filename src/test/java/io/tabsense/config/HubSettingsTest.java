package io.tabsense.config;

import io.tabsense.model.Capability;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

final class HubSettingsTest {

    @Test
    void defaultsEnableSixCapabilities() {
        HubSettings defaults = HubSettings.defaults();

        Assertions.assertEquals(Set.of(
                Capability.WEB_ANALYSIS,
                Capability.AUTOMATION,
                Capability.AI_INTERACTION,
                Capability.PERFORMANCE,
                Capability.SECURITY,
                Capability.ACCESSIBILITY
        ), defaults.enabledCapabilities());
        Assertions.assertTrue(defaults.autoOptimization());
        Assertions.assertEquals(0.7, defaults.confidenceThreshold());
        Assertions.assertEquals(5, defaults.maxConcurrentTasks());
        Assertions.assertFalse(defaults.isEnabled(Capability.LEARNING));
    }

    @Test
    void fromFileSanitizesValues() {
        HubSettings.SettingsFile file = new HubSettings.SettingsFile(
                false,
                null,
                null,
                4.2,
                99,
                List.of("security", "LEARNING", "telepathy")
        );

        HubSettings settings = HubSettings.fromFile(file, HubSettings.defaults());

        Assertions.assertFalse(settings.autoOptimization());
        Assertions.assertTrue(settings.predictiveBrowsing());
        Assertions.assertEquals(1.0, settings.confidenceThreshold());
        Assertions.assertEquals(20, settings.maxConcurrentTasks());
        Assertions.assertEquals(Set.of(Capability.SECURITY, Capability.LEARNING), settings.enabledCapabilities());
    }

    @Test
    void missingCapabilityListKeepsDefaults() {
        HubSettings.SettingsFile file = new HubSettings.SettingsFile(null, null, null, null, 0, null);

        HubSettings settings = HubSettings.fromFile(file, HubSettings.defaults());

        Assertions.assertEquals(HubSettings.defaults().enabledCapabilities(), settings.enabledCapabilities());
        Assertions.assertEquals(1, settings.maxConcurrentTasks());
    }

    @Test
    void applyTouchesOnlyProvidedFields() {
        HubSettings next = HubSettings.defaults().apply(SettingsUpdate.builder()
                .maxConcurrentTasks(8)
                .confidenceThreshold(-1.0)
                .build());

        Assertions.assertEquals(8, next.maxConcurrentTasks());
        Assertions.assertEquals(0.0, next.confidenceThreshold());
        Assertions.assertTrue(next.learningMode());
        Assertions.assertEquals(List.of("confidenceThreshold", "maxConcurrentTasks"), HubSettings.defaults().diffFields(next));
    }

    @Test
    void toFileRoundTripsThroughFromFile() {
        HubSettings original = HubSettings.defaults()
                .withCapability(Capability.SECURITY, false)
                .withCapability(Capability.COLLABORATION, true);

        HubSettings restored = HubSettings.fromFile(original.toFile(), HubSettings.defaults());

        Assertions.assertEquals(original, restored);
        Assertions.assertTrue(original.toFile().enabledCapabilities().contains("collaboration"));
    }

    @Test
    void configDefaultsMatchEngineConstants() {
        HubConfig config = HubConfig.fromRoot("build/tabsense-config-test");

        Assertions.assertEquals(10, config.reaperInterval().toSeconds());
        Assertions.assertEquals(120, config.insightInterval().toSeconds());
        Assertions.assertEquals(50, config.insightCapacity());
        Assertions.assertTrue(config.dbFile().endsWith("tabsense.db"));
        Assertions.assertTrue(config.handlersFile().endsWith("scripts.json"));
    }
}
