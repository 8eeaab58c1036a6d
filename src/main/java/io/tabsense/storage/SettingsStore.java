package io.tabsense.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.tabsense.config.HubSettings;
import io.tabsense.util.Jsons;

import java.util.Optional;

/**
 * Key/value persistence for the settings block. Values are JSON documents.
 */
public interface SettingsStore {
    Optional<String> get(String key);

    void put(String key, String value);

    /**
     * Reads the persisted settings block, sanitised against the defaults.
     *
     * @throws IllegalStateException if the stored document is not valid JSON
     */
    default Optional<HubSettings> loadSettings() {
        Optional<String> raw = get(HubSettings.STORE_KEY);
        if (raw.isEmpty() || raw.get().isBlank()) {
            return Optional.empty();
        }
        try {
            HubSettings.SettingsFile file = Jsons.mapper().readValue(raw.get(), HubSettings.SettingsFile.class);
            return Optional.of(HubSettings.fromFile(file, HubSettings.defaults()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to parse settings: " + e.getOriginalMessage(), e);
        }
    }

    default void saveSettings(HubSettings settings) {
        put(HubSettings.STORE_KEY, Jsons.toCompactJson(settings.toFile()));
    }
}
