package io.tabsense.storage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

public final class SqliteSettingsStore implements SettingsStore {
    private final Database db;

    public SqliteSettingsStore(Database db) {
        this.db = db;
    }

    @Override
    public Optional<String> get(String key) {
        String sql = "SELECT setting_value FROM settings WHERE setting_key=?";
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.ofNullable(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to read setting: " + key, e);
        }
    }

    @Override
    public void put(String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("setting key must not be blank");
        }
        if (value == null) {
            delete(key);
            return;
        }
        String sql = """
                INSERT INTO settings(setting_key,setting_value,updated_at_ms)
                VALUES(?,?,?)
                ON CONFLICT(setting_key) DO UPDATE SET
                    setting_value=excluded.setting_value,
                    updated_at_ms=excluded.updated_at_ms
                """;
        try (Connection c = db.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.setLong(3, System.currentTimeMillis());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to write setting: " + key, e);
        }
    }

    private void delete(String key) {
        try (Connection c = db.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM settings WHERE setting_key=?")) {
            ps.setString(1, key);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to delete setting: " + key, e);
        }
    }
}
