package io.tabsense.cli;

import io.tabsense.config.HubConfig;
import io.tabsense.config.HubSettings;
import io.tabsense.model.Capability;
import io.tabsense.storage.Database;
import io.tabsense.storage.SqliteSettingsStore;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

final class TabSenseCommandTest {

    @Test
    void settingsCommandPersistsChanges() throws Exception {
        Path root = Files.createTempDirectory("tabsense-cli-");
        try {
            int exit = new CommandLine(new TabSenseCommand()).execute(
                    "--root", root.toString(),
                    "settings",
                    "--enable", "learning,prediction",
                    "--disable", "security",
                    "--max-concurrent", "9"
            );
            assertEquals(0, exit);

            Database db = new Database(HubConfig.fromRoot(root.toString()));
            db.init();
            HubSettings saved = new SqliteSettingsStore(db).loadSettings().orElseThrow();
            assertTrue(saved.isEnabled(Capability.LEARNING));
            assertTrue(saved.isEnabled(Capability.PREDICTION));
            assertFalse(saved.isEnabled(Capability.SECURITY));
            assertEquals(9, saved.maxConcurrentTasks());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void commandRunsAgainstEchoHandlers() throws Exception {
        Path root = Files.createTempDirectory("tabsense-cli-");
        try {
            int exit = new CommandLine(new TabSenseCommand()).execute(
                    "--root", root.toString(),
                    "command",
                    "--tab", "t1",
                    "--timeout-seconds", "5",
                    "analyze", "this", "page"
            );
            assertEquals(0, exit);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownCapabilityFailsSettingsCommand() throws Exception {
        Path root = Files.createTempDirectory("tabsense-cli-");
        try {
            int exit = new CommandLine(new TabSenseCommand()).execute(
                    "--root", root.toString(),
                    "settings",
                    "--enable", "telepathy"
            );
            assertTrue(exit != 0);
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
