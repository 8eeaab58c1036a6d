package io.tabsense.cli;

import io.tabsense.capability.CapabilityRegistry;
import io.tabsense.capability.RenderTarget;
import io.tabsense.capability.ScriptHandlerLoader;
import io.tabsense.config.HubConfig;
import io.tabsense.config.HubSettings;
import io.tabsense.config.SettingsUpdate;
import io.tabsense.model.Capability;
import io.tabsense.model.Insight;
import io.tabsense.model.IntelligenceTask;
import io.tabsense.runtime.IntelligenceHub;
import io.tabsense.security.SensitiveDataMasker;
import io.tabsense.storage.Database;
import io.tabsense.storage.SqliteSettingsStore;
import io.tabsense.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Command(
        name = "tabsense",
        mixinStandardHelpOptions = true,
        description = "TabSense intelligence hub CLI",
        subcommands = {
                TabSenseCommand.InitCommand.class,
                TabSenseCommand.SettingsCommand.class,
                TabSenseCommand.RunCommand.class,
                TabSenseCommand.CommandCommand.class
        }
)
public final class TabSenseCommand implements Runnable {
    @Option(names = {"--root"}, description = "Data root directory", defaultValue = "data")
    String root;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | settings | run | command");
    }

    HubConfig config() {
        return HubConfig.fromRoot(root);
    }

    SqliteSettingsStore settingsStore(HubConfig config) {
        Database db = new Database(config);
        db.init();
        return new SqliteSettingsStore(db);
    }

    IntelligenceHub startHub() {
        HubConfig config = config();
        SqliteSettingsStore store = settingsStore(config);
        CapabilityRegistry registry = new CapabilityRegistry();
        new ScriptHandlerLoader(config.rootDir()).load(config.handlersFile(), registry);
        IntelligenceHub hub = new IntelligenceHub(config, store, registry);
        hub.start();
        return hub;
    }

    static Map<String, Object> printable(IntelligenceTask task) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", task.id());
        out.put("tabId", task.tabId());
        out.put("name", task.name());
        out.put("capability", task.capability().wireName());
        out.put("priority", task.priority().name());
        out.put("status", task.status().name());
        out.put("parameters", SensitiveDataMasker.masked(task.parameters()));
        out.put("createdAt", task.createdAt());
        out.put("startedAt", task.startedAt());
        out.put("completedAt", task.completedAt());
        out.put("progress", task.progress());
        out.put("error", task.error());
        out.put("result", SensitiveDataMasker.masked(task.result()));
        return out;
    }

    @Command(name = "init", description = "Initialize the data root and SQLite settings schema")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        TabSenseCommand parent;

        @Override
        public Integer call() {
            HubConfig config = parent.config();
            parent.settingsStore(config);
            System.out.println("Initialized TabSense at: " + config.rootDir());
            return 0;
        }
    }

    @Command(name = "settings", description = "Show or update the persisted hub settings")
    static final class SettingsCommand implements Callable<Integer> {
        @ParentCommand
        TabSenseCommand parent;

        @Option(names = {"--enable"}, split = ",", description = "Capabilities to enable")
        List<String> enable;

        @Option(names = {"--disable"}, split = ",", description = "Capabilities to disable")
        List<String> disable;

        @Option(names = {"--max-concurrent"}, description = "Concurrency cap (1-20)")
        Integer maxConcurrent;

        @Option(names = {"--confidence"}, description = "Confidence threshold (0-1)")
        Double confidence;

        @Option(names = {"--auto-optimization"}, arity = "1", description = "true|false")
        Boolean autoOptimization;

        @Option(names = {"--predictive"}, arity = "1", description = "true|false")
        Boolean predictive;

        @Option(names = {"--learning"}, arity = "1", description = "true|false")
        Boolean learning;

        @Override
        public Integer call() {
            SqliteSettingsStore store = parent.settingsStore(parent.config());
            HubSettings current = store.loadSettings().orElseGet(HubSettings::defaults);
            HubSettings next = current.apply(SettingsUpdate.builder()
                    .autoOptimization(autoOptimization)
                    .predictiveBrowsing(predictive)
                    .learningMode(learning)
                    .confidenceThreshold(confidence)
                    .maxConcurrentTasks(maxConcurrent)
                    .build());
            if (enable != null) {
                for (String raw : enable) {
                    next = next.withCapability(Capability.fromString(raw), true);
                }
            }
            if (disable != null) {
                for (String raw : disable) {
                    next = next.withCapability(Capability.fromString(raw), false);
                }
            }
            if (!next.equals(current)) {
                store.saveSettings(next);
            }
            System.out.println(Jsons.toJson(next.toFile()));
            return 0;
        }
    }

    @Command(name = "run", description = "Register tabs on a local hub, wait, and report tasks, insights and stats")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        TabSenseCommand parent;

        @Option(names = {"--tab"}, required = true, description = "Tab id to register (repeatable)")
        List<String> tabs;

        @Option(names = {"--url"}, description = "Current URL handed to handlers")
        String url;

        @Option(names = {"--seconds"}, defaultValue = "5", description = "How long to let the hub run")
        long seconds;

        @Option(names = {"--format"}, defaultValue = "json", description = "Output format: json|prometheus")
        String format;

        @Override
        public Integer call() throws Exception {
            String fmt = format == null ? "json" : format.trim().toLowerCase(Locale.ROOT);
            if (!"json".equals(fmt) && !"prometheus".equals(fmt)) {
                throw new IllegalArgumentException("--format must be json or prometheus");
            }
            try (IntelligenceHub hub = parent.startHub()) {
                for (String tabId : tabs) {
                    hub.registerTab(tabId, RenderTarget.of(tabId, url));
                }
                TimeUnit.SECONDS.sleep(Math.max(0L, seconds));
                if ("prometheus".equals(fmt)) {
                    System.out.print(hub.metricsText());
                    return 0;
                }
                List<Map<String, Object>> taskViews = new ArrayList<>();
                for (IntelligenceTask task : hub.getActiveTasks()) {
                    taskViews.add(printable(task));
                }
                List<Insight> insights = hub.getInsights();
                System.out.println(Jsons.toJson(new RunOutcome(taskViews, insights, hub.stats())));
                return 0;
            }
        }
    }

    @Command(name = "command", description = "Run a free-text command against a tab")
    static final class CommandCommand implements Callable<Integer> {
        @ParentCommand
        TabSenseCommand parent;

        @Option(names = {"--tab"}, required = true, description = "Tab id")
        String tab;

        @Option(names = {"--url"}, description = "Current URL handed to handlers")
        String url;

        @Option(names = {"--timeout-seconds"}, defaultValue = "30", description = "Maximum wait for the outcome")
        long timeoutSeconds;

        @Parameters(arity = "1..*", description = "Command text")
        List<String> text;

        @Override
        public Integer call() throws Exception {
            String command = String.join(" ", text);
            try (IntelligenceHub hub = parent.startHub()) {
                hub.registerTab(tab, RenderTarget.of(tab, url));
                String outcome;
                try {
                    outcome = hub.processCommand(tab, command).get(Math.max(1L, timeoutSeconds), TimeUnit.SECONDS);
                } catch (TimeoutException e) {
                    System.out.println(Jsons.toJson(new CommandOutcome(tab, command, null, "timed out after " + timeoutSeconds + "s")));
                    return 1;
                }
                System.out.println(Jsons.toJson(new CommandOutcome(tab, command, outcome, null)));
                return outcome.startsWith("Command executed successfully") ? 0 : 1;
            }
        }
    }

    record RunOutcome(List<Map<String, Object>> tasks, List<Insight> insights, IntelligenceHub.StatsOutcome stats) {
    }

    record CommandOutcome(String tabId, String command, String outcome, String error) {
    }
}
