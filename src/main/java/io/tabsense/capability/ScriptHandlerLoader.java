package io.tabsense.capability;

import io.tabsense.model.Capability;
import io.tabsense.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Registers {@link ScriptHandler}s declared in {@code handlers/scripts.json} and fills the
 * remaining capabilities with {@link EchoHandler}.
 */
public final class ScriptHandlerLoader {
    private static final Logger log = LoggerFactory.getLogger(ScriptHandlerLoader.class);
    private static final long DEFAULT_TIMEOUT_MS = 60_000L;

    private final Path rootDir;

    public ScriptHandlerLoader(Path rootDir) {
        this.rootDir = rootDir;
    }

    public LoadOutcome load(Path file, CapabilityRegistry registry) {
        if (!Files.exists(file)) {
            return new LoadOutcome(List.of(), 0, fillWithEcho(registry));
        }
        HandlerFile parsed;
        try {
            parsed = Jsons.mapper().readValue(file.toFile(), HandlerFile.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read handler config: " + file, e);
        }
        List<String> loaded = new ArrayList<>();
        int skipped = 0;
        if (parsed != null && parsed.handlers() != null) {
            for (HandlerSpec spec : parsed.handlers()) {
                if (spec == null || spec.capability() == null || spec.command() == null || spec.command().isEmpty()) {
                    skipped++;
                    continue;
                }
                try {
                    Capability capability = Capability.fromString(spec.capability());
                    long timeoutMs = spec.timeoutMs() == null ? DEFAULT_TIMEOUT_MS : spec.timeoutMs();
                    registry.register(capability, new ScriptHandler(
                            capability.wireName(),
                            resolveCommand(spec.command()),
                            timeoutMs
                    ));
                    loaded.add(capability.wireName());
                } catch (IllegalArgumentException e) {
                    skipped++;
                    log.warn("Skipped handler spec {}: {}", spec.capability(), e.getMessage());
                }
            }
        }
        List<String> echoed = fillWithEcho(registry);
        log.info("Loaded script handlers from {} loaded={} skipped={}", file, loaded, skipped);
        return new LoadOutcome(List.copyOf(loaded), skipped, echoed);
    }

    List<String> resolveCommand(List<String> rawCommand) {
        List<String> resolved = new ArrayList<>(rawCommand.size());
        for (String token : rawCommand) {
            if (token == null || token.isBlank()) {
                continue;
            }
            Path candidate = rootDir.resolve(token).normalize();
            if (Files.exists(candidate)) {
                resolved.add(candidate.toString());
            } else {
                resolved.add(token);
            }
        }
        if (resolved.isEmpty()) {
            throw new IllegalArgumentException("script command became empty after normalization");
        }
        return resolved;
    }

    private static List<String> fillWithEcho(CapabilityRegistry registry) {
        Set<Capability> missing = EnumSet.allOf(Capability.class);
        missing.removeAll(registry.registeredCapabilities());
        List<String> echoed = new ArrayList<>();
        for (Capability capability : missing) {
            registry.register(capability, new EchoHandler(capability));
            echoed.add(capability.wireName());
        }
        return List.copyOf(echoed);
    }

    public record LoadOutcome(List<String> scripted, int skipped, List<String> echoed) {
    }

    private record HandlerFile(List<HandlerSpec> handlers) {
    }

    private record HandlerSpec(String capability, List<String> command, Long timeoutMs) {
    }
}
