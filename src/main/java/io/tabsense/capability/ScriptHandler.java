package io.tabsense.capability;

import io.tabsense.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command per task. The capability context is written to stdin as JSON and the
 * command's stdout must be a JSON object, which becomes the task result.
 */
public final class ScriptHandler implements CapabilityHandler {
    private static final int MAX_ERROR_CHARS = 512;

    private final String name;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptHandler(String name, List<String> command, long timeoutMs) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("script handler name cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script handler command cannot be empty: " + name);
        }
        this.name = name;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    public String name() {
        return name;
    }

    @Override
    public Map<String, Object> execute(CapabilityContext context) throws Exception {
        context.cancellation().throwIfCancelled();
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectErrorStream(true);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new IOException("script spawn failed: " + e.getMessage(), e);
        }
        context.cancellation().onCancel(process::destroyForcibly);
        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readOutput(process));

        try {
            Map<String, Object> input = new LinkedHashMap<>();
            input.put("taskId", context.taskId());
            input.put("tabId", context.tabId());
            input.put("url", context.target().flatMap(RenderTarget::currentUrl).orElse(null));
            input.put("parameters", context.parameters());
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(Jsons.toCompactJson(input).getBytes(StandardCharsets.UTF_8));
            }

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                throw new IllegalStateException("script timeout after " + Duration.ofMillis(timeoutMs));
            }
            if (context.cancellation().isCancelled()) {
                throw new CancellationException(context.cancellation().reason());
            }

            String combined = awaitOutput(output);
            if (process.exitValue() != 0) {
                throw new IllegalStateException("script exit=" + process.exitValue() + " output=" + truncate(combined));
            }
            return Jsons.readMap(combined.strip());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw e;
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private static String readOutput(Process process) {
        try (InputStream stdout = process.getInputStream()) {
            return new String(stdout.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String awaitOutput(CompletableFuture<String> output) throws IOException, InterruptedException {
        try {
            return output.get(5, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new IOException("script output read failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("script output not closed after exit", e);
        }
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
