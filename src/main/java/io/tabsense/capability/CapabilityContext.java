package io.tabsense.capability;

import java.util.Map;
import java.util.Optional;
import java.util.function.DoubleConsumer;

public record CapabilityContext(
        String taskId,
        String tabId,
        Map<String, Object> parameters,
        RenderTarget renderTarget,
        CancellationToken cancellation,
        DoubleConsumer progressSink
) {
    public CapabilityContext {
        parameters = parameters == null ? Map.of() : parameters;
        cancellation = cancellation == null ? new CancellationToken() : cancellation;
        progressSink = progressSink == null ? value -> { } : progressSink;
    }

    public Optional<RenderTarget> target() {
        return Optional.ofNullable(renderTarget);
    }

    public void reportProgress(double value) {
        progressSink.accept(value);
    }
}
