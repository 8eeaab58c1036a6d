package io.tabsense.capability;

import io.tabsense.model.Capability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stand-in handler that reports what it was asked to do. Used by the CLI for capabilities that
 * have no configured script.
 */
public final class EchoHandler implements CapabilityHandler {
    private final Capability capability;

    public EchoHandler(Capability capability) {
        this.capability = capability;
    }

    @Override
    public Map<String, Object> execute(CapabilityContext context) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("handler", "echo");
        output.put("capability", capability.wireName());
        output.put("timestamp", Instant.now().toString());
        output.put("taskId", context.taskId());
        output.put("tabId", context.tabId());
        output.put("url", context.target().flatMap(RenderTarget::currentUrl).orElse(null));
        output.put("received", context.parameters());
        output.put("message", "echoed " + capability.wireName());
        return output;
    }
}
