package io.tabsense.capability;

import io.tabsense.model.Capability;

import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

public final class CapabilityRegistry {
    private final Map<Capability, CapabilityHandler> handlers = new EnumMap<>(Capability.class);

    public synchronized void register(Capability capability, CapabilityHandler handler) {
        handlers.put(Objects.requireNonNull(capability, "capability"), Objects.requireNonNull(handler, "handler"));
    }

    public synchronized void registerAll(Collection<Capability> capabilities, CapabilityHandler handler) {
        for (Capability capability : capabilities) {
            register(capability, handler);
        }
    }

    public synchronized Optional<CapabilityHandler> find(Capability capability) {
        return Optional.ofNullable(handlers.get(capability));
    }

    public synchronized Set<Capability> registeredCapabilities() {
        return handlers.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(handlers.keySet()));
    }
}
