package io.tabsense.runtime;

import io.tabsense.model.Capability;

public final class CapabilityDisabledException extends IllegalStateException {
    private final Capability capability;

    public CapabilityDisabledException(Capability capability) {
        super("Capability " + capability.wireName() + " is not enabled");
        this.capability = capability;
    }

    public Capability capability() {
        return capability;
    }
}
