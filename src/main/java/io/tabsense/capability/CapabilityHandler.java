package io.tabsense.capability;

import java.util.Map;

/**
 * Externally supplied implementation of one capability. Failures are reported by throwing; the
 * hub records them on the task. Long-running handlers should poll
 * {@link CancellationToken#isCancelled()} or react to interruption.
 */
@FunctionalInterface
public interface CapabilityHandler {
    Map<String, Object> execute(CapabilityContext context) throws Exception;
}
