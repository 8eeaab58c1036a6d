package io.tabsense.runtime;

/**
 * Handle returned by the subscribe methods. Closing it stops further deliveries.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {
    @Override
    void close();
}
