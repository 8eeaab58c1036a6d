package io.tabsense.capability;

import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative cancellation signal handed to a running handler. Signalled at most once.
 */
public final class CancellationToken {
    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String reason() {
        return reason.get();
    }

    public void throwIfCancelled() {
        String current = reason.get();
        if (current != null) {
            throw new CancellationException(current);
        }
    }

    /**
     * Registers a callback run on cancellation, or immediately if already cancelled.
     */
    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
    }

    public boolean cancel(String why) {
        String safeReason = why == null || why.isBlank() ? "cancelled" : why;
        if (!reason.compareAndSet(null, safeReason)) {
            return false;
        }
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                listener.run();
            }
        }
        return true;
    }
}
