package io.tabsense.runtime;

import io.tabsense.config.HubSettings;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Counting limiter for running tasks with a cap that can change while permits are held.
 * Lowering the cap never revokes permits; new acquisitions wait until usage falls below it.
 */
public final class ConcurrencyLimiter {
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private int cap;
    private int inUse;

    public ConcurrencyLimiter(int cap) {
        this.cap = clamp(cap);
    }

    public void acquire() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (inUse >= cap) {
                available.await();
            }
            inUse++;
        } finally {
            lock.unlock();
        }
    }

    public boolean tryAcquire(long timeout, TimeUnit unit) throws InterruptedException {
        long remaining = unit.toNanos(timeout);
        lock.lockInterruptibly();
        try {
            while (inUse >= cap) {
                if (remaining <= 0L) {
                    return false;
                }
                remaining = available.awaitNanos(remaining);
            }
            inUse++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public void release() {
        lock.lock();
        try {
            if (inUse <= 0) {
                throw new IllegalStateException("release without matching acquire");
            }
            inUse--;
            available.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public void setCap(int value) {
        lock.lock();
        try {
            cap = clamp(value);
            available.signalAll();
        } finally {
            lock.unlock();
        }
    }

    public int cap() {
        lock.lock();
        try {
            return cap;
        } finally {
            lock.unlock();
        }
    }

    public int inUse() {
        lock.lock();
        try {
            return inUse;
        } finally {
            lock.unlock();
        }
    }

    private static int clamp(int value) {
        return Math.max(HubSettings.MIN_CONCURRENT_TASKS, Math.min(HubSettings.MAX_CONCURRENT_TASKS, value));
    }
}
