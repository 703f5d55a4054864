package com.phillippitts.draco.service.lifecycle;

import java.time.Instant;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable per-name record owned by {@link ComponentLifecycleManager}.
 *
 * <p>All non-final fields are guarded by {@link #lock}. Waiters for an in-flight load or
 * unload block on {@link #settled}, which is signalled on every transition out of
 * {@code LOADING}/{@code UNLOADING}.
 *
 * @param <T> instance type
 */
final class ComponentDescriptor<T> {

    final String name;
    final ComponentLoader<T> loader;
    final ComponentUnloader<T> unloader;
    final double estimatedMemoryMb;

    final ReentrantLock lock = new ReentrantLock();
    final Condition settled = lock.newCondition();

    ComponentState state = ComponentState.NOT_LOADED;
    T instance;
    long lastUsedNanos;
    Instant lastUsedAt;
    long accessCount;
    Throwable lastFailure;

    ScheduledFuture<?> pendingEviction;
    long evictionSequence;

    /** Set once a later registration has replaced this descriptor. */
    boolean retired;

    ComponentDescriptor(String name,
                        ComponentLoader<T> loader,
                        ComponentUnloader<T> unloader,
                        double estimatedMemoryMb) {
        this.name = name;
        this.loader = loader;
        this.unloader = unloader;
        this.estimatedMemoryMb = estimatedMemoryMb;
    }

    /** Records a successful acquire. Caller holds the lock. */
    void touch() {
        lastUsedNanos = System.nanoTime();
        lastUsedAt = Instant.now();
        accessCount++;
    }

    /** Nanoseconds since the last successful acquire, 0 if never used. Caller holds the lock. */
    long idleNanos() {
        return lastUsedAt == null ? 0L : System.nanoTime() - lastUsedNanos;
    }

    /**
     * Cancels the outstanding idle check, if any, and invalidates checks that already started
     * running but have not yet taken the lock. Caller holds the lock.
     */
    void cancelPendingEviction() {
        evictionSequence++;
        if (pendingEviction != null) {
            pendingEviction.cancel(false);
            pendingEviction = null;
        }
    }

    ComponentStatus snapshot() {
        lock.lock();
        try {
            double idleSeconds = idleNanos() / (double) TimeUnit.SECONDS.toNanos(1);
            String failure = null;
            if (lastFailure != null) {
                failure = lastFailure.getMessage() != null
                        ? lastFailure.getMessage()
                        : lastFailure.getClass().getSimpleName();
            }
            return new ComponentStatus(name, state, idleSeconds, accessCount,
                    estimatedMemoryMb, lastUsedAt, failure);
        } finally {
            lock.unlock();
        }
    }
}
