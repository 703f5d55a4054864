package com.phillippitts.draco.service.lifecycle;

import com.phillippitts.draco.config.properties.ComponentLifecycleProperties;
import com.phillippitts.draco.exception.ComponentLoadException;
import com.phillippitts.draco.exception.ComponentLoadTimeoutException;
import com.phillippitts.draco.exception.UnknownComponentException;
import com.phillippitts.draco.service.lifecycle.event.ComponentEvictedEvent;
import com.phillippitts.draco.service.lifecycle.event.ComponentLoadFailedEvent;
import com.phillippitts.draco.service.lifecycle.event.ComponentLoadTimeoutEvent;
import com.phillippitts.draco.service.lifecycle.event.ComponentLoadedEvent;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry of named, lazily constructed, memory-hungry components (language model, speech
 * recognizer, vision model, automation driver, search client).
 *
 * <p>Collaborators register a loader (and optionally an unloader) at their own initialization
 * time and call {@link #acquire(String)} whenever they need the resource. The first acquire
 * loads it; later acquires share the cached instance. {@link #scheduleEviction(String, Duration)}
 * arms a debounced idle check that releases the instance once nobody has acquired it for the
 * whole timeout.
 *
 * <p><b>Thread Safety:</b> Each component has its own {@link java.util.concurrent.locks.ReentrantLock}.
 * The lock is held only to claim or publish a state transition; loaders and unloaders always run
 * outside it, so a slow load never blocks operations on other components. Concurrent acquires
 * of the same component during a load wait on a condition, bounded by
 * {@code components.load-wait-timeout-millis}; exactly one of them runs the loader.
 *
 * <p><b>Ownership:</b> The loaded instance is shared, not copied. Callers must not keep it
 * beyond the operation they acquired it for, since eviction hands it to the unloader.
 *
 * <p><b>Lifecycle:</b> {@link #close()} runs on context shutdown: it evicts every loaded
 * component, cancels pending idle checks and rejects further acquires. Idle checks that fire
 * after close are no-ops.
 *
 * @see ComponentHandle
 * @see ComponentState
 */
@Component
public class ComponentLifecycleManager implements AutoCloseable {

    private static final Logger LOG = LogManager.getLogger(ComponentLifecycleManager.class);

    /** ThreadContext key carrying the component name during background idle checks. */
    static final String MDC_COMPONENT = "component";

    private final ConcurrentMap<String, ComponentDescriptor<?>> components = new ConcurrentHashMap<>();
    private final ComponentLifecycleProperties props;
    private final TaskScheduler scheduler;
    private final ApplicationEventPublisher publisher;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    /**
     * Creates a manager.
     *
     * @param props lifecycle configuration
     * @param scheduler scheduler for deferred idle checks
     * @param publisher lifecycle event publisher (nullable, events are skipped when absent)
     */
    public ComponentLifecycleManager(ComponentLifecycleProperties props,
                                     @Qualifier("componentEvictionScheduler") TaskScheduler scheduler,
                                     ApplicationEventPublisher publisher) {
        this.props = Objects.requireNonNull(props, "props");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.publisher = publisher;
    }

    // ---------------------------------------------------------------- registration

    /**
     * Registers a component without an unloader, using the default memory estimate.
     *
     * @see #register(String, ComponentLoader, ComponentUnloader, double)
     */
    public <T> ComponentHandle<T> register(String name, ComponentLoader<T> loader) {
        return register(name, loader, null, props.getDefaultEstimatedMemoryMb());
    }

    /**
     * Registers a component using the default memory estimate.
     *
     * @see #register(String, ComponentLoader, ComponentUnloader, double)
     */
    public <T> ComponentHandle<T> register(String name, ComponentLoader<T> loader, ComponentUnloader<T> unloader) {
        return register(name, loader, unloader, props.getDefaultEstimatedMemoryMb());
    }

    /**
     * Installs a component descriptor in {@link ComponentState#NOT_LOADED}.
     *
     * <p>Registering an existing name replaces the previous descriptor (last write wins). The
     * replaced descriptor's pending idle check is cancelled and, if it held a loaded instance,
     * that instance is released through the replaced unloader.
     *
     * @param name unique component name
     * @param loader factory invoked on first acquire
     * @param unloader destructor invoked on eviction (nullable)
     * @param estimatedMemoryMb advisory memory cost, reporting only
     * @return typed handle for the registered component
     * @throws IllegalArgumentException if name is blank or the estimate is negative
     */
    public <T> ComponentHandle<T> register(String name,
                                           ComponentLoader<T> loader,
                                           ComponentUnloader<T> unloader,
                                           double estimatedMemoryMb) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Component name must not be blank");
        }
        Objects.requireNonNull(loader, "loader");
        if (estimatedMemoryMb < 0 || Double.isNaN(estimatedMemoryMb)) {
            throw new IllegalArgumentException("Estimated memory must not be negative: " + estimatedMemoryMb);
        }

        ComponentDescriptor<T> descriptor = new ComponentDescriptor<>(name, loader, unloader, estimatedMemoryMb);
        ComponentDescriptor<?> previous = components.put(name, descriptor);
        LOG.info("Component registered: name={}, estimatedMemoryMb={}, unloader={}",
                name, estimatedMemoryMb, unloader != null);
        if (previous != null) {
            retire(previous);
        }
        return new ComponentHandle<>(this, name);
    }

    private void retire(ComponentDescriptor<?> previous) {
        previous.lock.lock();
        try {
            previous.retired = true;
            previous.cancelPendingEviction();
        } finally {
            previous.lock.unlock();
        }
        // A load still in flight on the replaced descriptor releases its own instance.
        if (evict(previous, EvictionReason.SUPERSEDED)) {
            LOG.info("Released instance of replaced registration: {}", previous.name);
        }
    }

    /** Returns true if a component is registered under the name. */
    public boolean isRegistered(String name) {
        return name != null && components.containsKey(name);
    }

    // ---------------------------------------------------------------- acquire

    /**
     * Returns the component's instance, loading it first if necessary.
     *
     * @see #acquire(String, boolean)
     */
    public Object acquire(String name) {
        return acquire(name, false);
    }

    /**
     * Returns the component's instance cast to the expected type.
     *
     * @param name component name
     * @param type expected instance type
     * @return shared instance
     * @throws ClassCastException if the loaded instance is not of the expected type
     */
    public <T> T acquire(String name, Class<T> type) {
        Object instance = acquire(name, false);
        if (!type.isInstance(instance)) {
            throw new ClassCastException("Component " + name + " is a " + instance.getClass().getName()
                    + ", not a " + type.getName());
        }
        return type.cast(instance);
    }

    /**
     * Returns the component's instance, loading it first if necessary.
     *
     * <p>Cancels any pending idle check for the component. If a load or unload is in flight,
     * waits for it to settle, bounded by the configured ceiling. If the component is not
     * loaded (or {@code forceReload} is set) this caller runs the loader; concurrent callers
     * wait for its result instead of loading again.
     *
     * @param name component name
     * @param forceReload release the current instance (if any) and load a fresh one
     * @return shared instance
     * @throws UnknownComponentException if the name was never registered
     * @throws ComponentLoadException if the loader failed, or the awaited load failed
     * @throws ComponentLoadTimeoutException if another caller's load did not finish in time
     * @throws IllegalStateException if the manager has been closed
     */
    public Object acquire(String name, boolean forceReload) {
        while (true) {
            Object instance = acquire(lookup(name), forceReload);
            if (instance != null) {
                return instance;
            }
            LOG.debug("Component {} was re-registered while acquiring; retrying", name);
        }
    }

    /** Returns null if the descriptor was replaced by a later registration. */
    private <T> T acquire(ComponentDescriptor<T> d, boolean forceReload) {
        if (closed.get()) {
            throw new IllegalStateException("Component manager is closed; cannot acquire " + d.name);
        }

        T previous = null;
        d.lock.lock();
        try {
            d.cancelPendingEviction();
            awaitSettled(d);
            if (d.retired) {
                return null;
            }
            if (closed.get()) {
                throw new IllegalStateException("Component manager is closed; cannot acquire " + d.name);
            }
            if (d.state == ComponentState.LOADED && !forceReload) {
                d.touch();
                return d.instance;
            }
            if (d.state == ComponentState.LOADED) {
                previous = d.instance;
                d.instance = null;
            }
            d.state = ComponentState.LOADING;
        } finally {
            d.lock.unlock();
        }

        if (previous != null) {
            LOG.info("Force reload requested for {}; releasing current instance first", d.name);
            boolean unloaderFailed = release(d, previous);
            afterRelease(d, EvictionReason.FORCE_RELOAD, unloaderFailed);
        }
        return load(d);
    }

    /**
     * Blocks until no load or unload is in flight. Caller holds the lock.
     *
     * <p>A caller that waited on a load which then failed gets that failure instead of
     * starting a second load.
     */
    private void awaitSettled(ComponentDescriptor<?> d) {
        if (!d.state.isTransitioning()) {
            return;
        }
        boolean awaitedLoad = d.state == ComponentState.LOADING;
        long start = System.nanoTime();
        long remaining = TimeUnit.MILLISECONDS.toNanos(props.getLoadWaitTimeoutMillis());
        LOG.debug("Waiting for in-flight {} of component {}", d.state, d.name);

        while (d.state.isTransitioning()) {
            if (remaining <= 0L) {
                long waited = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                LOG.warn("Gave up waiting for component {} after {}ms (state={})", d.name, waited, d.state);
                publish(new ComponentLoadTimeoutEvent(d.name, Instant.now(), waited));
                throw new ComponentLoadTimeoutException(d.name, waited);
            }
            try {
                remaining = d.settled.awaitNanos(remaining);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ComponentLoadException(d.name, "Interrupted while waiting for component to load", e);
            }
        }

        if (awaitedLoad && d.state == ComponentState.ERROR) {
            throw new ComponentLoadException(d.name, d.lastFailure);
        }
    }

    /**
     * Runs the loader outside the lock and publishes the outcome. State is LOADING on entry.
     *
     * <p>An instance that finishes loading after its descriptor was replaced, or after the
     * manager was closed, is released immediately instead of being published.
     *
     * @return the loaded instance, or null if the descriptor was replaced meanwhile
     */
    private <T> T load(ComponentDescriptor<T> d) {
        LOG.info("Loading component {} (~{} MB)", d.name, d.estimatedMemoryMb);
        long start = System.nanoTime();

        T instance = null;
        Throwable failure = null;
        try {
            instance = d.loader.load();
            if (instance == null) {
                failure = new IllegalStateException("Loader returned no instance");
            }
        } catch (Throwable t) {
            failure = t;
        }
        long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        boolean retired = false;
        boolean shutDown = false;
        d.lock.lock();
        try {
            retired = d.retired;
            shutDown = closed.get();
            if (failure == null && (retired || shutDown)) {
                d.instance = null;
                d.state = ComponentState.NOT_LOADED;
            } else if (failure == null) {
                d.instance = instance;
                d.state = ComponentState.LOADED;
                d.lastFailure = null;
                d.touch();
            } else {
                d.instance = null;
                d.state = ComponentState.ERROR;
                d.lastFailure = failure;
            }
            d.settled.signalAll();
        } finally {
            d.lock.unlock();
        }

        if (failure != null) {
            LOG.error("Failed to load component {} after {}ms: {}", d.name, durationMs, failure.toString());
            publish(new ComponentLoadFailedEvent(d.name, Instant.now(), durationMs, failure));
            throw new ComponentLoadException(d.name, failure);
        }
        LOG.info("Component loaded: name={}, durationMs={}", d.name, durationMs);
        publish(new ComponentLoadedEvent(d.name, Instant.now(), durationMs));

        if (retired || shutDown) {
            LOG.info("Discarding instance of {}: {} while it was loading", d.name,
                    retired ? "re-registered" : "manager closed");
            boolean unloaderFailed = release(d, instance);
            afterRelease(d, retired ? EvictionReason.SUPERSEDED : EvictionReason.SHUTDOWN, unloaderFailed);
            if (!retired) {
                throw new IllegalStateException("Component manager closed while loading " + d.name);
            }
            return null;
        }
        return instance;
    }

    // ---------------------------------------------------------------- idle eviction

    /**
     * Schedules an idle check using {@code components.default-idle-timeout-seconds}.
     *
     * @see #scheduleEviction(String, Duration)
     */
    public void scheduleEviction(String name) {
        scheduleEviction(name, Duration.ofSeconds(props.getDefaultIdleTimeoutSeconds()));
    }

    /**
     * Schedules an idle check after the given number of seconds.
     *
     * @see #scheduleEviction(String, Duration)
     */
    public void scheduleEviction(String name, long timeoutSeconds) {
        scheduleEviction(name, Duration.ofSeconds(timeoutSeconds));
    }

    /**
     * Arms a one-shot idle check that fires after {@code timeout} on the eviction scheduler.
     *
     * <p>Replaces any check previously scheduled for the component; only the most recent
     * schedule call can fire. When it fires, the component is evicted only if it is still
     * loaded and has not been acquired for at least {@code timeout}.
     *
     * @param name component name
     * @param timeout idle period after which the component may be evicted
     * @throws UnknownComponentException if the name was never registered
     * @throws IllegalArgumentException if the timeout is negative
     */
    public void scheduleEviction(String name, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative()) {
            throw new IllegalArgumentException("Eviction timeout must not be negative: " + timeout);
        }
        ComponentDescriptor<?> d = lookup(name);
        if (closed.get()) {
            LOG.debug("Ignoring eviction schedule for {}: manager closed", name);
            return;
        }

        d.lock.lock();
        try {
            d.cancelPendingEviction();
            long sequence = d.evictionSequence;
            d.pendingEviction = scheduler.schedule(() -> evictIfIdle(d, sequence, timeout),
                    Instant.now().plus(timeout));
        } catch (TaskRejectedException e) {
            LOG.warn("Eviction scheduler rejected idle check for {}: {}", name, e.getMessage());
        } finally {
            d.lock.unlock();
        }
        LOG.debug("Idle eviction scheduled: name={}, timeoutMs={}", name, timeout.toMillis());
    }

    /** Body of a scheduled idle check. Runs on the eviction scheduler. */
    private <T> void evictIfIdle(ComponentDescriptor<T> d, long sequence, Duration timeout) {
        if (closed.get()) {
            return;
        }
        ThreadContext.put(MDC_COMPONENT, d.name);
        try {
            T instance;
            long idleMs;
            d.lock.lock();
            try {
                if (d.evictionSequence != sequence || components.get(d.name) != d) {
                    LOG.debug("Stale idle check for {} ignored", d.name);
                    return;
                }
                d.pendingEviction = null;
                if (d.state != ComponentState.LOADED) {
                    return;
                }
                long idleNanos = d.idleNanos();
                if (idleNanos < timeout.toNanos()) {
                    LOG.debug("Component {} used {}ms ago; keeping it", d.name,
                            TimeUnit.NANOSECONDS.toMillis(idleNanos));
                    return;
                }
                idleMs = TimeUnit.NANOSECONDS.toMillis(idleNanos);
                instance = beginUnload(d);
            } finally {
                d.lock.unlock();
            }
            LOG.info("Evicting idle component {} after {}ms without use", d.name, idleMs);
            finishUnload(d, instance, EvictionReason.IDLE);
        } finally {
            ThreadContext.remove(MDC_COMPONENT);
        }
    }

    // ---------------------------------------------------------------- explicit eviction

    /**
     * Releases the component's instance now. No-op if it is not loaded.
     *
     * <p>Unloader failures are logged and swallowed; the component always ends in
     * {@link ComponentState#NOT_LOADED}.
     *
     * @param name component name
     * @throws UnknownComponentException if the name was never registered
     */
    public void evictComponent(String name) {
        ComponentDescriptor<?> d = lookup(name);
        d.lock.lock();
        try {
            d.cancelPendingEviction();
        } finally {
            d.lock.unlock();
        }
        if (!evict(d, EvictionReason.EXPLICIT)) {
            LOG.debug("Component {} not loaded; nothing to evict", name);
        }
    }

    /**
     * Evicts every loaded component, then cancels every pending idle check. Idempotent.
     */
    public void evictAll() {
        evictAll(EvictionReason.EXPLICIT);
    }

    private void evictAll(EvictionReason reason) {
        int evicted = 0;
        for (ComponentDescriptor<?> d : components.values()) {
            if (evict(d, reason)) {
                evicted++;
            }
        }
        for (ComponentDescriptor<?> d : components.values()) {
            d.lock.lock();
            try {
                d.cancelPendingEviction();
            } finally {
                d.lock.unlock();
            }
        }
        LOG.info("Evicted {} component(s) ({})", evicted, reason);
    }

    /** Returns true if an instance was released. */
    private <T> boolean evict(ComponentDescriptor<T> d, EvictionReason reason) {
        T instance;
        d.lock.lock();
        try {
            instance = beginUnload(d);
        } finally {
            d.lock.unlock();
        }
        if (instance == null) {
            return false;
        }
        finishUnload(d, instance, reason);
        return true;
    }

    /**
     * Claims the UNLOADING transition and detaches the instance. Caller holds the lock.
     *
     * @return the detached instance, or null if the component was not loaded
     */
    private <T> T beginUnload(ComponentDescriptor<T> d) {
        if (d.state != ComponentState.LOADED) {
            return null;
        }
        T instance = d.instance;
        d.instance = null;
        d.state = ComponentState.UNLOADING;
        return instance;
    }

    /** Runs the unloader outside the lock and always completes the transition to NOT_LOADED. */
    private <T> void finishUnload(ComponentDescriptor<T> d, T instance, EvictionReason reason) {
        boolean unloaderFailed = true;
        try {
            unloaderFailed = release(d, instance);
        } finally {
            d.lock.lock();
            try {
                d.state = ComponentState.NOT_LOADED;
                d.settled.signalAll();
            } finally {
                d.lock.unlock();
            }
        }
        afterRelease(d, reason, unloaderFailed);
    }

    /** Invokes the unloader, if any. Returns true if it threw. */
    private <T> boolean release(ComponentDescriptor<T> d, T instance) {
        if (d.unloader == null) {
            return false;
        }
        try {
            d.unloader.unload(instance);
            return false;
        } catch (Exception e) {
            LOG.warn("Unloader for component {} failed; slot released anyway", d.name, e);
            return true;
        }
    }

    private void afterRelease(ComponentDescriptor<?> d, EvictionReason reason, boolean unloaderFailed) {
        if (props.isReclaimMemoryOnEvict()) {
            System.gc();
        }
        LOG.info("Component evicted: name={}, reason={}, releasedMb~{}", d.name, reason, d.estimatedMemoryMb);
        publish(new ComponentEvictedEvent(d.name, Instant.now(), reason, d.estimatedMemoryMb, unloaderFailed));
    }

    // ---------------------------------------------------------------- status

    /**
     * Returns a snapshot of every registered component, ordered by name.
     *
     * <p>Each entry is copied under that component's lock, which is never held for the
     * duration of a load, so this does not block on slow loaders.
     *
     * @return unmodifiable map of component name to status
     */
    public Map<String, ComponentStatus> status() {
        Map<String, ComponentStatus> snapshot = new TreeMap<>();
        for (ComponentDescriptor<?> d : components.values()) {
            snapshot.put(d.name, d.snapshot());
        }
        return Collections.unmodifiableMap(snapshot);
    }

    /**
     * Returns the current state of one component.
     *
     * @throws UnknownComponentException if the name was never registered
     */
    public ComponentState state(String name) {
        return status(name).state();
    }

    /**
     * Returns a snapshot of one component.
     *
     * @throws UnknownComponentException if the name was never registered
     */
    public ComponentStatus status(String name) {
        return lookup(name).snapshot();
    }

    /** Sum of memory estimates of the components currently loaded. */
    public double loadedMemoryMb() {
        double total = 0;
        for (ComponentDescriptor<?> d : components.values()) {
            d.lock.lock();
            try {
                if (d.state == ComponentState.LOADED) {
                    total += d.estimatedMemoryMb;
                }
            } finally {
                d.lock.unlock();
            }
        }
        return total;
    }

    public boolean isClosed() {
        return closed.get();
    }

    // ---------------------------------------------------------------- shutdown

    /**
     * Evicts every loaded component and stops accepting acquires. Idempotent.
     *
     * <p>Automatically invoked by the Spring container on shutdown.
     */
    @Override
    @PreDestroy
    public void close() {
        if (closed.compareAndSet(false, true)) {
            LOG.info("Component manager shutting down; releasing {} registered component(s)", components.size());
            evictAll(EvictionReason.SHUTDOWN);
        }
    }

    // ---------------------------------------------------------------- helpers

    private ComponentDescriptor<?> lookup(String name) {
        ComponentDescriptor<?> d = name == null ? null : components.get(name);
        if (d == null) {
            throw new UnknownComponentException(name);
        }
        return d;
    }

    private void publish(Object event) {
        if (publisher == null) {
            return;
        }
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            LOG.warn("Lifecycle event listener failed for {}: {}", event.getClass().getSimpleName(), e.toString());
        }
    }
}
