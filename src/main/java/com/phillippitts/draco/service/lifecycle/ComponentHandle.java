package com.phillippitts.draco.service.lifecycle;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Function;

/**
 * Typed view of one registered component, returned by
 * {@link ComponentLifecycleManager#register(String, ComponentLoader, ComponentUnloader, double)}.
 *
 * <p>Collaborators keep the handle instead of the instance: the instance may be evicted
 * between calls, the handle stays valid for the lifetime of the manager.
 *
 * <p>Typical usage from a collaborator:
 * <pre>{@code
 * ComponentHandle<ChatModel> chatModel = manager.register("chat_model",
 *         ChatModel::loadFromDisk, ChatModel::close, 2_600);
 *
 * String reply = chatModel.use(model -> model.complete(prompt));
 * }</pre>
 *
 * <p>The type parameter is not checked at runtime. Re-registering the name with a loader of
 * a different type breaks handles obtained earlier.
 *
 * @param <T> instance type produced by the loader
 */
public final class ComponentHandle<T> {

    private final ComponentLifecycleManager manager;
    private final String name;

    ComponentHandle(ComponentLifecycleManager manager, String name) {
        this.manager = Objects.requireNonNull(manager, "manager");
        this.name = Objects.requireNonNull(name, "name");
    }

    public String name() {
        return name;
    }

    /** @see ComponentLifecycleManager#acquire(String) */
    @SuppressWarnings("unchecked")
    public T acquire() {
        return (T) manager.acquire(name);
    }

    /** Releases the current instance (if any) and loads a fresh one. */
    @SuppressWarnings("unchecked")
    public T reload() {
        return (T) manager.acquire(name, true);
    }

    /** @see ComponentLifecycleManager#scheduleEviction(String) */
    public void scheduleEviction() {
        manager.scheduleEviction(name);
    }

    /** @see ComponentLifecycleManager#scheduleEviction(String, Duration) */
    public void scheduleEviction(Duration timeout) {
        manager.scheduleEviction(name, timeout);
    }

    /** @see ComponentLifecycleManager#evictComponent(String) */
    public void evict() {
        manager.evictComponent(name);
    }

    public ComponentState state() {
        return manager.state(name);
    }

    /**
     * Acquires the instance, applies {@code work} to it and re-arms the default idle timeout,
     * the acquire-use-schedule pattern every collaborator follows.
     *
     * <p>The idle timeout is re-armed even if {@code work} throws. If the acquire itself fails,
     * nothing is scheduled.
     *
     * @param work operation on the shared instance; must not retain it
     * @return result of {@code work}
     */
    public <R> R use(Function<? super T, ? extends R> work) {
        T instance = acquire();
        try {
            return work.apply(instance);
        } finally {
            manager.scheduleEviction(name);
        }
    }

    @Override
    public String toString() {
        return "ComponentHandle[" + name + "]";
    }
}
