package com.phillippitts.draco.service.lifecycle;

/**
 * Factory that constructs an expensive component instance (model, driver, client).
 *
 * <p>Invoked at most once per load, never while the manager holds a lock that other
 * components contend on. Throwing, or returning {@code null}, fails the load.
 *
 * @param <T> instance type
 */
@FunctionalInterface
public interface ComponentLoader<T> {

    T load() throws Exception;
}
