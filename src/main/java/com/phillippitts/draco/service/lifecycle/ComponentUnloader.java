package com.phillippitts.draco.service.lifecycle;

/**
 * Releases native or off-heap resources held by a component instance.
 *
 * <p>Failures are logged by the manager and never prevent the component from returning to
 * {@link ComponentState#NOT_LOADED}.
 *
 * @param <T> instance type
 */
@FunctionalInterface
public interface ComponentUnloader<T> {

    void unload(T instance) throws Exception;
}
