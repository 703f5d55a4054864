package com.phillippitts.draco.service.lifecycle;

/**
 * Lifecycle state of a registered component.
 *
 * <p>Transitions: {@code NOT_LOADED -> LOADING -> LOADED -> UNLOADING -> NOT_LOADED}.
 * A failing loader moves {@code LOADING -> ERROR}; the next acquire treats {@code ERROR}
 * like {@code NOT_LOADED} and retries.
 */
public enum ComponentState {
    NOT_LOADED,
    LOADING,
    LOADED,
    UNLOADING,
    ERROR;

    /** True while a load or unload is in flight and callers must wait for it to settle. */
    public boolean isTransitioning() {
        return this == LOADING || this == UNLOADING;
    }
}
