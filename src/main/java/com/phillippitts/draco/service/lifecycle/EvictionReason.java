package com.phillippitts.draco.service.lifecycle;

/** Why a loaded instance was released. */
public enum EvictionReason {
    /** Caller asked for it via evictComponent or evictAll. */
    EXPLICIT,
    /** Scheduled idle check found the component unused for the whole timeout. */
    IDLE,
    /** Manager closed. */
    SHUTDOWN,
    /** Previous instance released ahead of a forced reload. */
    FORCE_RELOAD,
    /** Registration under the same name replaced the descriptor. */
    SUPERSEDED
}
