package com.phillippitts.draco.service.lifecycle.event;

import com.phillippitts.draco.service.lifecycle.EvictionReason;

import java.time.Instant;

/**
 * Published after a loaded instance was released.
 *
 * @param component component name
 * @param at release time
 * @param reason why the instance was released
 * @param estimatedMemoryMb advisory memory estimate of the released instance
 * @param unloaderFailed true if the unloader threw (the slot was released anyway)
 */
public record ComponentEvictedEvent(
        String component,
        Instant at,
        EvictionReason reason,
        double estimatedMemoryMb,
        boolean unloaderFailed
) {
    public ComponentEvictedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
