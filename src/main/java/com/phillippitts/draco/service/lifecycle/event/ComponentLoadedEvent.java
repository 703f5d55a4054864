package com.phillippitts.draco.service.lifecycle.event;

import java.time.Instant;

/**
 * Published after a component loader completed and the instance became available.
 */
public record ComponentLoadedEvent(
        String component,
        Instant at,
        long durationMs
) {
    public ComponentLoadedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
