package com.phillippitts.draco.service.lifecycle.event;

import java.time.Instant;

/**
 * Published when a caller gave up waiting for another caller's in-flight load.
 */
public record ComponentLoadTimeoutEvent(
        String component,
        Instant at,
        long waitedMillis
) {
    public ComponentLoadTimeoutEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
