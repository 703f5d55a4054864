package com.phillippitts.draco.service.lifecycle.event;

import java.time.Instant;

/**
 * Published when a component loader throws or returns no instance.
 * The component is left in {@code ERROR} and will be retried by the next acquire.
 */
public record ComponentLoadFailedEvent(
        String component,
        Instant at,
        long durationMs,
        Throwable cause
) {
    public ComponentLoadFailedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
