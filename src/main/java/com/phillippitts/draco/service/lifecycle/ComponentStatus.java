package com.phillippitts.draco.service.lifecycle;

import java.time.Instant;

/**
 * Point-in-time view of one registered component.
 *
 * @param name component name
 * @param state lifecycle state at snapshot time
 * @param idleSeconds seconds since the last successful acquire, 0 if never used
 * @param accessCount successful acquires since registration
 * @param estimatedMemoryMb advisory memory cost supplied at registration
 * @param lastUsedAt wall-clock time of the last successful acquire, null if never used
 * @param lastFailure message of the most recent failed load, null after a successful load
 */
public record ComponentStatus(
        String name,
        ComponentState state,
        double idleSeconds,
        long accessCount,
        double estimatedMemoryMb,
        Instant lastUsedAt,
        String lastFailure
) {
}
