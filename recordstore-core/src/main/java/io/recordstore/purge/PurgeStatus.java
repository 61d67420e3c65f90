package io.recordstore.purge;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of the purge scheduler state.
 *
 * @param threshold              writes that trigger a sweep
 * @param cooldown               minimum quiet period after a sweep completes
 * @param writesSinceLastTrigger writes counted since the last sweep was triggered
 * @param sweeping               {@code true} while a sweep or its cooldown is in progress
 * @param lastSweepInstant       time the last sweep ran to the end, successfully or not, or
 *                               {@code null} if none has; a sweep abandoned at its timeout
 *                               does not update it
 */
public record PurgeStatus(
        int threshold,
        Duration cooldown,
        long writesSinceLastTrigger,
        boolean sweeping,
        Instant lastSweepInstant) {
}
