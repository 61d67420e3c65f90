package io.recordstore.purge;

import java.time.Instant;

/**
 * Deletes expired rows across every volatile record type.
 *
 * <p>Invoked by {@link PurgeScheduler} on a worker thread.
 *
 * @see PurgeExecutor
 */
@FunctionalInterface
public interface Sweeper {

    /**
     * Runs one sweep with {@code now} as the expiration cutoff.
     *
     * <p>Per-type failures are reported in the result, not thrown.
     */
    SweepResult sweep(Instant now);
}
