/**
 * Write-driven purge of expired records.
 *
 * <p>{@link io.recordstore.purge.PurgeScheduler} counts committed writes and, once a
 * threshold is reached, hands a sweep to a worker thread and then holds a cooldown
 * window during which further triggers are ignored.
 * {@link io.recordstore.purge.PurgeExecutor} performs the sweep, deleting expired rows
 * of every volatile type in parallel with failures isolated per type.
 *
 * @see io.recordstore.purge.PurgeScheduler
 * @see io.recordstore.purge.PurgeExecutor
 * @see io.recordstore.spi.ExpiredRecordPurger
 */
package io.recordstore.purge;
