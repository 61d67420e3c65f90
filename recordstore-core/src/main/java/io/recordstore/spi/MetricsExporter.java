package io.recordstore.spi;

/**
 * Observability hook for exporting write and purge counters to a metrics backend.
 *
 * <p>The {@link #NOOP} instance discards all metrics silently. Implement this interface
 * to bridge into Micrometer, Prometheus, or other monitoring systems.
 */
public interface MetricsExporter {

    /**
     * No-op instance that discards all metrics.
     */
    MetricsExporter NOOP = new Noop();

    /**
     * Increments the count of committed writes seen by the purge scheduler.
     */
    void incrementWrites();

    /**
     * Increments the count of sweeps started.
     */
    void incrementSweepsStarted();

    /**
     * Increments the count of threshold crossings ignored because a sweep or its
     * cooldown was in progress.
     */
    void incrementSweepsDebounced();

    /**
     * Increments the count of sweeps abandoned after exceeding the sweep timeout.
     */
    default void incrementSweepTimeouts() {
    }

    /**
     * Records rows purged from one type during a sweep.
     *
     * @param typeName logical record type
     * @param rows     rows deleted (may be zero)
     */
    void recordPurged(String typeName, int rows);

    /**
     * Increments the count of per-type purge failures.
     *
     * @param typeName logical record type that failed
     */
    void incrementPurgeFailures(String typeName);

    /**
     * Records the wall time of a completed sweep.
     *
     * @param durationMs sweep duration in milliseconds (always non-negative)
     */
    default void recordSweepDurationMs(long durationMs) {
    }

    /**
     * Records whether a sweep or cooldown is currently in progress.
     */
    default void recordSweeping(boolean sweeping) {
    }

    /**
     * Default no-op implementation that discards all metrics.
     */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementWrites() {
        }

        @Override
        public void incrementSweepsStarted() {
        }

        @Override
        public void incrementSweepsDebounced() {
        }

        @Override
        public void recordPurged(String typeName, int rows) {
        }

        @Override
        public void incrementPurgeFailures(String typeName) {
        }
    }
}
