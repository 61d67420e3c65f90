package io.recordstore.purge;

import io.recordstore.spi.MetricsExporter;
import io.recordstore.util.DaemonThreadFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Write-driven, debounced trigger for {@link Sweeper} runs.
 *
 * <p>Every committed write calls {@link #recordWrite()}. When the write counter reaches
 * the threshold (default 1000) and no sweep is in progress, the counter is reset and a
 * sweep is handed to a worker thread; the writer returns immediately. When the sweep
 * finishes, a cooldown (default 2 s) starts. Until it elapses the scheduler stays in the
 * sweeping state and further threshold crossings are ignored, so a burst of writes
 * produces at most one sweep per cooldown window.
 *
 * <p>A sweep running longer than the sweep timeout (default 60 s) is interrupted and the
 * scheduler proceeds to cooldown without recording a completion. Each sweep carries a
 * generation number so a late completion cannot alter the state of a newer sweep.
 *
 * <p>All state is guarded by this object's monitor. Create instances via {@link #builder()}.
 *
 * @see PurgeExecutor
 * @see PurgeStatus
 */
public final class PurgeScheduler implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(PurgeScheduler.class.getName());

    public static final int DEFAULT_THRESHOLD = 1000;
    public static final Duration DEFAULT_COOLDOWN = Duration.ofMillis(2000);
    public static final Duration DEFAULT_SWEEP_TIMEOUT = Duration.ofSeconds(60);

    private final Sweeper sweeper;
    private final Clock clock;
    private final MetricsExporter metrics;
    private final Duration sweepTimeout;
    private final ExecutorService sweepThreads;
    private final ScheduledExecutorService timer;

    private int threshold;
    private Duration cooldown;
    private long writesSinceLastTrigger;
    private boolean sweeping;
    private Instant lastSweepInstant;
    private long generation;
    private long finishedGeneration;
    private boolean closed;

    private PurgeScheduler(Builder builder) {
        this.sweeper = Objects.requireNonNull(builder.sweeper, "sweeper");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
        this.sweepTimeout = builder.sweepTimeout != null ? builder.sweepTimeout : DEFAULT_SWEEP_TIMEOUT;
        this.cooldown = builder.cooldown != null ? builder.cooldown : DEFAULT_COOLDOWN;
        this.threshold = builder.threshold;

        validateThreshold(threshold);
        validateCooldown(cooldown);
        if (sweepTimeout.isNegative() || sweepTimeout.isZero()) {
            throw new IllegalArgumentException("sweepTimeout must be > 0");
        }

        // cached so that a sweep stuck past its timeout does not hold up the next one
        this.sweepThreads = Executors.newCachedThreadPool(new DaemonThreadFactory("sweep"));
        this.timer = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("sweep-timer"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Counts one committed write and triggers a sweep if the threshold is reached while idle.
     *
     * <p>Never blocks on the sweep and never throws because of it.
     */
    public void recordWrite() {
        metrics.incrementWrites();
        long sweepGeneration;
        synchronized (this) {
            writesSinceLastTrigger++;
            if (writesSinceLastTrigger < threshold || closed) {
                return;
            }
            if (sweeping) {
                metrics.incrementSweepsDebounced();
                return;
            }
            sweepGeneration = beginSweep();
        }
        logger.log(Level.FINE, "Write threshold reached, starting sweep {0}", sweepGeneration);
        launch(sweepGeneration);
    }

    /**
     * Starts a sweep now if the scheduler is idle, resetting the write counter.
     *
     * @return {@code true} if a sweep was started, {@code false} if one is already in
     *     progress or cooling down, or the scheduler is closed
     */
    public boolean requestSweep() {
        long sweepGeneration;
        synchronized (this) {
            if (sweeping || closed) {
                return false;
            }
            sweepGeneration = beginSweep();
        }
        logger.log(Level.FINE, "Sweep {0} requested", sweepGeneration);
        launch(sweepGeneration);
        return true;
    }

    /**
     * Replaces the trigger threshold and/or cooldown. A {@code null} argument keeps the
     * current value. Takes effect from the next write; a running cooldown keeps its length.
     *
     * @throws IllegalArgumentException if {@code threshold <= 0} or {@code cooldown} is negative
     */
    public synchronized void configure(Integer threshold, Duration cooldown) {
        if (threshold != null) {
            validateThreshold(threshold);
        }
        if (cooldown != null) {
            validateCooldown(cooldown);
        }
        if (threshold != null) {
            this.threshold = threshold;
        }
        if (cooldown != null) {
            this.cooldown = cooldown;
        }
        logger.log(Level.INFO, "Purge configured: threshold={0}, cooldown={1}",
                new Object[]{this.threshold, this.cooldown});
    }

    /** Returns a consistent snapshot of the scheduler state. */
    public synchronized PurgeStatus status() {
        return new PurgeStatus(threshold, cooldown, writesSinceLastTrigger, sweeping, lastSweepInstant);
    }

    // Caller holds the monitor.
    private long beginSweep() {
        writesSinceLastTrigger = 0;
        sweeping = true;
        metrics.recordSweeping(true);
        return ++generation;
    }

    private void launch(long sweepGeneration) {
        metrics.incrementSweepsStarted();
        SweepRun task = new SweepRun(sweepGeneration, System.nanoTime());
        try {
            sweepThreads.execute(task);
        } catch (RejectedExecutionException e) {
            logger.log(Level.WARNING, "Sweep rejected, purge scheduler is closed", e);
            returnToIdle(sweepGeneration);
            return;
        }
        try {
            timer.schedule(() -> abandonIfRunning(sweepGeneration, task),
                    sweepTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            logger.log(Level.FINE, "Sweep timeout not armed, purge scheduler is closed", e);
        }
    }

    /**
     * One sweep on a pool thread. Runs through {@code execute} so an {@link Error} reaches
     * the thread's uncaught exception handler instead of an unread future.
     */
    private final class SweepRun implements Runnable {
        private final long sweepGeneration;
        private final long startNanos;
        private volatile Thread runner;

        SweepRun(long sweepGeneration, long startNanos) {
            this.sweepGeneration = sweepGeneration;
            this.startNanos = startNanos;
        }

        @Override
        public void run() {
            runner = Thread.currentThread();
            try {
                SweepResult result = sweeper.sweep(clock.instant());
                logger.log(Level.FINE, "Sweep {0} finished: {1}", new Object[]{sweepGeneration, result});
            } catch (RuntimeException e) {
                logger.log(Level.SEVERE, "Sweep " + sweepGeneration + " failed", e);
            } finally {
                runner = null;
                if (finish(sweepGeneration, true)) {
                    metrics.recordSweepDurationMs(
                            TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos));
                }
            }
        }

        void interrupt() {
            Thread thread = runner;
            if (thread != null) {
                thread.interrupt();
            }
        }
    }

    private void abandonIfRunning(long sweepGeneration, SweepRun task) {
        if (finish(sweepGeneration, false)) {
            task.interrupt();
            metrics.incrementSweepTimeouts();
            logger.log(Level.WARNING, "Sweep {0} exceeded {1}, abandoned",
                    new Object[]{sweepGeneration, sweepTimeout});
        }
    }

    /**
     * Marks the given sweep finished and starts its cooldown. Only a sweep that ran to the
     * end, successfully or not, updates {@code lastSweepInstant}. Returns {@code false} if
     * the sweep was already finished (by completion or timeout) or has been superseded.
     */
    private boolean finish(long sweepGeneration, boolean completed) {
        Duration wait;
        synchronized (this) {
            if (sweepGeneration != generation || finishedGeneration >= sweepGeneration) {
                return false;
            }
            finishedGeneration = sweepGeneration;
            if (completed) {
                lastSweepInstant = clock.instant();
            }
            wait = cooldown;
        }
        try {
            timer.schedule(() -> returnToIdle(sweepGeneration), wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            returnToIdle(sweepGeneration);
        }
        return true;
    }

    private void returnToIdle(long sweepGeneration) {
        synchronized (this) {
            if (sweepGeneration != generation) {
                return;
            }
            sweeping = false;
        }
        metrics.recordSweeping(false);
        logger.log(Level.FINE, "Sweep {0} cooldown elapsed", sweepGeneration);
    }

    private static void validateThreshold(int threshold) {
        if (threshold <= 0) {
            throw new IllegalArgumentException("threshold must be > 0");
        }
    }

    private static void validateCooldown(Duration cooldown) {
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown must be >= 0");
        }
    }

    /**
     * Stops the sweep and timer threads. Later writes are still counted but never
     * trigger a sweep.
     */
    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
        }
        timer.shutdownNow();
        sweepThreads.shutdownNow();
        try {
            sweepThreads.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Builder for {@link PurgeScheduler}. */
    public static final class Builder {
        private Sweeper sweeper;
        private Clock clock;
        private MetricsExporter metrics;
        private int threshold = DEFAULT_THRESHOLD;
        private Duration cooldown;
        private Duration sweepTimeout;

        private Builder() {}

        /**
         * Sets the component that performs sweeps.
         *
         * <p><b>Required.</b>
         */
        public Builder sweeper(Sweeper sweeper) {
            this.sweeper = sweeper;
            return this;
        }

        /**
         * Sets the clock used for sweep cutoffs and completion timestamps.
         *
         * <p>Optional. Defaults to {@link Clock#systemUTC()}.
         */
        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
        public Builder metrics(MetricsExporter metrics) {
            this.metrics = metrics;
            return this;
        }

        /**
         * Sets the number of writes that triggers a sweep.
         *
         * <p>Optional. Defaults to {@code 1000}. Must be &gt; 0.
         */
        public Builder threshold(int threshold) {
            this.threshold = threshold;
            return this;
        }

        /**
         * Sets the quiet period after a sweep during which triggers are ignored.
         *
         * <p>Optional. Defaults to {@code 2000 ms}. Must be &ge; 0.
         */
        public Builder cooldown(Duration cooldown) {
            this.cooldown = cooldown;
            return this;
        }

        /**
         * Sets how long a sweep may run before it is cancelled.
         *
         * <p>Optional. Defaults to {@code 60 s}. Must be &gt; 0.
         */
        public Builder sweepTimeout(Duration sweepTimeout) {
            this.sweepTimeout = sweepTimeout;
            return this;
        }

        /**
         * @throws NullPointerException if {@code sweeper} is null
         * @throws IllegalArgumentException if a numeric setting is out of range
         */
        public PurgeScheduler build() {
            return new PurgeScheduler(this);
        }
    }
}
