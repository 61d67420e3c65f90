package io.recordstore.util;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the background threads of one record store pool.
 *
 * <p>Threads are daemons named {@code recordstore-<pool>-1}, {@code recordstore-<pool>-2},
 * and so on. A throwable that escapes a thread's task is logged at {@code SEVERE} with the
 * thread name, so a sweep or purge thread that dies is visible in the logs.
 */
public final class DaemonThreadFactory implements ThreadFactory {
    private static final Logger logger = Logger.getLogger(DaemonThreadFactory.class.getName());

    private static final Thread.UncaughtExceptionHandler LOG_UNCAUGHT = (thread, e) ->
            logger.log(Level.SEVERE, "Uncaught exception in record store thread " + thread.getName(), e);

    private final String prefix;
    private final AtomicInteger counter = new AtomicInteger(1);

    /**
     * @param pool short pool name, e.g. {@code sweep} or {@code purge}
     */
    public DaemonThreadFactory(String pool) {
        Objects.requireNonNull(pool, "pool");
        if (pool.isBlank()) {
            throw new IllegalArgumentException("pool must not be blank");
        }
        this.prefix = "recordstore-" + pool + "-";
    }

    @Override
    public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable, prefix + counter.getAndIncrement());
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler(LOG_UNCAUGHT);
        return thread;
    }
}
