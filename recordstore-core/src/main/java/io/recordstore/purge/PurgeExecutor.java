package io.recordstore.purge;

import io.recordstore.PartialSweepFailureException;
import io.recordstore.StorageUnavailableException;
import io.recordstore.model.RecordType;
import io.recordstore.model.RecordTypeRegistry;
import io.recordstore.model.TypeStats;
import io.recordstore.spi.ConnectionProvider;
import io.recordstore.spi.ExpiredRecordPurger;
import io.recordstore.spi.MetricsExporter;
import io.recordstore.spi.RecordStore;
import io.recordstore.util.DaemonThreadFactory;
import io.recordstore.util.SqlExceptions;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deletes expired rows and reports statistics across every volatile record type.
 *
 * <p>A sweep issues one independent deletion per volatile type on a small worker pool.
 * Each type deletes in batches (default 500) until fewer than {@code batchSize} rows are
 * deleted; each batch uses its own auto-committed connection to limit lock duration.
 * A failing type never stops the others; failures are collected into the
 * {@link SweepResult}.
 *
 * <p>Create instances via {@link #builder()}.
 *
 * @see PurgeScheduler
 * @see ExpiredRecordPurger
 */
public final class PurgeExecutor implements Sweeper, AutoCloseable {
    private static final Logger logger = Logger.getLogger(PurgeExecutor.class.getName());

    private final ConnectionProvider connectionProvider;
    private final RecordStore recordStore;
    private final ExpiredRecordPurger purger;
    private final RecordTypeRegistry registry;
    private final Clock clock;
    private final MetricsExporter metrics;
    private final int batchSize;
    private final ExecutorService workers;

    private PurgeExecutor(Builder builder) {
        this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
        this.recordStore = Objects.requireNonNull(builder.recordStore, "recordStore");
        this.purger = Objects.requireNonNull(builder.purger, "purger");
        this.registry = Objects.requireNonNull(builder.registry, "registry");
        this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
        this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

        if (builder.batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (builder.parallelism <= 0) {
            throw new IllegalArgumentException("parallelism must be > 0");
        }
        this.batchSize = builder.batchSize;
        this.workers = Executors.newFixedThreadPool(builder.parallelism, new DaemonThreadFactory("purge"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Deletes rows with {@code expires_at <= now} from every volatile type.
     *
     * <p>Returns once every per-type deletion has completed or failed. If the calling
     * thread is interrupted, outstanding deletions are cancelled and reported as failures.
     */
    @Override
    public SweepResult sweep(Instant now) {
        Objects.requireNonNull(now, "now");
        Map<RecordType, Future<Integer>> pending = submitAll(type -> () -> purgeType(type, now));
        SweepResult.Builder result = SweepResult.builder(now);
        Map<String, Throwable> failures = collect(pending, result::deleted);
        failures.forEach((typeName, cause) -> {
            result.failed(typeName, cause);
            metrics.incrementPurgeFailures(typeName);
        });

        SweepResult sweep = result.build();
        sweep.deleted().forEach(metrics::recordPurged);
        if (sweep.totalDeleted() > 0) {
            logger.log(Level.INFO, "Purged {0} expired records at {1}: {2}",
                    new Object[]{sweep.totalDeleted(), now, sweep.deleted()});
        }
        sweep.failure().ifPresent(e ->
                logger.log(Level.WARNING, "Sweep incomplete for " + e.failedTypes(), e));
        return sweep;
    }

    /**
     * Returns live row counts and creation time range for every volatile type.
     *
     * @throws StorageUnavailableException if no connection can be obtained
     */
    public List<TypeStats> statsByType() {
        Instant now = clock.instant();
        try (Connection conn = connectionProvider.getConnection()) {
            List<TypeStats> stats = new ArrayList<>();
            for (RecordType type : registry.expiringTypes()) {
                stats.add(recordStore.stats(conn, type.name(), type.namespace(), now));
            }
            return stats;
        } catch (SQLException e) {
            throw SqlExceptions.translate("Failed to collect record statistics", e);
        }
    }

    /**
     * Deletes every row of every volatile type, regardless of expiration.
     *
     * @return rows deleted per logical type
     * @throws PartialSweepFailureException if one or more types could not be wiped
     */
    public Map<String, Integer> wipeAllVolatile() {
        Map<RecordType, Future<Integer>> pending = submitAll(type -> () -> wipeType(type));
        Map<String, Integer> deleted = new LinkedHashMap<>();
        Map<String, Throwable> failures = collect(pending, deleted::put);
        if (!failures.isEmpty()) {
            throw new PartialSweepFailureException("Volatile wipe", failures);
        }
        logger.log(Level.INFO, "Wiped volatile records: {0}", deleted);
        return deleted;
    }

    private Map<RecordType, Future<Integer>> submitAll(
            Function<RecordType, Callable<Integer>> task) {
        Map<RecordType, Future<Integer>> pending = new LinkedHashMap<>();
        for (RecordType type : registry.expiringTypes()) {
            pending.put(type, workers.submit(task.apply(type)));
        }
        return pending;
    }

    private Map<String, Throwable> collect(Map<RecordType, Future<Integer>> pending,
            BiConsumer<String, Integer> onSuccess) {
        Map<String, Throwable> failures = new LinkedHashMap<>();
        boolean interrupted = false;
        for (Map.Entry<RecordType, Future<Integer>> entry : pending.entrySet()) {
            String typeName = entry.getKey().name();
            Future<Integer> future = entry.getValue();
            if (interrupted) {
                future.cancel(true);
                failures.put(typeName, new InterruptedException("Cancelled before completion"));
                continue;
            }
            try {
                onSuccess.accept(typeName, future.get());
            } catch (ExecutionException e) {
                failures.put(typeName, e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                interrupted = true;
                future.cancel(true);
                failures.put(typeName, e);
            }
        }
        return failures;
    }

    private int purgeType(RecordType type, Instant now) {
        int total = 0;
        int deleted;
        do {
            deleted = purgeBatch(type, now);
            total += deleted;
        } while (deleted >= batchSize && !Thread.currentThread().isInterrupted());
        return total;
    }

    private int purgeBatch(RecordType type, Instant now) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return purger.purge(conn, type.namespace(), now, batchSize);
        } catch (SQLException e) {
            throw SqlExceptions.translate("Failed to purge expired " + type.name() + " records", e);
        }
    }

    private int wipeType(RecordType type) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return recordStore.deleteAll(conn, type.namespace());
        } catch (SQLException e) {
            throw SqlExceptions.translate("Failed to wipe " + type.name() + " records", e);
        }
    }

    /** Shuts down the per-type worker threads. */
    @Override
    public void close() {
        workers.shutdownNow();
        try {
            workers.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /** Builder for {@link PurgeExecutor}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private RecordStore recordStore;
        private ExpiredRecordPurger purger;
        private RecordTypeRegistry registry;
        private Clock clock;
        private MetricsExporter metrics;
        private int batchSize = 500;
        private int parallelism = 4;

        private Builder() {}

        /** <b>Required.</b> */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> Used for statistics and volatile wipes. */
        public Builder recordStore(RecordStore recordStore) {
            this.recordStore = recordStore;
            return this;
        }

        /** <b>Required.</b> Dialect-specific expired-row deletion. */
        public Builder purger(ExpiredRecordPurger purger) {
            this.purger = purger;
            return this;
        }

        /** <b>Required.</b> Supplies the volatile types to sweep. */
        public Builder registry(RecordTypeRegistry registry) {
            this.registry = registry;
            return this;
        }

        /** Optional. Defaults to {@link Clock#systemUTC()}. Used by {@link #statsByType()}. */
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
         * Sets the maximum number of rows deleted per batch.
         *
         * <p>Optional. Defaults to {@code 500}. Must be &gt; 0.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Sets the number of types purged concurrently.
         *
         * <p>Optional. Defaults to {@code 4}. Must be &gt; 0.
         */
        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        /**
         * @throws NullPointerException if a required component is missing
         * @throws IllegalArgumentException if {@code batchSize} or {@code parallelism} is not positive
         */
        public PurgeExecutor build() {
            return new PurgeExecutor(this);
        }
    }
}
