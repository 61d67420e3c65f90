package io.recordstore;

import io.recordstore.model.ListQuery;
import io.recordstore.model.RecordType;
import io.recordstore.model.RecordTypeRegistry;
import io.recordstore.model.StoredRecord;
import io.recordstore.model.TypeStats;
import io.recordstore.purge.PurgeExecutor;
import io.recordstore.purge.PurgeScheduler;
import io.recordstore.purge.PurgeStatus;
import io.recordstore.purge.SweepResult;
import io.recordstore.spi.ConnectionProvider;
import io.recordstore.spi.ExpiredRecordPurger;
import io.recordstore.spi.MetricsExporter;
import io.recordstore.spi.RecordStore;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Composite entry point that wires one {@link RecordAdapter} per registered type, a
 * {@link PurgeExecutor} and a {@link PurgeScheduler} into a single {@link AutoCloseable} unit.
 *
 * <p>All adapters share the scheduler, so the write threshold counts writes across every
 * type.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (RecordStorage storage = RecordStorage.builder()
 *     .connectionProvider(connProvider)
 *     .recordStore(JdbcRecordStores.detect(dataSource))
 *     .purger(JdbcExpiredRecordPurgers.forStore(store))
 *     .build()) {
 *   RecordAdapter sessions = storage.adapter("Session");
 *   sessions.upsert("s1", Map.of("uid", "u1"), 3600);
 * }
 * }</pre>
 *
 * @see RecordAdapter
 * @see PurgeScheduler
 * @see PurgeExecutor
 */
public final class RecordStorage implements AutoCloseable {
    private static final Logger logger = Logger.getLogger(RecordStorage.class.getName());

    private final RecordTypeRegistry registry;
    private final Map<String, RecordAdapter> adapters;
    private final PurgeExecutor purgeExecutor;
    private final PurgeScheduler purgeScheduler;
    private final MetricsExporter metrics;
    private final Clock clock;

    private RecordStorage(RecordTypeRegistry registry, Map<String, RecordAdapter> adapters,
            PurgeExecutor purgeExecutor, PurgeScheduler purgeScheduler, MetricsExporter metrics,
            Clock clock) {
        this.clock = clock;
        this.registry = registry;
        this.adapters = adapters;
        this.purgeExecutor = purgeExecutor;
        this.purgeScheduler = purgeScheduler;
        this.metrics = metrics;
    }

    public static Builder builder() {
        return new Builder();
    }

    public RecordTypeRegistry registry() {
        return registry;
    }

    /**
     * Returns the adapter for a logical type name.
     *
     * @throws IllegalArgumentException if the type is not registered
     */
    public RecordAdapter adapter(String typeName) {
        RecordType type = registry.get(typeName);
        return adapters.get(type.name());
    }

    /** Lists rows of one type for administration. Expired rows are included. */
    public List<StoredRecord> list(String typeName, ListQuery query) {
        return adapter(typeName).list(query);
    }

    /**
     * Changes the purge threshold and/or cooldown at runtime. {@code null} keeps the
     * current value.
     */
    public void configurePurge(Integer threshold, Duration cooldown) {
        purgeScheduler.configure(threshold, cooldown);
    }

    public PurgeStatus purgeStatus() {
        return purgeScheduler.status();
    }

    /**
     * Starts an asynchronous sweep if none is running or cooling down.
     *
     * @return {@code true} if a sweep was started
     */
    public boolean requestSweep() {
        return purgeScheduler.requestSweep();
    }

    /**
     * Runs a sweep on the calling thread, bypassing the scheduler and its cooldown.
     */
    public SweepResult sweepNow() {
        return purgeExecutor.sweep(clock.instant());
    }

    public List<TypeStats> statsByType() {
        return purgeExecutor.statsByType();
    }

    /**
     * Deletes every row of every volatile type. Durable types are untouched.
     *
     * @throws PartialSweepFailureException if one or more types could not be wiped
     */
    public Map<String, Integer> wipeAllVolatile() {
        return purgeExecutor.wipeAllVolatile();
    }

    /**
     * Shuts down components in order: purge scheduler, purge executor, metrics.
     */
    @Override
    public void close() {
        RuntimeException first = null;
        try {
            purgeScheduler.close();
        } catch (RuntimeException e) {
            first = e;
        }
        try {
            purgeExecutor.close();
        } catch (RuntimeException e) {
            if (first == null) first = e; else first.addSuppressed(e);
        }
        if (metrics instanceof AutoCloseable closeable) {
            try {
                closeable.close();
            } catch (Exception e) {
                RuntimeException re = (e instanceof RuntimeException r) ? r : new RecordStoreException(
                        "Failed to close metrics exporter", e);
                if (first == null) first = re; else first.addSuppressed(re);
            }
        }
        if (first != null) {
            throw first;
        }
    }

    /** Builder for {@link RecordStorage}. */
    public static final class Builder {
        private ConnectionProvider connectionProvider;
        private RecordStore recordStore;
        private ExpiredRecordPurger purger;
        private RecordTypeRegistry registry;
        private Clock clock;
        private MetricsExporter metrics;
        private int purgeThreshold = PurgeScheduler.DEFAULT_THRESHOLD;
        private Duration purgeCooldown;
        private Duration sweepTimeout;
        private int purgeBatchSize = 500;
        private int purgeParallelism = 4;
        private final AtomicBoolean built = new AtomicBoolean(false);

        private Builder() {}

        /**
         * Sets the connection provider for obtaining JDBC connections.
         *
         * <p><b>Required.</b>
         */
        public Builder connectionProvider(ConnectionProvider connectionProvider) {
            this.connectionProvider = connectionProvider;
            return this;
        }

        /** <b>Required.</b> Dialect-specific record persistence. */
        public Builder recordStore(RecordStore recordStore) {
            this.recordStore = recordStore;
            return this;
        }

        /** <b>Required.</b> Dialect-specific expired-row deletion. */
        public Builder purger(ExpiredRecordPurger purger) {
            this.purger = purger;
            return this;
        }

        /**
         * Optional. Defaults to {@link RecordTypeRegistry#oidcDefaults()}.
         */
        public Builder registry(RecordTypeRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Sets the clock used for timestamps, expiration checks and sweep cutoffs.
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

        /** Optional. Defaults to {@code 1000} writes. */
        public Builder purgeThreshold(int purgeThreshold) {
            this.purgeThreshold = purgeThreshold;
            return this;
        }

        /** Optional. Defaults to {@code 2000 ms}. */
        public Builder purgeCooldown(Duration purgeCooldown) {
            this.purgeCooldown = purgeCooldown;
            return this;
        }

        /** Optional. Defaults to {@code 60 s}. */
        public Builder sweepTimeout(Duration sweepTimeout) {
            this.sweepTimeout = sweepTimeout;
            return this;
        }

        /** Optional. Defaults to {@code 500} rows per delete batch. */
        public Builder purgeBatchSize(int purgeBatchSize) {
            this.purgeBatchSize = purgeBatchSize;
            return this;
        }

        /** Optional. Defaults to {@code 4} types purged concurrently. */
        public Builder purgeParallelism(int purgeParallelism) {
            this.purgeParallelism = purgeParallelism;
            return this;
        }

        /**
         * Builds the executor, scheduler and adapters. If scheduler construction fails,
         * the executor is closed before rethrowing.
         *
         * @throws NullPointerException if a required component is missing
         * @throws IllegalArgumentException if a numeric setting is out of range
         * @throws IllegalStateException if {@code build()} was already called
         */
        public RecordStorage build() {
            if (!built.compareAndSet(false, true)) {
                throw new IllegalStateException("build() already called on this builder");
            }
            Objects.requireNonNull(connectionProvider, "connectionProvider");
            Objects.requireNonNull(recordStore, "recordStore");
            Objects.requireNonNull(purger, "purger");
            RecordTypeRegistry types = registry != null ? registry : RecordTypeRegistry.oidcDefaults();
            Clock effectiveClock = clock != null ? clock : Clock.systemUTC();
            MetricsExporter effectiveMetrics = metrics != null ? metrics : MetricsExporter.NOOP;

            PurgeExecutor executor = PurgeExecutor.builder()
                    .connectionProvider(connectionProvider)
                    .recordStore(recordStore)
                    .purger(purger)
                    .registry(types)
                    .clock(effectiveClock)
                    .metrics(effectiveMetrics)
                    .batchSize(purgeBatchSize)
                    .parallelism(purgeParallelism)
                    .build();
            PurgeScheduler scheduler;
            try {
                scheduler = PurgeScheduler.builder()
                        .sweeper(executor)
                        .clock(effectiveClock)
                        .metrics(effectiveMetrics)
                        .threshold(purgeThreshold)
                        .cooldown(purgeCooldown)
                        .sweepTimeout(sweepTimeout)
                        .build();
            } catch (RuntimeException e) {
                executor.close();
                throw e;
            }

            Map<String, RecordAdapter> adapters = new LinkedHashMap<>();
            for (RecordType type : types.all()) {
                adapters.put(type.name(), new RecordAdapter(
                        type, connectionProvider, recordStore, scheduler, effectiveClock));
            }
            logger.log(Level.INFO, "Record storage ready: {0} types ({1} volatile), purge threshold {2}",
                    new Object[]{types.all().size(), types.expiringTypes().size(), purgeThreshold});
            return new RecordStorage(types, Map.copyOf(adapters), executor, scheduler, effectiveMetrics,
                    effectiveClock);
        }
    }
}
