package io.recordstore.jdbc;

import io.recordstore.PartialSweepFailureException;
import io.recordstore.RecordStoreException;
import io.recordstore.StorageUnavailableException;
import io.recordstore.jdbc.purge.H2ExpiredRecordPurger;
import io.recordstore.jdbc.store.H2RecordStore;
import io.recordstore.model.ListQuery;
import io.recordstore.model.RecordTypeRegistry;
import io.recordstore.model.StoredRecord;
import io.recordstore.model.TypeStats;
import io.recordstore.purge.PurgeExecutor;
import io.recordstore.purge.SweepResult;
import io.recordstore.spi.ConnectionProvider;
import io.recordstore.spi.ExpiredRecordPurger;
import io.recordstore.spi.MetricsExporter;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class PurgeExecutorTest {
    private static final Instant START = Instant.parse("2024-06-15T08:00:00Z");

    private final MutableClock clock = new MutableClock(START);
    private final H2RecordStore store = new H2RecordStore();
    private final RecordTypeRegistry registry = RecordTypeRegistry.builder()
            .expiring("Session")
            .expiring("AccessToken")
            .expiring("Grant")
            .durable("Client")
            .build();
    private final RecordingMetrics metrics = new RecordingMetrics();
    private DataSourceConnectionProvider connectionProvider;
    private PurgeExecutor executor;

    @BeforeEach
    void setup() {
        JdbcDataSource dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        connectionProvider = new DataSourceConnectionProvider(dataSource);
        RecordSchema.create(connectionProvider, store, registry);
        executor = executor(new H2ExpiredRecordPurger());
    }

    @AfterEach
    void teardown() {
        executor.close();
    }

    private PurgeExecutor executor(ExpiredRecordPurger purger) {
        return executor(connectionProvider, purger);
    }

    private PurgeExecutor executor(ConnectionProvider connectionProvider, ExpiredRecordPurger purger) {
        return PurgeExecutor.builder()
                .connectionProvider(connectionProvider)
                .recordStore(store)
                .purger(purger)
                .registry(registry)
                .clock(clock)
                .metrics(metrics)
                .build();
    }

    @Test
    void sweepDeletesExpiredRowsInclusiveOfCutoff() throws Exception {
        insert("oidc_session", "s-past", START.minusSeconds(1));
        insert("oidc_session", "s-now", START);
        insert("oidc_session", "s-future", START.plusMillis(1));
        insert("oidc_session", "s-forever", null);

        SweepResult result = executor.sweep(START);

        assertTrue(result.isComplete());
        assertEquals(START, result.cutoff());
        assertEquals(Map.of("Session", 2, "AccessToken", 0, "Grant", 0), result.deleted());
        assertEquals(List.of("s-forever", "s-future"), ids("oidc_session"));
        assertEquals(2, metrics.purged.get("Session"));
    }

    @Test
    void durableTypesAreNeverSwept() throws Exception {
        insert("oidc_client", "c-1", START.minusSeconds(3600));

        SweepResult result = executor.sweep(START);

        assertFalse(result.deleted().containsKey("Client"));
        assertEquals(List.of("c-1"), ids("oidc_client"));
    }

    @Test
    void sweepLoopsOverBatches() throws Exception {
        try (Connection conn = connectionProvider.getConnection()) {
            for (int i = 0; i < 1203; i++) {
                store.insert(conn, "oidc_grant", new StoredRecord(String.format("g-%05d", i),
                        Map.of("n", i), START.minusSeconds(60), null, START.minusSeconds(i % 7)));
            }
        }
        insert("oidc_grant", "g-live", START.plusSeconds(60));

        SweepResult result = executor.sweep(START);

        assertEquals(1203, result.deleted().get("Grant"));
        assertEquals(List.of("g-live"), ids("oidc_grant"));
    }

    @Test
    void failingTypeDoesNotStopOthers() throws Exception {
        insert("oidc_session", "s-1", START.minusSeconds(1));
        insert("oidc_access_token", "at-1", START.minusSeconds(1));
        insert("oidc_grant", "g-1", START.minusSeconds(1));
        H2ExpiredRecordPurger delegate = new H2ExpiredRecordPurger();
        ExpiredRecordPurger flaky = (conn, namespace, now, limit) -> {
            if (namespace.equals("oidc_access_token")) {
                throw new IllegalStateException("lock wait timeout");
            }
            return delegate.purge(conn, namespace, now, limit);
        };

        try (PurgeExecutor flakyExecutor = executor(flaky)) {
            SweepResult result = flakyExecutor.sweep(START);

            assertFalse(result.isComplete());
            assertEquals(Map.of("Session", 1, "Grant", 1), result.deleted());
            assertEquals(List.of("AccessToken"), List.copyOf(result.failures().keySet()));
            assertInstanceOf(IllegalStateException.class, result.failures().get("AccessToken"));
            PartialSweepFailureException failure = result.failure().orElseThrow();
            assertEquals(List.of("AccessToken"), failure.failedTypes());
        }
        assertEquals(1, metrics.failures.get("AccessToken"));
        assertEquals(List.of("at-1"), ids("oidc_access_token"));
        assertTrue(ids("oidc_session").isEmpty());
    }

    @Test
    void unreachableDatabaseIsReportedAsUnavailable() {
        ConnectionProvider refused = () -> {
            throw new SQLException("Connection refused", "08001");
        };

        try (PurgeExecutor offline = executor(refused, new H2ExpiredRecordPurger())) {
            SweepResult result = offline.sweep(START);

            assertEquals(List.of("Session", "AccessToken", "Grant"),
                    List.copyOf(result.failures().keySet()));
            result.failures().values().forEach(cause ->
                    assertInstanceOf(StorageUnavailableException.class, cause));
        }
    }

    @Test
    void rejectedCredentialsAreNotReportedAsUnavailable() {
        ConnectionProvider rejected = () -> {
            throw new SQLException("Access denied for user", "28000");
        };

        try (PurgeExecutor denied = executor(rejected, new H2ExpiredRecordPurger())) {
            Throwable cause = denied.sweep(START).failures().get("Session");
            assertEquals(RecordStoreException.class, cause.getClass());
            assertTrue(cause.getMessage().contains("Session"));

            PartialSweepFailureException wipe = assertThrows(PartialSweepFailureException.class,
                    denied::wipeAllVolatile);
            assertEquals(List.of("Session", "AccessToken", "Grant"), wipe.failedTypes());
            for (Throwable suppressed : wipe.getSuppressed()) {
                assertEquals(RecordStoreException.class, suppressed.getClass());
            }
        }
    }

    @Test
    void missingTableIsReportedAsFailure() throws Exception {
        insert("oidc_session", "s-1", START.minusSeconds(1));
        dropTable("oidc_grant");

        SweepResult result = executor.sweep(START);

        assertEquals(List.of("Grant"), result.failure().orElseThrow().failedTypes());
        assertEquals(1, result.deleted().get("Session"));
    }

    @Test
    void statsCountLiveRowsPerVolatileType() throws Exception {
        insert("oidc_session", "s-1", START.plusSeconds(60), START.minusSeconds(30));
        insert("oidc_session", "s-2", null, START.minusSeconds(10));
        insert("oidc_session", "s-expired", START.minusSeconds(1), START.minusSeconds(100));
        insert("oidc_client", "c-1", null, START);

        List<TypeStats> stats = executor.statsByType();

        assertEquals(List.of("Session", "AccessToken", "Grant"),
                stats.stream().map(TypeStats::type).toList());
        TypeStats sessions = stats.get(0);
        assertEquals(2, sessions.liveRowCount());
        assertEquals(START.minusSeconds(30), sessions.oldestCreatedAt());
        assertEquals(START.minusSeconds(10), sessions.newestCreatedAt());
        TypeStats tokens = stats.get(1);
        assertEquals(0, tokens.liveRowCount());
        assertNull(tokens.oldestCreatedAt());
        assertNull(tokens.newestCreatedAt());
    }

    @Test
    void statsFollowClock() throws Exception {
        insert("oidc_session", "s-1", START.plusSeconds(60));

        assertEquals(1, executor.statsByType().get(0).liveRowCount());
        clock.advance(Duration.ofSeconds(60));
        assertEquals(0, executor.statsByType().get(0).liveRowCount());
    }

    @Test
    void wipeAllVolatileLeavesClientsUntouched() throws Exception {
        insert("oidc_session", "s-1", START.plusSeconds(3600));
        insert("oidc_session", "s-2", null);
        insert("oidc_grant", "g-1", START.minusSeconds(1));
        insert("oidc_client", "c-1", null);

        Map<String, Integer> wiped = executor.wipeAllVolatile();

        assertEquals(Map.of("Session", 2, "AccessToken", 0, "Grant", 1), wiped);
        assertTrue(ids("oidc_session").isEmpty());
        assertTrue(ids("oidc_grant").isEmpty());
        assertEquals(List.of("c-1"), ids("oidc_client"));
    }

    @Test
    void wipeReportsFailedTypesAfterWipingTheRest() throws Exception {
        insert("oidc_session", "s-1", null);
        dropTable("oidc_access_token");

        PartialSweepFailureException ex = assertThrows(PartialSweepFailureException.class,
                () -> executor.wipeAllVolatile());

        assertEquals(List.of("AccessToken"), ex.failedTypes());
        assertEquals(1, ex.getSuppressed().length);
        assertTrue(ids("oidc_session").isEmpty());
    }

    @Test
    void builderValidation() {
        assertThrows(NullPointerException.class, () -> PurgeExecutor.builder().build());
        assertThrows(IllegalArgumentException.class, () -> PurgeExecutor.builder()
                .connectionProvider(connectionProvider)
                .recordStore(store)
                .purger(new H2ExpiredRecordPurger())
                .registry(registry)
                .batchSize(0)
                .build());
        assertThrows(IllegalArgumentException.class, () -> PurgeExecutor.builder()
                .connectionProvider(connectionProvider)
                .recordStore(store)
                .purger(new H2ExpiredRecordPurger())
                .registry(registry)
                .parallelism(0)
                .build());
    }

    private void insert(String namespace, String id, Instant expiresAt) throws SQLException {
        insert(namespace, id, expiresAt, START.minusSeconds(3600));
    }

    private void insert(String namespace, String id, Instant expiresAt, Instant createdAt) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            store.insert(conn, namespace, new StoredRecord(id, Map.of("id", id), createdAt, null, expiresAt));
        }
    }

    private List<String> ids(String namespace) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            return store.list(conn, namespace,
                            ListQuery.all().orderBy(ListQuery.SortField.ID, ListQuery.Direction.ASC))
                    .stream().map(StoredRecord::id).toList();
        }
    }

    private void dropTable(String table) throws SQLException {
        try (Connection conn = connectionProvider.getConnection()) {
            JdbcTemplate.update(conn, "DROP TABLE " + table);
        }
    }

    private static final class RecordingMetrics implements MetricsExporter {
        final Map<String, Integer> purged = new ConcurrentHashMap<>();
        final Map<String, Integer> failures = new ConcurrentHashMap<>();

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
            purged.merge(typeName, rows, Integer::sum);
        }

        @Override
        public void incrementPurgeFailures(String typeName) {
            failures.merge(typeName, 1, Integer::sum);
        }
    }
}
