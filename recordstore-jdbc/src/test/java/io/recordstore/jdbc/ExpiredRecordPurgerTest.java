package io.recordstore.jdbc;

import io.recordstore.jdbc.purge.AbstractJdbcExpiredRecordPurger;
import io.recordstore.jdbc.purge.H2ExpiredRecordPurger;
import io.recordstore.jdbc.purge.JdbcExpiredRecordPurgers;
import io.recordstore.jdbc.purge.MySqlExpiredRecordPurger;
import io.recordstore.jdbc.purge.PostgresExpiredRecordPurger;
import io.recordstore.jdbc.store.H2RecordStore;
import io.recordstore.jdbc.store.JdbcRecordStores;
import io.recordstore.model.ListQuery;
import io.recordstore.model.StoredRecord;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ExpiredRecordPurgerTest {
    private static final String TABLE = "oidc_replay_detection";
    private static final Instant NOW = Instant.parse("2024-09-01T00:00:00Z");

    private final H2RecordStore store = new H2RecordStore();
    private final AbstractJdbcExpiredRecordPurger purger = new H2ExpiredRecordPurger();
    private JdbcDataSource dataSource;

    @BeforeEach
    void setup() throws Exception {
        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        try (Connection conn = dataSource.getConnection()) {
            for (String ddl : store.schemaStatements(TABLE)) {
                JdbcTemplate.update(conn, ddl);
            }
        }
    }

    @Test
    void deletesOldestExpirationFirstUpToLimit() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            insert(conn, "r-3", NOW.minusSeconds(10));
            insert(conn, "r-1", NOW.minusSeconds(30));
            insert(conn, "r-2", NOW.minusSeconds(20));
            insert(conn, "r-live", NOW.plusSeconds(10));
            insert(conn, "r-never", null);

            assertEquals(2, purger.purge(conn, TABLE, NOW, 2));
            assertEquals(List.of("r-3", "r-live", "r-never"), ids(conn));

            assertEquals(1, purger.purge(conn, TABLE, NOW, 2));
            assertEquals(0, purger.purge(conn, TABLE, NOW, 2));
            assertEquals(List.of("r-live", "r-never"), ids(conn));
        }
    }

    @Test
    void cutoffIsTruncatedToMillis() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            insert(conn, "r-1", NOW.plusMillis(1));

            assertEquals(0, purger.purge(conn, TABLE, NOW.plusNanos(999_999), 10));
            assertEquals(1, purger.purge(conn, TABLE, NOW.plusMillis(1), 10));
        }
    }

    @Test
    void rejectsUnsafeNamespace() throws Exception {
        try (Connection conn = dataSource.getConnection()) {
            assertThrows(IllegalArgumentException.class,
                    () -> purger.purge(conn, "x; DELETE FROM y", NOW, 10));
        }
    }

    @Test
    void purgerMatchesStoreDialect() {
        assertInstanceOf(H2ExpiredRecordPurger.class,
                JdbcExpiredRecordPurgers.forStore(JdbcRecordStores.get("h2")));
        assertInstanceOf(MySqlExpiredRecordPurger.class,
                JdbcExpiredRecordPurgers.forStore(JdbcRecordStores.get("mysql")));
        assertInstanceOf(PostgresExpiredRecordPurger.class,
                JdbcExpiredRecordPurgers.forName("PostgreSQL"));
        assertThrows(IllegalArgumentException.class, () -> JdbcExpiredRecordPurgers.forName("oracle"));
    }

    private void insert(Connection conn, String id, Instant expiresAt) {
        store.insert(conn, TABLE, new StoredRecord(id, Map.of("jti", id), NOW.minusSeconds(60), null, expiresAt));
    }

    private List<String> ids(Connection conn) {
        return store.list(conn, TABLE, ListQuery.all().orderBy(ListQuery.SortField.ID, ListQuery.Direction.ASC))
                .stream().map(StoredRecord::id).toList();
    }
}
