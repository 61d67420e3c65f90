package io.recordstore.jdbc;

import io.recordstore.RecordAdapter;
import io.recordstore.RecordStorage;
import io.recordstore.jdbc.purge.JdbcExpiredRecordPurgers;
import io.recordstore.jdbc.store.H2RecordStore;
import io.recordstore.model.ListQuery;
import io.recordstore.model.RecordTypeRegistry;
import io.recordstore.model.StoredRecord;
import io.recordstore.purge.SweepResult;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.TimeZone;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs in a zone whose clocks fall back on 2024-11-03: 01:00 to 02:00 local time
 * happens twice, 05:00Z to 07:00Z.
 */
class DaylightSavingTimeTest {
    private static final Instant FIRST_ONE_THIRTY = Instant.parse("2024-11-03T05:30:00Z");

    private TimeZone previousDefault;
    private JdbcDataSource dataSource;
    private MutableClock clock;
    private RecordStorage storage;

    @BeforeEach
    void setup() {
        previousDefault = TimeZone.getDefault();
        TimeZone.setDefault(TimeZone.getTimeZone("America/New_York"));

        dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        DataSourceConnectionProvider connectionProvider = new DataSourceConnectionProvider(dataSource);
        H2RecordStore store = new H2RecordStore();
        RecordSchema.create(connectionProvider, store, RecordTypeRegistry.oidcDefaults());

        clock = new MutableClock(FIRST_ONE_THIRTY);
        storage = RecordStorage.builder()
                .connectionProvider(connectionProvider)
                .recordStore(store)
                .purger(JdbcExpiredRecordPurgers.forStore(store))
                .clock(clock)
                .build();
    }

    @AfterEach
    void teardown() {
        storage.close();
        TimeZone.setDefault(previousDefault);
    }

    @Test
    void recordExpiresDuringRepeatedHour() {
        RecordAdapter tokens = storage.adapter("AccessToken");
        tokens.upsert("at-1", Map.of("k", "v"), 600);

        // 01:35 EST, earlier on the wall clock than the 01:40 EDT expiration
        clock.advance(Duration.ofMinutes(65));

        assertTrue(tokens.find("at-1").isEmpty());
        SweepResult result = storage.sweepNow();
        assertEquals(1, result.deleted().get("AccessToken"));
    }

    @Test
    void instantsRoundTripAcrossFallBack() {
        RecordAdapter sessions = storage.adapter("Session");
        sessions.upsert("s-1", Map.of("uid", "u1"), 7200);
        clock.advance(Duration.ofMinutes(61));
        sessions.upsert("s-1", Map.of("uid", "u1"));

        StoredRecord row = sessions.list(ListQuery.all()).get(0);
        assertEquals(FIRST_ONE_THIRTY, row.createdAt());
        assertEquals(FIRST_ONE_THIRTY.plusSeconds(61 * 60), row.updatedAt());
        assertEquals(FIRST_ONE_THIRTY.plusSeconds(7200), row.expiresAt());
        assertTrue(sessions.findByUid("u1").isPresent());
    }

    @Test
    void columnsHoldUtcWallClock() throws Exception {
        storage.adapter("Grant").upsert("g-1", Map.of(), 600);

        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery("SELECT created_at, expires_at FROM oidc_grant")) {
            assertTrue(rs.next());
            assertEquals(LocalDateTime.of(2024, 11, 3, 5, 30), rs.getObject(1, LocalDateTime.class));
            assertEquals(LocalDateTime.of(2024, 11, 3, 5, 40), rs.getObject(2, LocalDateTime.class));
        }
    }
}
