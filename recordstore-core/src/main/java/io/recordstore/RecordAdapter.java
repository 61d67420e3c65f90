package io.recordstore;

import io.recordstore.model.ListQuery;
import io.recordstore.model.RecordType;
import io.recordstore.model.StoredRecord;
import io.recordstore.purge.PurgeScheduler;
import io.recordstore.spi.ConnectionProvider;
import io.recordstore.spi.RecordStore;
import io.recordstore.util.SqlExceptions;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Storage operations for one logical record type, as used by an OpenID Connect provider.
 *
 * <p>Manages connection and transaction lifecycle internally using a
 * {@link ConnectionProvider}. Every successful {@code upsert} is reported to the shared
 * {@link PurgeScheduler}; reads never are. Visibility is enforced at read time: a record
 * whose expiration instant has passed is never returned by a {@code find*} method, even
 * if its row has not been purged yet.
 *
 * <p>Obtain instances from {@link RecordStorage#adapter(String)}.
 */
public final class RecordAdapter {
    private static final Logger logger = Logger.getLogger(RecordAdapter.class.getName());

    /** Payload field set by {@link #consume(String)}. */
    public static final String CONSUMED = "consumed";

    /** Payload field used to tie tokens to an authorization grant. */
    public static final String GRANT_ID = "grantId";

    /** Payload field holding the session uid. */
    public static final String UID = "uid";

    /** Payload field holding the device flow user code. */
    public static final String USER_CODE = "userCode";

    // Range a SQL TIMESTAMP column can hold.
    private static final Instant EARLIEST_EXPIRATION = Instant.parse("0001-01-01T00:00:00Z");
    private static final Instant LATEST_EXPIRATION = Instant.parse("9999-12-31T23:59:59Z");

    private final RecordType type;
    private final ConnectionProvider connectionProvider;
    private final RecordStore store;
    private final PurgeScheduler purgeScheduler;
    private final Clock clock;

    RecordAdapter(RecordType type, ConnectionProvider connectionProvider, RecordStore store,
            PurgeScheduler purgeScheduler, Clock clock) {
        this.type = Objects.requireNonNull(type, "type");
        this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
        this.store = Objects.requireNonNull(store, "store");
        this.purgeScheduler = Objects.requireNonNull(purgeScheduler, "purgeScheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public RecordType type() {
        return type;
    }

    /**
     * Inserts or replaces a record without setting an expiration.
     *
     * <p>On replace, an expiration set by an earlier write is kept.
     */
    public void upsert(String id, Map<String, Object> data) {
        write(id, data, null);
    }

    /**
     * Inserts or replaces a record that expires {@code ttlSeconds} from now.
     *
     * <p>A zero or negative TTL stores a record that is already expired: it is never
     * returned by a lookup and is removed by the next sweep.
     *
     * @throws IllegalArgumentException if the expiration would fall outside years 1 to 9999
     */
    public void upsert(String id, Map<String, Object> data, long ttlSeconds) {
        write(id, data, ttlSeconds);
    }

    private void write(String id, Map<String, Object> data, Long ttlSeconds) {
        requireId(id);
        Objects.requireNonNull(data, "data");
        Instant now = clock.instant();
        Instant expiresAt = ttlSeconds == null ? null : expiration(now, ttlSeconds);
        inTransaction("upsert", conn -> {
            int updated = store.update(conn, type.namespace(), id, data, now, expiresAt);
            if (updated == 0) {
                store.insert(conn, type.namespace(), new StoredRecord(id, data, now, null, expiresAt));
            }
            return null;
        });
        purgeScheduler.recordWrite();
    }

    private static Instant expiration(Instant now, long ttlSeconds) {
        long seconds = now.getEpochSecond();
        if (ttlSeconds > LATEST_EXPIRATION.getEpochSecond() - seconds
                || ttlSeconds < EARLIEST_EXPIRATION.getEpochSecond() - seconds) {
            throw new IllegalArgumentException("ttlSeconds out of range: " + ttlSeconds);
        }
        return now.plusSeconds(ttlSeconds);
    }

    /**
     * Returns the payload of a live record.
     */
    public Optional<Map<String, Object>> find(String id) {
        requireId(id);
        Instant now = clock.instant();
        return read("find", conn -> store.findLive(conn, type.namespace(), id, now))
                .map(StoredRecord::data);
    }

    /**
     * Returns the payload of the live record whose data contains {@code {field: value}}.
     *
     * <p>If several live records match, the most recently written wins
     * ({@code updated_at}, falling back to {@code created_at}), then the lowest id.
     */
    public Optional<Map<String, Object>> findBySecondaryField(String field, Object value) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        Instant now = clock.instant();
        return read("findBySecondaryField",
                conn -> store.findLiveByField(conn, type.namespace(), field, value, now))
                .map(StoredRecord::data);
    }

    /** Looks up a session by its {@value #UID} field. */
    public Optional<Map<String, Object>> findByUid(String uid) {
        return findBySecondaryField(UID, uid);
    }

    /** Looks up a device code by its {@value #USER_CODE} field. */
    public Optional<Map<String, Object>> findByUserCode(String userCode) {
        return findBySecondaryField(USER_CODE, userCode);
    }

    /**
     * Marks a record consumed by setting {@value #CONSUMED} to the current instant.
     *
     * <p>The record is read regardless of expiration and stays readable through
     * {@link #find(String)} until it expires.
     *
     * @throws RecordNotFoundException if no row exists for {@code id}
     */
    public void consume(String id) {
        requireId(id);
        Instant now = clock.instant();
        inTransaction("consume", conn -> {
            StoredRecord record = store.find(conn, type.namespace(), id)
                    .orElseThrow(() -> new RecordNotFoundException(type.name(), id));
            Map<String, Object> data = new LinkedHashMap<>(record.data());
            data.put(CONSUMED, now.toString());
            store.updateData(conn, type.namespace(), id, data);
            return null;
        });
    }

    /**
     * Deletes a record. Deleting an unknown id is not an error.
     */
    public void destroy(String id) {
        requireId(id);
        int deleted = inAutoCommit("destroy", conn -> store.delete(conn, type.namespace(), id));
        logger.log(Level.FINE, "Destroyed {0} {1} ({2} row)", new Object[]{type.name(), id, deleted});
    }

    /**
     * Deletes every record whose data contains {@code {field: value}}, expired or not.
     *
     * @return the number of records deleted
     */
    public int deleteBySecondaryField(String field, Object value) {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(value, "value");
        return inAutoCommit("deleteBySecondaryField",
                conn -> store.deleteByField(conn, type.namespace(), field, value));
    }

    /**
     * Deletes every record tied to an authorization grant.
     *
     * @return the number of records deleted
     */
    public int revokeByGrantId(String grantId) {
        int deleted = deleteBySecondaryField(GRANT_ID, grantId);
        logger.log(Level.FINE, "Revoked {0} {1} record(s) of grant {2}",
                new Object[]{deleted, type.name(), grantId});
        return deleted;
    }

    /**
     * Lists rows for administration. Expired rows are included.
     */
    public List<StoredRecord> list(ListQuery query) {
        Objects.requireNonNull(query, "query");
        return read("list", conn -> store.list(conn, type.namespace(), query));
    }

    /**
     * Deletes every record of this type.
     *
     * @return the number of records deleted
     */
    public int destroyAll() {
        int deleted = inAutoCommit("destroyAll", conn -> store.deleteAll(conn, type.namespace()));
        logger.log(Level.INFO, "Destroyed all {0} records ({1} rows)", new Object[]{type.name(), deleted});
        return deleted;
    }

    @FunctionalInterface
    private interface ConnectionCallback<T> {
        T apply(Connection conn);
    }

    private <T> T read(String operation, ConnectionCallback<T> callback) {
        try (Connection conn = connectionProvider.getConnection()) {
            return callback.apply(conn);
        } catch (SQLException e) {
            throw SqlExceptions.translate(failure(operation), e);
        }
    }

    private <T> T inAutoCommit(String operation, ConnectionCallback<T> callback) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            return callback.apply(conn);
        } catch (SQLException e) {
            throw SqlExceptions.translate(failure(operation), e);
        }
    }

    private <T> T inTransaction(String operation, ConnectionCallback<T> callback) {
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = callback.apply(conn);
                conn.commit();
                return result;
            } catch (RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            } catch (SQLException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw SqlExceptions.translate(failure(operation), e);
        }
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    private String failure(String operation) {
        return "Failed to " + operation + " " + type.name();
    }

    private static void requireId(String id) {
        Objects.requireNonNull(id, "id");
        if (id.isEmpty()) {
            throw new IllegalArgumentException("id must not be empty");
        }
    }
}
