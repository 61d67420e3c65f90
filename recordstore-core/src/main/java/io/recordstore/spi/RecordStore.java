package io.recordstore.spi;

import io.recordstore.model.ListQuery;
import io.recordstore.model.StoredRecord;
import io.recordstore.model.TypeStats;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistence operations on the namespace backing one record type.
 *
 * <p>All methods receive an explicit {@link Connection} so the caller controls
 * transaction boundaries, and the namespace of the target type. Lookups whose
 * name starts with {@code findLive} apply the visibility rule: a row is returned
 * only if {@code expires_at} is null or strictly after {@code now}.
 *
 * <p>Implementations live in the {@code recordstore-jdbc} module.
 *
 * @see io.recordstore.jdbc.store.AbstractJdbcRecordStore
 */
public interface RecordStore {

    /**
     * Reads a row by id, ignoring expiration.
     */
    Optional<StoredRecord> find(Connection conn, String namespace, String id);

    /**
     * Reads a row by id if it has not expired at {@code now}.
     */
    Optional<StoredRecord> findLive(Connection conn, String namespace, String id, Instant now);

    /**
     * Reads the live row whose data contains {@code {field: value}}.
     *
     * <p>When several rows match, returns the one with the most recent
     * {@code COALESCE(updated_at, created_at)}, then the lowest id.
     */
    Optional<StoredRecord> findLiveByField(Connection conn, String namespace,
            String field, Object value, Instant now);

    /**
     * Inserts a new row. {@code record.updatedAt()} is ignored.
     *
     * @throws io.recordstore.RecordConflictException if the id already exists
     */
    void insert(Connection conn, String namespace, StoredRecord record);

    /**
     * Replaces the data of an existing row and stamps {@code updated_at}.
     *
     * @param expiresAt new expiration instant, or {@code null} to keep the current one
     * @return the number of rows updated (0 if the id does not exist)
     */
    int update(Connection conn, String namespace, String id, Map<String, Object> data,
            Instant updatedAt, Instant expiresAt);

    /**
     * Replaces only the data of an existing row, leaving timestamps untouched.
     *
     * @return the number of rows updated
     */
    int updateData(Connection conn, String namespace, String id, Map<String, Object> data);

    /**
     * Deletes a row by id.
     *
     * @return the number of rows deleted (0 or 1)
     */
    int delete(Connection conn, String namespace, String id);

    /**
     * Deletes every row whose data contains {@code {field: value}}, regardless of expiration.
     *
     * @return the number of rows deleted
     */
    int deleteByField(Connection conn, String namespace, String field, Object value);

    /**
     * Deletes every row in the namespace.
     *
     * @return the number of rows deleted
     */
    int deleteAll(Connection conn, String namespace);

    /**
     * Lists rows without expiration filtering.
     */
    List<StoredRecord> list(Connection conn, String namespace, ListQuery query);

    /**
     * Counts rows still live at {@code now} with their creation time range.
     */
    TypeStats stats(Connection conn, String typeName, String namespace, Instant now);
}
