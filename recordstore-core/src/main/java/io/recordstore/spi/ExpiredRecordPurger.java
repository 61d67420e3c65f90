package io.recordstore.spi;

import java.sql.Connection;
import java.time.Instant;

/**
 * Deletes expired rows from the namespace of a volatile record type.
 *
 * <p>Rows with a null {@code expires_at} never qualify. All methods receive an
 * explicit {@link Connection}; implementations live in the {@code recordstore-jdbc} module.
 *
 * @see io.recordstore.jdbc.purge.AbstractJdbcExpiredRecordPurger
 */
public interface ExpiredRecordPurger {

    /**
     * Deletes rows with {@code expires_at <= now}, oldest expiration first.
     *
     * @param conn      the JDBC connection (caller controls transaction)
     * @param namespace the namespace to purge
     * @param now       the sweep instant
     * @param limit     maximum number of rows to delete in this batch
     * @return the number of rows actually deleted
     */
    int purge(Connection conn, String namespace, Instant now, int limit);
}
