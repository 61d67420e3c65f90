/**
 * JDBC-based {@link io.recordstore.spi.ExpiredRecordPurger} implementations.
 *
 * <p>{@link io.recordstore.jdbc.purge.AbstractJdbcExpiredRecordPurger} deletes rows with
 * {@code expires_at <= now}, oldest expiration first, in bounded batches. Subclasses: H2,
 * MySQL ({@code DELETE...ORDER BY...LIMIT}), PostgreSQL.
 *
 * @see io.recordstore.jdbc.purge.JdbcExpiredRecordPurgers
 */
package io.recordstore.jdbc.purge;
