/**
 * JDBC-based {@link io.recordstore.spi.RecordStore} implementations.
 *
 * <p>{@link io.recordstore.jdbc.store.AbstractJdbcRecordStore} provides shared SQL and row
 * mapping; subclasses supply column types and JSON containment: H2 ({@code LIKE} prefilter
 * verified in Java), MySQL ({@code JSON_CONTAINS}) and PostgreSQL ({@code jsonb @>}).
 *
 * @see io.recordstore.jdbc.store.AbstractJdbcRecordStore
 * @see io.recordstore.jdbc.store.H2RecordStore
 * @see io.recordstore.jdbc.store.MySqlRecordStore
 * @see io.recordstore.jdbc.store.PostgresRecordStore
 * @see io.recordstore.jdbc.store.JdbcRecordStores
 */
package io.recordstore.jdbc.store;
