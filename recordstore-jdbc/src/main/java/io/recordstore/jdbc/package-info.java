/**
 * JDBC infrastructure shared across sub-packages.
 *
 * <p>{@link io.recordstore.jdbc.JdbcTemplate} provides lightweight JDBC helpers and is the
 * one place SQL errors are translated. {@link io.recordstore.jdbc.DataSourceConnectionProvider}
 * adapts a {@link javax.sql.DataSource} to the {@link io.recordstore.spi.ConnectionProvider}
 * SPI. {@link io.recordstore.jdbc.RecordSchema} creates the per-type tables.
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code io.recordstore.jdbc.store}: {@link io.recordstore.spi.RecordStore} implementations</li>
 *   <li>{@code io.recordstore.jdbc.purge}: {@link io.recordstore.spi.ExpiredRecordPurger}
 *       implementations</li>
 * </ul>
 */
package io.recordstore.jdbc;
