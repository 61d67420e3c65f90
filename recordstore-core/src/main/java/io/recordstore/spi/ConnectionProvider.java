package io.recordstore.spi;

import java.sql.Connection;
import java.sql.SQLException;

/**
 * Provides JDBC connections to the record store and the purge executor.
 *
 * <p>Callers are responsible for closing the returned connection.
 *
 * @see io.recordstore.jdbc.DataSourceConnectionProvider
 */
@FunctionalInterface
public interface ConnectionProvider {

    /**
     * Obtains a new JDBC connection.
     *
     * @return an open connection; the caller must close it
     * @throws SQLException if a connection cannot be obtained
     */
    Connection getConnection() throws SQLException;
}
