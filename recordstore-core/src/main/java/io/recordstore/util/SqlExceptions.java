package io.recordstore.util;

import io.recordstore.RecordConflictException;
import io.recordstore.RecordStoreException;
import io.recordstore.StorageUnavailableException;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;

/**
 * Translates {@link SQLException}s into the unchecked {@link RecordStoreException} hierarchy.
 *
 * <ul>
 *   <li>SQLState class {@code 08}, connection and timeout exceptions:
 *       {@link StorageUnavailableException}</li>
 *   <li>SQLState class {@code 23} and integrity violations: {@link RecordConflictException}</li>
 *   <li>anything else: {@link RecordStoreException}</li>
 * </ul>
 */
public final class SqlExceptions {

    private SqlExceptions() {}

    public static RecordStoreException translate(String message, SQLException e) {
        String state = e.getSQLState();
        if (e instanceof SQLTransientConnectionException || e instanceof SQLTimeoutException
                || (state != null && state.startsWith("08"))) {
            return new StorageUnavailableException(message, e);
        }
        if (e instanceof SQLIntegrityConstraintViolationException
                || (state != null && state.startsWith("23"))) {
            return new RecordConflictException(message, e);
        }
        return new RecordStoreException(message, e);
    }
}
