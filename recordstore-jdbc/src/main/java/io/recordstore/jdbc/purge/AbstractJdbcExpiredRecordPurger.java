package io.recordstore.jdbc.purge;

import io.recordstore.jdbc.JdbcTemplate;
import io.recordstore.jdbc.TableNames;
import io.recordstore.spi.ExpiredRecordPurger;

import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * Base JDBC purger that deletes rows whose expiration instant has been reached.
 *
 * <p>Rows with a null {@code expires_at} never match. Default SQL uses a subquery-based
 * {@code DELETE} that works for H2 and PostgreSQL. MySQL overrides with
 * {@code DELETE ... ORDER BY ... LIMIT}.
 *
 * @see H2ExpiredRecordPurger
 * @see MySqlExpiredRecordPurger
 * @see PostgresExpiredRecordPurger
 */
public abstract class AbstractJdbcExpiredRecordPurger implements ExpiredRecordPurger {

    protected AbstractJdbcExpiredRecordPurger() {
    }

    @Override
    public int purge(Connection conn, String namespace, Instant now, int limit) {
        String table = TableNames.validate(namespace);
        String sql = "DELETE FROM " + table + " WHERE id IN (" +
                "SELECT id FROM " + table +
                " WHERE expires_at <= ?" +
                " ORDER BY expires_at LIMIT ?)";
        return JdbcTemplate.update(conn, sql, cutoff(now), limit);
    }

    /** Millisecond cutoff, bound in UTC by {@link JdbcTemplate} like the stored values. */
    protected static Timestamp cutoff(Instant now) {
        return Timestamp.from(now.truncatedTo(ChronoUnit.MILLIS));
    }
}
