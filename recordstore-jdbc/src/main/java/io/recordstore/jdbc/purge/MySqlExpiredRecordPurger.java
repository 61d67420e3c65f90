package io.recordstore.jdbc.purge;

import io.recordstore.jdbc.JdbcTemplate;
import io.recordstore.jdbc.TableNames;

import java.sql.Connection;
import java.time.Instant;

/**
 * MySQL purger. Also compatible with TiDB.
 *
 * <p>Overrides with {@code DELETE ... ORDER BY ... LIMIT}, which MySQL supports
 * natively and avoids the self-referencing subquery.
 */
public final class MySqlExpiredRecordPurger extends AbstractJdbcExpiredRecordPurger {

    public MySqlExpiredRecordPurger() {
        super();
    }

    @Override
    public int purge(Connection conn, String namespace, Instant now, int limit) {
        String sql = "DELETE FROM " + TableNames.validate(namespace) +
                " WHERE expires_at <= ?" +
                " ORDER BY expires_at LIMIT ?";
        return JdbcTemplate.update(conn, sql, cutoff(now), limit);
    }
}
