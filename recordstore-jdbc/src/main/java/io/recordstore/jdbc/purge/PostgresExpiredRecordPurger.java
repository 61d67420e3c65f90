package io.recordstore.jdbc.purge;

/**
 * PostgreSQL purger.
 *
 * <p>Uses the default subquery-based purge from {@link AbstractJdbcExpiredRecordPurger}.
 */
public final class PostgresExpiredRecordPurger extends AbstractJdbcExpiredRecordPurger {

    public PostgresExpiredRecordPurger() {
        super();
    }
}
