package io.recordstore.jdbc.purge;

/**
 * H2 purger. Uses the default subquery-based {@code DELETE}
 * from {@link AbstractJdbcExpiredRecordPurger}.
 */
public final class H2ExpiredRecordPurger extends AbstractJdbcExpiredRecordPurger {

    public H2ExpiredRecordPurger() {
        super();
    }
}
