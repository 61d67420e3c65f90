package io.recordstore.jdbc.purge;

import io.recordstore.jdbc.store.AbstractJdbcRecordStore;

import java.util.Locale;
import java.util.Objects;

/**
 * Picks the purger matching a record store's database.
 */
public final class JdbcExpiredRecordPurgers {

    private JdbcExpiredRecordPurgers() {
    }

    public static AbstractJdbcExpiredRecordPurger forStore(AbstractJdbcRecordStore store) {
        Objects.requireNonNull(store, "store");
        return forName(store.name());
    }

    /**
     * @param name record store name, as returned by {@link AbstractJdbcRecordStore#name()}
     * @throws IllegalArgumentException if the database is not supported
     */
    public static AbstractJdbcExpiredRecordPurger forName(String name) {
        Objects.requireNonNull(name, "name");
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "h2" -> new H2ExpiredRecordPurger();
            case "mysql" -> new MySqlExpiredRecordPurger();
            case "postgresql" -> new PostgresExpiredRecordPurger();
            default -> throw new IllegalArgumentException(
                    "No expired record purger for database: " + name);
        };
    }
}
