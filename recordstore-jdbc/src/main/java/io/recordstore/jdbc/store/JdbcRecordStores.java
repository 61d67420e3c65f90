package io.recordstore.jdbc.store;

import io.recordstore.util.JsonCodec;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry for JDBC record stores with auto-detection support.
 *
 * <p>Record stores are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/io.recordstore.jdbc.store.AbstractJdbcRecordStore}.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * // Auto-detect from DataSource
 * AbstractJdbcRecordStore store = JdbcRecordStores.detect(dataSource);
 *
 * // Auto-detect from JDBC URL
 * AbstractJdbcRecordStore store = JdbcRecordStores.detect("jdbc:mysql://localhost/oidc");
 *
 * // Get by name
 * AbstractJdbcRecordStore store = JdbcRecordStores.get("postgresql");
 * }</pre>
 */
public final class JdbcRecordStores {

    private static final List<AbstractJdbcRecordStore> STORES;
    private static final Map<String, AbstractJdbcRecordStore> BY_NAME = new ConcurrentHashMap<>();

    static {
        STORES = ServiceLoader.load(AbstractJdbcRecordStore.class)
                .stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (AbstractJdbcRecordStore store : STORES) {
            BY_NAME.put(store.name().toLowerCase(Locale.ROOT), store);
        }
    }

    private JdbcRecordStores() {
    }

    /**
     * Returns all registered record stores.
     */
    public static List<AbstractJdbcRecordStore> all() {
        return STORES;
    }

    /**
     * Gets a record store by name.
     *
     * @param name record store name (case-insensitive)
     * @throws IllegalArgumentException if no record store is registered under that name
     */
    public static AbstractJdbcRecordStore get(String name) {
        Objects.requireNonNull(name, "name");
        AbstractJdbcRecordStore store = BY_NAME.get(name.toLowerCase(Locale.ROOT));
        if (store == null) {
            throw new IllegalArgumentException("Unknown record store: " + name +
                    ". Available: " + BY_NAME.keySet());
        }
        return store;
    }

    /**
     * Auto-detects the record store from a DataSource.
     *
     * @throws IllegalStateException if the connection metadata cannot be read
     * @throws IllegalArgumentException if no record store matches the URL
     */
    public static AbstractJdbcRecordStore detect(DataSource dataSource) {
        Objects.requireNonNull(dataSource, "dataSource");
        try (Connection conn = dataSource.getConnection()) {
            String url = conn.getMetaData().getURL();
            return detect(url);
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to detect record store from DataSource", e);
        }
    }

    /**
     * Auto-detects the record store from a JDBC URL.
     *
     * @throws IllegalArgumentException if no record store matches the URL
     */
    public static AbstractJdbcRecordStore detect(String jdbcUrl) {
        if (jdbcUrl == null || jdbcUrl.isEmpty()) {
            throw new IllegalArgumentException("JDBC URL cannot be null or empty");
        }

        String url = jdbcUrl.toLowerCase(Locale.ROOT);
        for (AbstractJdbcRecordStore store : STORES) {
            for (String prefix : store.jdbcUrlPrefixes()) {
                if (url.startsWith(prefix.toLowerCase(Locale.ROOT))) {
                    return store;
                }
            }
        }

        throw new IllegalArgumentException("No record store found for JDBC URL: " + jdbcUrl +
                ". Supported prefixes: " + allPrefixes());
    }

    /**
     * Auto-detects the record store from a DataSource and configures it with a custom
     * {@link JsonCodec}.
     */
    public static AbstractJdbcRecordStore detect(DataSource dataSource, JsonCodec jsonCodec) {
        Objects.requireNonNull(jsonCodec, "jsonCodec");
        return detect(dataSource).withJsonCodec(jsonCodec);
    }

    private static List<String> allPrefixes() {
        return STORES.stream()
                .flatMap(s -> s.jdbcUrlPrefixes().stream())
                .toList();
    }
}
