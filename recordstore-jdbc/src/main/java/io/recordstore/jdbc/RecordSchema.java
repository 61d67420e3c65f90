package io.recordstore.jdbc;

import io.recordstore.jdbc.store.AbstractJdbcRecordStore;
import io.recordstore.model.RecordType;
import io.recordstore.model.RecordTypeRegistry;
import io.recordstore.spi.ConnectionProvider;
import io.recordstore.util.SqlExceptions;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Creates the tables backing every type of a registry. Idempotent.
 */
public final class RecordSchema {
    private static final Logger logger = Logger.getLogger(RecordSchema.class.getName());

    private RecordSchema() {}

    public static void create(ConnectionProvider connectionProvider, AbstractJdbcRecordStore store,
            RecordTypeRegistry registry) {
        Objects.requireNonNull(connectionProvider, "connectionProvider");
        Objects.requireNonNull(store, "store");
        Objects.requireNonNull(registry, "registry");
        try (Connection conn = connectionProvider.getConnection()) {
            conn.setAutoCommit(true);
            for (RecordType type : registry.all()) {
                for (String ddl : store.schemaStatements(type.namespace())) {
                    JdbcTemplate.update(conn, ddl);
                }
            }
        } catch (SQLException e) {
            throw SqlExceptions.translate("Failed to create record tables", e);
        }
        logger.log(Level.INFO, "Ensured {0} record tables for {1}",
                new Object[]{registry.all().size(), store.name()});
    }
}
