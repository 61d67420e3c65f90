package io.recordstore.jdbc.store;

import io.recordstore.util.JsonCodec;

import java.util.List;

/**
 * MySQL record store. Also compatible with TiDB.
 *
 * <p>Stores payloads in a {@code JSON} column, matches secondary fields with
 * {@code JSON_CONTAINS} and keeps timestamps as {@code DATETIME(3)}. MySQL has no
 * {@code CREATE INDEX IF NOT EXISTS}, so the expiration index is declared inline.
 *
 * <p>{@code DATETIME} has no zone. Connect with {@code connectionTimeZone=UTC} so the
 * driver does not shift the UTC values this store writes, e.g.
 * {@code jdbc:mysql://db:3306/oidc?connectionTimeZone=UTC}.
 */
public final class MySqlRecordStore extends AbstractJdbcRecordStore {

    public MySqlRecordStore() {
        super();
    }

    public MySqlRecordStore(JsonCodec jsonCodec) {
        super(jsonCodec);
    }

    @Override
    public AbstractJdbcRecordStore withJsonCodec(JsonCodec jsonCodec) {
        return new MySqlRecordStore(jsonCodec);
    }

    @Override
    public String name() {
        return "mysql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:mysql:", "jdbc:tidb:");
    }

    @Override
    protected String dataColumnType() {
        return "JSON";
    }

    @Override
    protected String timestampColumnType() {
        return "DATETIME(3)";
    }

    @Override
    protected String containmentPredicate() {
        return "JSON_CONTAINS(data, ?)";
    }

    @Override
    public List<String> schemaStatements(String namespace) {
        String table = table(namespace);
        return List.of("CREATE TABLE IF NOT EXISTS " + table + " (" +
                "id VARCHAR(255) NOT NULL PRIMARY KEY, " +
                "data " + dataColumnType() + " NOT NULL, " +
                "created_at " + timestampColumnType() + " NOT NULL, " +
                "updated_at " + timestampColumnType() + " NULL, " +
                "expires_at " + timestampColumnType() + " NULL, " +
                "INDEX " + expiresAtIndex(table) + " (expires_at))");
    }
}
