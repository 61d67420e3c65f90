package io.recordstore.jdbc.store;

import io.recordstore.util.JsonCodec;

import java.util.List;

/**
 * PostgreSQL record store.
 *
 * <p>Stores payloads as {@code jsonb} and matches secondary fields with the
 * {@code @>} containment operator.
 */
public final class PostgresRecordStore extends AbstractJdbcRecordStore {

    public PostgresRecordStore() {
        super();
    }

    public PostgresRecordStore(JsonCodec jsonCodec) {
        super(jsonCodec);
    }

    @Override
    public AbstractJdbcRecordStore withJsonCodec(JsonCodec jsonCodec) {
        return new PostgresRecordStore(jsonCodec);
    }

    @Override
    public String name() {
        return "postgresql";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:postgresql:");
    }

    @Override
    protected String dataColumnType() {
        return "JSONB";
    }

    @Override
    protected String dataParameter() {
        return "CAST(? AS jsonb)";
    }

    @Override
    protected String containmentPredicate() {
        return "data @> CAST(? AS jsonb)";
    }
}
