package io.recordstore.jdbc.store;

import io.recordstore.util.JsonCodec;

import java.util.List;

/**
 * H2 record store. Primarily for testing.
 *
 * <p>H2 has no JSON containment operator, so secondary field lookups use the
 * {@code LIKE} prefilter from {@link AbstractJdbcRecordStore}.
 */
public final class H2RecordStore extends AbstractJdbcRecordStore {

    public H2RecordStore() {
        super();
    }

    public H2RecordStore(JsonCodec jsonCodec) {
        super(jsonCodec);
    }

    @Override
    public AbstractJdbcRecordStore withJsonCodec(JsonCodec jsonCodec) {
        return new H2RecordStore(jsonCodec);
    }

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }
}
