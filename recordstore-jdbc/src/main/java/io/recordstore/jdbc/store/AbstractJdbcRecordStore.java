package io.recordstore.jdbc.store;

import io.recordstore.jdbc.JdbcTemplate;
import io.recordstore.jdbc.TableNames;
import io.recordstore.model.ListQuery;
import io.recordstore.model.StoredRecord;
import io.recordstore.model.TypeStats;
import io.recordstore.spi.RecordStore;
import io.recordstore.util.JsonCodec;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC record store with standard SQL implementations.
 *
 * <p>Each namespace is a table
 * {@code (id, data, created_at, updated_at, expires_at)}; see {@link #schemaStatements}.
 * Subclasses describe the column types and, where the database has a native JSON
 * containment operator, override {@link #containmentPredicate()}. Without one, secondary
 * field lookups use a {@code LIKE} prefilter on the serialized member and verify each
 * candidate against the parsed payload.
 *
 * <p>Instants are stored with millisecond precision as UTC wall-clock values in columns
 * without a time zone. Register custom implementations via
 * {@code META-INF/services/io.recordstore.jdbc.store.AbstractJdbcRecordStore}.
 *
 * @see JdbcRecordStores
 */
public abstract class AbstractJdbcRecordStore implements RecordStore {
    private static final String COLUMNS = "id, data, created_at, updated_at, expires_at";
    private static final String LIVE = "(expires_at IS NULL OR expires_at > ?)";
    private static final String MOST_RECENT_FIRST = " ORDER BY COALESCE(updated_at, created_at) DESC, id";

    private final JsonCodec jsonCodec;
    private final JdbcTemplate.RowMapper<StoredRecord> rowMapper;

    protected AbstractJdbcRecordStore() {
        this(JsonCodec.getDefault());
    }

    protected AbstractJdbcRecordStore(JsonCodec jsonCodec) {
        this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
        this.rowMapper = this::mapRow;
    }

    /**
     * Unique identifier for this record store (e.g., "mysql", "postgresql", "h2").
     */
    public abstract String name();

    /**
     * JDBC URL prefixes this record store handles (e.g., "jdbc:mysql:", "jdbc:tidb:").
     */
    public abstract List<String> jdbcUrlPrefixes();

    /**
     * Returns a copy of this store that encodes payloads with the given codec.
     */
    public abstract AbstractJdbcRecordStore withJsonCodec(JsonCodec jsonCodec);

    protected JsonCodec jsonCodec() {
        return jsonCodec;
    }

    /** Column type holding the JSON payload. */
    protected String dataColumnType() {
        return "VARCHAR(1000000)";
    }

    protected String timestampColumnType() {
        return "TIMESTAMP";
    }

    /** Placeholder for a JSON payload parameter, e.g. {@code CAST(? AS jsonb)}. */
    protected String dataParameter() {
        return "?";
    }

    /**
     * Native predicate testing that {@code data} contains the JSON object bound to its
     * single placeholder, or {@code null} when the database has none.
     */
    protected String containmentPredicate() {
        return null;
    }

    /**
     * DDL creating the table and expiration index for one namespace, idempotently.
     */
    public List<String> schemaStatements(String namespace) {
        String table = table(namespace);
        return List.of(
                "CREATE TABLE IF NOT EXISTS " + table + " (" +
                        "id VARCHAR(255) NOT NULL PRIMARY KEY, " +
                        "data " + dataColumnType() + " NOT NULL, " +
                        "created_at " + timestampColumnType() + " NOT NULL, " +
                        "updated_at " + timestampColumnType() + ", " +
                        "expires_at " + timestampColumnType() + ")",
                "CREATE INDEX IF NOT EXISTS " + expiresAtIndex(table) +
                        " ON " + table + " (expires_at)");
    }

    protected static String expiresAtIndex(String table) {
        return table + "_expires_at_idx";
    }

    @Override
    public Optional<StoredRecord> find(Connection conn, String namespace, String id) {
        String sql = "SELECT " + COLUMNS + " FROM " + table(namespace) + " WHERE id=?";
        return JdbcTemplate.queryFirst(conn, sql, rowMapper, id);
    }

    @Override
    public Optional<StoredRecord> findLive(Connection conn, String namespace, String id, Instant now) {
        String sql = "SELECT " + COLUMNS + " FROM " + table(namespace) +
                " WHERE id=? AND " + LIVE;
        return JdbcTemplate.queryFirst(conn, sql, rowMapper, id, timestamp(now));
    }

    @Override
    public Optional<StoredRecord> findLiveByField(Connection conn, String namespace,
            String field, Object value, Instant now) {
        String table = table(namespace);
        String predicate = containmentPredicate();
        if (predicate != null) {
            String sql = "SELECT " + COLUMNS + " FROM " + table +
                    " WHERE " + predicate + " AND " + LIVE + MOST_RECENT_FIRST + " LIMIT 1";
            return JdbcTemplate.queryFirst(conn, sql, rowMapper,
                    jsonCodec.toJsonMember(field, value), timestamp(now));
        }
        String sql = "SELECT " + COLUMNS + " FROM " + table +
                " WHERE data LIKE ? ESCAPE '\\' AND " + LIVE + MOST_RECENT_FIRST;
        return JdbcTemplate.query(conn, sql, rowMapper, likePattern(field, value), timestamp(now))
                .stream()
                .filter(r -> jsonCodec.containsMember(r.data(), field, value))
                .findFirst();
    }

    @Override
    public void insert(Connection conn, String namespace, StoredRecord record) {
        Objects.requireNonNull(record, "record");
        String table = table(namespace);
        String data = jsonCodec.toJson(record.data());
        if (record.expiresAt() == null) {
            String sql = "INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?," + dataParameter() +
                    ",?,NULL,NULL)";
            JdbcTemplate.update(conn, sql, record.id(), data, timestamp(record.createdAt()));
        } else {
            String sql = "INSERT INTO " + table + " (" + COLUMNS + ") VALUES (?," + dataParameter() +
                    ",?,NULL,?)";
            JdbcTemplate.update(conn, sql, record.id(), data,
                    timestamp(record.createdAt()), timestamp(record.expiresAt()));
        }
    }

    @Override
    public int update(Connection conn, String namespace, String id, Map<String, Object> data,
            Instant updatedAt, Instant expiresAt) {
        String table = table(namespace);
        String json = jsonCodec.toJson(data);
        if (expiresAt == null) {
            String sql = "UPDATE " + table + " SET data=" + dataParameter() + ", updated_at=? WHERE id=?";
            return JdbcTemplate.update(conn, sql, json, timestamp(updatedAt), id);
        }
        String sql = "UPDATE " + table + " SET data=" + dataParameter() +
                ", updated_at=?, expires_at=? WHERE id=?";
        return JdbcTemplate.update(conn, sql, json, timestamp(updatedAt), timestamp(expiresAt), id);
    }

    @Override
    public int updateData(Connection conn, String namespace, String id, Map<String, Object> data) {
        String sql = "UPDATE " + table(namespace) + " SET data=" + dataParameter() + " WHERE id=?";
        return JdbcTemplate.update(conn, sql, jsonCodec.toJson(data), id);
    }

    @Override
    public int delete(Connection conn, String namespace, String id) {
        return JdbcTemplate.update(conn, "DELETE FROM " + table(namespace) + " WHERE id=?", id);
    }

    @Override
    public int deleteByField(Connection conn, String namespace, String field, Object value) {
        String table = table(namespace);
        String predicate = containmentPredicate();
        if (predicate != null) {
            return JdbcTemplate.update(conn, "DELETE FROM " + table + " WHERE " + predicate,
                    jsonCodec.toJsonMember(field, value));
        }
        String sql = "SELECT " + COLUMNS + " FROM " + table + " WHERE data LIKE ? ESCAPE '\\'";
        int deleted = 0;
        for (StoredRecord candidate : JdbcTemplate.query(conn, sql, rowMapper, likePattern(field, value))) {
            if (jsonCodec.containsMember(candidate.data(), field, value)) {
                deleted += delete(conn, namespace, candidate.id());
            }
        }
        return deleted;
    }

    @Override
    public int deleteAll(Connection conn, String namespace) {
        return JdbcTemplate.update(conn, "DELETE FROM " + table(namespace));
    }

    @Override
    public List<StoredRecord> list(Connection conn, String namespace, ListQuery query) {
        Objects.requireNonNull(query, "query");
        StringBuilder sql = new StringBuilder("SELECT ").append(COLUMNS)
                .append(" FROM ").append(table(namespace));
        List<Object> params = new ArrayList<>();
        if (query.ids() != null) {
            if (query.ids().isEmpty()) {
                return List.of();
            }
            sql.append(" WHERE id IN (")
                    .append(String.join(",", Collections.nCopies(query.ids().size(), "?")))
                    .append(')');
            params.addAll(query.ids());
        }
        sql.append(" ORDER BY ").append(orderExpression(query.orderBy()))
                .append(' ').append(query.direction().name());
        if (query.orderBy() != ListQuery.SortField.ID) {
            sql.append(", id");
        }
        return JdbcTemplate.query(conn, sql.toString(), rowMapper, params.toArray());
    }

    /**
     * SQL sort expression for a field. {@code UPDATED_AT} sorts never-updated rows by
     * their creation time.
     */
    protected String orderExpression(ListQuery.SortField field) {
        if (field == ListQuery.SortField.UPDATED_AT) {
            return "COALESCE(updated_at, created_at)";
        }
        return field.column();
    }

    @Override
    public TypeStats stats(Connection conn, String typeName, String namespace, Instant now) {
        String sql = "SELECT COUNT(*), MIN(created_at), MAX(created_at) FROM " + table(namespace) +
                " WHERE " + LIVE;
        return JdbcTemplate.queryFirst(conn, sql,
                rs -> new TypeStats(typeName, rs.getLong(1),
                        JdbcTemplate.getInstant(rs, 2), JdbcTemplate.getInstant(rs, 3)),
                timestamp(now))
                .orElseGet(() -> new TypeStats(typeName, 0, null, null));
    }

    protected String table(String namespace) {
        return TableNames.validate(namespace);
    }

    private String likePattern(String field, Object value) {
        String fragment = jsonCodec.memberFragment(field, value);
        StringBuilder pattern = new StringBuilder(fragment.length() + 8).append('%');
        for (int i = 0; i < fragment.length(); i++) {
            char c = fragment.charAt(i);
            if (c == '%' || c == '_' || c == '\\') {
                pattern.append('\\');
            }
            pattern.append(c);
        }
        return pattern.append('%').toString();
    }

    private StoredRecord mapRow(ResultSet rs) throws SQLException {
        return new StoredRecord(
                rs.getString("id"),
                jsonCodec.parseObject(rs.getString("data")),
                JdbcTemplate.getInstant(rs, "created_at"),
                JdbcTemplate.getInstant(rs, "updated_at"),
                JdbcTemplate.getInstant(rs, "expires_at"));
    }

    /**
     * Truncates to millis so stored values compare equal across databases. Bound in UTC
     * by {@link JdbcTemplate}.
     */
    protected static Timestamp timestamp(Instant instant) {
        return Timestamp.from(instant.truncatedTo(ChronoUnit.MILLIS));
    }
}
