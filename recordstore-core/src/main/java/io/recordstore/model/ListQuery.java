package io.recordstore.model;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Selection and ordering for administrative listing of a record type.
 *
 * <p>Listing does not filter expired rows.
 *
 * @param ids       ids to include, or {@code null} for every row
 * @param orderBy   column to sort on
 * @param direction sort direction
 */
public record ListQuery(Set<String> ids, SortField orderBy, Direction direction) {

    public ListQuery {
        Objects.requireNonNull(orderBy, "orderBy");
        Objects.requireNonNull(direction, "direction");
        ids = ids == null ? null : Set.copyOf(ids);
    }

    /** All rows, most recently updated first. */
    public static ListQuery all() {
        return new ListQuery(null, SortField.UPDATED_AT, Direction.DESC);
    }

    /** Only the given ids, most recently updated first. */
    public static ListQuery ids(Collection<String> ids) {
        Objects.requireNonNull(ids, "ids");
        return new ListQuery(new LinkedHashSet<>(ids), SortField.UPDATED_AT, Direction.DESC);
    }

    public ListQuery orderBy(SortField field, Direction direction) {
        return new ListQuery(ids, field, direction);
    }

    /** Sortable columns. */
    public enum SortField {
        ID("id"),
        CREATED_AT("created_at"),
        UPDATED_AT("updated_at"),
        EXPIRES_AT("expires_at");

        private final String column;

        SortField(String column) {
            this.column = column;
        }

        public String column() {
            return column;
        }
    }

    public enum Direction {
        ASC,
        DESC
    }
}
