package io.recordstore.model;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * One stored row of a record type.
 *
 * @param id        caller-supplied identifier, unique within the namespace
 * @param data      the decoded payload
 * @param createdAt set once at insertion
 * @param updatedAt last update, or {@code null} if never updated
 * @param expiresAt expiration instant, or {@code null} for records that never expire
 */
public record StoredRecord(
        String id,
        Map<String, Object> data,
        Instant createdAt,
        Instant updatedAt,
        Instant expiresAt) {

    public StoredRecord {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(createdAt, "createdAt");
    }

    /**
     * Returns {@code true} while {@code now} is strictly before {@link #expiresAt()},
     * or always when the record has no expiration.
     */
    public boolean isLiveAt(Instant now) {
        return expiresAt == null || now.isBefore(expiresAt);
    }
}
