package io.recordstore.model;

import java.time.Instant;

/**
 * Row statistics for one volatile record type.
 *
 * @param type            logical type name
 * @param liveRowCount    rows that have not reached their expiration instant
 * @param oldestCreatedAt earliest {@code created_at} among those rows, or {@code null} if none
 * @param newestCreatedAt latest {@code created_at} among those rows, or {@code null} if none
 */
public record TypeStats(String type, long liveRowCount, Instant oldestCreatedAt, Instant newestCreatedAt) {
}
