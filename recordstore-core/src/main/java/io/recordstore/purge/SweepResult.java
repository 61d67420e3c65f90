package io.recordstore.purge;

import io.recordstore.PartialSweepFailureException;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one sweep: rows deleted per type and the types that failed.
 */
public final class SweepResult {
    private final Instant cutoff;
    private final Map<String, Integer> deleted;
    private final Map<String, Throwable> failures;

    private SweepResult(Instant cutoff, Map<String, Integer> deleted, Map<String, Throwable> failures) {
        this.cutoff = cutoff;
        this.deleted = Collections.unmodifiableMap(new LinkedHashMap<>(deleted));
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    public static Builder builder(Instant cutoff) {
        return new Builder(cutoff);
    }

    /** The expiration cutoff the sweep deleted against. */
    public Instant cutoff() {
        return cutoff;
    }

    /** Rows deleted per logical type, for types that completed. */
    public Map<String, Integer> deleted() {
        return deleted;
    }

    /** Failure cause per logical type. */
    public Map<String, Throwable> failures() {
        return failures;
    }

    public long totalDeleted() {
        long total = 0;
        for (int n : deleted.values()) {
            total += n;
        }
        return total;
    }

    public boolean isComplete() {
        return failures.isEmpty();
    }

    /**
     * Returns the aggregated failure, or empty if every type completed.
     */
    public Optional<PartialSweepFailureException> failure() {
        if (failures.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new PartialSweepFailureException("Sweep", failures));
    }

    @Override
    public String toString() {
        return "SweepResult{cutoff=" + cutoff + ", deleted=" + deleted +
                ", failed=" + failures.keySet() + "}";
    }

    public static final class Builder {
        private final Instant cutoff;
        private final Map<String, Integer> deleted = new LinkedHashMap<>();
        private final Map<String, Throwable> failures = new LinkedHashMap<>();

        private Builder(Instant cutoff) {
            this.cutoff = Objects.requireNonNull(cutoff, "cutoff");
        }

        public Builder deleted(String typeName, int rows) {
            deleted.put(typeName, rows);
            return this;
        }

        public Builder failed(String typeName, Throwable cause) {
            failures.put(typeName, cause);
            return this;
        }

        public SweepResult build() {
            return new SweepResult(cutoff, deleted, failures);
        }
    }
}
