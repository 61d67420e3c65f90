package io.recordstore;

import java.util.List;
import java.util.Map;

/**
 * One or more record types failed during a sweep or a volatile wipe.
 *
 * <p>Each per-type cause is attached as a suppressed exception. Types that
 * succeeded are not rolled back; the next sweep picks up what was left.
 */
public final class PartialSweepFailureException extends RecordStoreException {
    private final List<String> failedTypes;

    public PartialSweepFailureException(String operation, Map<String, Throwable> failures) {
        super(operation + " failed for " + failures.size() + " type(s): " + failures.keySet());
        this.failedTypes = List.copyOf(failures.keySet());
        failures.values().forEach(this::addSuppressed);
    }

    /**
     * Returns the logical names of the types that failed, in sweep order.
     */
    public List<String> failedTypes() {
        return failedTypes;
    }
}
