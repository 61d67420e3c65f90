package io.recordstore;

/**
 * A write violated an integrity constraint, typically a concurrent insert of
 * the same id. The conflict is surfaced as-is and never resolved automatically.
 */
public final class RecordConflictException extends RecordStoreException {

    public RecordConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
