package io.recordstore;

/**
 * Base unchecked exception for failures raised by the record store.
 *
 * <p>No operation retries internally; callers decide their own retry policy.
 *
 * @see StorageUnavailableException
 * @see RecordNotFoundException
 * @see RecordConflictException
 * @see PartialSweepFailureException
 */
public class RecordStoreException extends RuntimeException {

    public RecordStoreException(String message) {
        super(message);
    }

    public RecordStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
