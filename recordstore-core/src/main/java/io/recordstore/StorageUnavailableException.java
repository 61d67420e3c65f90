package io.recordstore;

/**
 * The backing database could not be reached or did not answer in time.
 */
public final class StorageUnavailableException extends RecordStoreException {

    public StorageUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
