package io.recordstore;

/**
 * Raised by {@link RecordAdapter#consume(String)} when no row exists for the id.
 *
 * <p>Every other lookup reports absence with an empty {@link java.util.Optional}.
 */
public final class RecordNotFoundException extends RecordStoreException {
    private final String typeName;
    private final String id;

    public RecordNotFoundException(String typeName, String id) {
        super("No " + typeName + " record with id " + id);
        this.typeName = typeName;
        this.id = id;
    }

    public String typeName() {
        return typeName;
    }

    public String id() {
        return id;
    }
}
