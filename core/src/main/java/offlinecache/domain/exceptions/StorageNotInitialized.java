package offlinecache.domain.exceptions;

/**
 * An operation was attempted before the storage backend was initialized.
 */
public class StorageNotInitialized extends RuntimeException implements InternalException {
    public StorageNotInitialized() {
        super();
    }

    public StorageNotInitialized(final String message) {
        super(message);
    }

    public StorageNotInitialized(final String message, final Throwable cause) {
        super(message, cause);
    }

    public StorageNotInitialized(final Throwable cause) {
        super(cause);
    }
}
