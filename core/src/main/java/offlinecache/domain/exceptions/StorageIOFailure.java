package offlinecache.domain.exceptions;

/**
 * Represents a failure that occurred reading or writing the storage area.
 */
public class StorageIOFailure extends RuntimeException implements ExternalException {
    public StorageIOFailure() {
        super();
    }

    public StorageIOFailure(final String message) {
        super(message);
    }

    public StorageIOFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public StorageIOFailure(final Throwable cause) {
        super(cause);
    }
}
