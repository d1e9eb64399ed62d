package offlinecache.domain.exceptions;

/**
 * A file or directory does not exist. This never escapes the public API, where it becomes an empty result.
 */
public class StorageNotFound extends RuntimeException implements InternalException {
    public StorageNotFound() {
        super();
    }

    public StorageNotFound(final String message) {
        super(message);
    }

    public StorageNotFound(final String message, final Throwable cause) {
        super(message, cause);
    }

    public StorageNotFound(final Throwable cause) {
        super(cause);
    }
}
