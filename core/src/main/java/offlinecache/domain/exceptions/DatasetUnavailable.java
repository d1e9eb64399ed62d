package offlinecache.domain.exceptions;

/**
 * A dataset could not be downloaded and no cached copy exists.
 */
public class DatasetUnavailable extends RuntimeException implements ExternalException {
    public DatasetUnavailable() {
        super();
    }

    public DatasetUnavailable(final String message) {
        super(message);
    }

    public DatasetUnavailable(final String message, final Throwable cause) {
        super(message, cause);
    }

    public DatasetUnavailable(final Throwable cause) {
        super(cause);
    }
}
