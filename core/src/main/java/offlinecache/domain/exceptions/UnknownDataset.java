package offlinecache.domain.exceptions;

/**
 * The named dataset has not been registered.
 */
public class UnknownDataset extends RuntimeException implements InternalException {
    public UnknownDataset() {
        super();
    }

    public UnknownDataset(final String message) {
        super(message);
    }

    public UnknownDataset(final String message, final Throwable cause) {
        super(message, cause);
    }

    public UnknownDataset(final Throwable cause) {
        super(cause);
    }
}
