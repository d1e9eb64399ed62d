package offlinecache.domain.exceptions;

/**
 * The host does not provide a usable hierarchical storage area.
 */
public class UnsupportedEnvironment extends RuntimeException implements InternalException {
    public UnsupportedEnvironment() {
        super();
    }

    public UnsupportedEnvironment(final String message) {
        super(message);
    }

    public UnsupportedEnvironment(final String message, final Throwable cause) {
        super(message, cause);
    }

    public UnsupportedEnvironment(final Throwable cause) {
        super(cause);
    }
}
