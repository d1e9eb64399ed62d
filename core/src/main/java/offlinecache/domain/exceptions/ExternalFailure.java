package offlinecache.domain.exceptions;

/**
 * Concrete external failure, used where vavr needs a class rather than the ExternalException interface.
 * The same call may succeed later.
 */
public class ExternalFailure extends RuntimeException implements ExternalException {
    public ExternalFailure() {
        super();
    }

    public ExternalFailure(final String message) {
        super(message);
    }

    public ExternalFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ExternalFailure(final Throwable cause) {
        super(cause);
    }
}
