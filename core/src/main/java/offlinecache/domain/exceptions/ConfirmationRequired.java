package offlinecache.domain.exceptions;

/**
 * A destructive operation was requested without confirmation.
 */
public class ConfirmationRequired extends RuntimeException implements InternalException {
    public ConfirmationRequired() {
        super();
    }

    public ConfirmationRequired(final String message) {
        super(message);
    }

    public ConfirmationRequired(final String message, final Throwable cause) {
        super(message, cause);
    }

    public ConfirmationRequired(final Throwable cause) {
        super(cause);
    }
}
