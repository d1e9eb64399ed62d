package offlinecache.domain.exceptions;

/**
 * No sync task has the requested id.
 */
public class UnknownTask extends RuntimeException implements InternalException {
    public UnknownTask() {
        super();
    }

    public UnknownTask(final String message) {
        super(message);
    }

    public UnknownTask(final String message, final Throwable cause) {
        super(message, cause);
    }

    public UnknownTask(final Throwable cause) {
        super(cause);
    }
}
