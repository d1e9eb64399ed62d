package offlinecache.domain.exceptions;

/**
 * Represents a failed sync task.
 */
public class TaskFailure extends RuntimeException {
    public TaskFailure() {
        super();
    }

    public TaskFailure(final String message) {
        super(message);
    }

    public TaskFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public TaskFailure(final Throwable cause) {
        super(cause);
    }
}
