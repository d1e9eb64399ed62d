package offlinecache.domain.exceptions;

/**
 * Concrete internal failure, used where vavr needs a class rather than the InternalException interface,
 * for example in Try.recover(). Retrying the same call with the same data gives the same result.
 */
public class InternalFailure extends RuntimeException implements InternalException {
    public InternalFailure() {
        super();
    }

    public InternalFailure(final String message) {
        super(message);
    }

    public InternalFailure(final String message, final Throwable cause) {
        super(message, cause);
    }

    public InternalFailure(final Throwable cause) {
        super(cause);
    }
}
