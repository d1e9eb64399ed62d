package offlinecache.domain.exceptionhandling;

/**
 * Converts exceptions into text suitable for logs and task records.
 */
public interface ExceptionHandler {
    String getExceptionMessage(Throwable e);
}
