package offlinecache.domain.exceptionhandling;

import io.vavr.control.Try;

public interface ExceptionMapping {
    <T> Try<T> map(Try<T> tryObject);
}
