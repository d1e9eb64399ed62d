package offlinecache.domain.exceptionhandling;

import io.vavr.API;
import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import offlinecache.domain.exceptions.ExternalException;
import offlinecache.domain.exceptions.ExternalFailure;
import offlinecache.domain.exceptions.InternalFailure;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Predicates.instanceOf;

/**
 * Maps all exceptions to either InternalFailure or ExternalFailure.
 * InternalFailure indicates a non-recoverable error.
 * ExternalFailure indicates a potentially recoverable error (e.g. by retrying a sync task).
 */
@ApplicationScoped
public class StandardExceptionMapping implements ExceptionMapping {
    @Override
    public <T> Try<T> map(final Try<T> tryObject) {
        checkNotNull(tryObject);

        return tryObject.mapFailure(
                API.Case(API.$(instanceOf(InternalFailure.class)), throwable -> throwable),
                API.Case(API.$(instanceOf(ExternalFailure.class)), throwable -> throwable),
                // Only failures that explicitly declare themselves external are worth retrying
                API.Case(API.$(instanceOf(ExternalException.class)), throwable -> new ExternalFailure(throwable)),
                API.Case(API.$(), throwable -> new InternalFailure(throwable)));
    }
}
