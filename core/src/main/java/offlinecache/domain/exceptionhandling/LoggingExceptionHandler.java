package offlinecache.domain.exceptionhandling;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.exception.ExceptionUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

@ApplicationScoped
public class LoggingExceptionHandler implements ExceptionHandler {

    @Inject
    @ConfigProperty(name = "oc.exceptions.printstacktrace", defaultValue = "false")
    private String printStackTrace;

    @Override
    public String getExceptionMessage(final Throwable e) {
        if (e == null) {
            return "Exception was null";
        }

        if (Boolean.parseBoolean(printStackTrace)) {
            return ExceptionUtils.getStackTrace(e);
        }

        // Wrapped failures usually carry the useful message on the root cause
        final Throwable root = ExceptionUtils.getRootCause(e);
        final Throwable source = root == null ? e : root;

        if (StringUtils.isBlank(source.getMessage())) {
            return source.toString();
        }

        return source.getMessage();
    }
}
