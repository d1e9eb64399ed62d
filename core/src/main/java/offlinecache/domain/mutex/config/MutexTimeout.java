package offlinecache.domain.mutex.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
public class MutexTimeout {
    private static final long DEFAULT_TIMEOUT_MS = 10000;

    @Inject
    @ConfigProperty(name = "oc.mutex.timeout")
    private Optional<String> timeout;

    public long getTimeout() {
        return Math.max(0, NumberUtils.toLong(timeout.orElse(""), DEFAULT_TIMEOUT_MS));
    }
}
