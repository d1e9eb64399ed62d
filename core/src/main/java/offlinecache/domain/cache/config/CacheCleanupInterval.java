package offlinecache.domain.cache.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.util.Optional;

@ApplicationScoped
public class CacheCleanupInterval {
    private static final long DEFAULT_INTERVAL_SECONDS = 300;

    @Inject
    @ConfigProperty(name = "oc.cache.cleanupinterval")
    private Optional<String> interval;

    /**
     * @return how often expired entries are swept, or empty when periodic cleanup is off
     */
    public Optional<Duration> getInterval() {
        final long seconds = NumberUtils.toLong(interval.orElse(DEFAULT_INTERVAL_SECONDS + ""), DEFAULT_INTERVAL_SECONDS);
        return seconds > 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
    }
}
