package offlinecache.domain.cache.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.util.Optional;

/**
 * TTL given to cache entries stored without one. Zero or less means they never expire.
 */
@ApplicationScoped
public class CacheDefaultTtl {
    @Inject
    @ConfigProperty(name = "oc.cache.defaultttl")
    private Optional<String> defaultTtl;

    public Optional<Duration> getDefaultTtl() {
        final long seconds = NumberUtils.toLong(defaultTtl.orElse("0"), 0);
        return seconds > 0 ? Optional.of(Duration.ofSeconds(seconds)) : Optional.empty();
    }
}
