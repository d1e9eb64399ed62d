package offlinecache.domain.query.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.util.Optional;

@ApplicationScoped
public class QueryResultTtl {
    private static final long DEFAULT_TTL_SECONDS = 3600;

    @Inject
    @ConfigProperty(name = "oc.cache.queryttl")
    private Optional<String> queryTtl;

    public Duration getQueryTtl() {
        return Duration.ofSeconds(Math.max(0, NumberUtils.toLong(queryTtl.orElse(DEFAULT_TTL_SECONDS + ""), DEFAULT_TTL_SECONDS)));
    }
}
