package offlinecache.domain.cache.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
public class CacheMaxBytes {
    private static final long DEFAULT_MAX_BYTES = 500L * 1024L * 1024L;

    @Inject
    @ConfigProperty(name = "oc.cache.maxbytes")
    private Optional<String> maxBytes;

    /**
     * @return the byte ceiling of the cache partition, 0 for no limit
     */
    public long getMaxBytes() {
        return Math.max(0, NumberUtils.toLong(maxBytes.orElse(DEFAULT_MAX_BYTES + ""), DEFAULT_MAX_BYTES));
    }
}
