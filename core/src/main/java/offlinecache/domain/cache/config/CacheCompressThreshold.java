package offlinecache.domain.cache.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
public class CacheCompressThreshold {
    private static final int DEFAULT_THRESHOLD = 10 * 1024;

    @Inject
    @ConfigProperty(name = "oc.cache.compressthreshold")
    private Optional<String> threshold;

    /**
     * @return payloads larger than this many bytes are compressed, 0 disables compression
     */
    public int getThreshold() {
        return Math.max(0, NumberUtils.toInt(threshold.orElse(DEFAULT_THRESHOLD + ""), DEFAULT_THRESHOLD));
    }
}
