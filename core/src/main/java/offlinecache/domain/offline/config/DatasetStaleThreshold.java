package offlinecache.domain.offline.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.time.Duration;
import java.util.Optional;

@ApplicationScoped
public class DatasetStaleThreshold {
    private static final long DEFAULT_THRESHOLD_SECONDS = 24 * 60 * 60;

    @Inject
    @ConfigProperty(name = "oc.datasets.stalethreshold")
    private Optional<String> threshold;

    public Duration getThreshold() {
        return Duration.ofSeconds(Math.max(0, NumberUtils.toLong(threshold.orElse(DEFAULT_THRESHOLD_SECONDS + ""), DEFAULT_THRESHOLD_SECONDS)));
    }
}
