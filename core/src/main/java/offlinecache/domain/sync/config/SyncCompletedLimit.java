package offlinecache.domain.sync.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.math.NumberUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

@ApplicationScoped
public class SyncCompletedLimit {
    private static final int DEFAULT_LIMIT = 1000;

    @Inject
    @ConfigProperty(name = "oc.sync.completedlimit")
    private Optional<String> limit;

    /**
     * @return how many finished tasks are kept before the oldest are dropped, 0 for no limit
     */
    public int getLimit() {
        return Math.max(0, NumberUtils.toInt(limit.orElse(DEFAULT_LIMIT + ""), DEFAULT_LIMIT));
    }
}
