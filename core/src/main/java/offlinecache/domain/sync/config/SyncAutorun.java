package offlinecache.domain.sync.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.lang3.BooleanUtils;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.Optional;

/**
 * When enabled, queued tasks run on a background thread. Otherwise the caller drives the queue.
 */
@ApplicationScoped
public class SyncAutorun {
    @Inject
    @ConfigProperty(name = "oc.sync.autorun")
    private Optional<String> autorun;

    public boolean isAutorun() {
        return autorun.map(BooleanUtils::toBoolean).orElse(true);
    }
}
