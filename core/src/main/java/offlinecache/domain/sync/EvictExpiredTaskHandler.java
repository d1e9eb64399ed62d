package offlinecache.domain.sync;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import offlinecache.domain.cache.CacheController;

@ApplicationScoped
public class EvictExpiredTaskHandler implements SyncTaskHandler {
    @Inject
    private CacheController cacheController;

    @Override
    public boolean supports(final SyncTaskKind kind) {
        return kind == SyncTaskKind.EVICT_EXPIRED;
    }

    @Override
    public void execute(final SyncTask task) {
        cacheController.clearExpired();
    }
}
