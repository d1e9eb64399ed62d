package offlinecache.domain.sync;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import offlinecache.domain.metadata.MetadataIndex;

/**
 * Brings the metadata index back in line with storage, dropping entries whose files vanished.
 */
@ApplicationScoped
public class RevalidateCacheTaskHandler implements SyncTaskHandler {
    @Inject
    private MetadataIndex metadataIndex;

    @Override
    public boolean supports(final SyncTaskKind kind) {
        return kind == SyncTaskKind.REVALIDATE_CACHE;
    }

    @Override
    public void execute(final SyncTask task) {
        metadataIndex.reconcileAll();
    }
}
