package offlinecache.domain.offline;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import offlinecache.domain.sync.SyncTask;
import offlinecache.domain.sync.SyncTaskHandler;
import offlinecache.domain.sync.SyncTaskKind;

/**
 * Refreshes the task's target dataset, or every auto-update dataset when there is no target.
 */
@ApplicationScoped
public class RefreshDatasetTaskHandler implements SyncTaskHandler {
    @Inject
    private OfflineDataManager offlineDataManager;

    @Override
    public boolean supports(final SyncTaskKind kind) {
        return kind == SyncTaskKind.REFRESH_DATASET;
    }

    @Override
    public void execute(final SyncTask task) {
        if (task.target() == null) {
            offlineDataManager.refreshAll();
        } else {
            offlineDataManager.refreshDataset(task.target());
        }
    }
}
