package offlinecache.domain.management;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import offlinecache.domain.cache.CacheController;
import offlinecache.domain.cache.CacheStats;
import offlinecache.domain.connectivity.ConnectivityMonitor;
import offlinecache.domain.exceptions.ConfirmationRequired;
import offlinecache.domain.offline.OfflineDataManager;
import offlinecache.domain.query.QueryResultCache;
import offlinecache.domain.storage.Partition;
import offlinecache.domain.storage.StorageBackend;
import offlinecache.domain.sync.SyncCoordinator;
import offlinecache.domain.sync.SyncStatus;
import offlinecache.domain.sync.SyncTask;
import offlinecache.domain.sync.SyncTaskEvent;
import offlinecache.domain.sync.SyncTaskKind;
import offlinecache.domain.sync.SyncTaskStatus;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

/**
 * The operations behind the storage management screen: usage figures, sync state and the
 * maintenance actions.
 */
@ApplicationScoped
public class StorageManagement {

    @Inject
    private StorageBackend storageBackend;

    @Inject
    private CacheController cacheController;

    @Inject
    private QueryResultCache queryResultCache;

    @Inject
    private OfflineDataManager offlineDataManager;

    @Inject
    private SyncCoordinator syncCoordinator;

    @Inject
    private ConnectivityMonitor connectivityMonitor;

    @Inject
    private Logger logger;

    private final AtomicBoolean lastTaskFailed = new AtomicBoolean(false);

    public StorageStats getStorageStats() {
        final CacheStats stats = cacheController.stats();
        final Map<Partition, Long> perDirectory = new EnumMap<>(stats.bytesByPartition());

        return new StorageStats(
                stats.totalBytes(),
                perDirectory,
                offlineDataManager.storedDatasetCount(),
                stats.count(Partition.CACHE));
    }

    public SyncStatus getSyncStatus() {
        return syncCoordinator.getSyncStatus();
    }

    public String formatBytes(final long bytes) {
        return storageBackend.formatSize(bytes);
    }

    /**
     * Queues a refresh of every auto-update dataset.
     */
    public SyncTask refreshData() {
        return syncCoordinator.requestSync(SyncTaskKind.REFRESH_DATASET, null);
    }

    /**
     * Removes cached query results, leaving datasets and other cache entries alone.
     */
    public int clearQueryCache() {
        final int removed = queryResultCache.clear();
        logger.info("Cleared " + removed + " cached query results");
        return removed;
    }

    public int clearExpiredCache() {
        return cacheController.clearExpired();
    }

    /**
     * Wipes every partition.
     *
     * @param confirmed the user has confirmed the wipe
     * @throws ConfirmationRequired if not confirmed
     */
    public int clearOfflineData(final boolean confirmed) {
        if (!confirmed) {
            throw new ConfirmationRequired("Clearing all offline data must be confirmed");
        }

        return offlineDataManager.clearAllData();
    }

    public SyncTask syncNow() {
        return syncCoordinator.syncNow();
    }

    public int clearCompletedTasks() {
        return syncCoordinator.clearCompletedTasks();
    }

    public StatusIndicator getStatus() {
        if (!connectivityMonitor.isOnline()) {
            return StatusIndicator.OFFLINE;
        }

        if (syncCoordinator.getSyncStatus().running() > 0) {
            return StatusIndicator.SYNCING;
        }

        if (lastTaskFailed.get()) {
            return StatusIndicator.ERROR;
        }

        if (offlineDataManager.wasLastServedFromCache()) {
            return StatusIndicator.CACHED;
        }

        return StatusIndicator.ONLINE;
    }

    public void onSyncTaskEvent(@Observes final SyncTaskEvent event) {
        if (event.task().status() == SyncTaskStatus.FAILED) {
            lastTaskFailed.set(true);
        } else if (event.task().status() == SyncTaskStatus.COMPLETED) {
            lastTaskFailed.set(false);
        }
    }
}
