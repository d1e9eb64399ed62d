package offlinecache.domain.management;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import offlinecache.domain.cache.CacheController;
import offlinecache.domain.cache.GetOptions;
import offlinecache.domain.cache.PutOptions;
import offlinecache.domain.cache.config.CacheCleanupInterval;
import offlinecache.domain.cache.config.CacheCompressThreshold;
import offlinecache.domain.cache.config.CacheDefaultTtl;
import offlinecache.domain.cache.config.CacheMaxBytes;
import offlinecache.domain.connectivity.ConnectivityMonitor;
import offlinecache.domain.date.MutableClock;
import offlinecache.domain.exceptionhandling.LoggingExceptionHandler;
import offlinecache.domain.exceptionhandling.StandardExceptionMapping;
import offlinecache.domain.exceptions.ConfirmationRequired;
import offlinecache.domain.json.JsonDeserializerJackson;
import offlinecache.domain.logger.Loggers;
import offlinecache.domain.metadata.MetadataIndex;
import offlinecache.domain.mutex.KeyedMutex;
import offlinecache.domain.mutex.config.MutexTimeout;
import offlinecache.domain.offline.FakeDatasetSource;
import offlinecache.domain.offline.OfflineDataManager;
import offlinecache.domain.offline.RefreshDatasetTaskHandler;
import offlinecache.domain.offline.config.DatasetStaleThreshold;
import offlinecache.domain.query.FakeQueryExecutor;
import offlinecache.domain.query.QueryFingerprint;
import offlinecache.domain.query.QueryResultCache;
import offlinecache.domain.query.config.QueryResultTtl;
import offlinecache.domain.storage.FileSystemStorageCapabilities;
import offlinecache.domain.storage.InMemoryStorageCapabilities;
import offlinecache.domain.storage.Partition;
import offlinecache.domain.storage.ReadMode;
import offlinecache.domain.storage.SandboxStorageBackend;
import offlinecache.domain.storage.StorageCapabilitiesProducer;
import offlinecache.domain.storage.config.StorageRoot;
import offlinecache.domain.sync.EvictExpiredTaskHandler;
import offlinecache.domain.sync.RevalidateCacheTaskHandler;
import offlinecache.domain.sync.SyncCoordinator;
import offlinecache.domain.sync.SyncTask;
import offlinecache.domain.sync.SyncTaskKind;
import offlinecache.domain.sync.SyncTaskStatus;
import offlinecache.domain.sync.config.SyncAutorun;
import offlinecache.domain.sync.config.SyncCompletedLimit;
import offlinecache.domain.zip.ApacheCompressZipper;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(StorageManagement.class)
@AddBeanClasses(StatusRecorder.class)
@AddBeanClasses(QueryResultCache.class)
@AddBeanClasses(QueryFingerprint.class)
@AddBeanClasses(QueryResultTtl.class)
@AddBeanClasses(FakeQueryExecutor.class)
@AddBeanClasses(OfflineDataManager.class)
@AddBeanClasses(FakeDatasetSource.class)
@AddBeanClasses(DatasetStaleThreshold.class)
@AddBeanClasses(RefreshDatasetTaskHandler.class)
@AddBeanClasses(RevalidateCacheTaskHandler.class)
@AddBeanClasses(EvictExpiredTaskHandler.class)
@AddBeanClasses(SyncCoordinator.class)
@AddBeanClasses(SyncAutorun.class)
@AddBeanClasses(SyncCompletedLimit.class)
@AddBeanClasses(CacheCleanupInterval.class)
@AddBeanClasses(ConnectivityMonitor.class)
@AddBeanClasses(StandardExceptionMapping.class)
@AddBeanClasses(LoggingExceptionHandler.class)
@AddBeanClasses(CacheController.class)
@AddBeanClasses(CacheDefaultTtl.class)
@AddBeanClasses(CacheMaxBytes.class)
@AddBeanClasses(CacheCompressThreshold.class)
@AddBeanClasses(ApacheCompressZipper.class)
@AddBeanClasses(MetadataIndex.class)
@AddBeanClasses(KeyedMutex.class)
@AddBeanClasses(MutexTimeout.class)
@AddBeanClasses(SandboxStorageBackend.class)
@AddBeanClasses(StorageCapabilitiesProducer.class)
@AddBeanClasses(FileSystemStorageCapabilities.class)
@AddBeanClasses(InMemoryStorageCapabilities.class)
@AddBeanClasses(StorageRoot.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(Loggers.class)
@AddBeanClasses(MutableClock.class)
public class StorageManagementTest {

    @Inject
    StorageManagement storageManagement;

    @Inject
    StatusRecorder statusRecorder;

    @Inject
    QueryResultCache queryResultCache;

    @Inject
    OfflineDataManager offlineDataManager;

    @Inject
    FakeDatasetSource datasetSource;

    @Inject
    CacheController cacheController;

    @Inject
    ConnectivityMonitor connectivityMonitor;

    @Inject
    SyncCoordinator syncCoordinator;

    @Inject
    SandboxStorageBackend storageBackend;

    @Inject
    MutableClock clock;

    @BeforeEach
    void setUp() {
        updateConfig();
        storageBackend.initialize();
        offlineDataManager.registerDataset("sales", "https://example.org/sales.parquet", "parquet", true);
    }

    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of("oc.storage.provider", "memory",
                        "oc.sync.autorun", "false"),
                "TestConfig",
                Integer.MAX_VALUE
        );
        final Config newConfig = new SmallRyeConfigBuilder()
                .withSources(configSource)
                .build();

        final var configProviderResolver = ConfigProviderResolver.instance();
        final var oldConfig = configProviderResolver.getConfig();

        configProviderResolver.releaseConfig(oldConfig);
        configProviderResolver.registerConfig(
                newConfig,
                Thread.currentThread().getContextClassLoader()
        );
    }

    @Test
    public void testStorageStats() {
        offlineDataManager.loadDataset("sales");
        cacheController.put("tile.png", new byte[2048]);

        final StorageStats stats = storageManagement.getStorageStats();
        final int registryBytes = storageBackend.read(Partition.DATASETS, OfflineDataManager.REGISTRY_KEY, ReadMode.BYTES).orElseThrow().length;

        Assertions.assertEquals(1, stats.datasetCount());
        Assertions.assertEquals(1, stats.cacheEntryCount());
        Assertions.assertEquals(2048, stats.perDirectoryBytes().get(Partition.CACHE));
        Assertions.assertEquals(0, stats.perDirectoryBytes().get(Partition.TEMPORARY));
        Assertions.assertEquals(2048 + "sales v1".length() + registryBytes, stats.totalBytes());
    }

    @Test
    public void testFormatBytes() {
        Assertions.assertEquals("0 Bytes", storageManagement.formatBytes(0));
        Assertions.assertEquals("1.5 KB", storageManagement.formatBytes(1536));
        Assertions.assertEquals("1 MB", storageManagement.formatBytes(1024 * 1024));
    }

    @Test
    public void testClearQueryCacheKeepsOtherEntries() {
        queryResultCache.execute("SELECT * FROM sales");
        cacheController.put("tile.png", new byte[]{1});
        offlineDataManager.loadDataset("sales");

        Assertions.assertEquals(1, storageManagement.clearQueryCache());

        Assertions.assertTrue(cacheController.has("tile.png", GetOptions.defaults()));
        Assertions.assertTrue(offlineDataManager.isDatasetAvailableOffline("sales"));
        Assertions.assertFalse(queryResultCache.execute("SELECT * FROM sales").fromCache());
    }

    @Test
    public void testClearExpiredCache() {
        cacheController.put("short", new byte[]{1}, PutOptions.defaults().withTtl(Duration.ofSeconds(1)));
        cacheController.put("kept", new byte[]{1});
        clock.advance(Duration.ofSeconds(2));

        Assertions.assertEquals(1, storageManagement.clearExpiredCache());
        Assertions.assertTrue(cacheController.has("kept", GetOptions.defaults()));
    }

    @Test
    public void testClearOfflineDataNeedsConfirmation() {
        offlineDataManager.loadDataset("sales");

        Assertions.assertThrows(ConfirmationRequired.class, () -> storageManagement.clearOfflineData(false));
        Assertions.assertTrue(offlineDataManager.isDatasetAvailableOffline("sales"));

        Assertions.assertEquals(1, storageManagement.clearOfflineData(true));
        Assertions.assertFalse(offlineDataManager.isDatasetAvailableOffline("sales"));
    }

    @Test
    public void testSyncNowAndClearCompletedTasks() {
        final SyncTask task = storageManagement.syncNow();

        Assertions.assertEquals(SyncTaskKind.REVALIDATE_CACHE, task.kind());
        Assertions.assertEquals(1, storageManagement.getSyncStatus().completed());

        Assertions.assertEquals(1, storageManagement.clearCompletedTasks());
        Assertions.assertEquals(0, storageManagement.getSyncStatus().total());
    }

    @Test
    public void testRefreshDataDownloadsAutoUpdateDatasets() {
        final SyncTask task = storageManagement.refreshData();

        Assertions.assertEquals(SyncTaskStatus.COMPLETED, syncCoordinator.task(task.id()).orElseThrow().status());
        Assertions.assertTrue(offlineDataManager.isDatasetAvailableOffline("sales"));
        Assertions.assertEquals(1, datasetSource.getFetches());
    }

    @Test
    public void testEvictExpiredTask() {
        cacheController.put("short", new byte[]{1}, PutOptions.defaults().withTtl(Duration.ofSeconds(1)));
        clock.advance(Duration.ofSeconds(2));

        final SyncTask task = syncCoordinator.requestSync(SyncTaskKind.EVICT_EXPIRED, null);

        Assertions.assertEquals(SyncTaskStatus.COMPLETED, syncCoordinator.task(task.id()).orElseThrow().status());
        Assertions.assertEquals(0, storageManagement.getStorageStats().cacheEntryCount());
    }

    @Test
    public void testStatusIsOnlineByDefault() {
        Assertions.assertEquals(StatusIndicator.ONLINE, storageManagement.getStatus());
    }

    @Test
    public void testStatusOffline() {
        connectivityMonitor.setOnline(false);

        Assertions.assertEquals(StatusIndicator.OFFLINE, storageManagement.getStatus());
        Assertions.assertEquals("offline", storageManagement.getStatus().label());
    }

    @Test
    public void testStatusSyncing() {
        storageManagement.syncNow();

        Assertions.assertEquals(List.of(StatusIndicator.SYNCING), statusRecorder.getWhileRunning());
    }

    @Test
    public void testStatusCached() {
        offlineDataManager.loadDataset("sales");
        Assertions.assertEquals(StatusIndicator.ONLINE, storageManagement.getStatus());

        offlineDataManager.loadDataset("sales");
        Assertions.assertEquals(StatusIndicator.CACHED, storageManagement.getStatus());
    }

    @Test
    public void testStatusErrorClearsAfterASuccessfulTask() {
        datasetSource.setUnreachable("sales", true);
        storageManagement.refreshData();
        Assertions.assertEquals(StatusIndicator.ERROR, storageManagement.getStatus());

        datasetSource.setUnreachable("sales", false);
        storageManagement.refreshData();
        Assertions.assertEquals(StatusIndicator.ONLINE, storageManagement.getStatus());
    }
}
