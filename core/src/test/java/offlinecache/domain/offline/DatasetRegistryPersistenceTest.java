package offlinecache.domain.offline;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import offlinecache.domain.cache.CacheController;
import offlinecache.domain.cache.config.CacheCleanupInterval;
import offlinecache.domain.cache.config.CacheCompressThreshold;
import offlinecache.domain.cache.config.CacheDefaultTtl;
import offlinecache.domain.cache.config.CacheMaxBytes;
import offlinecache.domain.connectivity.ConnectivityMonitor;
import offlinecache.domain.date.SystemClockProducer;
import offlinecache.domain.exceptionhandling.LoggingExceptionHandler;
import offlinecache.domain.exceptionhandling.StandardExceptionMapping;
import offlinecache.domain.json.JsonDeserializerJackson;
import offlinecache.domain.logger.Loggers;
import offlinecache.domain.metadata.MetadataIndex;
import offlinecache.domain.mutex.KeyedMutex;
import offlinecache.domain.mutex.config.MutexTimeout;
import offlinecache.domain.offline.config.DatasetStaleThreshold;
import offlinecache.domain.storage.FileSystemStorageCapabilities;
import offlinecache.domain.storage.InMemoryStorageCapabilities;
import offlinecache.domain.storage.Partition;
import offlinecache.domain.storage.SandboxStorageBackend;
import offlinecache.domain.storage.StorageBackend;
import offlinecache.domain.storage.StorageCapabilitiesProducer;
import offlinecache.domain.storage.config.StorageRoot;
import offlinecache.domain.sync.SyncCoordinator;
import offlinecache.domain.sync.config.SyncAutorun;
import offlinecache.domain.sync.config.SyncCompletedLimit;
import offlinecache.domain.zip.ApacheCompressZipper;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.environment.se.Weld;
import org.jboss.weld.environment.se.WeldContainer;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Map;

/**
 * Registrations are kept in the datasets partition and come back with a new container.
 */
public class DatasetRegistryPersistenceTest {

    @TempDir
    Path root;

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of("oc.storage.provider", "filesystem",
                        "oc.storage.root", root.toString(),
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

    private Weld weld() {
        return new Weld()
                .disableDiscovery()
                .addExtension(new ConfigExtension())
                .addBeanClasses(
                        OfflineDataManager.class,
                        FakeDatasetSource.class,
                        DatasetStaleThreshold.class,
                        RefreshDatasetTaskHandler.class,
                        SyncCoordinator.class,
                        SyncAutorun.class,
                        SyncCompletedLimit.class,
                        CacheCleanupInterval.class,
                        ConnectivityMonitor.class,
                        StandardExceptionMapping.class,
                        LoggingExceptionHandler.class,
                        CacheController.class,
                        CacheDefaultTtl.class,
                        CacheMaxBytes.class,
                        CacheCompressThreshold.class,
                        ApacheCompressZipper.class,
                        MetadataIndex.class,
                        KeyedMutex.class,
                        MutexTimeout.class,
                        SandboxStorageBackend.class,
                        StorageCapabilitiesProducer.class,
                        FileSystemStorageCapabilities.class,
                        InMemoryStorageCapabilities.class,
                        StorageRoot.class,
                        JsonDeserializerJackson.class,
                        Loggers.class,
                        SystemClockProducer.class);
    }

    @Test
    public void testRegistrationsSurviveARestart() {
        try (WeldContainer container = weld().initialize()) {
            container.select(StorageBackend.class).get().initialize();
            final OfflineDataManager manager = container.select(OfflineDataManager.class).get();
            manager.registerDataset("sales", "https://example.org/sales.parquet", "parquet", true);
            manager.loadDataset("sales");
        }

        try (WeldContainer container = weld().initialize()) {
            container.select(StorageBackend.class).get().initialize();
            final OfflineDataManager manager = container.select(OfflineDataManager.class).get();

            final DatasetDescriptor sales = manager.getDataset("sales").orElseThrow();
            Assertions.assertEquals("https://example.org/sales.parquet", sales.url());
            Assertions.assertEquals("parquet", sales.format());
            Assertions.assertTrue(sales.autoUpdate());

            final DatasetLoadResult result = manager.loadDataset("sales");
            Assertions.assertTrue(result.fromCache());
            Assertions.assertEquals("sales v1", new String(result.data(), StandardCharsets.UTF_8));
            Assertions.assertEquals(1, manager.storedDatasetCount());
        }
    }

    @Test
    public void testRegistrationsBeforeInitializationAreSavedOnceStorageIsReady() {
        try (WeldContainer container = weld().initialize()) {
            final OfflineDataManager manager = container.select(OfflineDataManager.class).get();
            manager.registerDataset("stock", "https://example.org/stock.csv", "csv", false);

            final StorageBackend backend = container.select(StorageBackend.class).get();
            backend.initialize();
            Assertions.assertEquals(1, manager.listDatasets().size());
            Assertions.assertTrue(backend.exists(Partition.DATASETS, OfflineDataManager.REGISTRY_KEY));
        }

        try (WeldContainer container = weld().initialize()) {
            container.select(StorageBackend.class).get().initialize();
            final OfflineDataManager manager = container.select(OfflineDataManager.class).get();

            Assertions.assertFalse(manager.getDataset("stock").orElseThrow().autoUpdate());
        }
    }

    @Test
    public void testClearingAllDataKeepsTheRegistrations() {
        try (WeldContainer container = weld().initialize()) {
            container.select(StorageBackend.class).get().initialize();
            final OfflineDataManager manager = container.select(OfflineDataManager.class).get();
            manager.registerDataset("sales", "https://example.org/sales.parquet", "parquet", true);
            manager.loadDataset("sales");

            Assertions.assertEquals(1, manager.clearAllData());
            Assertions.assertEquals(0, manager.storedDatasetCount());
        }

        try (WeldContainer container = weld().initialize()) {
            container.select(StorageBackend.class).get().initialize();
            final OfflineDataManager manager = container.select(OfflineDataManager.class).get();

            Assertions.assertTrue(manager.getDataset("sales").isPresent());
            Assertions.assertFalse(manager.isDatasetAvailableOffline("sales"));
        }
    }
}
