package offlinecache.domain.metadata;

import io.smallrye.config.PropertiesConfigSource;
import io.smallrye.config.SmallRyeConfigBuilder;
import io.smallrye.config.inject.ConfigExtension;
import jakarta.inject.Inject;
import offlinecache.domain.date.MutableClock;
import offlinecache.domain.json.JsonDeserializerJackson;
import offlinecache.domain.logger.Loggers;
import offlinecache.domain.storage.FileSystemStorageCapabilities;
import offlinecache.domain.storage.InMemoryStorageCapabilities;
import offlinecache.domain.storage.Partition;
import offlinecache.domain.storage.SandboxStorageBackend;
import offlinecache.domain.storage.StorageCapabilitiesProducer;
import offlinecache.domain.storage.config.StorageRoot;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.spi.ConfigProviderResolver;
import org.jboss.weld.junit5.auto.AddBeanClasses;
import org.jboss.weld.junit5.auto.AddExtensions;
import org.jboss.weld.junit5.auto.EnableAutoWeld;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

@EnableAutoWeld
@AddExtensions(ConfigExtension.class)
@AddBeanClasses(MetadataIndex.class)
@AddBeanClasses(SandboxStorageBackend.class)
@AddBeanClasses(StorageCapabilitiesProducer.class)
@AddBeanClasses(FileSystemStorageCapabilities.class)
@AddBeanClasses(InMemoryStorageCapabilities.class)
@AddBeanClasses(StorageRoot.class)
@AddBeanClasses(JsonDeserializerJackson.class)
@AddBeanClasses(Loggers.class)
@AddBeanClasses(MutableClock.class)
public class MetadataIndexTest {

    @TempDir
    Path tempDir;

    @Inject
    MetadataIndex metadataIndex;

    @Inject
    SandboxStorageBackend storageBackend;

    @Inject
    MutableClock clock;

    @BeforeEach
    void updateConfig() {
        final var configSource = new PropertiesConfigSource(
                Map.of("oc.storage.provider", "filesystem",
                        "oc.storage.root", tempDir.toString()),
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
    public void testWritesAreIndexed() {
        storageBackend.initialize();

        storageBackend.write(Partition.CACHE, "entry", new byte[]{1, 2, 3});

        final IndexEntry entry = metadataIndex.lookup(Partition.CACHE, "entry").orElseThrow();
        Assertions.assertEquals(3, entry.size());
        Assertions.assertEquals(clock.millis(), entry.lastModified());
        Assertions.assertNull(entry.ttlMillis());
    }

    @Test
    public void testDeletesAreIndexed() {
        storageBackend.initialize();
        storageBackend.write(Partition.CACHE, "entry", new byte[]{1});

        storageBackend.remove(Partition.CACHE, "entry");

        Assertions.assertTrue(metadataIndex.lookup(Partition.CACHE, "entry").isEmpty());
    }

    @Test
    public void testReconcilesEntriesFromAnEarlierSession() throws IOException {
        Files.createDirectories(tempDir.resolve("cache").resolve(".meta"));
        Files.write(tempDir.resolve("cache").resolve("previous"), new byte[]{1, 2, 3, 4, 5});
        Files.writeString(
                tempDir.resolve("cache").resolve(".meta").resolve("previous.json"),
                "{\"metadata\":{\"kind\":\"query-result\"},\"ttlMillis\":60000,\"createdAt\":1000}");
        Files.createDirectories(tempDir.resolve("datasets"));
        Files.write(tempDir.resolve("datasets").resolve("orphan.bin"), new byte[]{1});

        storageBackend.initialize();

        final IndexEntry previous = metadataIndex.lookup(Partition.CACHE, "previous").orElseThrow();
        Assertions.assertEquals(5, previous.size());
        Assertions.assertEquals(1000, previous.lastModified());
        Assertions.assertEquals(60000L, previous.ttlMillis());
        Assertions.assertEquals("query-result", previous.metadata().get("kind"));

        final IndexEntry orphan = metadataIndex.lookup(Partition.DATASETS, "orphan.bin").orElseThrow();
        Assertions.assertNull(orphan.ttlMillis());
        Assertions.assertTrue(orphan.metadata().isEmpty());
    }

    @Test
    public void testReconcileDropsVanishedFiles() throws IOException {
        storageBackend.initialize();
        storageBackend.write(Partition.CACHE, "gone", new byte[]{1});
        storageBackend.write(Partition.CACHE, "kept", new byte[]{2});
        Assertions.assertEquals(2, metadataIndex.count(Partition.CACHE));

        Files.delete(tempDir.resolve("cache").resolve("gone"));
        metadataIndex.reconcile(Partition.CACHE);

        Assertions.assertTrue(metadataIndex.lookup(Partition.CACHE, "gone").isEmpty());
        Assertions.assertTrue(metadataIndex.lookup(Partition.CACHE, "kept").isPresent());
    }

    @Test
    public void testTotals() {
        storageBackend.initialize();
        storageBackend.write(Partition.DATASETS, "a", new byte[100]);
        storageBackend.write(Partition.DATASETS, "b", new byte[50]);
        storageBackend.write(Partition.CACHE, "c", new byte[10]);

        Assertions.assertEquals(150, metadataIndex.totalBytes(Partition.DATASETS));
        Assertions.assertEquals(2, metadataIndex.count(Partition.DATASETS));
        Assertions.assertEquals(3, metadataIndex.entries().size());
    }

    @Test
    public void testExpiry() {
        final IndexEntry entry = new IndexEntry(Partition.CACHE, "key", 1, 1000, Map.of(), 500L, 1000, false);

        Assertions.assertFalse(entry.isExpired(1500));
        Assertions.assertTrue(entry.isExpired(1501));
        Assertions.assertFalse(new IndexEntry(Partition.CACHE, "key", 1, 0, Map.of(), null, 0, false).isExpired(Long.MAX_VALUE));
    }

    @Test
    public void testTouch() {
        storageBackend.initialize();
        storageBackend.write(Partition.CACHE, "entry", new byte[]{1});
        final long written = clock.millis();

        clock.advance(Duration.ofMinutes(5));
        metadataIndex.touch(Partition.CACHE, "entry");

        final IndexEntry entry = metadataIndex.lookup(Partition.CACHE, "entry").orElseThrow();
        Assertions.assertEquals(written, entry.lastModified());
        Assertions.assertEquals(clock.millis(), entry.lastAccessed());
    }
}
