package offlinecache.domain.offline;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import offlinecache.domain.cache.CacheController;
import offlinecache.domain.cache.GetOptions;
import offlinecache.domain.cache.PutOptions;
import offlinecache.domain.connectivity.ConnectivityMonitor;
import offlinecache.domain.exceptionhandling.ExceptionHandler;
import offlinecache.domain.exceptions.DatasetUnavailable;
import offlinecache.domain.exceptions.InternalFailure;
import offlinecache.domain.exceptions.UnknownDataset;
import offlinecache.domain.json.JsonDeserializer;
import offlinecache.domain.metadata.IndexEntry;
import offlinecache.domain.metadata.MetadataIndex;
import offlinecache.domain.mutex.Mutex;
import offlinecache.domain.offline.config.DatasetStaleThreshold;
import offlinecache.domain.storage.EntryAttributes;
import offlinecache.domain.storage.Partition;
import offlinecache.domain.storage.ReadMode;
import offlinecache.domain.storage.StorageBackend;
import offlinecache.domain.sync.SyncCoordinator;
import offlinecache.domain.sync.SyncTaskKind;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Keeps registered datasets available offline.
 * <p>
 * Loading prefers the stored copy. When there is none, or a refresh is forced, the dataset is downloaded
 * and stored in the datasets partition. If the download fails the stored copy is served as stale,
 * when allowed. Loads of the same dataset are serialized so one download serves concurrent callers.
 * <p>
 * The registry is stored as JSON in the datasets partition so registrations survive a restart. It is read
 * the first time it is used after storage has been initialized. Serving a stale auto-update dataset while
 * online queues a background refresh.
 */
@ApplicationScoped
public class OfflineDataManager {
    public static final String REGISTRY_KEY = "dataset-registry.json";
    private static final String REGISTRY_LOCK = "dataset-registry";
    private static final String KIND_METADATA = "kind";
    private static final String URL_METADATA = "url";
    private static final String FORMAT_METADATA = "format";
    private static final String ETAG_METADATA = "etag";

    @Inject
    private CacheController cacheController;

    @Inject
    private MetadataIndex metadataIndex;

    @Inject
    private StorageBackend storageBackend;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private SyncCoordinator syncCoordinator;

    @Inject
    private ConnectivityMonitor connectivityMonitor;

    @Inject
    private Instance<DatasetSource> datasetSource;

    @Inject
    private Mutex mutex;

    @Inject
    private DatasetStaleThreshold datasetStaleThreshold;

    @Inject
    private ExceptionHandler exceptionHandler;

    @Inject
    private Clock clock;

    @Inject
    private Logger logger;

    private final Map<String, DatasetDescriptor> registry = new ConcurrentSkipListMap<>();

    private final AtomicBoolean lastServedFromCache = new AtomicBoolean(false);

    private volatile boolean registryLoaded;

    public DatasetDescriptor registerDataset(final String name, final String url, final String format, final boolean autoUpdate) {
        checkArgument(StringUtils.isNotBlank(name), "name must not be blank");
        checkArgument(StringUtils.isNotBlank(format), "format must not be blank");

        final DatasetDescriptor descriptor = new DatasetDescriptor(name, url, format, autoUpdate);
        registry().put(name, descriptor);
        saveRegistry();
        logger.info("Registered dataset " + name + " (" + format + ") from " + url);
        return descriptor;
    }

    public Optional<DatasetDescriptor> getDataset(final String name) {
        return Optional.ofNullable(registry().get(name));
    }

    public List<DatasetDescriptor> listDatasets() {
        return List.copyOf(registry().values());
    }

    public DatasetLoadResult loadDataset(final String name) {
        return loadDataset(name, DatasetLoadOptions.defaults());
    }

    /**
     * @throws UnknownDataset      if the dataset was never registered
     * @throws DatasetUnavailable if the dataset can not be downloaded and there is no usable stored copy
     */
    public DatasetLoadResult loadDataset(final String name, final DatasetLoadOptions options) {
        final DatasetDescriptor dataset = requireDataset(name);
        final DatasetLoadResult result = mutex.acquire("dataset:" + name, () -> loadLocked(dataset, options));
        lastServedFromCache.set(result.fromCache());
        return result;
    }

    /**
     * Downloads the dataset again, failing if the download fails.
     */
    public DatasetLoadResult refreshDataset(final String name) {
        return loadDataset(name, DatasetLoadOptions.refresh());
    }

    /**
     * Refreshes every auto-update dataset. Every dataset is attempted even if an earlier one fails.
     *
     * @throws DatasetUnavailable naming the datasets that could not be refreshed
     */
    public int refreshAll() {
        final List<String> failed = registry().values().stream()
                .filter(DatasetDescriptor::autoUpdate)
                .filter(dataset -> Try.of(() -> refreshDataset(dataset.name()))
                        .onFailure(ex -> logger.warning("Failed to refresh dataset " + dataset.name() + ": " + exceptionHandler.getExceptionMessage(ex)))
                        .isFailure())
                .map(DatasetDescriptor::name)
                .toList();

        if (!failed.isEmpty()) {
            throw new DatasetUnavailable("Failed to refresh datasets " + String.join(", ", failed));
        }

        final int refreshed = (int) registry().values().stream().filter(DatasetDescriptor::autoUpdate).count();
        logger.info("Refreshed " + refreshed + " datasets");
        return refreshed;
    }

    public boolean isDatasetAvailableOffline(final String name) {
        return getDataset(name)
                .flatMap(dataset -> metadataIndex.lookup(Partition.DATASETS, dataset.storageKey()))
                .isPresent();
    }

    /**
     * Removes the stored copy of a dataset. The registration is kept.
     */
    public boolean clearDataset(final String name) {
        final DatasetDescriptor dataset = requireDataset(name);
        final boolean removed = cacheController.invalidate(dataset.storageKey(), Partition.DATASETS);
        logger.info((removed ? "Removed" : "No stored copy of") + " dataset " + name);
        return removed;
    }

    /**
     * Wipes every partition. Registrations are kept.
     *
     * @return the number of entries removed
     */
    public int clearAllData() {
        final int datasets = (int) metadataIndex.entries(Partition.DATASETS).stream()
                .filter(entry -> !REGISTRY_KEY.equals(entry.path()))
                .filter(entry -> cacheController.invalidate(entry.path(), Partition.DATASETS))
                .count();
        final int removed = datasets
                + cacheController.clearAll(Partition.CACHE)
                + cacheController.clearAll(Partition.TEMPORARY);

        lastServedFromCache.set(false);
        logger.info("Cleared all offline data (" + removed + " entries)");
        return removed;
    }

    public OfflineStatus getOfflineStatus() {
        final long now = clock.millis();
        final List<DatasetStatus> datasets = registry().values().stream()
                .map(dataset -> metadataIndex.lookup(Partition.DATASETS, dataset.storageKey())
                        .map(entry -> new DatasetStatus(dataset.name(), true, entry.lastModified(), entry.size(), isStale(entry, now)))
                        .orElseGet(() -> new DatasetStatus(dataset.name(), false, null, 0, false)))
                .toList();

        return new OfflineStatus(
                connectivityMonitor.isOnline(),
                datasets,
                datasets.stream().mapToLong(DatasetStatus::size).sum());
    }

    /**
     * @return the number of stored dataset payloads, not counting the registry itself
     */
    public int storedDatasetCount() {
        return (int) metadataIndex.entries(Partition.DATASETS).stream()
                .filter(entry -> !REGISTRY_KEY.equals(entry.path()))
                .count();
    }

    /**
     * True if the most recent load was served from storage rather than downloaded.
     */
    public boolean wasLastServedFromCache() {
        return lastServedFromCache.get();
    }

    private DatasetLoadResult loadLocked(final DatasetDescriptor dataset, final DatasetLoadOptions options) {
        if (!options.forceRefresh() && options.fallbackToCache()) {
            final Optional<DatasetLoadResult> cached = loadStored(dataset, false);
            if (cached.isPresent()) {
                logger.fine("Serving dataset " + dataset.name() + " from storage");
                scheduleUpdateCheck(dataset, cached.get());
                return cached.get();
            }
        }

        if (!connectivityMonitor.isOnline()) {
            return fallback(dataset, options, new DatasetUnavailable("Offline and dataset " + dataset.name() + " is not stored"));
        }

        return Try.of(() -> download(dataset))
                .recover(ex -> fallback(dataset, options, ex))
                .get();
    }

    private void scheduleUpdateCheck(final DatasetDescriptor dataset, final DatasetLoadResult cached) {
        if (!dataset.autoUpdate() || !cached.stale() || !connectivityMonitor.isOnline()) {
            return;
        }

        Try.of(() -> syncCoordinator.enqueueIfAbsent(SyncTaskKind.REFRESH_DATASET, dataset.name()))
                .onSuccess(task -> logger.fine("Queued update check " + task.id() + " for dataset " + dataset.name()))
                .onFailure(ex -> logger.warning("Failed to queue an update check for dataset " + dataset.name() + ": " + ex.getMessage()));
    }

    private DatasetLoadResult download(final DatasetDescriptor dataset) {
        if (datasetSource.isUnsatisfied()) {
            throw new InternalFailure("No dataset source is available");
        }

        final DatasetDownload download = datasetSource.get().fetch(dataset);

        final Map<String, String> metadata = new HashMap<>();
        metadata.put(URL_METADATA, StringUtils.defaultString(dataset.url()));
        metadata.put(FORMAT_METADATA, dataset.format());
        if (download.etag() != null) {
            metadata.put(ETAG_METADATA, download.etag());
        }

        cacheController.put(dataset.storageKey(), download.data(), PutOptions.in(Partition.DATASETS).withMetadata(metadata));
        logger.info("Downloaded dataset " + dataset.name() + " (" + download.data().length + " bytes)");
        return new DatasetLoadResult(download.data(), false, false, dataset);
    }

    private DatasetLoadResult fallback(final DatasetDescriptor dataset, final DatasetLoadOptions options, final Throwable cause) {
        if (options.fallbackToCache()) {
            final Optional<DatasetLoadResult> cached = loadStored(dataset, true);
            if (cached.isPresent()) {
                logger.warning("Serving stored copy of dataset " + dataset.name() + " after: " + exceptionHandler.getExceptionMessage(cause));
                return cached.get();
            }
        }

        if (cause instanceof DatasetUnavailable unavailable) {
            throw unavailable;
        }

        throw new DatasetUnavailable("Dataset " + dataset.name() + " could not be downloaded", cause);
    }

    private Optional<DatasetLoadResult> loadStored(final DatasetDescriptor dataset, final boolean forceStale) {
        final long now = clock.millis();
        return cacheController.get(dataset.storageKey(), GetOptions.in(Partition.DATASETS))
                .map(data -> new DatasetLoadResult(
                        data,
                        true,
                        forceStale || metadataIndex.lookup(Partition.DATASETS, dataset.storageKey())
                                .map(entry -> isStale(entry, now))
                                .orElse(false),
                        dataset));
    }

    private boolean isStale(final IndexEntry entry, final long now) {
        return entry.lastModified() + datasetStaleThreshold.getThreshold().toMillis() < now;
    }

    private Map<String, DatasetDescriptor> registry() {
        if (!registryLoaded && storageBackend.isInitialized()) {
            loadRegistry();
        }

        return registry;
    }

    /**
     * Merges the stored registry into the one held in memory. Registrations made before storage was
     * initialized win over stored ones and are written back.
     */
    private synchronized void loadRegistry() {
        if (registryLoaded) {
            return;
        }

        final Map<String, DatasetDescriptor> stored = storageBackend.read(Partition.DATASETS, REGISTRY_KEY, ReadMode.TEXT)
                .map(json -> Try.of(() -> jsonDeserializer.deserializeMap(json, String.class, DatasetDescriptor.class))
                        .onFailure(ex -> logger.warning("Ignoring unreadable dataset registry: " + ex.getMessage()))
                        .getOrElse(Map.of()))
                .orElse(Map.of());

        final boolean unsaved = !stored.keySet().containsAll(registry.keySet());
        stored.forEach(registry::putIfAbsent);
        registryLoaded = true;
        logger.fine("Loaded " + stored.size() + " datasets from the registry");

        if (unsaved) {
            saveRegistry();
        }
    }

    private void saveRegistry() {
        if (!storageBackend.isInitialized()) {
            logger.fine("Storage is not initialized, the dataset registry is only held in memory");
            return;
        }

        Try.run(() -> mutex.acquire(REGISTRY_LOCK, () -> {
                    storageBackend.write(
                            Partition.DATASETS,
                            REGISTRY_KEY,
                            jsonDeserializer.serialize(registry).getBytes(StandardCharsets.UTF_8),
                            new EntryAttributes(Map.of(KIND_METADATA, "registry"), null, clock.millis(), false));
                    return null;
                }))
                .onFailure(ex -> logger.warning("Failed to save the dataset registry: " + exceptionHandler.getExceptionMessage(ex)));
    }

    private DatasetDescriptor requireDataset(final String name) {
        return getDataset(name)
                .orElseThrow(() -> new UnknownDataset("Dataset " + name + " is not registered"));
    }
}
