package offlinecache.domain.storage;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Event;
import jakarta.inject.Inject;
import offlinecache.domain.exceptions.DeserializationFailed;
import offlinecache.domain.exceptions.StorageIOFailure;
import offlinecache.domain.exceptions.StorageNotFound;
import offlinecache.domain.exceptions.StorageNotInitialized;
import offlinecache.domain.exceptions.UnsupportedEnvironment;
import offlinecache.domain.injection.Preferred;
import offlinecache.domain.json.JsonDeserializer;
import offlinecache.domain.timing.TimedOperation;
import org.apache.commons.lang3.StringUtils;
import org.jspecify.annotations.Nullable;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * The storage backend over the host's sandboxed file area.
 * <p>
 * Each partition is a directory under the root. Entry attributes are JSON files in a nested
 * {@code .meta} directory of the partition, which listings skip because they only report files.
 * The root handle is opened once and only this class holds the directory handles.
 */
@ApplicationScoped
public class SandboxStorageBackend implements StorageBackend {
    private static final String META_DIRECTORY = ".meta";
    private static final String META_SUFFIX = ".json";

    @Inject
    @Preferred
    private StorageCapabilities capabilities;

    @Inject
    private JsonDeserializer jsonDeserializer;

    @Inject
    private Event<StorageEvent> storageEvents;

    @Inject
    private Clock clock;

    @Inject
    private Logger logger;

    @Nullable
    private volatile StorageDirectory root;

    @Override
    public boolean checkSupport() {
        return Try.of(capabilities::isSupported)
                .onFailure(ex -> logger.warning("Storage capability check failed: " + ex.getMessage()))
                .getOrElse(false);
    }

    @Override
    public synchronized void initialize() {
        if (root != null) {
            return;
        }

        if (!checkSupport()) {
            logger.severe("Hierarchical storage is not available, offline storage is disabled");
            throw new UnsupportedEnvironment("Hierarchical storage is not supported by this environment");
        }

        final StorageDirectory opened = capabilities.openRoot();
        Arrays.stream(Partition.values())
                .forEach(partition -> opened.createDirectory(partition.directoryName()));
        root = opened;

        logger.info("Storage initialized with partitions " + Arrays.toString(Partition.values()));
    }

    @Override
    public boolean isInitialized() {
        return root != null;
    }

    @Override
    public void write(final Partition partition, final String path, final byte[] payload) {
        write(partition, path, payload, null);
    }

    @Override
    public void write(final Partition partition, final String path, final byte[] payload, @Nullable final EntryAttributes attributes) {
        checkPath(path);
        checkNotNull(payload, "payload must not be null");

        final StorageDirectory directory = partitionDirectory(partition);
        final Optional<EntryAttributes> previous = readAttributes(partition, path);

        // Attributes go first, so the index entry created by the payload commit already carries them
        Try.run(() -> replaceAttributes(directory, path, attributes))
                .andThenTry(() -> commit(directory, path, payload))
                .onFailure(ex -> restoreAttributes(directory, partition, path, previous.orElse(null)))
                .onFailure(ex -> logger.warning("Failed to write " + describe(partition, path) + ": " + ex.getMessage()))
                .getOrElseThrow(ex -> ex instanceof StorageIOFailure failure
                        ? failure
                        : new StorageIOFailure("Failed to write " + describe(partition, path), ex));

        logger.fine("Stored " + describe(partition, path) + " (" + formatSize(payload.length) + ")");
        storageEvents.fire(new StorageEvent(StorageEvent.Type.STORED, partition, path, payload.length));
    }

    @Override
    public <T> Optional<T> read(final Partition partition, final String path, final ReadMode<T> mode) {
        checkPath(path);
        checkNotNull(mode, "mode must not be null");

        return existingPartitionDirectory(partition)
                .flatMap(directory -> directory.file(path))
                .flatMap(file -> Try.of(() -> mode.read(file))
                        .map(Optional::of)
                        // The file can vanish between the lookup and the read
                        .recover(StorageNotFound.class, ex -> Optional.empty())
                        .get());
    }

    @Override
    public boolean exists(final Partition partition, final String path) {
        checkPath(path);

        return existingPartitionDirectory(partition)
                .flatMap(directory -> directory.file(path))
                .isPresent();
    }

    @Override
    public boolean remove(final Partition partition, final String path) {
        checkPath(path);

        final Optional<StorageDirectory> directory = existingPartitionDirectory(partition);
        if (directory.isEmpty()) {
            return false;
        }

        final long size = directory.get().file(path).map(StorageFile::size).orElse(0L);
        final boolean removed = directory.get().removeFile(path);
        replaceAttributes(directory.get(), path, null);

        if (removed) {
            logger.fine("Removed " + describe(partition, path));
            storageEvents.fire(new StorageEvent(StorageEvent.Type.DELETED, partition, path, size));
        }

        return removed;
    }

    @Override
    public List<StoredFileInfo> list(final Partition partition) {
        try (TimedOperation ignored = new TimedOperation("list " + partition.directoryName())) {
            return existingPartitionDirectory(partition)
                    .map(StorageDirectory::entries)
                    .orElse(List.of())
                    .stream()
                    .filter(handle -> handle.kind() == HandleKind.FILE)
                    .map(StorageFile.class::cast)
                    .flatMap(file -> Try.of(() -> Optional.of(new StoredFileInfo(file.name(), file.size(), file.lastModified(), file.contentType())))
                            // Removed while listing
                            .recover(StorageNotFound.class, ex -> Optional.empty())
                            .get()
                            .stream())
                    .toList();
        }
    }

    @Override
    public Optional<EntryAttributes> readAttributes(final Partition partition, final String path) {
        checkPath(path);

        return existingPartitionDirectory(partition)
                .flatMap(directory -> directory.directory(META_DIRECTORY))
                .flatMap(meta -> meta.file(path + META_SUFFIX))
                .flatMap(file -> Try.of(() -> new String(file.readAllBytes(), StandardCharsets.UTF_8))
                        .map(json -> jsonDeserializer.deserialize(json, EntryAttributes.class))
                        .map(Optional::of)
                        .recover(StorageNotFound.class, ex -> Optional.empty())
                        .recover(DeserializationFailed.class, ex -> {
                            logger.warning("Ignoring unreadable attributes of " + describe(partition, path));
                            return Optional.empty();
                        })
                        .get());
    }

    @Override
    public StorageUsage usage() {
        final Map<Partition, Long> bytes = new EnumMap<>(Partition.class);
        for (final Partition partition : Partition.values()) {
            bytes.put(partition, list(partition).stream().mapToLong(StoredFileInfo::size).sum());
        }

        return new StorageUsage(bytes, bytes.values().stream().mapToLong(Long::longValue).sum());
    }

    @Override
    public int cleanupTemporary() {
        final int removed = (int) list(Partition.TEMPORARY).stream()
                .filter(file -> remove(Partition.TEMPORARY, file.name()))
                .count();

        logger.info("Removed " + removed + " temporary files");
        return removed;
    }

    @Override
    public int cleanupCache(final Duration maxAge) {
        checkNotNull(maxAge, "maxAge must not be null");

        final long cutoff = clock.millis() - maxAge.toMillis();
        final int removed = (int) list(Partition.CACHE).stream()
                .filter(file -> file.lastModified() < cutoff)
                .filter(file -> remove(Partition.CACHE, file.name()))
                .count();

        logger.info("Removed " + removed + " cache files older than " + maxAge);
        return removed;
    }

    /**
     * Writes the attributes of an entry, or deletes them when there are none.
     */
    private void replaceAttributes(final StorageDirectory directory, final String path, @Nullable final EntryAttributes attributes) {
        if (attributes == null) {
            directory.directory(META_DIRECTORY)
                    .ifPresent(meta -> meta.removeFile(path + META_SUFFIX));
            return;
        }

        commit(directory.createDirectory(META_DIRECTORY),
                path + META_SUFFIX,
                jsonDeserializer.serialize(attributes).getBytes(StandardCharsets.UTF_8));
    }

    private void restoreAttributes(final StorageDirectory directory,
                                   final Partition partition,
                                   final String path,
                                   @Nullable final EntryAttributes previous) {
        Try.run(() -> replaceAttributes(directory, path, previous))
                .onFailure(ex -> logger.severe("Failed to restore the attributes of " + describe(partition, path) + ": " + ex.getMessage()));
    }

    private static void commit(final StorageDirectory directory, final String name, final byte[] data) {
        final StorageWritable writable = directory.openWritable(name);

        Try.run(() -> writable.write(data))
                .andThen(writable::close)
                .onFailure(ex -> writable.abort())
                .get();
    }

    private StorageDirectory requireRoot() {
        final StorageDirectory current = root;
        if (current == null) {
            throw new StorageNotInitialized("Storage has not been initialized");
        }

        return current;
    }

    /**
     * The partition directory, recreated if something removed it.
     */
    private StorageDirectory partitionDirectory(final Partition partition) {
        return requireRoot().createDirectory(partition.directoryName());
    }

    private Optional<StorageDirectory> existingPartitionDirectory(final Partition partition) {
        return requireRoot().directory(partition.directoryName());
    }

    private static void checkPath(final String path) {
        checkArgument(StringUtils.isNotEmpty(path), "path must not be empty");
    }

    private static String describe(final Partition partition, final String path) {
        return partition.directoryName() + "/" + path;
    }
}
