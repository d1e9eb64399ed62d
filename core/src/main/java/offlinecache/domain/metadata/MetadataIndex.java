package offlinecache.domain.metadata;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import offlinecache.domain.storage.EntryAttributes;
import offlinecache.domain.storage.Partition;
import offlinecache.domain.storage.StorageBackend;
import offlinecache.domain.storage.StorageEvent;
import offlinecache.domain.storage.StoredFileInfo;
import offlinecache.domain.timing.TimedOperation;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * In-memory view of what each partition holds, so existence, size and staleness checks do not touch storage.
 * <p>
 * Every committed write and delete is applied through {@link StorageEvent}s. A partition is reconciled
 * against the backend listing the first time it is used, which picks up entries from earlier sessions.
 * The index itself is never persisted.
 */
@ApplicationScoped
public class MetadataIndex {

    @Inject
    private StorageBackend storageBackend;

    @Inject
    private Clock clock;

    @Inject
    private Logger logger;

    private final Map<EntryKey, IndexEntry> entries = new ConcurrentHashMap<>();

    private final Set<Partition> reconciled = ConcurrentHashMap.newKeySet();

    public Optional<IndexEntry> lookup(final Partition partition, final String path) {
        ensureReconciled(partition);
        return Optional.ofNullable(entries.get(new EntryKey(partition, path)));
    }

    public List<IndexEntry> entries(final Partition partition) {
        ensureReconciled(partition);
        return entries.values().stream()
                .filter(entry -> entry.partition() == partition)
                .toList();
    }

    public List<IndexEntry> entries() {
        return Arrays.stream(Partition.values())
                .flatMap(partition -> entries(partition).stream())
                .toList();
    }

    public long totalBytes(final Partition partition) {
        return entries(partition).stream().mapToLong(IndexEntry::size).sum();
    }

    public int count(final Partition partition) {
        return entries(partition).size();
    }

    public void record(final IndexEntry entry) {
        entries.put(entry.key(), entry);
    }

    public void remove(final Partition partition, final String path) {
        entries.remove(new EntryKey(partition, path));
    }

    /**
     * Marks an entry as used now.
     */
    public void touch(final Partition partition, final String path) {
        entries.computeIfPresent(new EntryKey(partition, path), (key, entry) -> entry.withLastAccessed(clock.millis()));
    }

    /**
     * Rebuilds the entries of a partition from the backend listing and the stored attributes.
     * Entries whose files are gone are dropped. Access times of surviving entries are kept.
     */
    public synchronized void reconcile(final Partition partition) {
        try (TimedOperation ignored = new TimedOperation("reconcile " + partition.directoryName())) {
            final Map<String, StoredFileInfo> files = storageBackend.list(partition).stream()
                    .collect(Collectors.toMap(StoredFileInfo::name, Function.identity(), (a, b) -> a));

            entries.keySet().stream()
                    .filter(key -> key.partition() == partition)
                    .filter(key -> !files.containsKey(key.path()))
                    // A write may have committed after the listing was taken
                    .filter(key -> !storageBackend.exists(partition, key.path()))
                    .toList()
                    .forEach(entries::remove);

            files.values().forEach(file -> entries.compute(
                    new EntryKey(partition, file.name()),
                    (key, existing) -> fromStorage(partition, file, existing)));

            reconciled.add(partition);
            logger.fine("Reconciled " + files.size() + " entries in " + partition.directoryName());
        }
    }

    public void reconcileAll() {
        Arrays.stream(Partition.values()).forEach(this::reconcile);
    }

    public void onStorageEvent(@Observes final StorageEvent event) {
        if (event.type() == StorageEvent.Type.STORED) {
            record(fromStorage(event.partition(), event.path(), event.size(), clock.millis(), null));
        } else {
            remove(event.partition(), event.path());
        }
    }

    private void ensureReconciled(final Partition partition) {
        if (!reconciled.contains(partition)) {
            reconcile(partition);
        }
    }

    private IndexEntry fromStorage(final Partition partition, final StoredFileInfo file, @Nullable final IndexEntry existing) {
        if (existing != null && existing.size() == file.size()) {
            return existing;
        }

        return fromStorage(partition, file.name(), file.size(), file.lastModified(), existing);
    }

    private IndexEntry fromStorage(final Partition partition,
                                   final String path,
                                   final long size,
                                   final long fallbackModified,
                                   @Nullable final IndexEntry existing) {
        final Optional<EntryAttributes> attributes = storageBackend.readAttributes(partition, path);
        final long lastModified = attributes.map(EntryAttributes::createdAt).orElse(fallbackModified);
        final long lastAccessed = existing == null ? lastModified : existing.lastAccessed();

        return new IndexEntry(
                partition,
                path,
                size,
                lastModified,
                attributes.map(EntryAttributes::metadata).orElse(Map.of()),
                attributes.map(EntryAttributes::ttlMillis).orElse(null),
                lastAccessed,
                attributes.map(EntryAttributes::compressed).orElse(false));
    }
}
