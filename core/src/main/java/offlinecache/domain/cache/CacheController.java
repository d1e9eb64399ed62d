package offlinecache.domain.cache;

import io.vavr.control.Try;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import offlinecache.domain.cache.config.CacheCompressThreshold;
import offlinecache.domain.cache.config.CacheDefaultTtl;
import offlinecache.domain.cache.config.CacheMaxBytes;
import offlinecache.domain.metadata.EntryKey;
import offlinecache.domain.metadata.IndexEntry;
import offlinecache.domain.metadata.MetadataIndex;
import offlinecache.domain.mutex.Mutex;
import offlinecache.domain.storage.EntryAttributes;
import offlinecache.domain.storage.Partition;
import offlinecache.domain.storage.ReadMode;
import offlinecache.domain.storage.StorageBackend;
import offlinecache.domain.zip.Zipper;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;
import java.util.logging.Logger;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Cache policy over the storage backend and the metadata index.
 * <p>
 * An entry is expired once {@code lastModified + ttl} is before now. Expired entries are reported as misses
 * and stay on disk until {@link #clearExpired()} runs. Writes and removals of one key are serialized;
 * different keys proceed independently. When the cache partition grows past the configured ceiling
 * the least recently used cache entries are evicted. Datasets are never evicted automatically.
 * <p>
 * Payloads above the compression threshold are stored gzipped when that saves at least a tenth of their size.
 */
@ApplicationScoped
public class CacheController {
    private static final double MAX_COMPRESSED_RATIO = 0.9;

    @Inject
    private StorageBackend storageBackend;

    @Inject
    private MetadataIndex metadataIndex;

    @Inject
    private Mutex mutex;

    @Inject
    private CacheDefaultTtl cacheDefaultTtl;

    @Inject
    private CacheMaxBytes cacheMaxBytes;

    @Inject
    private CacheCompressThreshold cacheCompressThreshold;

    @Inject
    private Zipper zipper;

    @Inject
    private Clock clock;

    @Inject
    private Logger logger;

    private final AtomicLong hits = new AtomicLong();

    private final AtomicLong misses = new AtomicLong();

    public Optional<byte[]> get(final String path) {
        return get(path, GetOptions.defaults());
    }

    /**
     * @return the stored bytes, or empty on a miss. A missing or expired entry is a miss, not an error.
     */
    public Optional<byte[]> get(final String path, final GetOptions options) {
        return get(path, options, Function.identity());
    }

    /**
     * Reads and decodes an entry. A payload the decoder rejects is invalidated and reported as a miss.
     */
    public <T> Optional<T> get(final String path, final GetOptions options, final Function<byte[], T> decoder) {
        checkNotNull(path, "path must not be null");
        checkNotNull(decoder, "decoder must not be null");
        final Partition partition = options.partition();

        final Optional<IndexEntry> entry = metadataIndex.lookup(partition, path);
        if (entry.isEmpty()) {
            return miss(partition, path, "not found");
        }

        if (entry.get().isExpired(clock.millis())) {
            return miss(partition, path, "expired");
        }

        final Optional<byte[]> payload = storageBackend.read(partition, path, ReadMode.BYTES);
        if (payload.isEmpty()) {
            // Removed behind our back, for example by the host reclaiming space
            metadataIndex.remove(partition, path);
            return miss(partition, path, "missing from storage");
        }

        final Optional<byte[]> value = entry.get().compressed()
                ? decompress(partition, path, payload.get())
                : payload;
        if (value.isEmpty()) {
            return miss(partition, path, "unreadable compressed payload");
        }

        final Optional<T> decoded = Try.of(() -> decoder.apply(value.get()))
                .onFailure(ex -> logger.warning("Discarding unreadable entry " + describe(partition, path) + ": " + ex.getMessage()))
                .toJavaOptional();
        if (decoded.isEmpty()) {
            invalidate(path, partition);
            return miss(partition, path, "unreadable payload");
        }

        hits.incrementAndGet();
        metadataIndex.touch(partition, path);
        logger.fine("Cache hit for " + describe(partition, path));
        return decoded;
    }

    public Optional<String> getText(final String path, final GetOptions options) {
        return get(path, options, bytes -> new String(bytes, StandardCharsets.UTF_8));
    }

    public void put(final String path, final byte[] payload) {
        put(path, payload, PutOptions.defaults());
    }

    /**
     * Stores the payload, replacing any previous value, with an expiry computed from the TTL.
     */
    public void put(final String path, final byte[] payload, final PutOptions options) {
        checkNotNull(path, "path must not be null");
        checkNotNull(payload, "payload must not be null");
        final Partition partition = options.partition();
        final Long ttlMillis = resolveTtl(options).map(Duration::toMillis).orElse(null);
        final Optional<byte[]> compressed = compress(payload);
        final byte[] stored = compressed.orElse(payload);

        mutex.acquire(lockName(partition, path), () -> {
            storageBackend.write(partition, path, stored,
                    new EntryAttributes(options.metadata(), ttlMillis, clock.millis(), compressed.isPresent()));
            metadataIndex.touch(partition, path);
            return null;
        });

        logger.fine("Cached " + describe(partition, path) + " (" + storageBackend.formatSize(stored.length)
                + (compressed.isPresent() ? " compressed from " + storageBackend.formatSize(payload.length) : "") + ")");

        if (partition == Partition.CACHE) {
            enforceQuota(new EntryKey(partition, path));
        }
    }

    /**
     * Returns the cached value, or generates, stores and returns a fresh one.
     */
    public CacheResult<byte[]> getOrPut(final String path, final PutOptions options, final GenerateValue<byte[]> generator) {
        final Optional<byte[]> cached = get(path, GetOptions.in(options.partition()));
        if (cached.isPresent()) {
            return new CacheResult<>(cached.get(), true);
        }

        final byte[] generated = generator.generate();
        if (generated != null) {
            put(path, generated, options);
        }

        return new CacheResult<>(generated, false);
    }

    /**
     * True if a live entry exists. Does not count as a hit or a miss.
     */
    public boolean has(final String path, final GetOptions options) {
        return metadataIndex.lookup(options.partition(), path)
                .filter(entry -> !entry.isExpired(clock.millis()))
                .isPresent();
    }

    public boolean invalidate(final String path) {
        return invalidate(path, Partition.CACHE);
    }

    /**
     * Removes one entry. The index entry goes first so it never points at a deleted file.
     *
     * @return true if a stored payload was removed
     */
    public boolean invalidate(final String path, final Partition partition) {
        return mutex.acquire(lockName(partition, path), () -> {
            metadataIndex.remove(partition, path);
            return storageBackend.remove(partition, path);
        });
    }

    /**
     * Removes every entry whose TTL has elapsed, in all partitions. Entries without a TTL are kept.
     *
     * @return the number of entries removed
     */
    public int clearExpired() {
        final long now = clock.millis();
        final int removed = (int) metadataIndex.entries().stream()
                .filter(entry -> entry.isExpired(now))
                .filter(entry -> invalidate(entry.path(), entry.partition()))
                .count();

        logger.info("Cleared " + removed + " expired entries");
        return removed;
    }

    /**
     * Removes every entry of a partition.
     *
     * @return the number of entries removed
     */
    public int clearAll(final Partition partition) {
        final int removed = (int) metadataIndex.entries(partition).stream()
                .filter(entry -> invalidate(entry.path(), partition))
                .count();

        logger.info("Cleared " + removed + " entries from " + partition.directoryName());
        return removed;
    }

    /**
     * Removes every entry, in any partition, whose metadata maps key to value.
     *
     * @return the number of entries removed
     */
    public int invalidateByMetadata(final String key, final String value) {
        final int removed = (int) metadataIndex.entries().stream()
                .filter(entry -> Objects.equals(entry.metadata().get(key), value))
                .filter(entry -> invalidate(entry.path(), entry.partition()))
                .count();

        logger.info("Invalidated " + removed + " entries tagged " + key + "=" + value);
        return removed;
    }

    public CacheStats stats() {
        final Map<Partition, Long> bytes = new EnumMap<>(Partition.class);
        final Map<Partition, Integer> counts = new EnumMap<>(Partition.class);
        Arrays.stream(Partition.values()).forEach(partition -> {
            final List<IndexEntry> entries = metadataIndex.entries(partition);
            bytes.put(partition, entries.stream().mapToLong(IndexEntry::size).sum());
            counts.put(partition, entries.size());
        });

        return new CacheStats(bytes, counts, hits.get(), misses.get());
    }

    public void resetCounters() {
        hits.set(0);
        misses.set(0);
    }

    /**
     * @return the gzipped payload, or empty if it is under the threshold or does not shrink enough
     */
    private Optional<byte[]> compress(final byte[] payload) {
        final int threshold = cacheCompressThreshold.getThreshold();
        if (threshold <= 0 || payload.length <= threshold) {
            return Optional.empty();
        }

        return Try.of(() -> zipper.compress(payload))
                .onFailure(ex -> logger.warning("Storing " + payload.length + " bytes uncompressed: " + ex.getMessage()))
                .toJavaOptional()
                .filter(compressed -> compressed.length <= payload.length * MAX_COMPRESSED_RATIO);
    }

    private Optional<byte[]> decompress(final Partition partition, final String path, final byte[] stored) {
        return Try.of(() -> zipper.decompress(stored))
                .onFailure(ex -> logger.warning("Failed to decompress " + describe(partition, path) + ": " + ex.getMessage()))
                .toJavaOptional();
    }

    private Optional<Duration> resolveTtl(final PutOptions options) {
        if (options.ttl() != null) {
            return Optional.of(options.ttl());
        }

        return options.partition() == Partition.CACHE
                ? cacheDefaultTtl.getDefaultTtl()
                : Optional.empty();
    }

    /**
     * Evicts least recently used cache entries until the partition fits under the ceiling.
     * The entry just written is never evicted, even when it alone exceeds the ceiling.
     */
    private void enforceQuota(final EntryKey justWritten) {
        final long maxBytes = cacheMaxBytes.getMaxBytes();
        if (maxBytes <= 0) {
            return;
        }

        long total = metadataIndex.totalBytes(Partition.CACHE);
        if (total <= maxBytes) {
            return;
        }

        final List<IndexEntry> candidates = metadataIndex.entries(Partition.CACHE).stream()
                .filter(entry -> !entry.key().equals(justWritten))
                .sorted(Comparator.comparingLong(IndexEntry::lastAccessed)
                        .thenComparingLong(IndexEntry::lastModified))
                .toList();

        int evicted = 0;
        for (final IndexEntry candidate : candidates) {
            if (total <= maxBytes) {
                break;
            }

            if (invalidate(candidate.path(), Partition.CACHE)) {
                total -= candidate.size();
                evicted++;
            }
        }

        logger.info("Evicted " + evicted + " cache entries to stay under " + storageBackend.formatSize(maxBytes));
    }

    private <T> Optional<T> miss(final Partition partition, final String path, final String reason) {
        misses.incrementAndGet();
        logger.fine("Cache miss for " + describe(partition, path) + ": " + reason);
        return Optional.empty();
    }

    private static String lockName(final Partition partition, final String path) {
        return "entry:" + describe(partition, path);
    }

    private static String describe(final Partition partition, final String path) {
        return partition.directoryName() + "/" + path;
    }
}
