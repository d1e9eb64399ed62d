package offlinecache.domain.metadata;

import offlinecache.domain.storage.Partition;
import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * What the index knows about one stored payload.
 *
 * @param size         payload length in bytes
 * @param lastModified when the payload was written
 * @param ttlMillis    time to live, or null if the entry never expires
 * @param lastAccessed last successful read or write, used for LRU eviction
 * @param compressed   true if the stored payload is gzip compressed
 */
public record IndexEntry(Partition partition,
                         String path,
                         long size,
                         long lastModified,
                         Map<String, String> metadata,
                         @Nullable Long ttlMillis,
                         long lastAccessed,
                         boolean compressed) {

    public IndexEntry {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public EntryKey key() {
        return new EntryKey(partition, path);
    }

    public boolean isExpired(final long now) {
        return ttlMillis != null && lastModified + ttlMillis < now;
    }

    public IndexEntry withLastAccessed(final long lastAccessed) {
        return new IndexEntry(partition, path, size, lastModified, metadata, ttlMillis, lastAccessed, compressed);
    }
}
