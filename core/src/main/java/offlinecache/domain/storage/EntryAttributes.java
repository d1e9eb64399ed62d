package offlinecache.domain.storage;

import org.jspecify.annotations.Nullable;

import java.util.Map;

/**
 * The caller-supplied attributes of an entry, persisted beside the payload so they survive a restart.
 *
 * @param metadata   arbitrary caller values, such as a source URL or a tag
 * @param ttlMillis  time to live, or null if the entry never expires
 * @param createdAt  when the entry was written
 * @param compressed true if the stored payload is gzip compressed
 */
public record EntryAttributes(Map<String, String> metadata, @Nullable Long ttlMillis, long createdAt, boolean compressed) {
    public EntryAttributes {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
