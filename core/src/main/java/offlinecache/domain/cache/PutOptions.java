package offlinecache.domain.cache;

import offlinecache.domain.storage.Partition;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.util.Map;

/**
 * Where and how a payload is stored.
 *
 * @param ttl time to live. When null, cache entries get the configured default and other partitions never expire.
 */
public record PutOptions(Partition partition, Map<String, String> metadata, @Nullable Duration ttl) {
    public PutOptions {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static PutOptions defaults() {
        return new PutOptions(Partition.CACHE, Map.of(), null);
    }

    public static PutOptions in(final Partition partition) {
        return new PutOptions(partition, Map.of(), null);
    }

    public PutOptions withMetadata(final Map<String, String> metadata) {
        return new PutOptions(partition, metadata, ttl);
    }

    public PutOptions withTtl(@Nullable final Duration ttl) {
        return new PutOptions(partition, metadata, ttl);
    }
}
