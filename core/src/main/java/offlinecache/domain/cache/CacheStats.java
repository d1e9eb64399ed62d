package offlinecache.domain.cache;

import offlinecache.domain.storage.Partition;

import java.util.Map;

/**
 * A snapshot derived from the metadata index plus the hit and miss counters.
 */
public record CacheStats(Map<Partition, Long> bytesByPartition,
                         Map<Partition, Integer> countsByPartition,
                         long hits,
                         long misses) {

    public long totalBytes() {
        return bytesByPartition.values().stream().mapToLong(Long::longValue).sum();
    }

    public int count(final Partition partition) {
        return countsByPartition.getOrDefault(partition, 0);
    }

    public long bytes(final Partition partition) {
        return bytesByPartition.getOrDefault(partition, 0L);
    }

    /**
     * @return hits divided by lookups, or 0 when nothing has been looked up
     */
    public double hitRate() {
        final long lookups = hits + misses;
        return lookups == 0 ? 0 : (double) hits / lookups;
    }
}
