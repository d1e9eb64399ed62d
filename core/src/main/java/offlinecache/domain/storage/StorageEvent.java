package offlinecache.domain.storage;

/**
 * Fired after a payload is committed to, or removed from, a partition.
 */
public record StorageEvent(Type type, Partition partition, String path, long size) {
    public enum Type {
        STORED,
        DELETED
    }
}
